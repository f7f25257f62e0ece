package org.agroforestry.farmprofile.config;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.agroforestry.farmprofile.validation.Numbers;

/**
 * Runtime settings of the profiling core.
 *
 * @param defaultYear reference year used when callers pass none
 * @param maxWorkers default bulk pool size (1-256)
 * @param queryTimeoutSeconds per remote call bound (1-3600); {@code 0} disables the bound
 * @param errorMessageMaxBytes UTF-8 budget of a failed profile's {@code error}
 * @param datasets external dataset catalog replacing the bundled one, if any
 * @param metricsExporter {@code otlp} or {@code none}; empty defers to the OpenTelemetry environment
 * @param verbose raise the root log level to DEBUG
 * @since 0.1.0
 */
public record ProfilingConfig(
    int defaultYear,
    int maxWorkers,
    int queryTimeoutSeconds,
    int errorMessageMaxBytes,
    Optional<Path> datasets,
    String metricsExporter,
    boolean verbose) {

  /** YAML section holding profiling settings; merged over {@code common}. */
  public static final String SECTION = "profiling";

  public ProfilingConfig {
    Numbers.requireRange("defaultYear", defaultYear, 1900, 2100);
    Numbers.requireRange("maxWorkers", maxWorkers, 1, 256);
    if (queryTimeoutSeconds != 0) {
      Numbers.requireRange("queryTimeoutSeconds", queryTimeoutSeconds, 1, 3600);
    }
    Numbers.requireRange("errorMessageMaxBytes", errorMessageMaxBytes, 16, 65_536);
    Objects.requireNonNull(datasets, "datasets");
    metricsExporter = metricsExporter == null ? "" : metricsExporter.trim().toLowerCase(Locale.ROOT);
    if (!metricsExporter.isEmpty() && !metricsExporter.equals("otlp") && !metricsExporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be otlp or none (was " + metricsExporter + ")");
    }
  }

  /**
   * Returns the embedded defaults.
   *
   * @return default configuration
   */
  public static ProfilingConfig defaults() {
    return fromMap(Map.of());
  }

  /**
   * Builds a configuration from flat string settings over the embedded defaults.
   *
   * @param options settings keyed as in {@link ProfilingDefaults#asFlatMap()}; unknown keys are ignored
   * @return validated configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static ProfilingConfig fromMap(Map<String, String> options) {
    Map<String, String> merged = new LinkedHashMap<>(ProfilingDefaults.asFlatMap());
    if (options != null) {
      options.forEach((key, value) -> {
        if (key != null && value != null) {
          merged.put(key, value);
        }
      });
    }
    return new ProfilingConfig(
        parseInt("defaultYear", merged.get("defaultYear")),
        parseInt("maxWorkers", merged.get("maxWorkers")),
        parseInt("queryTimeoutSeconds", merged.get("queryTimeoutSeconds")),
        parseInt("errorMessageMaxBytes", merged.get("errorMessageMaxBytes")),
        optionalPath("datasets", merged.get("datasets")),
        merged.get("metricsExporter"),
        parseBoolean("verbose", merged.get("verbose")));
  }

  /**
   * Loads the {@code profiling} section (merged with {@code common}) of a YAML file over the defaults.
   *
   * @param yaml settings file; a missing file yields the defaults
   * @return validated configuration
   * @throws IOException if the file exists but cannot be read
   */
  public static ProfilingConfig load(Path yaml) throws IOException {
    return fromMap(YamlConfigLoader.load(yaml, SECTION).orElse(Map.of()));
  }

  private static int parseInt(String name, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was '" + value + "')", ex);
    }
  }

  private static boolean parseBoolean(String name, String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (normalized.equals("true")) {
      return true;
    }
    if (normalized.equals("false") || normalized.isEmpty()) {
      return false;
    }
    throw new IllegalArgumentException(name + " must be true or false (was '" + value + "')");
  }

  private static Optional<Path> optionalPath(String name, String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Path.of(value.trim()));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }
}
