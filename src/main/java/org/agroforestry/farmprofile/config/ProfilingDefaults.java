package org.agroforestry.farmprofile.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Embedded defaults for every runtime setting, as the flat string map that YAML settings are merged over.
 */
public final class ProfilingDefaults {
  public static final int DEFAULT_YEAR = 2024;
  public static final int MAX_WORKERS = 4;
  public static final int QUERY_TIMEOUT_SECONDS = 60;
  public static final int ERROR_MESSAGE_MAX_BYTES = 512;

  private static final Map<String, String> DEFAULTS = build();

  private ProfilingDefaults() {}

  /**
   * Returns the defaults.
   *
   * @return unmodifiable map of setting name to default value
   */
  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  private static Map<String, String> build() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("defaultYear", Integer.toString(DEFAULT_YEAR));
    map.put("maxWorkers", Integer.toString(MAX_WORKERS));
    map.put("queryTimeoutSeconds", Integer.toString(QUERY_TIMEOUT_SECONDS));
    map.put("errorMessageMaxBytes", Integer.toString(ERROR_MESSAGE_MAX_BYTES));
    map.put("datasets", "");
    map.put("metricsExporter", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }
}
