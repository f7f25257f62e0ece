package org.agroforestry.farmprofile.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.agroforestry.farmprofile.domain.dataset.DatasetConfig;
import org.agroforestry.farmprofile.domain.dataset.DatasetRegistry;
import org.agroforestry.farmprofile.domain.dataset.DatasetType;
import org.agroforestry.farmprofile.domain.dataset.PostProcess;
import org.agroforestry.farmprofile.domain.dataset.Reducer;
import org.agroforestry.farmprofile.domain.dataset.TerrainDerivation;
import org.agroforestry.farmprofile.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads the dataset catalog from YAML into an immutable {@link DatasetRegistry}.
 *
 * <p>The document holds a top-level {@code datasets} mapping of dataset name to descriptor keys. Unknown keys and
 * unknown enumeration values are rejected with a message naming the dataset and key.</p>
 *
 * @since 0.1.0
 */
public final class DatasetCatalogLoader {
  /** Classpath location of the bundled catalog. */
  public static final String BUNDLED_CATALOG = "/datasets.yaml";

  private static final Logger log = LoggerFactory.getLogger(DatasetCatalogLoader.class);
  private static final Set<String> KNOWN_KEYS = Set.of(
      "asset_id", "band", "field", "scale", "reducer", "temporal", "type",
      "scale_factor", "offset", "bias_correction", "post_process", "terrain", "proxy");

  private DatasetCatalogLoader() {}

  /**
   * Loads the catalog bundled on the classpath.
   *
   * @return registry of bundled datasets
   * @throws IllegalStateException if the bundled catalog is missing
   */
  public static DatasetRegistry loadBundled() {
    try (InputStream in = DatasetCatalogLoader.class.getResourceAsStream(BUNDLED_CATALOG)) {
      if (in == null) {
        throw new IllegalStateException("Bundled dataset catalog " + BUNDLED_CATALOG + " not found");
      }
      return parse(new InputStreamReader(in, StandardCharsets.UTF_8), "classpath:" + BUNDLED_CATALOG);
    } catch (IOException ex) {
      throw new IllegalStateException("Unable to read bundled dataset catalog", ex);
    }
  }

  /**
   * Loads a catalog file.
   *
   * @param path YAML catalog
   * @return registry of the file's datasets
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the catalog is invalid
   */
  public static DatasetRegistry load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, path.toString());
    }
  }

  /**
   * Parses a catalog document.
   *
   * @param reader YAML source; not closed
   * @param origin description of the source used in messages
   * @return registry in document order
   * @throws IllegalArgumentException if the catalog is invalid
   */
  public static DatasetRegistry parse(Reader reader, String origin) {
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse dataset catalog at " + origin, ex);
    }
    if (document == null) {
      throw new IllegalArgumentException("Dataset catalog at " + origin + " is empty");
    }
    Object datasetsNode = YamlConfigLoader.asMap(document, "root").get("datasets");
    if (datasetsNode == null) {
      throw new IllegalArgumentException("Dataset catalog at " + origin + " has no 'datasets' mapping");
    }
    Map<String, Object> datasets = YamlConfigLoader.asMap(datasetsNode, "datasets");
    List<DatasetConfig> configs = new ArrayList<>(datasets.size());
    for (Map.Entry<String, Object> entry : datasets.entrySet()) {
      String name = Strings.requireKey("dataset name", entry.getKey());
      configs.add(toConfig(name, YamlConfigLoader.asMap(entry.getValue(), "datasets." + name)));
    }
    DatasetRegistry registry = DatasetRegistry.of(configs);
    log.debug("Loaded {} datasets from {}: {}", configs.size(), origin, registry.list());
    return registry;
  }

  private static DatasetConfig toConfig(String name, Map<String, Object> node) {
    for (String key : node.keySet()) {
      if (!KNOWN_KEYS.contains(key)) {
        throw new IllegalArgumentException("dataset " + name + ": unknown key '" + key + "'");
      }
    }
    try {
      DatasetType type = DatasetType.from(text(name, node, "type"));
      DatasetConfig.Builder builder = type == DatasetType.RASTER
          ? DatasetConfig.raster(name, text(name, node, "asset_id"), text(name, node, "band"),
              number(name, node, "scale", 0.0))
          : DatasetConfig.vector(name, text(name, node, "asset_id"), text(name, node, "field"));
      builder.reducer(Reducer.from(text(name, node, "reducer")))
          .temporal(flag(name, node, "temporal"))
          .postProcess(PostProcess.from(text(name, node, "post_process")))
          .terrain(TerrainDerivation.from(text(name, node, "terrain")))
          .proxy(flag(name, node, "proxy"));
      if (node.get("scale_factor") != null) {
        builder.scaleFactor(number(name, node, "scale_factor", 1.0));
      }
      if (node.get("offset") != null) {
        builder.offset(number(name, node, "offset", 0.0));
      }
      if (node.get("bias_correction") != null) {
        builder.biasCorrection(number(name, node, "bias_correction", 0.0));
      }
      return builder.build();
    } catch (IllegalArgumentException ex) {
      if (ex.getMessage() != null && ex.getMessage().startsWith("dataset ")) {
        throw ex;
      }
      throw new IllegalArgumentException("dataset " + name + ": " + ex.getMessage(), ex);
    }
  }

  private static String text(String dataset, Map<String, Object> node, String key) {
    Object value = node.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
      throw new IllegalArgumentException("dataset " + dataset + ": " + key + " must be a scalar");
    }
    return value.toString();
  }

  private static double number(String dataset, Map<String, Object> node, String key, double fallback) {
    Object value = node.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    throw new IllegalArgumentException("dataset " + dataset + ": " + key + " must be a number (was '" + value + "')");
  }

  private static boolean flag(String dataset, Map<String, Object> node, String key) {
    Object value = node.get(key);
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean bool) {
      return bool;
    }
    throw new IllegalArgumentException("dataset " + dataset + ": " + key + " must be true or false");
  }
}
