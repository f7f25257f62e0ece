package org.agroforestry.farmprofile.application.extract;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import org.agroforestry.farmprofile.application.port.MetricsPort;
import org.agroforestry.farmprofile.application.port.RemoteQueryException;
import org.agroforestry.farmprofile.domain.dataset.DatasetConfig;
import org.agroforestry.farmprofile.domain.dataset.DatasetRegistry;
import org.agroforestry.farmprofile.domain.dataset.DatasetType;
import org.agroforestry.farmprofile.domain.geometry.Geometry;
import org.agroforestry.farmprofile.domain.geometry.GeometryParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns a dataset name and a geometry into one transformed scalar.
 * <p><strong>Why:</strong> Every environmental attribute is read the same way; only the dataset descriptor
 * changes.</p>
 * <p><strong>Role:</strong> Application service between the typed {@link EnvironmentalExtractor} wrappers and the
 * {@link ExtractionStrategy} table.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse the geometry once and resolve the dataset descriptor.</li>
 *   <li>Dispatch to the strategy registered for the dataset type.</li>
 *   <li>Degrade remote failures to an empty result, logging at WARN.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable collaborators; safe for bulk workers.</p>
 * <p><strong>Observability:</strong> Increments {@code extract.remote.failure} and {@code extract.raster.absent}.</p>
 *
 * @since 0.1.0
 */
public final class ExtractionEngine {
  private static final Logger log = LoggerFactory.getLogger(ExtractionEngine.class);

  private final DatasetRegistry registry;
  private final Map<DatasetType, ExtractionStrategy> strategies;
  private final MetricsPort metrics;

  /**
   * Creates an engine over a strategy table.
   *
   * @param registry dataset descriptors
   * @param strategies one strategy per dataset type
   * @param metrics metrics sink; {@code null} selects {@link MetricsPort#NO_OP}
   * @throws IllegalArgumentException if a dataset type has no strategy or two strategies claim the same type
   */
  public ExtractionEngine(DatasetRegistry registry, Collection<? extends ExtractionStrategy> strategies,
      MetricsPort metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    Map<DatasetType, ExtractionStrategy> table = new EnumMap<>(DatasetType.class);
    for (ExtractionStrategy strategy : strategies) {
      if (table.put(strategy.type(), strategy) != null) {
        throw new IllegalArgumentException("Duplicate extraction strategy for " + strategy.type());
      }
    }
    for (DatasetType type : DatasetType.values()) {
      if (!table.containsKey(type)) {
        throw new IllegalArgumentException("No extraction strategy for " + type);
      }
    }
    this.strategies = table;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Dataset descriptors this engine resolves names against.
   *
   * @return registry
   */
  public DatasetRegistry registry() {
    return registry;
  }

  /**
   * Extracts a transformed value from a dataset of either type.
   *
   * @param geometry raw or canonical geometry
   * @param datasetName registry key
   * @param year calendar year for temporal datasets, or {@code null}
   * @return transformed scalar, or empty when the service has no data or fails
   * @throws org.agroforestry.farmprofile.domain.geometry.InvalidGeometryException if the geometry is invalid
   * @throws org.agroforestry.farmprofile.domain.dataset.UnknownDatasetException if the dataset is not configured
   */
  public OptionalDouble extract(Object geometry, String datasetName, Integer year) {
    Geometry parsed = GeometryParser.parse(geometry);
    DatasetConfig config = registry.get(datasetName);
    ExtractionStrategy strategy = strategies.get(config.type());
    try {
      OptionalDouble value = strategy.extract(parsed, config, year);
      if (value.isEmpty() && config.type() == DatasetType.RASTER) {
        metrics.increment("extract.raster.absent");
        log.debug("No raster value for dataset {} (year {})", datasetName, year);
      }
      return value;
    } catch (RemoteQueryException ex) {
      degraded(datasetName, ex);
      return OptionalDouble.empty();
    }
  }

  /**
   * Extracts from a raster dataset.
   *
   * @param geometry raw or canonical geometry
   * @param datasetName registry key of a raster dataset
   * @param year calendar year for temporal datasets, or {@code null}
   * @return transformed scalar, or empty
   * @throws IllegalArgumentException if the dataset is not a raster
   */
  public OptionalDouble extractRaster(Object geometry, String datasetName, Integer year) {
    requireType(datasetName, DatasetType.RASTER);
    return extract(geometry, datasetName, year);
  }

  /**
   * Extracts from a vector dataset.
   *
   * @param geometry raw or canonical geometry
   * @param datasetName registry key of a vector dataset
   * @return transformed scalar, or empty
   * @throws IllegalArgumentException if the dataset is not a vector
   */
  public OptionalDouble extractVector(Object geometry, String datasetName) {
    requireType(datasetName, DatasetType.VECTOR);
    return extract(geometry, datasetName, null);
  }

  /**
   * Reads the untransformed value of a dataset, for categorical attributes such as soil texture.
   *
   * @param geometry raw or canonical geometry
   * @param datasetName registry key
   * @param year calendar year for temporal datasets, or {@code null}
   * @return raw number or text, or empty when the service has no data or fails
   */
  public Optional<Object> sample(Object geometry, String datasetName, Integer year) {
    Geometry parsed = GeometryParser.parse(geometry);
    DatasetConfig config = registry.get(datasetName);
    try {
      return strategies.get(config.type()).sample(parsed, config, year);
    } catch (RemoteQueryException ex) {
      degraded(datasetName, ex);
      return Optional.empty();
    }
  }

  private void requireType(String datasetName, DatasetType expected) {
    DatasetConfig config = registry.get(datasetName);
    if (config.type() != expected) {
      throw new IllegalArgumentException(
          "Dataset " + datasetName + " is " + config.type() + ", expected " + expected);
    }
  }

  private void degraded(String datasetName, RemoteQueryException ex) {
    metrics.increment("extract.remote.failure");
    log.warn("Remote query for dataset {} failed; treating as no data: {}", datasetName, ex.getMessage());
  }
}
