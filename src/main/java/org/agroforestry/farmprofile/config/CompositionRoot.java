package org.agroforestry.farmprofile.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.agroforestry.farmprofile.application.bulk.BulkOrchestrator;
import org.agroforestry.farmprofile.application.extract.EnvironmentalExtractor;
import org.agroforestry.farmprofile.application.extract.ExtractionEngine;
import org.agroforestry.farmprofile.application.extract.RasterExtractionStrategy;
import org.agroforestry.farmprofile.application.extract.TextureClassifier;
import org.agroforestry.farmprofile.application.extract.VectorExtractionStrategy;
import org.agroforestry.farmprofile.application.port.GeospatialQueryPort;
import org.agroforestry.farmprofile.application.port.MetricsPort;
import org.agroforestry.farmprofile.application.profile.FarmProfileBuilder;
import org.agroforestry.farmprofile.application.profile.FarmProfileUpdater;
import org.agroforestry.farmprofile.domain.dataset.DatasetRegistry;
import org.agroforestry.farmprofile.domain.texture.TextureMap;
import org.agroforestry.farmprofile.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import org.agroforestry.farmprofile.infrastructure.query.TimeoutGeospatialQueryAdapter;
import org.agroforestry.farmprofile.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the profiling use cases to a query service adapter and the configured catalog.
 * <p><strong>Why:</strong> One place translates {@link ProfilingConfig} into a ready object graph, so the registry
 * and texture table are built once and passed explicitly.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load the dataset catalog (external file or bundled resource).</li>
 *   <li>Decorate the query port with the configured timeout.</li>
 *   <li>Own the metrics adapter and the timeout pool; release both in {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct on one thread; the exposed use cases are thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final ProfilingConfig config;
  private final DatasetRegistry registry;
  private final MetricsPort metrics;
  private final AutoCloseable ownedMetrics;
  private final TimeoutGeospatialQueryAdapter timeoutAdapter;
  private final EnvironmentalExtractor extractor;
  private final FarmProfileBuilder builder;
  private final FarmProfileUpdater updater;
  private final BulkOrchestrator orchestrator;

  /**
   * Creates a composition root exporting metrics through OpenTelemetry.
   *
   * @param config runtime settings
   * @param queries adapter onto the remote geospatial service
   */
  public CompositionRoot(ProfilingConfig config, GeospatialQueryPort queries) {
    this(config, queries, null);
  }

  /**
   * Creates a composition root with an explicit metrics port, which the root does not close.
   *
   * @param config runtime settings
   * @param queries adapter onto the remote geospatial service
   * @param metrics metrics port; {@code null} creates an owned OpenTelemetry adapter
   * @throws UncheckedIOException if an external dataset catalog cannot be read
   */
  public CompositionRoot(ProfilingConfig config, GeospatialQueryPort queries, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    Objects.requireNonNull(queries, "queries");
    if (config.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    if (metrics == null) {
      OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter(config.metricsExporter());
      this.metrics = adapter;
      this.ownedMetrics = adapter;
    } else {
      this.metrics = metrics;
      this.ownedMetrics = null;
    }

    this.registry = loadRegistry(config);
    GeospatialQueryPort effectiveQueries = queries;
    if (config.queryTimeoutSeconds() > 0) {
      this.timeoutAdapter =
          new TimeoutGeospatialQueryAdapter(queries, Duration.ofSeconds(config.queryTimeoutSeconds()));
      effectiveQueries = timeoutAdapter;
    } else {
      this.timeoutAdapter = null;
    }

    ExtractionEngine engine = new ExtractionEngine(
        registry,
        List.of(new RasterExtractionStrategy(effectiveQueries), new VectorExtractionStrategy(effectiveQueries)),
        this.metrics);
    this.extractor = new EnvironmentalExtractor(
        engine, effectiveQueries, new TextureClassifier(TextureMap.usda()), config.defaultYear());
    this.builder = new FarmProfileBuilder(extractor, this.metrics, config.errorMessageMaxBytes());
    this.updater = new FarmProfileUpdater(extractor, this.metrics, config.errorMessageMaxBytes());
    this.orchestrator = new BulkOrchestrator(builder, updater, this.metrics, config.defaultYear(),
        config.maxWorkers(), config.errorMessageMaxBytes());
    log.info("Farm profiling ready: {} datasets, default year {}, {} workers, query timeout {}s",
        registry.list().size(), config.defaultYear(), config.maxWorkers(), config.queryTimeoutSeconds());
  }

  public ProfilingConfig config() {
    return config;
  }

  public DatasetRegistry registry() {
    return registry;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public EnvironmentalExtractor extractor() {
    return extractor;
  }

  public FarmProfileBuilder builder() {
    return builder;
  }

  public FarmProfileUpdater updater() {
    return updater;
  }

  public BulkOrchestrator orchestrator() {
    return orchestrator;
  }

  /** Stops the timeout pool and shuts down an owned metrics adapter. */
  @Override
  public void close() {
    if (timeoutAdapter != null) {
      timeoutAdapter.close();
    }
    if (ownedMetrics != null) {
      try {
        ownedMetrics.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter cleanly", ex);
      }
    }
  }

  private static DatasetRegistry loadRegistry(ProfilingConfig config) {
    if (config.datasets().isEmpty()) {
      return DatasetCatalogLoader.loadBundled();
    }
    try {
      return DatasetCatalogLoader.load(config.datasets().get());
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to read dataset catalog " + config.datasets().get(), ex);
    }
  }
}
