package org.agroforestry.farmprofile.application.extract;

import java.util.Optional;
import java.util.OptionalDouble;
import org.agroforestry.farmprofile.application.port.RemoteQueryException;
import org.agroforestry.farmprofile.domain.dataset.DatasetConfig;
import org.agroforestry.farmprofile.domain.dataset.DatasetType;
import org.agroforestry.farmprofile.domain.geometry.Geometry;

/**
 * <strong>What:</strong> Reads one dataset over one geometry for a given storage model.
 * <p><strong>Why:</strong> The extraction engine dispatches on {@link DatasetType} through a strategy table
 * instead of branching on configuration strings.</p>
 * <p><strong>Thread-safety:</strong> Implementations are stateless apart from the shared query port.</p>
 *
 * @since 0.1.0
 */
public interface ExtractionStrategy {

  /**
   * Storage model handled by this strategy.
   *
   * @return dataset type
   */
  DatasetType type();

  /**
   * Reads the untransformed value.
   *
   * @param geometry canonical geometry
   * @param config dataset descriptor of {@link #type()}
   * @param year calendar year for temporal datasets; {@code null} selects the non-temporal path
   * @return raw value (a number, or text for categorical vector attributes); empty when the service has no data
   * @throws RemoteQueryException if the service call fails
   */
  Optional<Object> sample(Geometry geometry, DatasetConfig config, Integer year) throws RemoteQueryException;

  /**
   * Reads the value and applies the dataset's transform pipeline.
   *
   * @param geometry canonical geometry
   * @param config dataset descriptor of {@link #type()}
   * @param year calendar year for temporal datasets, or {@code null}
   * @return transformed scalar; empty when absent or not numeric
   * @throws RemoteQueryException if the service call fails
   */
  default OptionalDouble extract(Geometry geometry, DatasetConfig config, Integer year)
      throws RemoteQueryException {
    Optional<Object> raw = sample(geometry, config, year);
    if (raw.isPresent() && raw.get() instanceof Number number) {
      return TransformPipeline.apply(number.doubleValue(), config);
    }
    return OptionalDouble.empty();
  }
}
