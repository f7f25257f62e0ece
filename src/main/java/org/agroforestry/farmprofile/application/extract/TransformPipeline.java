package org.agroforestry.farmprofile.application.extract;

import java.util.OptionalDouble;
import org.agroforestry.farmprofile.domain.dataset.DatasetConfig;
import org.agroforestry.farmprofile.domain.dataset.DatasetType;

/**
 * Ordered numeric transforms applied to a raw dataset reading.
 *
 * <p>Raster readings: scale factor, offset, bias correction, then rounding. Vector readings: scale factor, then
 * rounding. A non-finite intermediate value short-circuits to empty.</p>
 *
 * @since 0.1.0
 */
public final class TransformPipeline {

  private TransformPipeline() {
    // Utility
  }

  /**
   * Applies the transforms configured on a dataset.
   *
   * @param raw raw reading in the dataset's native unit
   * @param config dataset descriptor
   * @return transformed value, or empty when the reading is not a finite number
   */
  public static OptionalDouble apply(double raw, DatasetConfig config) {
    if (!Double.isFinite(raw)) {
      return OptionalDouble.empty();
    }
    double value = raw;
    if (config.scaleFactor().isPresent()) {
      value *= config.scaleFactor().getAsDouble();
    }
    if (config.type() == DatasetType.RASTER) {
      if (config.offset().isPresent()) {
        value += config.offset().getAsDouble();
      }
      if (config.biasCorrection().isPresent()) {
        value += config.biasCorrection().getAsDouble();
      }
    }
    if (!Double.isFinite(value)) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(config.postProcess().apply(value));
  }
}
