package org.agroforestry.farmprofile.domain.dataset;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Immutable descriptor of one remote dataset and the transforms applied to its readings.
 * <p><strong>Why:</strong> Keeps extraction generic; adding an environmental attribute means adding a catalog
 * entry rather than code.</p>
 * <p><strong>Role:</strong> Domain value object resolved from {@link DatasetRegistry} by the extraction engine.</p>
 * <p><strong>Thread-safety:</strong> Immutable; read-only at extraction time.</p>
 *
 * @param name registry key, e.g. {@code rainfall}
 * @param assetId opaque reference to the remote image, image collection or feature collection
 * @param band raster band to read; {@code null} for vector datasets
 * @param field vector attribute to read; {@code null} for raster datasets
 * @param scale spatial resolution of the raster reduction in metres; ignored for vector datasets
 * @param reducer spatial (and, for temporal datasets, composite) aggregation operator
 * @param temporal whether the asset is a time-indexed collection that must be filtered by year
 * @param type raster or vector storage model
 * @param scaleFactor optional multiplicative transform, applied first
 * @param offset optional additive transform, applied after the scale factor (raster only)
 * @param biasCorrection optional additive correction, applied after the offset (raster only)
 * @param postProcess rounding rule applied last
 * @param terrain terrain product derived from the band before reduction
 * @param proxy whether readings stand in for a quantity the dataset does not measure directly
 * @since 0.1.0
 */
public record DatasetConfig(
    String name,
    String assetId,
    String band,
    String field,
    double scale,
    Reducer reducer,
    boolean temporal,
    DatasetType type,
    OptionalDouble scaleFactor,
    OptionalDouble offset,
    OptionalDouble biasCorrection,
    PostProcess postProcess,
    TerrainDerivation terrain,
    boolean proxy) {

  /**
   * Validates required keys for the dataset type.
   *
   * @throws IllegalArgumentException if a required key is missing or the scale is not positive for rasters
   */
  public DatasetConfig {
    requireText("name", name, name);
    requireText("asset_id", assetId, name);
    Objects.requireNonNull(reducer, "reducer");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(scaleFactor, "scaleFactor");
    Objects.requireNonNull(offset, "offset");
    Objects.requireNonNull(biasCorrection, "biasCorrection");
    Objects.requireNonNull(postProcess, "postProcess");
    Objects.requireNonNull(terrain, "terrain");
    if (type == DatasetType.RASTER) {
      requireText("band", band, name);
      if (!(scale > 0.0) || !Double.isFinite(scale)) {
        throw new IllegalArgumentException("dataset " + name + ": scale must be a positive number (was " + scale + ")");
      }
    } else {
      requireText("field", field, name);
      if (offset.isPresent() || biasCorrection.isPresent()) {
        throw new IllegalArgumentException("dataset " + name + ": offset and bias_correction apply to raster datasets only");
      }
      if (temporal) {
        throw new IllegalArgumentException("dataset " + name + ": vector datasets cannot be temporal");
      }
      if (terrain != TerrainDerivation.NONE) {
        throw new IllegalArgumentException("dataset " + name + ": terrain derivation requires a raster dataset");
      }
    }
  }

  /**
   * Returns the variable read from the dataset: the band for rasters, the field for vectors.
   *
   * @return band or field name
   */
  public String variable() {
    return type == DatasetType.RASTER ? band : field;
  }

  /**
   * Starts a builder for a raster dataset.
   *
   * @param name registry key
   * @param assetId remote asset reference
   * @param band band to read
   * @param scale reduction scale in metres
   * @return builder pre-populated with the required keys
   */
  public static Builder raster(String name, String assetId, String band, double scale) {
    return new Builder(name, assetId, DatasetType.RASTER).band(band).scale(scale);
  }

  /**
   * Starts a builder for a vector dataset.
   *
   * @param name registry key
   * @param assetId remote feature collection reference
   * @param field attribute to read
   * @return builder pre-populated with the required keys
   */
  public static Builder vector(String name, String assetId, String field) {
    return new Builder(name, assetId, DatasetType.VECTOR).field(field);
  }

  private static void requireText(String key, String value, String dataset) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("dataset " + (dataset == null ? "<unnamed>" : dataset)
          + ": " + key + " is required");
    }
  }

  /**
   * Mutable builder for {@link DatasetConfig}; not thread-safe.
   */
  public static final class Builder {
    private final String name;
    private final String assetId;
    private final DatasetType type;
    private String band;
    private String field;
    private double scale;
    private Reducer reducer = Reducer.MEAN;
    private boolean temporal;
    private OptionalDouble scaleFactor = OptionalDouble.empty();
    private OptionalDouble offset = OptionalDouble.empty();
    private OptionalDouble biasCorrection = OptionalDouble.empty();
    private PostProcess postProcess = PostProcess.NONE;
    private TerrainDerivation terrain = TerrainDerivation.NONE;
    private boolean proxy;

    private Builder(String name, String assetId, DatasetType type) {
      this.name = name;
      this.assetId = assetId;
      this.type = type;
    }

    public Builder band(String band) {
      this.band = band;
      return this;
    }

    public Builder field(String field) {
      this.field = field;
      return this;
    }

    public Builder scale(double scale) {
      this.scale = scale;
      return this;
    }

    public Builder reducer(Reducer reducer) {
      this.reducer = Objects.requireNonNull(reducer, "reducer");
      return this;
    }

    public Builder temporal(boolean temporal) {
      this.temporal = temporal;
      return this;
    }

    public Builder scaleFactor(double scaleFactor) {
      this.scaleFactor = OptionalDouble.of(scaleFactor);
      return this;
    }

    public Builder offset(double offset) {
      this.offset = OptionalDouble.of(offset);
      return this;
    }

    public Builder biasCorrection(double biasCorrection) {
      this.biasCorrection = OptionalDouble.of(biasCorrection);
      return this;
    }

    public Builder postProcess(PostProcess postProcess) {
      this.postProcess = Objects.requireNonNull(postProcess, "postProcess");
      return this;
    }

    public Builder terrain(TerrainDerivation terrain) {
      this.terrain = Objects.requireNonNull(terrain, "terrain");
      return this;
    }

    public Builder proxy(boolean proxy) {
      this.proxy = proxy;
      return this;
    }

    /**
     * Builds the validated descriptor.
     *
     * @return immutable dataset configuration
     * @throws IllegalArgumentException if required keys are missing
     */
    public DatasetConfig build() {
      return new DatasetConfig(
          name,
          assetId,
          band,
          field,
          scale,
          reducer,
          temporal,
          type,
          scaleFactor,
          offset,
          biasCorrection,
          postProcess,
          terrain,
          proxy);
    }
  }
}
