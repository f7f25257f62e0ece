package org.agroforestry.farmprofile.application.port;

import java.util.Objects;
import org.agroforestry.farmprofile.domain.dataset.Reducer;

/**
 * Description of the single image a raster reduction runs against.
 *
 * <p>The query service interprets these descriptions server-side; this core never materializes pixels.</p>
 *
 * @since 0.1.0
 */
public sealed interface ImageRef
    permits ImageRef.AssetImage, ImageRef.CollectionComposite, ImageRef.TerrainSlope {

  /**
   * A stored single image.
   *
   * @param assetId remote image identifier
   */
  record AssetImage(String assetId) implements ImageRef {
    public AssetImage {
      Objects.requireNonNull(assetId, "assetId");
    }
  }

  /**
   * One band of an image collection collapsed to a single image.
   *
   * @param collection source collection, usually year-filtered
   * @param band band selected before compositing
   * @param reducer {@link Reducer#SUM} for a total, {@link Reducer#MEAN} otherwise
   */
  record CollectionComposite(ImageCollectionRef collection, String band, Reducer reducer) implements ImageRef {
    public CollectionComposite {
      Objects.requireNonNull(collection, "collection");
      Objects.requireNonNull(band, "band");
      Objects.requireNonNull(reducer, "reducer");
    }
  }

  /**
   * Terrain slope in degrees derived from an elevation band; exposes the band {@link #OUTPUT_BAND}.
   *
   * @param elevation source elevation image
   * @param elevationBand band holding elevation in metres
   */
  record TerrainSlope(ImageRef elevation, String elevationBand) implements ImageRef {
    /** Band name of the derived slope image. */
    public static final String OUTPUT_BAND = "slope";

    public TerrainSlope {
      Objects.requireNonNull(elevation, "elevation");
      Objects.requireNonNull(elevationBand, "elevationBand");
    }
  }
}
