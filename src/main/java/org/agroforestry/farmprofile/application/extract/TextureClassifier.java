package org.agroforestry.farmprofile.application.extract;

import java.util.Objects;
import java.util.OptionalInt;
import org.agroforestry.farmprofile.domain.texture.TextureMap;
import org.agroforestry.farmprofile.domain.texture.TextureNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a raw soil-texture reading to a texture class identifier.
 *
 * <p>Text is normalized and looked up. Numbers are accepted only from a non-proxy dataset and only when they are
 * an integral class code known to the texture table; a proxy dataset's numeric reading never maps to a class.</p>
 *
 * @since 0.1.0
 */
public final class TextureClassifier {
  private static final Logger log = LoggerFactory.getLogger(TextureClassifier.class);

  private final TextureMap textures;

  /**
   * Creates a classifier over a texture table.
   *
   * @param textures normalized class names to identifiers
   */
  public TextureClassifier(TextureMap textures) {
    this.textures = Objects.requireNonNull(textures, "textures");
  }

  /**
   * Classifies one reading.
   *
   * @param raw number or text read from the texture dataset; may be {@code null}
   * @param proxy whether the dataset only stands in for texture
   * @return class identifier, or empty for "no classification"
   */
  public OptionalInt classify(Object raw, boolean proxy) {
    if (raw == null) {
      return OptionalInt.empty();
    }
    if (raw instanceof Number number) {
      if (proxy) {
        log.debug("Proxy texture reading {} has no class mapping", number);
        return OptionalInt.empty();
      }
      double value = number.doubleValue();
      if (Double.isFinite(value) && value == Math.rint(value) && textures.containsId((int) value)) {
        return OptionalInt.of((int) value);
      }
      return OptionalInt.empty();
    }
    String normalized = TextureNormalizer.normalize(raw);
    return normalized == null ? OptionalInt.empty() : textures.idOf(normalized);
  }
}
