package org.agroforestry.farmprofile.domain.texture;

import java.util.Locale;
import java.util.Set;

/**
 * Normalizes raw soil texture labels before they are looked up in a {@link TextureMap}.
 *
 * <p>Labels are lower-cased and trimmed; when several classes are listed ({@code "Clay, Clay Loam"}) only the
 * first is kept. {@code organic} and {@code variable} carry no texture class.</p>
 *
 * @since 0.1.0
 */
public final class TextureNormalizer {
  private static final Set<String> UNCLASSIFIED = Set.of("organic", "variable");

  private TextureNormalizer() {
    // Utility
  }

  /**
   * Normalizes a raw texture label.
   *
   * @param raw label read from a dataset; any object is rendered with {@link String#valueOf(Object)}
   * @return normalized class name, or {@code null} for null, blank and unclassified labels
   */
  public static String normalize(Object raw) {
    if (raw == null) {
      return null;
    }
    String text = String.valueOf(raw).trim().toLowerCase(Locale.ROOT);
    int comma = text.indexOf(',');
    if (comma >= 0) {
      text = text.substring(0, comma).trim();
    }
    if (text.isEmpty() || UNCLASSIFIED.contains(text)) {
      return null;
    }
    return text;
  }
}
