package org.agroforestry.farmprofile.domain.texture;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Immutable mapping from normalized soil texture class names to class identifiers.
 * <p><strong>Why:</strong> The farm schema stores texture as an integer identifier while source datasets
 * publish class names.</p>
 * <p><strong>Role:</strong> Read-only lookup table built once and injected into texture extraction.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for unsynchronized concurrent reads.</p>
 *
 * @since 0.1.0
 * @see TextureNormalizer
 */
public final class TextureMap {
  private static final TextureMap USDA = buildUsda();

  private final Map<String, Integer> ids;

  private TextureMap(Map<String, Integer> ids) {
    this.ids = Collections.unmodifiableMap(new LinkedHashMap<>(ids));
  }

  /**
   * Returns the twelve USDA texture classes numbered from coarsest ({@code sand = 1}) to finest
   * ({@code clay = 12}).
   *
   * @return shared immutable table
   */
  public static TextureMap usda() {
    return USDA;
  }

  /**
   * Creates a table from explicit entries.
   *
   * @param entries normalized class name to identifier; names must be lower case and trimmed
   * @return immutable table
   * @throws IllegalArgumentException if an identifier is duplicated or a name is not normalized
   */
  public static TextureMap of(Map<String, Integer> entries) {
    Objects.requireNonNull(entries, "entries");
    Map<String, Integer> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Integer> entry : entries.entrySet()) {
      String name = Objects.requireNonNull(entry.getKey(), "name");
      Integer id = Objects.requireNonNull(entry.getValue(), "id");
      if (!name.equals(TextureNormalizer.normalize(name))) {
        throw new IllegalArgumentException("Texture name must be normalized: '" + name + "'");
      }
      if (copy.containsValue(id)) {
        throw new IllegalArgumentException("Duplicate texture id " + id);
      }
      copy.put(name, id);
    }
    return new TextureMap(copy);
  }

  /**
   * Looks up a normalized class name.
   *
   * @param normalizedName output of {@link TextureNormalizer#normalize(Object)}; may be {@code null}
   * @return identifier, or empty for {@code null} and unmapped names
   */
  public OptionalInt idOf(String normalizedName) {
    if (normalizedName == null) {
      return OptionalInt.empty();
    }
    Integer id = ids.get(normalizedName);
    return id == null ? OptionalInt.empty() : OptionalInt.of(id);
  }

  /**
   * Reports whether an identifier belongs to this table.
   *
   * @param id candidate class identifier
   * @return {@code true} when some class name maps to {@code id}
   */
  public boolean containsId(int id) {
    return ids.containsValue(id);
  }

  /**
   * Returns the class names in identifier order.
   *
   * @return unmodifiable view of the names
   */
  public Collection<String> names() {
    return ids.keySet();
  }

  private static TextureMap buildUsda() {
    Map<String, Integer> map = new LinkedHashMap<>();
    map.put("sand", 1);
    map.put("loamy sand", 2);
    map.put("sandy loam", 3);
    map.put("loam", 4);
    map.put("silt loam", 5);
    map.put("silt", 6);
    map.put("sandy clay loam", 7);
    map.put("clay loam", 8);
    map.put("silty clay loam", 9);
    map.put("sandy clay", 10);
    map.put("silty clay", 11);
    map.put("clay", 12);
    return new TextureMap(map);
  }
}
