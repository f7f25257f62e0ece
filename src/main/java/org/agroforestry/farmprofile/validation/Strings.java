package org.agroforestry.farmprofile.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for identifiers read from configuration and bulk input.
 * <p><strong>Why:</strong> Dataset names, asset identifiers and field names end up in remote queries and column
 * headers; blank or control-character values are rejected up front.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[a-z][a-z0-9_]*$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw.trim())) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a snake_case key such as a dataset name or a bulk input field name.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate key
   * @return trimmed key matching {@code [a-z][a-z0-9_]*}
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the key is blank or uses other characters
   */
  public static String requireKey(String name, String value) {
    String key = requireNonBlank(name, value);
    if (!KEY_PATTERN.matcher(key).matches()) {
      throw new IllegalArgumentException(message(name,
          "must be lower-case letters, digits or underscore, starting with a letter (was '" + key + "')"));
    }
    return key;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
