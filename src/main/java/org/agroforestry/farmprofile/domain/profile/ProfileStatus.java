package org.agroforestry.farmprofile.domain.profile;

import java.util.Locale;

/**
 * Outcome of a profile build or update.
 *
 * @since 0.1.0
 */
public enum ProfileStatus {
  SUCCESS,
  FAILED;

  /**
   * Returns the lower-case label written to tabular output.
   *
   * @return {@code success} or {@code failed}
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
