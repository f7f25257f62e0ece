package org.agroforestry.farmprofile.domain.geometry;

/**
 * Raised when caller-supplied geometry input cannot be normalized into a {@link Geometry}.
 *
 * <p>Signals a caller error; profile builders and updaters let it propagate, only the bulk layer
 * captures it per item.</p>
 *
 * @since 0.1.0
 */
public final class InvalidGeometryException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable reason
   */
  public InvalidGeometryException(String message) {
    super(message);
  }
}
