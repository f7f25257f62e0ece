package org.agroforestry.farmprofile.application.port;

/**
 * Signals that the geospatial query service failed, timed out or returned an unusable result.
 *
 * <p>Checked so every caller decides explicitly whether to degrade the reading to "no data" or to fail
 * the surrounding profile.</p>
 *
 * @since 0.1.0
 */
public class RemoteQueryException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable reason
   */
  public RemoteQueryException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a descriptive message and root cause.
   *
   * @param message human-readable reason
   * @param cause underlying service error
   */
  public RemoteQueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
