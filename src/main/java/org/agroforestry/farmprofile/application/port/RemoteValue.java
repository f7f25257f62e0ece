package org.agroforestry.farmprofile.application.port;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * <strong>What:</strong> Result of a geospatial query that may still live on the remote service.
 * <p><strong>Why:</strong> Query services often return lazy server-side handles; callers resolve them explicitly
 * instead of probing the returned object for a fetch method.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Wrap an already-local value, an absent value, or a deferred fetch.</li>
 *   <li>Resolve to an {@link Optional}, mapping a {@code null} fetch result to empty.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; a deferred value performs its fetch on every {@link #resolve()}.</p>
 *
 * @param <T> local value type
 * @since 0.1.0
 */
public final class RemoteValue<T> {
  private final Fetch<? extends T> fetch;

  private RemoteValue(Fetch<? extends T> fetch) {
    this.fetch = fetch;
  }

  /**
   * Wraps a value that is already local.
   *
   * @param value local value; {@code null} behaves like {@link #absent()}
   * @param <T> value type
   * @return resolved remote value
   */
  public static <T> RemoteValue<T> of(T value) {
    return value == null ? absent() : new RemoteValue<>(() -> value);
  }

  /**
   * Returns a value that resolves to empty.
   *
   * @param <T> value type
   * @return absent value
   */
  public static <T> RemoteValue<T> absent() {
    return new RemoteValue<>(() -> null);
  }

  /**
   * Wraps a fetch executed against the remote service on resolution.
   *
   * @param fetch remote fetch; may return {@code null} for "no data"
   * @param <T> value type
   * @return deferred remote value
   */
  public static <T> RemoteValue<T> deferred(Fetch<? extends T> fetch) {
    return new RemoteValue<>(Objects.requireNonNull(fetch, "fetch"));
  }

  /**
   * Brings the value to the local process.
   *
   * @return local value, or empty when the service reported no data
   * @throws RemoteQueryException if the remote fetch fails
   */
  public Optional<T> resolve() throws RemoteQueryException {
    return Optional.ofNullable(fetch.fetch());
  }

  /**
   * Applies a local transformation after resolution.
   *
   * @param mapper transformation applied to a present value; a {@code null} result means absent
   * @param <R> mapped type
   * @return deferred mapped value
   */
  public <R> RemoteValue<R> map(Function<? super T, ? extends R> mapper) {
    Objects.requireNonNull(mapper, "mapper");
    return new RemoteValue<>(() -> {
      T value = fetch.fetch();
      return value == null ? null : mapper.apply(value);
    });
  }

  /**
   * Remote fetch operation.
   *
   * @param <T> value type
   */
  @FunctionalInterface
  public interface Fetch<T> {
    /**
     * Performs the fetch.
     *
     * @return fetched value or {@code null} for "no data"
     * @throws RemoteQueryException if the service fails
     */
    T fetch() throws RemoteQueryException;
  }
}
