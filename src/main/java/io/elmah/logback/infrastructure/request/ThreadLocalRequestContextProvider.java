package io.elmah.logback.infrastructure.request;

import io.elmah.logback.application.port.RequestContextProvider;
import io.elmah.logback.domain.RequestInfo;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RequestContextProvider} reading the request bound to the current thread.
 * <p>Web integrations bind the request when handling starts and close the returned scope when it ends:</p>
 * <pre>{@code
 * try (ThreadLocalRequestContextProvider.Scope scope = provider.bind(requestInfo)) {
 *   chain.doFilter(request, response);
 * }
 * }</pre>
 * <p>Events are snapshotted on the logging thread, so the binding is read before the event is queued.</p>
 *
 * @since 1.0.0
 */
public final class ThreadLocalRequestContextProvider implements RequestContextProvider {
  private final ThreadLocal<RequestInfo> current = new ThreadLocal<>();

  /**
   * Binds a request to the calling thread, replacing any previous binding until the scope closes.
   *
   * @param request request to expose to lookups
   * @return scope restoring the previous binding when closed
   */
  public Scope bind(RequestInfo request) {
    Objects.requireNonNull(request, "request");
    RequestInfo previous = current.get();
    current.set(request);
    return () -> {
      if (previous == null) {
        current.remove();
      } else {
        current.set(previous);
      }
    };
  }

  /** Removes the binding of the calling thread. */
  public void clear() {
    current.remove();
  }

  @Override
  public Optional<RequestInfo> currentRequest() {
    return Optional.ofNullable(current.get());
  }

  /** Binding handle; closing it does not throw. */
  @FunctionalInterface
  public interface Scope extends AutoCloseable {
    @Override
    void close();
  }
}
