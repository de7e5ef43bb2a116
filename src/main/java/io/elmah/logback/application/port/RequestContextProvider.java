package io.elmah.logback.application.port;

import io.elmah.logback.domain.RequestInfo;
import java.util.Optional;

/**
 * Supplies the HTTP request being served by the current thread.
 * <p>Consulted on the logging thread when an event is captured. Configuring a provider enables the
 * {@code request:*} lookup sources.</p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface RequestContextProvider {

  /**
   * Returns the request active on the calling thread.
   *
   * @return current request, or empty outside a request
   */
  Optional<RequestInfo> currentRequest();
}
