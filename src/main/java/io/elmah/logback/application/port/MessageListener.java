package io.elmah.logback.application.port;

import io.elmah.logback.domain.CreateMessage;

/**
 * Callbacks raised by a {@link MessagesClient}.
 *
 * @since 1.0.0
 */
public interface MessageListener {

  /**
   * Invoked right before the message is sent. The message may still be modified.
   *
   * @param message outgoing message
   */
  default void onMessage(CreateMessage message) {}

  /**
   * Invoked for every message that the API did not store.
   *
   * @param message message that failed
   * @param error transport or API error
   */
  default void onMessageFail(CreateMessage message, Throwable error) {}
}
