package io.elmah.logback.application.port;

import io.elmah.logback.domain.CreateMessage;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * <strong>What:</strong> Port for submitting messages to the elmah.io messages API.
 * <p><strong>Why:</strong> Keeps the dispatcher independent of the HTTP transport so batches can be verified
 * with in-memory fakes.</p>
 * <p><strong>Role:</strong> Domain port implemented by {@code HttpMessagesClient}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Notify registered {@link MessageListener}s before each message is sent.</li>
 *   <li>Notify listeners of every message that could not be stored.</li>
 *   <li>Never propagate a submission failure to the caller.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from the batch worker while listeners
 * are registered from configuration threads.</p>
 *
 * @since 1.0.0
 */
public interface MessagesClient {

  /**
   * Submits a single message.
   *
   * @param logId destination log
   * @param message message to store; passed to {@link MessageListener#onMessage} before sending
   * @return future completing once the request finished, successfully or not
   */
  CompletableFuture<Void> createAndNotify(UUID logId, CreateMessage message);

  /**
   * Submits several messages in one request.
   *
   * @param logId destination log
   * @param messages messages to store; each is passed to {@link MessageListener#onMessage} before sending
   * @return future completing once the request finished, successfully or not
   */
  CompletableFuture<Void> createBulkAndNotify(UUID logId, List<CreateMessage> messages);

  /**
   * Registers a listener for send and failure notifications.
   *
   * @param listener listener to add; must not be {@code null}
   */
  void addListener(MessageListener listener);
}
