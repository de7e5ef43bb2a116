package io.elmah.logback.application.pipeline;

import io.elmah.logback.application.mapping.MessageMapper;
import io.elmah.logback.application.port.MessagesClient;
import io.elmah.logback.application.port.MetricsPort;
import io.elmah.logback.domain.CreateMessage;
import io.elmah.logback.domain.LogRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * <strong>What:</strong> Turns a batch of captured records into one API call.
 * <p><strong>Role:</strong> Use case invoked by the batching worker of {@code ElmahIoAppender}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map each record and drop the messages the filter rejects.</li>
 *   <li>Send a single-record batch with create, anything larger with bulk create.</li>
 *   <li>Skip the API entirely when every message was filtered.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Called from the single batch worker; holds no mutable state.</p>
 * <p><strong>Observability:</strong> Updates {@code elmahio.messages.filtered} and {@code elmahio.batch.size}.</p>
 *
 * @since 1.0.0
 */
public final class MessageDispatcher {
  private final MessageMapper mapper;
  private final MessagesClient client;
  private final UUID logId;
  private final Predicate<CreateMessage> filter;
  private final MetricsPort metrics;

  /**
   * Creates a dispatcher.
   *
   * @param mapper record to message mapper
   * @param client API client
   * @param logId destination log
   * @param filter returns {@code true} for messages that must not be sent; {@code null} keeps everything
   * @param metrics metrics port; {@code null} falls back to {@link MetricsPort#NO_OP}
   */
  public MessageDispatcher(
      MessageMapper mapper,
      MessagesClient client,
      UUID logId,
      Predicate<CreateMessage> filter,
      MetricsPort metrics) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.client = Objects.requireNonNull(client, "client");
    this.logId = Objects.requireNonNull(logId, "logId");
    this.filter = filter;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Maps, filters and submits a batch.
   *
   * @param records captured records in arrival order
   * @return future completing when the API call finished; already complete when nothing was sent
   */
  public CompletableFuture<Void> dispatch(List<LogRecord> records) {
    if (records == null || records.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }
    metrics.observe("elmahio.batch.size", records.size());

    List<CreateMessage> messages = new ArrayList<>(records.size());
    for (LogRecord record : records) {
      CreateMessage message = mapper.map(record);
      if (filter != null && filter.test(message)) {
        metrics.increment("elmahio.messages.filtered");
        continue;
      }
      if (records.size() == 1) {
        return client.createAndNotify(logId, message);
      }
      messages.add(message);
    }

    if (messages.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }
    return client.createBulkAndNotify(logId, messages);
  }
}
