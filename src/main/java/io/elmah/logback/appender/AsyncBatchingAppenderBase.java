package io.elmah.logback.appender;

import ch.qos.logback.core.UnsynchronizedAppenderBase;
import io.elmah.logback.infrastructure.exec.ExecutorFactories;
import io.elmah.logback.validation.Numbers;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * <strong>What:</strong> Logback appender base that queues events and writes them in batches from one worker.
 * <p><strong>Why:</strong> Sending each event over HTTP on the logging thread would tie application latency to
 * the remote API.</p>
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>{@link #append} snapshots the event with {@link #prepare} on the logging thread and queues the result.</li>
 *   <li>The worker waits for the first record, sleeps {@code taskDelayMillis} so more can arrive, drains up to
 *   {@code batchSize} records and hands them to {@link #writeBatch}.</li>
 *   <li>A failed or timed out batch is retried {@code retryCount} times with a doubling delay.</li>
 *   <li>{@link #stop} lets the worker drain the queue for at most {@code shutdownTimeoutMillis}.</li>
 * </ol>
 * <p>With {@link OverflowAction#BLOCK}, events appended from the worker itself (for example by a callback
 * that logs) never wait: they are dropped when the queue is full.</p>
 * <p><strong>Thread-safety:</strong> {@code append} may be called from any thread. Settings must be applied before
 * {@link #start}.</p>
 *
 * @param <E> Logback event type
 * @param <R> snapshot queued for the worker
 * @since 1.0.0
 */
public abstract class AsyncBatchingAppenderBase<E, R> extends UnsynchronizedAppenderBase<E> {
  public static final int DEFAULT_QUEUE_LIMIT = 10_000;
  public static final int DEFAULT_BATCH_SIZE = 50;
  public static final long DEFAULT_TASK_DELAY_MILLIS = 250;
  public static final int DEFAULT_TASK_TIMEOUT_SECONDS = 150;
  public static final int DEFAULT_RETRY_COUNT = 0;
  public static final long DEFAULT_RETRY_DELAY_MILLIS = 500;
  public static final long DEFAULT_SHUTDOWN_TIMEOUT_MILLIS = 5_000;
  private static final long POLL_MILLIS = 100;

  private int queueLimit = DEFAULT_QUEUE_LIMIT;
  private OverflowAction overflowAction = OverflowAction.DISCARD;
  private int batchSize = DEFAULT_BATCH_SIZE;
  private long taskDelayMillis = DEFAULT_TASK_DELAY_MILLIS;
  private int taskTimeoutSeconds = DEFAULT_TASK_TIMEOUT_SECONDS;
  private int retryCount = DEFAULT_RETRY_COUNT;
  private long retryDelayMillis = DEFAULT_RETRY_DELAY_MILLIS;
  private long shutdownTimeoutMillis = DEFAULT_SHUTDOWN_TIMEOUT_MILLIS;

  private volatile BlockingQueue<R> queue;
  private volatile boolean running;
  private final AtomicBoolean growWarned = new AtomicBoolean();
  private volatile Thread worker;

  /**
   * Captures everything the batch needs from the event. Runs on the logging thread.
   *
   * @param event Logback event
   * @return snapshot to queue, or {@code null} to ignore the event
   */
  protected abstract R prepare(E event);

  /**
   * Writes one batch. Runs on the worker thread.
   *
   * @param batch records in arrival order; never empty
   * @return future completing when the batch was handled; a failed future triggers a retry
   */
  protected abstract CompletableFuture<Void> writeBatch(List<R> batch);

  /** Called for every event rejected because the queue was full. */
  protected void onEventDropped() {}

  /**
   * Called after a batch completed.
   *
   * @param size number of records in the batch
   * @param elapsedMillis time spent in {@link #writeBatch}, retries included
   */
  protected void onBatchWritten(int size, long elapsedMillis) {}

  @Override
  public void start() {
    if (isStarted()) {
      return;
    }
    try {
      Numbers.requireRange("queueLimit", queueLimit, 1, Integer.MAX_VALUE);
      Numbers.requireRange("batchSize", batchSize, 1, Integer.MAX_VALUE);
      Numbers.requireRange("taskDelayMillis", taskDelayMillis, 0, Long.MAX_VALUE);
      Numbers.requireRange("taskTimeoutSeconds", taskTimeoutSeconds, 1, Integer.MAX_VALUE);
      Numbers.requireRange("retryCount", retryCount, 0, Integer.MAX_VALUE);
      Numbers.requireRange("retryDelayMillis", retryDelayMillis, 0, Long.MAX_VALUE);
      Numbers.requireRange("shutdownTimeoutMillis", shutdownTimeoutMillis, 0, Long.MAX_VALUE);
    } catch (IllegalArgumentException ex) {
      addError("Appender [" + getName() + "] not started: " + ex.getMessage());
      return;
    }

    queue = overflowAction == OverflowAction.GROW
        ? new LinkedBlockingQueue<>()
        : new LinkedBlockingQueue<>(queueLimit);
    growWarned.set(false);
    running = true;
    worker = ExecutorFactories
        .newBatchWorkerFactory(
            "elmahio-" + (getName() == null ? "appender" : getName()),
            (thread, ex) -> addError("Batch worker " + thread.getName() + " terminated", ex))
        .newThread(this::runWorker);
    worker.start();
    super.start();
  }

  @Override
  public void stop() {
    if (!isStarted()) {
      return;
    }
    super.stop();
    running = false;
    Thread current = worker;
    if (current != null) {
      try {
        current.join(shutdownTimeoutMillis);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      if (current.isAlive()) {
        current.interrupt();
        addWarn("Appender [" + getName() + "] stopped with " + queue.size() + " events not written");
      }
    }
    worker = null;
  }

  @Override
  protected void append(E event) {
    if (!isStarted()) {
      return;
    }
    R record;
    try {
      record = prepare(event);
    } catch (RuntimeException ex) {
      addError("Failed to capture logging event", ex);
      return;
    }
    if (record != null) {
      enqueue(record);
    }
  }

  private void enqueue(R record) {
    BlockingQueue<R> target = queue;
    switch (overflowAction) {
      case BLOCK -> {
        if (Thread.currentThread() == worker) {
          // the worker cannot wait for itself to drain the queue
          if (!target.offer(record)) {
            onEventDropped();
          }
          return;
        }
        try {
          target.put(record);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          onEventDropped();
        }
      }
      case GROW -> {
        target.offer(record);
        if (target.size() > queueLimit && growWarned.compareAndSet(false, true)) {
          addWarn("Queue of appender [" + getName() + "] grew beyond queueLimit " + queueLimit);
        }
      }
      default -> {
        if (!target.offer(record)) {
          onEventDropped();
        }
      }
    }
  }

  private void runWorker() {
    BlockingQueue<R> source = queue;
    try {
      while (running || !source.isEmpty()) {
        R first = source.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (first == null) {
          continue;
        }
        if (running && taskDelayMillis > 0) {
          Thread.sleep(taskDelayMillis);
        }
        List<R> batch = new ArrayList<>(Math.min(batchSize, source.size() + 1));
        batch.add(first);
        source.drainTo(batch, batchSize - 1);
        write(batch);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private void write(List<R> batch) throws InterruptedException {
    long started = System.nanoTime();
    long delay = retryDelayMillis;
    for (int attempt = 0; ; attempt++) {
      try {
        CompletableFuture<Void> result = writeBatch(List.copyOf(batch));
        if (result != null) {
          result.get(taskTimeoutSeconds, TimeUnit.SECONDS);
        }
        onBatchWritten(batch.size(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return;
      } catch (ExecutionException | TimeoutException | RuntimeException ex) {
        Throwable cause = ex instanceof ExecutionException && ex.getCause() != null ? ex.getCause() : ex;
        if (attempt >= retryCount) {
          addError("Failed to write batch of " + batch.size() + " events after " + (attempt + 1) + " attempt(s)",
              cause);
          return;
        }
        addWarn("Retrying batch of " + batch.size() + " events in " + delay + " ms: " + cause);
        if (delay > 0) {
          Thread.sleep(delay);
        }
        delay = delay > Long.MAX_VALUE / 2 ? Long.MAX_VALUE : delay * 2;
      }
    }
  }

  /** Number of records waiting for the worker; {@code 0} before start. */
  protected int queuedCount() {
    BlockingQueue<R> current = queue;
    return current == null ? 0 : current.size();
  }

  public int getQueueLimit() {
    return queueLimit;
  }

  public void setQueueLimit(int queueLimit) {
    this.queueLimit = queueLimit;
  }

  public OverflowAction getOverflowAction() {
    return overflowAction;
  }

  public void setOverflowAction(OverflowAction overflowAction) {
    this.overflowAction = Objects.requireNonNull(overflowAction, "overflowAction");
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public long getTaskDelayMillis() {
    return taskDelayMillis;
  }

  public void setTaskDelayMillis(long taskDelayMillis) {
    this.taskDelayMillis = taskDelayMillis;
  }

  public int getTaskTimeoutSeconds() {
    return taskTimeoutSeconds;
  }

  public void setTaskTimeoutSeconds(int taskTimeoutSeconds) {
    this.taskTimeoutSeconds = taskTimeoutSeconds;
  }

  public int getRetryCount() {
    return retryCount;
  }

  public void setRetryCount(int retryCount) {
    this.retryCount = retryCount;
  }

  public long getRetryDelayMillis() {
    return retryDelayMillis;
  }

  public void setRetryDelayMillis(long retryDelayMillis) {
    this.retryDelayMillis = retryDelayMillis;
  }

  public long getShutdownTimeoutMillis() {
    return shutdownTimeoutMillis;
  }

  public void setShutdownTimeoutMillis(long shutdownTimeoutMillis) {
    this.shutdownTimeoutMillis = shutdownTimeoutMillis;
  }
}
