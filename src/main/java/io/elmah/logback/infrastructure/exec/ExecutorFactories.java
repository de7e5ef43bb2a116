package io.elmah.logback.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factories for the appender's background workers.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a factory for batch worker threads.
   * <p>Threads are daemons so a forgotten {@code stop()} never keeps the JVM alive.</p>
   *
   * @param prefix thread-name prefix, typically derived from the appender name
   * @param handler uncaught exception handler installed on each thread; {@code null} ignores failures
   * @return thread factory producing named daemon threads
   */
  public static ThreadFactory newBatchWorkerFactory(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "elmahio-worker" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
