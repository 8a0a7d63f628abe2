package io.flightqc.infrastructure.exec;

import io.flightqc.logging.Logs;
import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.MDC;

/**
 * Factory helpers for the executors used by the extraction scheduler.
 *
 * <p>Every executor built here copies the submitting thread's SLF4J MDC onto the worker for the duration of each
 * task, so per-folder log lines keep their {@code site} and {@code folder} keys.</p>
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size worker pool fed by an unbounded work queue.
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    ThreadFactory factory = threadFactory(prefix, "flightqc-worker", false, handler);
    return new MdcThreadPoolExecutor(
        size,
        size,
        0L,
        new LinkedBlockingQueue<>(),
        factory);
  }

  /**
   * Builds an elastic pool for blocking remote reads.
   *
   * <p>Threads are daemons: a read abandoned after its deadline may stay blocked until its session is closed, and
   * must never keep the JVM alive.</p>
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on each thread
   * @return configured executor service
   */
  public static ExecutorService newIoPool(String prefix, UncaughtExceptionHandler handler) {
    ThreadFactory factory = threadFactory(prefix, "flightqc-io", true, handler);
    return new MdcThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        30_000L,
        new SynchronousQueue<>(),
        factory);
  }

  private static ThreadFactory threadFactory(
      String prefix, String fallbackPrefix, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallbackPrefix : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }

  private static final class MdcThreadPoolExecutor extends ThreadPoolExecutor {
    MdcThreadPoolExecutor(
        int core, int max, long keepAliveMillis, BlockingQueue<Runnable> queue, ThreadFactory factory) {
      super(core, max, keepAliveMillis, TimeUnit.MILLISECONDS, queue, factory, new ThreadPoolExecutor.AbortPolicy());
    }

    @Override
    public void execute(Runnable command) {
      super.execute(Logs.withMdc(MDC.getCopyOfContextMap(), command));
    }
  }
}
