package io.mqttrouter.dispatch;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the daemon threads of one {@link RouteDispatcher}.
 *
 * <p>Threads are named {@code mqttrouter-<dispatcher>-<role>-<n>}, where the dispatcher
 * number distinguishes routers running in the same JVM. Every thread remembers the factory
 * that created it, which lets the dispatcher recognise calls made from its own consumer and
 * handler threads. Uncaught exceptions are logged at SEVERE.
 */
final class DispatchThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(DispatchThreadFactory.class.getName());

  static final String HANDLER = "handler";
  static final String CONSUMER = "consumer";

  private static final AtomicInteger DISPATCHERS = new AtomicInteger();
  private static final ThreadLocal<DispatchThreadFactory> OWNER = new ThreadLocal<>();

  private final String namePrefix;
  private final Map<String, AtomicInteger> counters = new ConcurrentHashMap<>();

  DispatchThreadFactory() {
    this.namePrefix = "mqttrouter-" + DISPATCHERS.incrementAndGet() + "-";
  }

  /** Creates a handler pool thread. */
  @Override
  public Thread newThread(Runnable task) {
    return newThread(HANDLER, task);
  }

  Thread newThread(String role, Runnable task) {
    int n = counters.computeIfAbsent(role, r -> new AtomicInteger()).incrementAndGet();
    Thread thread = new Thread(() -> {
      OWNER.set(this);
      task.run();
    }, namePrefix + role + "-" + n);
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, e) ->
        logger.log(Level.SEVERE, "Uncaught exception in thread " + t.getName(), e));
    return thread;
  }

  /** Whether the calling thread was created by this factory. */
  boolean ownsCurrentThread() {
    return OWNER.get() == this;
  }
}
