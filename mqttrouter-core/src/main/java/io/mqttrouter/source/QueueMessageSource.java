package io.mqttrouter.source;

import io.mqttrouter.RawMessage;
import io.mqttrouter.spi.MessageSource;
import io.mqttrouter.spi.SourceClosedException;
import io.mqttrouter.spi.Subscription;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory {@link MessageSource} backed by a bounded queue.
 *
 * <p>Used directly in tests and as the hand-off point for callback-driven clients: the
 * client thread {@link #offer offers} or {@link #put puts} messages, the dispatcher's
 * consumer thread takes them with {@link #next()}.
 *
 * <p>{@link #fail(Throwable)} reports a lost connection: messages already queued are still
 * delivered, then {@code next()} throws {@link SourceClosedException}. {@link #close()}
 * discards the queue and fails {@code next()} immediately.
 */
public class QueueMessageSource implements MessageSource {
  private static final Logger logger = Logger.getLogger(QueueMessageSource.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final BlockingQueue<RawMessage> queue;
  private volatile List<Subscription> subscriptions = List.of();
  private volatile boolean closed;
  private volatile Throwable failure;

  public QueueMessageSource() {
    this(1000);
  }

  /**
   * @param capacity maximum number of queued messages; must be &gt; 0
   */
  public QueueMessageSource(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.queue = new LinkedBlockingQueue<>(capacity);
  }

  @Override
  public void open(List<Subscription> subscriptions) {
    this.subscriptions = List.copyOf(subscriptions);
    logger.log(Level.FINE, "Queue source opened with {0} subscription(s)", subscriptions.size());
  }

  /**
   * Enqueues a message without blocking.
   *
   * @return {@code false} if the queue is full or the source is closed or failed
   */
  public boolean offer(RawMessage message) {
    Objects.requireNonNull(message, "message");
    if (closed || failure != null) {
      return false;
    }
    return queue.offer(message);
  }

  /**
   * Enqueues a message, blocking while the queue is full.
   *
   * @throws SourceClosedException if the source is closed or failed
   * @throws InterruptedException if interrupted while waiting for space
   */
  public void put(RawMessage message) throws InterruptedException {
    Objects.requireNonNull(message, "message");
    while (true) {
      if (closed || failure != null) {
        throw new SourceClosedException("Message source is closed");
      }
      if (queue.offer(message, QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
        return;
      }
    }
  }

  @Override
  public RawMessage next() throws InterruptedException {
    while (true) {
      if (closed) {
        throw new SourceClosedException("Message source is closed");
      }
      RawMessage message = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
      if (message != null) {
        return message;
      }
      Throwable cause = failure;
      if (cause != null && queue.isEmpty()) {
        throw cause instanceof SourceClosedException sce
            ? sce
            : new SourceClosedException("Message source failed: " + cause.getMessage(), cause);
      }
    }
  }

  /**
   * Marks the source as failed. Queued messages are still delivered; afterwards
   * {@link #next()} throws {@link SourceClosedException} carrying {@code cause}.
   */
  public void fail(Throwable cause) {
    Objects.requireNonNull(cause, "cause");
    if (failure == null) {
      failure = cause;
      logger.log(Level.WARNING, "Message source failed", cause);
    }
  }

  @Override
  public void close() {
    closed = true;
    int dropped = queue.size();
    queue.clear();
    if (dropped > 0) {
      logger.log(Level.WARNING, "Message source closed; discarded {0} queued message(s)", dropped);
    }
  }

  /** Subscriptions passed to the last {@link #open(List)}. */
  public List<Subscription> subscriptions() {
    return subscriptions;
  }

  public boolean isClosed() {
    return closed;
  }

  public int size() {
    return queue.size();
  }
}
