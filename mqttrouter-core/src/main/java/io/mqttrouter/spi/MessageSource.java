package io.mqttrouter.spi;

import io.mqttrouter.RawMessage;

import java.util.List;

/**
 * Inbound side of the MQTT connection.
 *
 * <p>The dispatcher calls {@link #open(List)} once on start, then {@link #next()} from a
 * single consumer thread until the source reports {@link SourceClosedException} or the
 * consumer is interrupted by {@code stop()}. {@link #close()} is called once after the
 * dispatcher has drained.
 *
 * @see io.mqttrouter.source.QueueMessageSource
 */
public interface MessageSource extends AutoCloseable {

  /**
   * Subscribes to the given filters. Called before the first {@link #next()}.
   *
   * @param subscriptions distinct subscription filters with requested QoS
   */
  default void open(List<Subscription> subscriptions) {
  }

  /**
   * Blocks until the next message is available.
   *
   * <p>Implementations must respond to thread interruption by throwing
   * {@link InterruptedException}.
   *
   * @return the next inbound message (never {@code null})
   * @throws InterruptedException if the calling thread is interrupted while waiting
   * @throws SourceClosedException if the source is closed or the connection was lost
   */
  RawMessage next() throws InterruptedException;

  /**
   * Releases the source. Further {@link #next()} calls fail with
   * {@link SourceClosedException}.
   */
  @Override
  void close();
}
