package io.mqttrouter;

import io.mqttrouter.spi.MessageSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Test sink that records every publish and can be told to fail.
 */
public class RecordingSink implements MessageSink, AutoCloseable {

  public record Published(String topic, byte[] payload, QoS qos, boolean retain, MessageProperties properties) {
  }

  public final List<Published> published = new CopyOnWriteArrayList<>();
  public volatile RuntimeException failWith;
  public volatile boolean closed;

  @Override
  public void publish(String topic, byte[] payload, QoS qos, boolean retain, MessageProperties properties) {
    RuntimeException failure = failWith;
    if (failure != null) {
      throw failure;
    }
    published.add(new Published(topic, payload, qos, retain, properties));
  }

  /** Waits until at least {@code count} messages were published. */
  public boolean awaitPublished(int count, long timeoutMs) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
    while (published.size() < count) {
      if (System.nanoTime() > deadline) {
        return false;
      }
      Thread.sleep(5);
    }
    return true;
  }

  @Override
  public void close() {
    closed = true;
  }
}
