package io.mqttrouter.dispatch;

import io.mqttrouter.MessageProperties;
import io.mqttrouter.OutboundMessage;
import io.mqttrouter.PublishException;
import io.mqttrouter.QoS;
import io.mqttrouter.codec.CodecRegistry;
import io.mqttrouter.codec.PayloadType;
import io.mqttrouter.spi.DispatchMetrics;
import io.mqttrouter.spi.MessageSink;
import io.mqttrouter.topic.Topics;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Encodes outbound payloads and hands them to the {@link MessageSink}. Shared by the
 * dispatcher (handler results, replies) and the client facade ({@code publish}).
 *
 * <p>All failures are thrown to the caller: {@link io.mqttrouter.topic.InvalidTopicException}
 * for a bad topic, {@link io.mqttrouter.codec.EncodeException} for encode failures and
 * {@link PublishException} for sink failures.
 */
public final class OutboundPublisher {
  private static final Logger logger = Logger.getLogger(OutboundPublisher.class.getName());

  private final CodecRegistry codecs;
  private final MessageSink sink;
  private final DispatchMetrics metrics;

  public OutboundPublisher(CodecRegistry codecs, MessageSink sink, DispatchMetrics metrics) {
    this.codecs = Objects.requireNonNull(codecs, "codecs");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = metrics != null ? metrics : DispatchMetrics.NOOP;
  }

  /**
   * Publishes {@code payload} with the codec of the first bound type accepting it.
   */
  public OutboundMessage publish(String topic, Object payload, QoS qos, boolean retain,
                                 MessageProperties properties) {
    return publish(topic, codecs.typeOf(payload), payload, qos, retain, properties);
  }

  /**
   * Publishes {@code payload} encoded as {@code type}.
   *
   * @return what was handed to the sink
   */
  public OutboundMessage publish(String topic, PayloadType<?> type, Object payload, QoS qos,
                                 boolean retain, MessageProperties properties) {
    Topics.requireValidTopic(topic);
    byte[] encoded = codecs.encode(type, payload);
    return publishEncoded(topic, type.name(), encoded, qos, retain, properties);
  }

  /**
   * Publishes an already encoded payload.
   */
  public OutboundMessage publishEncoded(String topic, String payloadType, byte[] encoded, QoS qos,
                                        boolean retain, MessageProperties properties) {
    Topics.requireValidTopic(topic);
    Objects.requireNonNull(qos, "qos");
    MessageProperties props = properties != null ? properties : MessageProperties.EMPTY;
    try {
      sink.publish(topic, encoded, qos, retain, props);
    } catch (PublishException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new PublishException("Failed to publish to " + topic, e);
    }
    metrics.incrementPublished();
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Published " + encoded.length + " bytes of " + payloadType + " to " + topic
          + " with qos=" + qos.value());
    }
    return new OutboundMessage(topic, payloadType, encoded.length, qos, retain, props);
  }
}
