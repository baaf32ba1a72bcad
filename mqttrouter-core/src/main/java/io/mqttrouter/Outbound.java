package io.mqttrouter;

import io.mqttrouter.codec.PayloadType;
import io.mqttrouter.topic.Topics;

import java.util.Objects;

/**
 * What a {@link RouteHandler} asks the dispatcher to publish after handling a message.
 *
 * <p>A handler returns {@link #none()} (or {@code null}) when nothing is published,
 * {@link #publish(String, Object)} to publish to an explicit topic, or {@link #reply(Object)}
 * to answer on the inbound message's response topic. Unless a payload type is given the
 * outbound payload is encoded with the route's own payload type.
 */
public sealed interface Outbound permits Outbound.None, Outbound.Publish, Outbound.Reply {

  static Outbound none() {
    return None.INSTANCE;
  }

  static Outbound publish(String topic, Object payload) {
    return new Publish(topic, null, payload, null, false);
  }

  static <T> Outbound publish(String topic, PayloadType<T> type, T payload) {
    return new Publish(topic, type, payload, null, false);
  }

  static Outbound reply(Object payload) {
    return new Reply(null, payload);
  }

  static <T> Outbound reply(PayloadType<T> type, T payload) {
    return new Reply(type, payload);
  }

  /** Nothing to publish. */
  final class None implements Outbound {
    static final None INSTANCE = new None();

    private None() {
    }

    @Override
    public String toString() {
      return "Outbound.None";
    }
  }

  /**
   * Publish to an explicit topic.
   *
   * @param topic   destination topic
   * @param type    payload type to encode with, {@code null} for the route's type
   * @param payload value to encode
   * @param qos     publish QoS, {@code null} for the inbound message's QoS
   * @param retain  retain flag
   */
  record Publish(String topic, PayloadType<?> type, Object payload, QoS qos, boolean retain)
      implements Outbound {
    public Publish {
      Topics.requireValidTopic(topic);
    }

    public Publish withQos(QoS qos) {
      return new Publish(topic, type, payload, Objects.requireNonNull(qos, "qos"), retain);
    }

    public Publish retained() {
      return new Publish(topic, type, payload, qos, true);
    }
  }

  /**
   * Reply on the inbound response topic, copying its correlation data.
   *
   * @param type    payload type to encode with, {@code null} for the route's type
   * @param payload value to encode
   */
  record Reply(PayloadType<?> type, Object payload) implements Outbound {
  }
}
