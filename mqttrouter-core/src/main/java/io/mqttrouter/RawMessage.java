package io.mqttrouter;

import io.mqttrouter.topic.Topics;

import java.util.Arrays;
import java.util.Objects;

/**
 * An inbound message as delivered by a {@link io.mqttrouter.spi.MessageSource}: concrete
 * topic, undecoded payload and delivery metadata. Immutable; the payload array is copied
 * on the way in and on the way out.
 *
 * @param topic      the concrete topic the message was published to (no wildcards)
 * @param payload    raw payload bytes
 * @param qos        delivery QoS
 * @param retain     whether the broker delivered a retained message
 * @param properties MQTT v5 properties, {@link MessageProperties#EMPTY} when absent
 */
public record RawMessage(String topic, byte[] payload, QoS qos, boolean retain,
                         MessageProperties properties) {

  public RawMessage {
    Topics.requireValidTopic(topic);
    payload = Objects.requireNonNull(payload, "payload").clone();
    Objects.requireNonNull(qos, "qos");
    properties = properties == null ? MessageProperties.EMPTY : properties;
  }

  public RawMessage(String topic, byte[] payload) {
    this(topic, payload, QoS.AT_MOST_ONCE, false, MessageProperties.EMPTY);
  }

  public RawMessage(String topic, byte[] payload, QoS qos) {
    this(topic, payload, qos, false, MessageProperties.EMPTY);
  }

  @Override
  public byte[] payload() {
    return payload.clone();
  }

  /** Payload size in bytes without copying. */
  public int payloadLength() {
    return payload.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RawMessage other)) return false;
    return retain == other.retain
        && topic.equals(other.topic)
        && Arrays.equals(payload, other.payload)
        && qos == other.qos
        && properties.equals(other.properties);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(topic, qos, retain, properties);
    return 31 * result + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "RawMessage{topic=" + topic + ", payload=" + payload.length + " bytes, qos=" + qos
        + ", retain=" + retain + '}';
  }
}
