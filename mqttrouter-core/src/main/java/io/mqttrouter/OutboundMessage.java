package io.mqttrouter;

import java.util.Objects;

/**
 * A message handed to the {@link io.mqttrouter.spi.MessageSink}, after encoding.
 *
 * @param topic       destination topic
 * @param payloadType name of the payload type the message was encoded with
 * @param size        encoded size in bytes, tag included
 * @param qos         publish QoS
 * @param retain      retain flag
 * @param properties  MQTT v5 properties sent along
 */
public record OutboundMessage(String topic, String payloadType, int size, QoS qos, boolean retain,
                              MessageProperties properties) {

  public OutboundMessage {
    Objects.requireNonNull(topic, "topic");
    Objects.requireNonNull(payloadType, "payloadType");
    Objects.requireNonNull(qos, "qos");
    properties = properties == null ? MessageProperties.EMPTY : properties;
  }
}
