package io.mqttrouter.spi;

import io.mqttrouter.MessageProperties;
import io.mqttrouter.QoS;

/**
 * Outbound side of the MQTT connection. Must be safe to call from several handler threads
 * at once.
 */
public interface MessageSink {

  /**
   * Publishes an already encoded payload.
   *
   * @param topic      destination topic (validated, no wildcards)
   * @param payload    encoded payload
   * @param qos        publish QoS
   * @param retain     retain flag
   * @param properties MQTT v5 properties, {@link MessageProperties#EMPTY} for none
   * @throws io.mqttrouter.PublishException if the message could not be handed to the
   *     connection
   */
  void publish(String topic, byte[] payload, QoS qos, boolean retain, MessageProperties properties);

  default void publish(String topic, byte[] payload, QoS qos, boolean retain) {
    publish(topic, payload, qos, retain, MessageProperties.EMPTY);
  }
}
