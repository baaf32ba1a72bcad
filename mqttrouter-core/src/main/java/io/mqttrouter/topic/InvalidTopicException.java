package io.mqttrouter.topic;

import io.mqttrouter.MqttRouterException;

/**
 * Thrown when a topic or topic filter violates MQTT topic syntax.
 */
public final class InvalidTopicException extends MqttRouterException {

  public InvalidTopicException(String message) {
    super(message);
  }
}
