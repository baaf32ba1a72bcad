package io.mqttrouter.codec;

import io.mqttrouter.MqttRouterException;

/**
 * Raised when a value cannot be encoded, or when no codec is bound for its payload type.
 */
public class EncodeException extends MqttRouterException {

  public EncodeException(String message) {
    super(message);
  }

  public EncodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
