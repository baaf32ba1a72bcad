package io.mqttrouter.codec;

import io.mqttrouter.MqttRouterException;

/**
 * Raised when a payload cannot be decoded: malformed body, wrong type tag or oversized
 * payload. When raised during dispatch the exception carries the topic and payload length
 * of the offending message.
 */
public class DecodeException extends MqttRouterException {
  private final String topic;
  private final int payloadLength;

  public DecodeException(String message) {
    this(message, null, -1, null);
  }

  public DecodeException(String message, Throwable cause) {
    this(message, null, -1, cause);
  }

  public DecodeException(String message, String topic, int payloadLength, Throwable cause) {
    super(message, cause);
    this.topic = topic;
    this.payloadLength = payloadLength;
  }

  /** Topic of the message that failed to decode, or {@code null} outside dispatch. */
  public String topic() {
    return topic;
  }

  /** Raw payload length in bytes, or {@code -1} outside dispatch. */
  public int payloadLength() {
    return payloadLength;
  }
}
