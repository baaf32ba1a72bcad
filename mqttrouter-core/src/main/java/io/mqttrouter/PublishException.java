package io.mqttrouter;

/**
 * Thrown when a {@link io.mqttrouter.spi.MessageSink} fails to accept an outbound message,
 * or when a reply cannot be published because the inbound message carried no response topic.
 */
public class PublishException extends MqttRouterException {

  public PublishException(String message) {
    super(message);
  }

  public PublishException(String message, Throwable cause) {
    super(message, cause);
  }
}
