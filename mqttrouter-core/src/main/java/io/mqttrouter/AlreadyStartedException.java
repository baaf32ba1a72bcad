package io.mqttrouter;

/**
 * Thrown when an operation that is only valid before {@link MqttRouter#start()} is
 * attempted afterwards, or when {@code start()} is called twice.
 */
public final class AlreadyStartedException extends MqttRouterException {

  public AlreadyStartedException(String message) {
    super(message);
  }
}
