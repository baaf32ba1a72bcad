package io.mqttrouter.spi;

import io.mqttrouter.MqttRouterException;

/**
 * Raised by {@link MessageSource#next()} when the source can no longer deliver messages,
 * either because it was closed or because the underlying connection was lost. The
 * dispatcher drains in-flight work and stops.
 */
public class SourceClosedException extends MqttRouterException {

  public SourceClosedException(String message) {
    super(message);
  }

  public SourceClosedException(String message, Throwable cause) {
    super(message, cause);
  }
}
