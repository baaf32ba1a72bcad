package io.mqttrouter;

/**
 * Wraps whatever a {@link RouteHandler} threw, as carried in a {@link HandlerResult.Failure}
 * of stage {@code HANDLER}. The handler's own exception is the {@linkplain #getCause() cause}.
 */
public final class HandlerException extends MqttRouterException {

  public HandlerException(String message, Throwable cause) {
    super(message, cause);
  }
}
