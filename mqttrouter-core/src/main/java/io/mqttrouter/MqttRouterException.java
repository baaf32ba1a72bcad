package io.mqttrouter;

/**
 * Base class of all exceptions raised by the router.
 *
 * <p>All router exceptions are unchecked. Registration and misuse errors are thrown
 * synchronously to the caller; failures inside a single handler invocation are
 * contained by the dispatcher and reported as {@link HandlerResult.Failure}.
 */
public class MqttRouterException extends RuntimeException {

  public MqttRouterException(String message) {
    super(message);
  }

  public MqttRouterException(String message, Throwable cause) {
    super(message, cause);
  }
}
