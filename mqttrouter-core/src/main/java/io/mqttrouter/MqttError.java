package io.mqttrouter;

/**
 * Application error with an optional numeric code, sent back to the requester in an
 * error reply.
 *
 * <p>A handler may throw {@code MqttError} directly, or register an exception mapper on
 * {@link MqttRouter.Builder#exceptionMapper(Class, java.util.function.Function)} to turn
 * its own exceptions into one. The error reply carries the message as a STRING payload and
 * the code in the {@value #ERROR_PROPERTY} user property ({@value #NO_CODE} when absent).
 */
public class MqttError extends MqttRouterException {

  /** User property carrying the error code on error replies. */
  public static final String ERROR_PROPERTY = "error";

  /** Value of {@link #ERROR_PROPERTY} when the error has no code. */
  public static final String NO_CODE = "None";

  private final Integer errorCode;

  public MqttError(String message) {
    this(message, null);
  }

  public MqttError(String message, Integer errorCode) {
    super(message);
    this.errorCode = errorCode;
  }

  public MqttError(String message, Integer errorCode, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  /** The error code, or {@code null}. */
  public Integer errorCode() {
    return errorCode;
  }

  public String errorCodeProperty() {
    return errorCode == null ? NO_CODE : errorCode.toString();
  }
}
