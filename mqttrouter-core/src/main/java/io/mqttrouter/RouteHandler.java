package io.mqttrouter;

/**
 * Application callback for messages matched by a route.
 *
 * <p>Handlers may run concurrently with each other, including several invocations of the
 * same handler, and must be thread-safe. Any exception thrown is contained by the
 * dispatcher and reported as a {@link HandlerResult.Failure} at stage
 * {@link HandlerResult.Stage#HANDLER}, wrapped in a {@link HandlerException}.
 *
 * @param <T> decoded payload type
 */
@FunctionalInterface
public interface RouteHandler<T> {

  /**
   * Handles one decoded message.
   *
   * @param message the decoded message
   * @return what to publish afterwards; {@code null} is treated as {@link Outbound#none()}
   * @throws Exception on handler failure
   */
  Outbound handle(DecodedMessage<T> message) throws Exception;

  /** Adapts a handler that never publishes anything. */
  static <T> RouteHandler<T> of(MessageConsumer<T> consumer) {
    return message -> {
      consumer.accept(message);
      return Outbound.none();
    };
  }

  /** A handler body without an outbound result. */
  @FunctionalInterface
  interface MessageConsumer<T> {
    void accept(DecodedMessage<T> message) throws Exception;
  }
}
