package io.mqttrouter;

import io.mqttrouter.registry.Route;

import java.util.Objects;

/**
 * Outcome of one route invocation for one message. Results are reported to
 * {@link io.mqttrouter.dispatch.DeliveryListener}s and never propagate out of the dispatcher.
 */
public sealed interface HandlerResult permits HandlerResult.Success, HandlerResult.Failure {

  Route<?> route();

  RawMessage message();

  /** Where in the invocation a failure happened. */
  enum Stage {
    DECODE,
    HANDLER,
    PUBLISH
  }

  /**
   * The handler completed; {@code published} is the outbound message it produced, or
   * {@code null} when it published nothing.
   */
  record Success(Route<?> route, RawMessage message, OutboundMessage published)
      implements HandlerResult {
    public Success {
      Objects.requireNonNull(route, "route");
      Objects.requireNonNull(message, "message");
    }
  }

  /** The invocation failed at {@code stage}. */
  record Failure(Route<?> route, RawMessage message, Stage stage, Throwable cause)
      implements HandlerResult {
    public Failure {
      Objects.requireNonNull(route, "route");
      Objects.requireNonNull(message, "message");
      Objects.requireNonNull(stage, "stage");
      Objects.requireNonNull(cause, "cause");
    }
  }
}
