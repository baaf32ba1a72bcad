package io.mqttrouter.spi;

import io.mqttrouter.HandlerResult;

/**
 * Observability hook for exporting dispatch counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implementations are called
 * from the consumer thread and from handler threads concurrently and must be thread-safe.
 */
public interface DispatchMetrics {

  /**
   * No-op instance that discards all metrics.
   */
  DispatchMetrics NOOP = new Noop();

  /**
   * Increments the count of messages taken from the source.
   */
  void incrementReceived();

  /**
   * Increments the count of messages dropped because no route matched.
   */
  void incrementUnrouted();

  /**
   * Increments the count of route invocations that completed successfully.
   */
  void incrementHandlerSuccess();

  /**
   * Increments the count of route invocations that failed.
   *
   * @param stage the stage that failed
   */
  void incrementHandlerFailure(HandlerResult.Stage stage);

  /**
   * Increments the count of messages handed to the sink, replies and
   * {@code publish} calls included.
   */
  void incrementPublished();

  /**
   * Records the number of route invocations currently running.
   *
   * @param inFlight number of busy handler slots
   */
  default void recordInFlight(int inFlight) {
  }

  /**
   * Records the time spent in decode, handler and outbound publish of one invocation.
   *
   * @param durationMs invocation time in milliseconds (always non-negative)
   */
  default void recordHandlerDurationMs(long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements DispatchMetrics {
    @Override
    public void incrementReceived() {
    }

    @Override
    public void incrementUnrouted() {
    }

    @Override
    public void incrementHandlerSuccess() {
    }

    @Override
    public void incrementHandlerFailure(HandlerResult.Stage stage) {
    }

    @Override
    public void incrementPublished() {
    }
  }
}
