package io.mqttrouter.dispatch;

/**
 * Lifecycle of a {@link RouteDispatcher}. Transitions only move forward:
 * {@code IDLE -> RUNNING -> DRAINING -> STOPPED}, or {@code IDLE -> STOPPED} when stopped
 * before it was started.
 */
public enum DispatcherState {
  /** Created; routes may still be registered. */
  IDLE,
  /** Consuming messages from the source. */
  RUNNING,
  /** Intake stopped; waiting for in-flight invocations to finish. */
  DRAINING,
  /** All invocations finished and the source is closed. Terminal. */
  STOPPED
}
