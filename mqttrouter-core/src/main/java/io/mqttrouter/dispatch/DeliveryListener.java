package io.mqttrouter.dispatch;

import io.mqttrouter.HandlerResult;
import io.mqttrouter.RawMessage;

/**
 * Callback receiving the outcome of every route invocation.
 *
 * <p>{@link #onResult} runs on the handler thread before its slot is released;
 * {@link #onUnrouted} runs on the consumer thread. Exceptions thrown by a listener are
 * logged and ignored.
 */
public interface DeliveryListener {

  /**
   * Called for a message no route matched. The message is dropped.
   *
   * @param message the unrouted message
   */
  default void onUnrouted(RawMessage message) {
  }

  /**
   * Called once per (message, matching route) pair.
   *
   * @param result success or failure of the invocation
   */
  default void onResult(HandlerResult result) {
  }
}
