package io.mqttrouter.registry;

import io.mqttrouter.MqttRouterException;

/**
 * Thrown when a route is registered for a (filter, payload type) pair that already has one.
 */
public final class DuplicateRouteException extends MqttRouterException {

  public DuplicateRouteException(String message) {
    super(message);
  }
}
