package io.mqttrouter.registry;

import java.util.List;

/**
 * Lookup of the routes that match a published topic.
 *
 * @see DefaultRouteRegistry
 */
public interface RouteRegistry {

  /**
   * Returns all routes whose filter matches {@code topic}, in registration order.
   *
   * @param topic concrete topic of an inbound message
   * @return matching routes, empty if none (never {@code null})
   */
  List<Route<?>> resolve(String topic);

  /**
   * Returns every registered route in registration order.
   */
  List<Route<?>> routes();
}
