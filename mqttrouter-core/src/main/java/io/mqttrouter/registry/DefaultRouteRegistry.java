package io.mqttrouter.registry;

import io.mqttrouter.QoS;
import io.mqttrouter.RouteHandler;
import io.mqttrouter.codec.PayloadType;
import io.mqttrouter.spi.Subscription;
import io.mqttrouter.topic.TopicFilter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered route table.
 *
 * <p>Routes are kept in registration order, which is also the order in which matching
 * routes are dispatched. A (filter, payload type) pair can only be registered once; the
 * same filter may be registered with different payload types. Filters are compared by
 * subscription form, so {@code a/{id}} and {@code a/+} are the same filter.
 *
 * <h2>Thread Safety</h2>
 * <p>Registration is synchronized; lookups read a copy-on-write snapshot and never block.
 * After {@link #freeze()} the table is read-only.
 */
public final class DefaultRouteRegistry implements RouteRegistry {
  private final List<Route<?>> routes = new CopyOnWriteArrayList<>();
  private volatile boolean frozen;

  /**
   * Registers a route with the {@linkplain Route#DEFAULT_QOS default QoS}.
   *
   * @return the registered route
   * @throws DuplicateRouteException if the (filter, payload type) pair is already registered
   * @throws IllegalStateException if the registry is frozen
   */
  public <T> Route<T> register(TopicFilter filter, PayloadType<T> payloadType, RouteHandler<T> handler) {
    return register(new Route<>(filter, payloadType, handler));
  }

  /**
   * Registers a route.
   *
   * @return the registered route
   * @throws DuplicateRouteException if the (filter, payload type) pair is already registered
   * @throws IllegalStateException if the registry is frozen
   */
  public synchronized <T> Route<T> register(Route<T> route) {
    if (frozen) {
      throw new IllegalStateException("Route table is frozen; cannot register " + route);
    }
    if (contains(route.key())) {
      throw new DuplicateRouteException("Route already registered for filter '"
          + route.filter().pattern() + "' and payload type " + route.payloadType());
    }
    routes.add(route);
    return route;
  }

  public boolean contains(Route.Key key) {
    for (Route<?> existing : routes) {
      if (existing.key().equals(key)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public List<Route<?>> resolve(String topic) {
    List<Route<?>> matches = null;
    for (Route<?> route : routes) {
      if (route.filter().matches(topic)) {
        if (matches == null) {
          matches = new ArrayList<>(2);
        }
        matches.add(route);
      }
    }
    return matches == null ? List.of() : Collections.unmodifiableList(matches);
  }

  @Override
  public List<Route<?>> routes() {
    return List.copyOf(routes);
  }

  /**
   * Returns one subscription per distinct filter, in first-registration order, with the
   * highest QoS any route requested for it.
   */
  public List<Subscription> subscriptions() {
    Map<String, QoS> byFilter = new LinkedHashMap<>();
    for (Route<?> route : routes) {
      byFilter.merge(route.filter().subscription(), route.qos(), QoS::max);
    }
    List<Subscription> result = new ArrayList<>(byFilter.size());
    byFilter.forEach((filter, qos) -> result.add(new Subscription(filter, qos)));
    return Collections.unmodifiableList(result);
  }

  /** Makes the table read-only. Idempotent. */
  public synchronized void freeze() {
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }

  public int size() {
    return routes.size();
  }
}
