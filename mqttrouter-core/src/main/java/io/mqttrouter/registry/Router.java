package io.mqttrouter.registry;

import io.mqttrouter.QoS;
import io.mqttrouter.RouteHandler;
import io.mqttrouter.codec.PayloadType;
import io.mqttrouter.topic.TopicFilter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A reusable group of route declarations sharing an optional topic prefix.
 *
 * <pre>{@code
 * Router sensors = new Router("sensors");
 * sensors.route("{id}/temperature", Codecs.DOUBLE, msg -> {
 *     store(msg.parameter("id"), msg.payload());
 *     return Outbound.none();
 * });
 * mqttRouter.include(sensors);   // registers "sensors/{id}/temperature"
 * }</pre>
 *
 * <p>Filters are validated when declared. Duplicates are only detected when the group is
 * included into a route table. Not thread-safe; declare routes during setup.
 */
public final class Router {
  private final String prefix;
  private final List<Route<?>> routes = new ArrayList<>();
  private final List<Router> children = new ArrayList<>();

  public Router() {
    this("");
  }

  /**
   * @param prefix topic levels prepended to every route in this group, e.g. {@code "sensors"}
   */
  public Router(String prefix) {
    this.prefix = prefix == null ? "" : prefix;
    if (!this.prefix.isEmpty()) {
      TopicFilter.of(this.prefix);
    }
  }

  public <T> Router route(String filter, PayloadType<T> payloadType, RouteHandler<T> handler) {
    return route(filter, payloadType, Route.DEFAULT_QOS, handler);
  }

  public <T> Router route(String filter, PayloadType<T> payloadType, QoS qos, RouteHandler<T> handler) {
    routes.add(new Route<>(TopicFilter.of(filter).withPrefix(prefix), payloadType, handler, qos));
    return this;
  }

  /**
   * Includes another group; its routes are prefixed with this group's prefix.
   *
   * @throws IllegalArgumentException if {@code child} is this group or already includes it,
   *                                  directly or through nested groups
   */
  public Router include(Router child) {
    Objects.requireNonNull(child, "child");
    if (child == this) {
      throw new IllegalArgumentException("A router cannot include itself");
    }
    if (child.includes(this)) {
      throw new IllegalArgumentException("Including router '" + child.prefix + "' into '" + prefix
          + "' would create a cycle");
    }
    children.add(child);
    return this;
  }

  // The include graph is kept acyclic, so this terminates.
  private boolean includes(Router target) {
    for (Router child : children) {
      if (child == target || child.includes(target)) {
        return true;
      }
    }
    return false;
  }

  public String prefix() {
    return prefix;
  }

  /**
   * Returns this group's routes followed by those of included groups, all with prefixes
   * applied.
   */
  public List<Route<?>> routes() {
    List<Route<?>> result = new ArrayList<>(routes);
    for (Router child : children) {
      for (Route<?> route : child.routes()) {
        result.add(route.withPrefix(prefix));
      }
    }
    return result;
  }
}
