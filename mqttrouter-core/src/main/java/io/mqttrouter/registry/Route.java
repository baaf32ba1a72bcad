package io.mqttrouter.registry;

import io.mqttrouter.QoS;
import io.mqttrouter.RouteHandler;
import io.mqttrouter.codec.PayloadType;
import io.mqttrouter.topic.TopicFilter;

import java.util.Objects;

/**
 * One registration: topic filter, payload type, handler and the QoS to subscribe with.
 * Identity for duplicate detection is {@link #key()}, the (filter, payload type) pair.
 *
 * @param filter      topic filter the route matches
 * @param payloadType payload type messages are decoded as
 * @param handler     application handler
 * @param qos         subscription QoS requested for the filter
 * @param <T> decoded payload type
 */
public record Route<T>(TopicFilter filter, PayloadType<T> payloadType, RouteHandler<T> handler, QoS qos) {

  /** QoS used when a route does not name one. */
  public static final QoS DEFAULT_QOS = QoS.AT_MOST_ONCE;

  public Route {
    Objects.requireNonNull(filter, "filter");
    Objects.requireNonNull(payloadType, "payloadType");
    Objects.requireNonNull(handler, "handler");
    qos = qos == null ? DEFAULT_QOS : qos;
  }

  public Route(TopicFilter filter, PayloadType<T> payloadType, RouteHandler<T> handler) {
    this(filter, payloadType, handler, DEFAULT_QOS);
  }

  public Key key() {
    return new Key(filter, payloadType);
  }

  /** Returns a copy with the filter prefixed. */
  public Route<T> withPrefix(String prefix) {
    return new Route<>(filter.withPrefix(prefix), payloadType, handler, qos);
  }

  @Override
  public String toString() {
    return "Route{" + filter.pattern() + " -> " + payloadType + ", qos=" + qos.value() + '}';
  }

  /** Route identity: filter (by subscription form) and payload type. */
  public record Key(TopicFilter filter, PayloadType<?> payloadType) {
  }
}
