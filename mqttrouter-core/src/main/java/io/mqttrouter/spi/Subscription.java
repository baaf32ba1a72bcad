package io.mqttrouter.spi;

import io.mqttrouter.QoS;

import java.util.Objects;

/**
 * A topic filter to subscribe to at the broker, in subscription form (named parameters
 * already rendered as {@code +}), with the requested QoS.
 *
 * @param filter subscription filter
 * @param qos    requested maximum QoS
 */
public record Subscription(String filter, QoS qos) {
  public Subscription {
    Objects.requireNonNull(filter, "filter");
    Objects.requireNonNull(qos, "qos");
  }
}
