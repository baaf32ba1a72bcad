package io.mqttrouter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A raw message paired with its decoded payload and the path parameters captured by the
 * matching route's topic filter. Lives for a single handler invocation.
 *
 * @param message    the inbound raw message
 * @param payload    the decoded payload ({@code null} only for the {@code NONE} type)
 * @param parameters named captures of the route filter in filter order, see
 *                   {@link io.mqttrouter.topic.TopicFilter#extract(String)}
 * @param <T> payload type
 */
public record DecodedMessage<T>(RawMessage message, T payload, Map<String, String> parameters) {

  public DecodedMessage {
    Objects.requireNonNull(message, "message");
    parameters = parameters == null || parameters.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
  }

  public String topic() {
    return message.topic();
  }

  public QoS qos() {
    return message.qos();
  }

  public MessageProperties properties() {
    return message.properties();
  }

  /**
   * Returns a captured path parameter.
   *
   * @throws IllegalArgumentException if the route filter declares no such parameter
   */
  public String parameter(String name) {
    String value = parameters.get(name);
    if (value == null) {
      throw new IllegalArgumentException("No path parameter '" + name + "' on topic " + topic());
    }
    return value;
  }
}
