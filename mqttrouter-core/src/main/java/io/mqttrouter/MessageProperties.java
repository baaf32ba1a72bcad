package io.mqttrouter;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * MQTT v5 publish properties relevant to routing: response topic, correlation data and
 * user properties.
 *
 * @param responseTopic   topic a reply should be published to, or {@code null}
 * @param correlationData opaque request identifier echoed in replies, or {@code null}
 * @param userProperties  immutable user properties in insertion order (never {@code null})
 */
public record MessageProperties(String responseTopic, byte[] correlationData,
                                Map<String, String> userProperties) {

  /** Properties with nothing set. */
  public static final MessageProperties EMPTY = new MessageProperties(null, null, Map.of());

  public MessageProperties {
    correlationData = correlationData == null ? null : correlationData.clone();
    userProperties = userProperties == null || userProperties.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(userProperties));
  }

  @Override
  public byte[] correlationData() {
    return correlationData == null ? null : correlationData.clone();
  }

  public boolean hasResponseTopic() {
    return responseTopic != null && !responseTopic.isEmpty();
  }

  public boolean isEmpty() {
    return responseTopic == null && correlationData == null && userProperties.isEmpty();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof MessageProperties other)) return false;
    return Objects.equals(responseTopic, other.responseTopic)
        && Arrays.equals(correlationData, other.correlationData)
        && userProperties.equals(other.userProperties);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(responseTopic, userProperties);
    return 31 * result + Arrays.hashCode(correlationData);
  }

  @Override
  public String toString() {
    return "MessageProperties{responseTopic=" + responseTopic
        + ", correlationData=" + (correlationData == null ? "null" : correlationData.length + " bytes")
        + ", userProperties=" + userProperties + '}';
  }

  /** Builder for {@link MessageProperties}. */
  public static final class Builder {
    private String responseTopic;
    private byte[] correlationData;
    private final Map<String, String> userProperties = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder responseTopic(String responseTopic) {
      this.responseTopic = responseTopic;
      return this;
    }

    public Builder correlationData(byte[] correlationData) {
      this.correlationData = correlationData;
      return this;
    }

    public Builder userProperty(String key, String value) {
      this.userProperties.put(Objects.requireNonNull(key, "key"),
          Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder userProperties(Map<String, String> userProperties) {
      userProperties.forEach(this::userProperty);
      return this;
    }

    public MessageProperties build() {
      return new MessageProperties(responseTopic, correlationData, userProperties);
    }
  }
}
