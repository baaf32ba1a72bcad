package io.mqttrouter.codec;

import java.util.Objects;

/**
 * Identifier of a payload type: a unique name plus the Java type values of that payload
 * type are instances of. Routes and publishes refer to payload types; the
 * {@link CodecRegistry} binds exactly one {@link PayloadCodec} to each.
 *
 * <p>Identity is by name.
 *
 * @param <T> Java type of decoded values
 */
public final class PayloadType<T> {
  private final String name;
  private final Class<T> javaType;

  private PayloadType(String name, Class<T> javaType) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("name must not be empty");
    }
    this.name = name;
    this.javaType = Objects.requireNonNull(javaType, "javaType");
  }

  public static <T> PayloadType<T> of(String name, Class<T> javaType) {
    return new PayloadType<>(name, javaType);
  }

  /** Payload type named after the Java class' fully-qualified name. */
  public static <T> PayloadType<T> of(Class<T> javaType) {
    return new PayloadType<>(javaType.getName(), javaType);
  }

  public String name() {
    return name;
  }

  public Class<T> javaType() {
    return javaType;
  }

  /**
   * Checks and casts {@code value} to this type.
   *
   * @throws ClassCastException if the value is not an instance of {@link #javaType()}
   */
  public T cast(Object value) {
    return javaType.cast(value);
  }

  /** Whether {@code value} can be encoded as this payload type. */
  public boolean accepts(Object value) {
    return javaType.isInstance(value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PayloadType<?> other)) return false;
    return name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
