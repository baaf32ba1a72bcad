package io.mqttrouter.codec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe binding of payload types to codecs. Exactly one codec is bound per payload
 * type.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CodecRegistry codecs = CodecRegistry.withDefaults()
 *     .bind(SENSOR_READING, new ProtobufCodec<>(SensorReading.class));
 *
 * byte[] bytes = codecs.encode(Codecs.STRING, "hello");
 * String text = codecs.decode(Codecs.STRING, bytes);
 * }</pre>
 *
 * <p>Binding order matters for {@link #typeOf(Object)}: the first bound type whose Java
 * type accepts a value wins.
 */
public final class CodecRegistry {
  private final Map<PayloadType<?>, PayloadCodec<?>> codecs = new ConcurrentHashMap<>();
  private final List<PayloadType<?>> order = new CopyOnWriteArrayList<>();

  /** Creates an empty registry. */
  public CodecRegistry() {
  }

  /** Creates a registry with all {@link Codecs built-in codecs} bound. */
  public static CodecRegistry withDefaults() {
    CodecRegistry registry = new CodecRegistry();
    Codecs.bindDefaults(registry);
    return registry;
  }

  /**
   * Binds a codec to a payload type.
   *
   * @return this registry for chaining
   * @throws IllegalStateException if the type is already bound; use {@link #rebind}
   */
  public synchronized <T> CodecRegistry bind(PayloadType<T> type, PayloadCodec<T> codec) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(codec, "codec");
    if (codecs.putIfAbsent(type, codec) != null) {
      throw new IllegalStateException("A codec is already bound for payload type " + type);
    }
    order.add(type);
    return this;
  }

  /**
   * Binds a codec to a payload type, replacing any existing binding. A replaced binding
   * keeps its position in binding order.
   *
   * @return this registry for chaining
   */
  public synchronized <T> CodecRegistry rebind(PayloadType<T> type, PayloadCodec<T> codec) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(codec, "codec");
    if (codecs.put(type, codec) == null) {
      order.add(type);
    }
    return this;
  }

  public boolean isBound(PayloadType<?> type) {
    return codecs.containsKey(type);
  }

  /**
   * Returns the codec bound to {@code type}.
   *
   * @throws IllegalArgumentException if no codec is bound
   */
  @SuppressWarnings("unchecked")
  public <T> PayloadCodec<T> codecFor(PayloadType<T> type) {
    PayloadCodec<?> codec = codecs.get(type);
    if (codec == null) {
      throw new IllegalArgumentException("No codec bound for payload type " + type);
    }
    return (PayloadCodec<T>) codec;
  }

  /**
   * Resolves the payload type for a value: {@link Codecs#NONE} for {@code null}, otherwise
   * the first bound type (in binding order) that accepts the value.
   *
   * @throws EncodeException if no bound type accepts the value
   */
  public PayloadType<?> typeOf(Object value) {
    if (value == null) {
      if (!isBound(Codecs.NONE)) {
        throw new EncodeException("No codec bound for null values");
      }
      return Codecs.NONE;
    }
    for (PayloadType<?> type : order) {
      if (type.accepts(value)) {
        return type;
      }
    }
    throw new EncodeException("No codec bound for values of " + value.getClass().getName());
  }

  /**
   * Encodes a value with the codec bound to {@code type}.
   *
   * @throws EncodeException if no codec is bound, the value does not belong to the type or
   *     the codec fails
   */
  public <T> byte[] encode(PayloadType<T> type, Object value) {
    PayloadCodec<T> codec;
    try {
      codec = codecFor(type);
    } catch (IllegalArgumentException e) {
      throw new EncodeException(e.getMessage(), e);
    }
    if (value == null && !Codecs.NONE.equals(type)) {
      throw new EncodeException("Cannot encode null as payload type " + type);
    }
    T typed;
    try {
      typed = type.cast(value);
    } catch (ClassCastException e) {
      throw new EncodeException("Value of " + value.getClass().getName()
          + " is not a " + type + " payload", e);
    }
    try {
      return codec.encode(typed);
    } catch (EncodeException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new EncodeException("Failed to encode " + type + " payload", e);
    }
  }

  /**
   * Decodes a payload with the codec bound to {@code type}.
   *
   * @throws IllegalArgumentException if no codec is bound
   * @throws DecodeException if the codec rejects the payload
   */
  public <T> T decode(PayloadType<T> type, byte[] payload) {
    PayloadCodec<T> codec = codecFor(type);
    try {
      return codec.decode(payload);
    } catch (DecodeException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DecodeException("Failed to decode " + type + " payload", e);
    }
  }

  /** Bound payload types in binding order. */
  public List<PayloadType<?>> boundTypes() {
    return Collections.unmodifiableList(new ArrayList<>(order));
  }
}
