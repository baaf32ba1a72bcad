package io.mqttrouter.dispatch;

import io.mqttrouter.MqttError;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Translates handler exceptions into {@link MqttError}s for error replies.
 *
 * <p>Lookup walks the exception's class hierarchy, so a mapper registered for a supertype
 * also covers its subclasses unless a more specific mapper exists. {@code MqttError}
 * maps to itself unless overridden.
 */
public final class ExceptionMappers {
  private static final Logger logger = Logger.getLogger(ExceptionMappers.class.getName());

  private final Map<Class<?>, Function<Throwable, MqttError>> mappers = new ConcurrentHashMap<>();

  public ExceptionMappers() {
    register(MqttError.class, error -> error);
  }

  /**
   * Registers a mapper, replacing any existing mapper for the same type.
   *
   * @return this instance for chaining
   */
  public <E extends Throwable> ExceptionMappers register(Class<E> type, Function<? super E, MqttError> mapper) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(mapper, "mapper");
    mappers.put(type, error -> mapper.apply(type.cast(error)));
    return this;
  }

  /**
   * Maps an exception.
   *
   * @param error the handler exception
   * @return the mapped error, or {@code null} if no mapper applies or the mapper failed
   */
  public MqttError map(Throwable error) {
    for (Class<?> type = error.getClass(); type != null; type = type.getSuperclass()) {
      Function<Throwable, MqttError> mapper = mappers.get(type);
      if (mapper != null) {
        try {
          return mapper.apply(error);
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "Exception mapper for " + type.getName() + " failed", e);
          return null;
        }
      }
    }
    return null;
  }
}
