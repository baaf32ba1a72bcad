package io.mqttrouter.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.mqttrouter.HandlerResult;
import io.mqttrouter.spi.DispatchMetrics;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link DispatchMetrics}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code mqttrouter.messages.received} - messages taken from the source</li>
 *   <li>{@code mqttrouter.messages.unrouted} - messages no route matched</li>
 *   <li>{@code mqttrouter.handler.success} - route invocations that completed</li>
 *   <li>{@code mqttrouter.handler.failure} - failed invocations, tagged {@code stage}</li>
 *   <li>{@code mqttrouter.messages.published} - messages handed to the sink</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code mqttrouter.handler.inflight} - busy handler slots</li>
 * </ul>
 *
 * <h3>Summaries</h3>
 * <ul>
 *   <li>{@code mqttrouter.handler.duration.ms} - per-invocation time in milliseconds</li>
 * </ul>
 *
 * @see DispatchMetrics
 */
public final class MicrometerDispatchMetrics implements DispatchMetrics, AutoCloseable {

  /** Default meter name prefix. */
  public static final String DEFAULT_PREFIX = "mqttrouter";

  private final MeterRegistry registry;
  private final Counter received;
  private final Counter unrouted;
  private final Counter handlerSuccess;
  private final Map<HandlerResult.Stage, Counter> handlerFailure = new EnumMap<>(HandlerResult.Stage.class);
  private final Counter published;
  private final Gauge inFlightGauge;
  private final DistributionSummary duration;

  private final AtomicInteger inFlight = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates metrics with the default name prefix {@value #DEFAULT_PREFIX}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerDispatchMetrics(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates metrics with a custom name prefix, for several routers sharing one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "telemetry.router"})
   */
  public MicrometerDispatchMetrics(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.received = Counter.builder(namePrefix + ".messages.received")
        .description("Messages taken from the source")
        .register(registry);
    this.unrouted = Counter.builder(namePrefix + ".messages.unrouted")
        .description("Messages dropped because no route matched")
        .register(registry);
    this.handlerSuccess = Counter.builder(namePrefix + ".handler.success")
        .description("Route invocations that completed successfully")
        .register(registry);
    for (HandlerResult.Stage stage : HandlerResult.Stage.values()) {
      handlerFailure.put(stage, Counter.builder(namePrefix + ".handler.failure")
          .description("Route invocations that failed")
          .tag("stage", stage.name().toLowerCase(Locale.ROOT))
          .register(registry));
    }
    this.published = Counter.builder(namePrefix + ".messages.published")
        .description("Messages handed to the sink")
        .register(registry);
    this.inFlightGauge = Gauge.builder(namePrefix + ".handler.inflight", inFlight, AtomicInteger::get)
        .description("Busy handler slots")
        .register(registry);
    this.duration = DistributionSummary.builder(namePrefix + ".handler.duration.ms")
        .description("Time spent in decode, handler and outbound publish")
        .baseUnit("milliseconds")
        .register(registry);
  }

  @Override
  public void incrementReceived() {
    if (closed) return;
    received.increment();
  }

  @Override
  public void incrementUnrouted() {
    if (closed) return;
    unrouted.increment();
  }

  @Override
  public void incrementHandlerSuccess() {
    if (closed) return;
    handlerSuccess.increment();
  }

  @Override
  public void incrementHandlerFailure(HandlerResult.Stage stage) {
    if (closed) return;
    handlerFailure.get(stage).increment();
  }

  @Override
  public void incrementPublished() {
    if (closed) return;
    published.increment();
  }

  @Override
  public void recordInFlight(int inFlight) {
    if (closed) return;
    this.inFlight.set(inFlight);
  }

  @Override
  public void recordHandlerDurationMs(long durationMs) {
    if (closed) return;
    duration.record(durationMs);
  }

  /**
   * Removes all meters registered by this instance from the registry.
   *
   * <p>{@link io.mqttrouter.MqttRouter#close()} calls this when the router owns the metrics.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(received, unrouted, handlerSuccess, published,
        inFlightGauge, duration));
    meters.addAll(handlerFailure.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
