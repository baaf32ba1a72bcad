package io.mqttrouter;

import io.mqttrouter.codec.CodecRegistry;
import io.mqttrouter.codec.PayloadCodec;
import io.mqttrouter.codec.PayloadType;
import io.mqttrouter.dispatch.DeliveryListener;
import io.mqttrouter.dispatch.DispatcherState;
import io.mqttrouter.dispatch.ExceptionMappers;
import io.mqttrouter.dispatch.OutboundPublisher;
import io.mqttrouter.dispatch.RouteDispatcher;
import io.mqttrouter.registry.DefaultRouteRegistry;
import io.mqttrouter.registry.DuplicateRouteException;
import io.mqttrouter.registry.Route;
import io.mqttrouter.registry.Router;
import io.mqttrouter.spi.DispatchMetrics;
import io.mqttrouter.spi.MessageSink;
import io.mqttrouter.spi.MessageSource;
import io.mqttrouter.spi.Subscription;
import io.mqttrouter.topic.TopicFilter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Client facade that owns the route table, the codecs, the dispatcher and the MQTT
 * connection's source and sink.
 *
 * <p>Routes are registered before {@link #start()}; afterwards the table is frozen and
 * {@code route} fails with {@link AlreadyStartedException}. {@code publish} may be called
 * at any time after construction.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (MqttRouter router = MqttRouter.builder()
 *     .source(transport.source())
 *     .sink(transport)
 *     .maxConcurrency(8)
 *     .build()) {
 *   router.route("sensors/{id}/temperature", Codecs.DOUBLE, msg -> {
 *     store(msg.parameter("id"), msg.payload());
 *     return Outbound.none();
 *   });
 *   router.route("rpc/echo", Codecs.STRING, msg -> Outbound.reply(msg.payload()));
 *   router.start();
 *   router.publish("status/online", true);
 *   router.awaitTermination();
 * }
 * }</pre>
 *
 * @see RouteDispatcher
 * @see Router
 */
public final class MqttRouter implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(MqttRouter.class.getName());

  private final MessageSource source;
  private final MessageSink sink;
  private final CodecRegistry codecs;
  private final DefaultRouteRegistry registry = new DefaultRouteRegistry();
  private final OutboundPublisher publisher;
  private final RouteDispatcher dispatcher;
  private final DispatchMetrics metrics;
  private final QoS defaultQos;

  private MqttRouter(Builder builder) {
    this.source = Objects.requireNonNull(builder.source, "source");
    this.sink = Objects.requireNonNull(builder.sink, "sink");
    this.codecs = builder.codecs != null ? builder.codecs : CodecRegistry.withDefaults();
    for (Binding<?> binding : builder.bindings) {
      binding.applyTo(codecs);
    }
    this.metrics = builder.metrics != null ? builder.metrics : DispatchMetrics.NOOP;
    this.defaultQos = Objects.requireNonNull(builder.defaultQos, "defaultQos");
    this.publisher = new OutboundPublisher(codecs, sink, metrics);
    this.dispatcher = RouteDispatcher.builder()
        .source(source)
        .sink(sink)
        .registry(registry)
        .codecs(codecs)
        .metrics(metrics)
        .maxConcurrency(builder.maxConcurrency)
        .exceptionMappers(builder.exceptionMappers)
        .listeners(builder.listeners)
        .onStopped(this::closeSource)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Registers a route with the {@linkplain Route#DEFAULT_QOS default subscription QoS}.
   *
   * @see #route(String, PayloadType, QoS, RouteHandler)
   */
  public <T> Route<T> route(String filter, PayloadType<T> payloadType, RouteHandler<T> handler) {
    return route(filter, payloadType, Route.DEFAULT_QOS, handler);
  }

  /**
   * Registers a route.
   *
   * @param filter      topic filter, e.g. {@code sensors/{id}/temperature}
   * @param payloadType payload type messages are decoded as; must have a bound codec
   * @param qos         subscription QoS requested for the filter
   * @param handler     application handler
   * @return the registered route
   * @throws AlreadyStartedException if the router was started or stopped
   * @throws DuplicateRouteException if (filter, payload type) is already registered
   * @throws io.mqttrouter.topic.InvalidTopicException if the filter is malformed
   * @throws IllegalArgumentException if no codec is bound for {@code payloadType}
   */
  public synchronized <T> Route<T> route(String filter, PayloadType<T> payloadType, QoS qos,
                                         RouteHandler<T> handler) {
    ensureIdle();
    Route<T> route = new Route<>(TopicFilter.of(filter), payloadType, handler, qos);
    requireCodec(route);
    registry.register(route);
    logger.fine("Registered " + route);
    return route;
  }

  /**
   * Registers every route of a {@link Router} group. Either all routes are registered or,
   * on failure, none.
   *
   * @throws AlreadyStartedException if the router was started or stopped
   * @throws DuplicateRouteException if any route clashes with a registered one or with
   *     another route of the group
   */
  public synchronized MqttRouter include(Router group) {
    ensureIdle();
    List<Route<?>> routes = group.routes();
    Set<Route.Key> seen = new HashSet<>();
    for (Route<?> route : routes) {
      requireCodec(route);
      if (registry.contains(route.key()) || !seen.add(route.key())) {
        throw new DuplicateRouteException("Route already registered for filter '"
            + route.filter().pattern() + "' and payload type " + route.payloadType());
      }
    }
    for (Route<?> route : routes) {
      registry.register(route);
    }
    logger.fine("Included " + routes.size() + " route(s) with prefix '" + group.prefix() + "'");
    return this;
  }

  /**
   * Subscribes to every route filter, freezes the route table and starts consuming.
   *
   * @throws AlreadyStartedException if already started or stopped
   */
  public synchronized void start() {
    ensureIdle();
    List<Subscription> subscriptions = registry.subscriptions();
    if (subscriptions.isEmpty()) {
      logger.warning("Starting without routes; every message will be unrouted");
    }
    for (Subscription subscription : subscriptions) {
      logger.info("Subscribing to " + subscription.filter() + " with qos=" + subscription.qos().value()
          + " (" + subscription.qos() + ")");
    }
    source.open(subscriptions);
    registry.freeze();
    dispatcher.start();
  }

  /**
   * Publishes a value with the codec of the first bound type accepting it, using the
   * default QoS and no retain flag.
   *
   * @return what was handed to the sink
   * @throws io.mqttrouter.codec.EncodeException if no codec accepts the value or encoding fails
   * @throws PublishException if the sink fails
   */
  public OutboundMessage publish(String topic, Object payload) {
    return publish(topic, payload, defaultQos, false);
  }

  public OutboundMessage publish(String topic, Object payload, QoS qos, boolean retain) {
    return publisher.publish(topic, payload, qos, retain, MessageProperties.EMPTY);
  }

  public <T> OutboundMessage publish(String topic, PayloadType<T> payloadType, T payload) {
    return publish(topic, payloadType, payload, defaultQos, false, MessageProperties.EMPTY);
  }

  /**
   * Publishes a value encoded as {@code payloadType}.
   *
   * @return what was handed to the sink
   * @throws io.mqttrouter.topic.InvalidTopicException if the topic is empty or has wildcards
   * @throws io.mqttrouter.codec.EncodeException if encoding fails
   * @throws PublishException if the sink fails
   */
  public <T> OutboundMessage publish(String topic, PayloadType<T> payloadType, T payload, QoS qos,
                                     boolean retain, MessageProperties properties) {
    return publisher.publish(topic, payloadType, payload, qos, retain, properties);
  }

  /**
   * Stops intake, waits for in-flight handlers and closes the source. Idempotent.
   */
  public void stop() {
    dispatcher.stop();
  }

  /**
   * Blocks until stopped.
   *
   * @throws io.mqttrouter.spi.SourceClosedException if the connection was lost
   */
  public void awaitTermination() throws InterruptedException {
    dispatcher.awaitTermination();
  }

  /**
   * Blocks until stopped or the timeout elapses.
   *
   * @return {@code true} if stopped
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return dispatcher.awaitTermination(timeout);
  }

  public DispatcherState state() {
    return dispatcher.state();
  }

  public List<Route<?>> routes() {
    return registry.routes();
  }

  public List<Subscription> subscriptions() {
    return registry.subscriptions();
  }

  public CodecRegistry codecs() {
    return codecs;
  }

  /**
   * Stops the router, then closes the sink and metrics when they are {@link AutoCloseable}.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      stop();
    } catch (RuntimeException e) {
      first = e;
    }
    first = closeQuietly(sink, first);
    if (metrics != sink) {
      first = closeQuietly(metrics, first);
    }
    if (first != null) {
      throw first;
    }
  }

  private static RuntimeException closeQuietly(Object resource, RuntimeException first) {
    if (!(resource instanceof AutoCloseable closeable)) {
      return first;
    }
    try {
      closeable.close();
    } catch (Exception e) {
      RuntimeException re = (e instanceof RuntimeException r) ? r : new MqttRouterException("Close failed", e);
      if (first == null) {
        return re;
      }
      first.addSuppressed(re);
    }
    return first;
  }

  private void closeSource() {
    try {
      source.close();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to close message source", e);
    }
  }

  private void ensureIdle() {
    DispatcherState current = dispatcher.state();
    if (current != DispatcherState.IDLE) {
      throw new AlreadyStartedException("Routes can only be changed before start; router is " + current);
    }
  }

  private void requireCodec(Route<?> route) {
    if (!codecs.isBound(route.payloadType())) {
      throw new IllegalArgumentException("No codec bound for payload type " + route.payloadType()
          + " (route " + route.filter().pattern() + ")");
    }
  }

  private record Binding<T>(PayloadType<T> type, PayloadCodec<T> codec) {
    void applyTo(CodecRegistry registry) {
      registry.rebind(type, codec);
    }
  }

  /** Builder for {@link MqttRouter}. */
  public static final class Builder {
    private MessageSource source;
    private MessageSink sink;
    private CodecRegistry codecs;
    private final List<Binding<?>> bindings = new ArrayList<>();
    private int maxConcurrency = RouteDispatcher.DEFAULT_MAX_CONCURRENCY;
    private DispatchMetrics metrics;
    private final List<DeliveryListener> listeners = new ArrayList<>();
    private final ExceptionMappers exceptionMappers = new ExceptionMappers();
    private QoS defaultQos = QoS.AT_LEAST_ONCE;

    private Builder() {}

    /**
     * Sets the inbound side of the connection.
     *
     * <p><b>Required.</b>
     *
     * @param source the message source
     * @return this builder
     */
    public Builder source(MessageSource source) {
      this.source = source;
      return this;
    }

    /**
     * Sets the outbound side of the connection. Closed by {@link MqttRouter#close()} when
     * it implements {@link AutoCloseable}.
     *
     * <p><b>Required.</b>
     *
     * @param sink the message sink
     * @return this builder
     */
    public Builder sink(MessageSink sink) {
      this.sink = sink;
      return this;
    }

    /**
     * Sets the codec registry.
     *
     * <p>Optional. Defaults to {@link CodecRegistry#withDefaults()}.
     *
     * @param codecs the codec registry
     * @return this builder
     */
    public Builder codecs(CodecRegistry codecs) {
      this.codecs = codecs;
      return this;
    }

    /**
     * Binds a codec, replacing any codec already bound to {@code type}.
     *
     * @param type  payload type
     * @param codec codec for it
     * @return this builder
     */
    public <T> Builder codec(PayloadType<T> type, PayloadCodec<T> codec) {
      this.bindings.add(new Binding<>(Objects.requireNonNull(type, "type"),
          Objects.requireNonNull(codec, "codec")));
      return this;
    }

    /**
     * Sets the maximum number of concurrent handler invocations.
     *
     * <p>Optional. Defaults to {@code 16}. Must be &ge; 1.
     *
     * @param maxConcurrency handler slots
     * @return this builder
     */
    public Builder maxConcurrency(int maxConcurrency) {
      this.maxConcurrency = maxConcurrency;
      return this;
    }

    /**
     * Sets the metrics hook. Closed by {@link MqttRouter#close()} when it implements
     * {@link AutoCloseable}.
     *
     * <p>Optional. Defaults to {@link DispatchMetrics#NOOP}.
     *
     * @param metrics the metrics hook
     * @return this builder
     */
    public Builder metrics(DispatchMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder listener(DeliveryListener listener) {
      this.listeners.add(Objects.requireNonNull(listener, "listener"));
      return this;
    }

    /**
     * Maps exceptions of {@code type} (and subclasses) thrown by handlers to the
     * {@link MqttError} sent in error replies.
     *
     * @return this builder
     */
    public <E extends Throwable> Builder exceptionMapper(Class<E> type, Function<? super E, MqttError> mapper) {
      this.exceptionMappers.register(type, mapper);
      return this;
    }

    /**
     * Sets the QoS used by {@code publish} calls that do not name one.
     *
     * <p>Optional. Defaults to {@link QoS#AT_LEAST_ONCE}.
     *
     * @param defaultQos publish QoS
     * @return this builder
     */
    public Builder defaultQos(QoS defaultQos) {
      this.defaultQos = defaultQos;
      return this;
    }

    /**
     * Builds the router in state {@link DispatcherState#IDLE}.
     *
     * @throws NullPointerException if {@code source} or {@code sink} is null
     * @throws IllegalArgumentException if {@code maxConcurrency < 1}
     */
    public MqttRouter build() {
      return new MqttRouter(this);
    }
  }
}
