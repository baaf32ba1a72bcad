package io.mqttrouter.dispatch;

import io.mqttrouter.AlreadyStartedException;
import io.mqttrouter.DecodedMessage;
import io.mqttrouter.HandlerException;
import io.mqttrouter.HandlerResult;
import io.mqttrouter.MessageProperties;
import io.mqttrouter.MqttError;
import io.mqttrouter.MqttRouterException;
import io.mqttrouter.Outbound;
import io.mqttrouter.OutboundMessage;
import io.mqttrouter.PublishException;
import io.mqttrouter.QoS;
import io.mqttrouter.RawMessage;
import io.mqttrouter.codec.CodecRegistry;
import io.mqttrouter.codec.Codecs;
import io.mqttrouter.codec.DecodeException;
import io.mqttrouter.codec.PayloadType;
import io.mqttrouter.registry.Route;
import io.mqttrouter.registry.RouteRegistry;
import io.mqttrouter.spi.DispatchMetrics;
import io.mqttrouter.spi.MessageSink;
import io.mqttrouter.spi.MessageSource;
import io.mqttrouter.spi.SourceClosedException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Consumes inbound messages and runs the matching route handlers on a bounded pool.
 *
 * <p>A single consumer thread takes messages from the {@link MessageSource} in order and
 * resolves them against the {@link RouteRegistry}. Each matching route gets its own
 * invocation (decode, handler, optional outbound publish) on the handler pool. At most
 * {@code maxConcurrency} invocations run at once; when every slot is busy the consumer
 * stops taking messages until one frees up, which pushes back on the source.
 *
 * <p>Failures never escape an invocation: they are logged, counted and reported to
 * {@link DeliveryListener}s as {@link HandlerResult.Failure} with the failing stage. When
 * a handler throws and the inbound message carries a response topic, an error reply is
 * published (see {@link ExceptionMappers}).
 *
 * <p>{@link #stop()} interrupts the consumer, waits for every in-flight invocation and then
 * runs the {@code onStopped} callbacks. A {@link SourceClosedException} from the source
 * does the same and is reported to {@link #awaitTermination()} callers.
 *
 * @see RouteDispatcher.Builder
 * @see DispatcherState
 */
public final class RouteDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RouteDispatcher.class.getName());

  /** Default number of concurrent route invocations. */
  public static final int DEFAULT_MAX_CONCURRENCY = 16;

  private final MessageSource source;
  private final RouteRegistry registry;
  private final CodecRegistry codecs;
  private final OutboundPublisher publisher;
  private final DispatchMetrics metrics;
  private final List<DeliveryListener> listeners;
  private final ExceptionMappers exceptionMappers;
  private final List<Runnable> onStopped;
  private final int maxConcurrency;

  private final Semaphore slots;
  private final AtomicInteger inFlight = new AtomicInteger();
  private final DispatchThreadFactory threads = new DispatchThreadFactory();
  private final ExecutorService handlers;
  private final CountDownLatch stopped = new CountDownLatch(1);

  private volatile DispatcherState state = DispatcherState.IDLE;
  private volatile Throwable terminationCause;
  private Thread consumer;

  private RouteDispatcher(Builder builder) {
    this.source = Objects.requireNonNull(builder.source, "source");
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.codecs = builder.codecs != null ? builder.codecs : CodecRegistry.withDefaults();
    this.metrics = builder.metrics != null ? builder.metrics : DispatchMetrics.NOOP;
    this.publisher = new OutboundPublisher(codecs, Objects.requireNonNull(builder.sink, "sink"), metrics);
    this.listeners = Collections.unmodifiableList(new ArrayList<>(builder.listeners));
    this.exceptionMappers = builder.exceptionMappers != null
        ? builder.exceptionMappers : new ExceptionMappers();
    this.onStopped = Collections.unmodifiableList(new ArrayList<>(builder.onStopped));

    if (builder.maxConcurrency < 1) {
      throw new IllegalArgumentException("maxConcurrency must be >= 1");
    }
    this.maxConcurrency = builder.maxConcurrency;
    this.slots = new Semaphore(maxConcurrency);
    this.handlers = Executors.newFixedThreadPool(maxConcurrency, threads);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the consumer thread. The source must already be open.
   *
   * @throws AlreadyStartedException if the dispatcher is not {@link DispatcherState#IDLE}
   */
  public synchronized void start() {
    if (state != DispatcherState.IDLE) {
      throw new AlreadyStartedException("Dispatcher cannot be started in state " + state);
    }
    state = DispatcherState.RUNNING;
    consumer = threads.newThread(DispatchThreadFactory.CONSUMER, this::consumeLoop);
    consumer.start();
    logger.info("Dispatcher started with maxConcurrency=" + maxConcurrency);
  }

  private void consumeLoop() {
    Throwable cause = null;
    try {
      while (state == DispatcherState.RUNNING) {
        RawMessage message;
        try {
          message = source.next();
        } catch (InterruptedException e) {
          break;
        }
        dispatch(message);
      }
    } catch (SourceClosedException e) {
      if (state == DispatcherState.RUNNING) {
        logger.log(Level.WARNING, "Message source closed; draining dispatcher", e);
        cause = e;
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Dispatcher consumer loop error", t);
      cause = t;
    } finally {
      drainAndStop(cause);
    }
  }

  private void dispatch(RawMessage message) {
    metrics.incrementReceived();
    List<Route<?>> routes = registry.resolve(message.topic());
    if (routes.isEmpty()) {
      metrics.incrementUnrouted();
      logger.fine("No route for topic " + message.topic() + "; message dropped");
      for (DeliveryListener listener : listeners) {
        try {
          listener.onUnrouted(message);
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "Delivery listener onUnrouted failed", e);
        }
      }
      return;
    }
    for (Route<?> route : routes) {
      slots.acquireUninterruptibly();
      metrics.recordInFlight(inFlight.incrementAndGet());
      try {
        handlers.execute(() -> runInvocation(route, message));
      } catch (RejectedExecutionException e) {
        metrics.recordInFlight(inFlight.decrementAndGet());
        slots.release();
        logger.log(Level.SEVERE, "Handler pool rejected invocation of " + route + " for topic "
            + message.topic(), e);
      }
    }
  }

  private void runInvocation(Route<?> route, RawMessage message) {
    long start = System.nanoTime();
    try {
      HandlerResult result = invoke(route, message);
      metrics.recordHandlerDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
      report(result);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Unexpected error while dispatching " + route + " for topic "
          + message.topic(), t);
    } finally {
      metrics.recordInFlight(inFlight.decrementAndGet());
      slots.release();
    }
  }

  private <T> HandlerResult invoke(Route<T> route, RawMessage message) {
    PayloadType<T> type = route.payloadType();
    T payload;
    try {
      payload = codecs.decode(type, message.payload());
    } catch (RuntimeException e) {
      DecodeException failure = new DecodeException("Failed to decode " + type + " payload on topic "
          + message.topic() + " (payload_length=" + message.payloadLength() + "): " + e.getMessage(),
          message.topic(), message.payloadLength(), e);
      logger.log(Level.WARNING, failure.getMessage());
      return new HandlerResult.Failure(route, message, HandlerResult.Stage.DECODE, failure);
    }

    DecodedMessage<T> decoded = new DecodedMessage<>(message, payload, route.filter().extract(message.topic()));
    Outbound outbound;
    try {
      outbound = route.handler().handle(decoded);
    } catch (Throwable t) {
      HandlerException cause = new HandlerException("Handler for " + route.filter().pattern()
          + " failed on topic " + message.topic() + ": " + t, t);
      logger.log(Level.WARNING, "Handler for " + route.filter().pattern() + " failed on topic "
          + message.topic() + " with payload_length=" + message.payloadLength(), t);
      publishErrorReply(message, t, cause);
      return new HandlerResult.Failure(route, message, HandlerResult.Stage.HANDLER, cause);
    }

    try {
      OutboundMessage published = publishOutbound(route, message, outbound);
      return new HandlerResult.Success(route, message, published);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to publish result of " + route.filter().pattern()
          + " for topic " + message.topic(), e);
      return new HandlerResult.Failure(route, message, HandlerResult.Stage.PUBLISH, e);
    }
  }

  private OutboundMessage publishOutbound(Route<?> route, RawMessage message, Outbound outbound) {
    if (outbound == null || outbound instanceof Outbound.None) {
      return null;
    }
    if (outbound instanceof Outbound.Publish publish) {
      PayloadType<?> type = publish.type() != null ? publish.type() : route.payloadType();
      QoS qos = publish.qos() != null ? publish.qos() : message.qos();
      return publisher.publish(publish.topic(), type, publish.payload(), qos, publish.retain(),
          MessageProperties.EMPTY);
    }
    Outbound.Reply reply = (Outbound.Reply) outbound;
    MessageProperties inbound = message.properties();
    if (!inbound.hasResponseTopic()) {
      throw new PublishException("Cannot reply to message on topic " + message.topic()
          + ": no response topic");
    }
    PayloadType<?> type = reply.type() != null ? reply.type() : route.payloadType();
    MessageProperties properties = MessageProperties.builder()
        .correlationData(inbound.correlationData())
        .build();
    return publisher.publish(inbound.responseTopic(), type, reply.payload(), message.qos(), false, properties);
  }

  private void publishErrorReply(RawMessage message, Throwable error, Throwable reported) {
    MessageProperties inbound = message.properties();
    if (!inbound.hasResponseTopic()) {
      return;
    }
    MqttError mapped = exceptionMappers.map(error);
    String text;
    String code;
    if (mapped != null) {
      text = Objects.toString(mapped.getMessage(), "");
      code = mapped.errorCodeProperty();
    } else {
      text = error.toString();
      code = MqttError.NO_CODE;
    }
    MessageProperties properties = MessageProperties.builder()
        .correlationData(inbound.correlationData())
        .userProperty(MqttError.ERROR_PROPERTY, code)
        .build();
    try {
      publisher.publishEncoded(inbound.responseTopic(), Codecs.STRING.name(), Codecs.string().encode(text),
          message.qos(), false, properties);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to publish error reply to " + inbound.responseTopic(), e);
      reported.addSuppressed(e);
    }
  }

  private void report(HandlerResult result) {
    if (result instanceof HandlerResult.Failure failure) {
      metrics.incrementHandlerFailure(failure.stage());
    } else {
      metrics.incrementHandlerSuccess();
    }
    for (DeliveryListener listener : listeners) {
      try {
        listener.onResult(result);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Delivery listener onResult failed", e);
      }
    }
  }

  private void drainAndStop(Throwable cause) {
    synchronized (this) {
      if (state == DispatcherState.RUNNING) {
        state = DispatcherState.DRAINING;
      }
    }
    int busy = inFlight.get();
    if (busy > 0) {
      logger.info("Draining " + busy + " in-flight invocation(s)");
    }
    slots.acquireUninterruptibly(maxConcurrency);
    try {
      handlers.shutdown();
      terminate(cause);
    } finally {
      slots.release(maxConcurrency);
    }
  }

  private void terminate(Throwable cause) {
    terminationCause = cause;
    state = DispatcherState.STOPPED;
    for (Runnable callback : onStopped) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "onStopped callback failed", e);
      }
    }
    stopped.countDown();
    logger.info("Dispatcher stopped");
  }

  /**
   * Stops intake and waits until every in-flight invocation has finished.
   *
   * <p>Idempotent. A dispatcher that was never started goes straight to
   * {@link DispatcherState#STOPPED}. When called from a handler, listener or the consumer
   * thread, the stop is initiated but not awaited.
   */
  public void stop() {
    synchronized (this) {
      if (state == DispatcherState.IDLE) {
        handlers.shutdown();
        terminate(null);
        return;
      }
      if (state == DispatcherState.RUNNING) {
        logger.info("Stopping dispatcher");
        state = DispatcherState.DRAINING;
        consumer.interrupt();
      }
    }
    if (threads.ownsCurrentThread()) {
      return;
    }
    try {
      stopped.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Blocks until the dispatcher is {@link DispatcherState#STOPPED}.
   *
   * @throws SourceClosedException if it stopped because the source was lost
   * @throws InterruptedException if interrupted while waiting
   */
  public void awaitTermination() throws InterruptedException {
    stopped.await();
    rethrowTerminationCause();
  }

  /**
   * Blocks until the dispatcher is {@link DispatcherState#STOPPED} or the timeout elapses.
   *
   * @return {@code true} if stopped, {@code false} on timeout
   * @throws SourceClosedException if it stopped because the source was lost
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    if (!stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
      return false;
    }
    rethrowTerminationCause();
    return true;
  }

  private void rethrowTerminationCause() {
    Throwable cause = terminationCause;
    if (cause == null) {
      return;
    }
    if (cause instanceof RuntimeException re) {
      throw re;
    }
    throw new MqttRouterException("Dispatcher stopped abnormally", cause);
  }

  public DispatcherState state() {
    return state;
  }

  /** Why the dispatcher stopped on its own, if it did. */
  public Optional<Throwable> terminationCause() {
    return Optional.ofNullable(terminationCause);
  }

  public int inFlight() {
    return inFlight.get();
  }

  public int maxConcurrency() {
    return maxConcurrency;
  }

  /** Same as {@link #stop()}. */
  @Override
  public void close() {
    stop();
  }

  /** Builder for {@link RouteDispatcher}. */
  public static final class Builder {
    private MessageSource source;
    private MessageSink sink;
    private RouteRegistry registry;
    private CodecRegistry codecs;
    private DispatchMetrics metrics;
    private ExceptionMappers exceptionMappers;
    private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
    private final List<DeliveryListener> listeners = new ArrayList<>();
    private final List<Runnable> onStopped = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the source inbound messages are taken from.
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
     * Sets the sink handler results and replies are published to.
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
     * Sets the route table messages are resolved against.
     *
     * <p><b>Required.</b>
     *
     * @param registry the route registry
     * @return this builder
     */
    public Builder registry(RouteRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the codec registry used to decode inbound and encode outbound payloads.
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
     * Sets the metrics hook.
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

    /**
     * Sets the mappers used to build error replies.
     *
     * <p>Optional. Defaults to mappers that only know {@link MqttError}.
     *
     * @param exceptionMappers the exception mappers
     * @return this builder
     */
    public Builder exceptionMappers(ExceptionMappers exceptionMappers) {
      this.exceptionMappers = exceptionMappers;
      return this;
    }

    /**
     * Sets the maximum number of route invocations running at once.
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
     * Appends a delivery listener. Listeners are called in registration order.
     *
     * @param listener the listener to add
     * @return this builder
     */
    public Builder listener(DeliveryListener listener) {
      this.listeners.add(Objects.requireNonNull(listener, "listener"));
      return this;
    }

    public Builder listeners(List<DeliveryListener> listeners) {
      listeners.forEach(this::listener);
      return this;
    }

    /**
     * Appends a callback run once the dispatcher reaches {@link DispatcherState#STOPPED},
     * before {@link #awaitTermination()} returns.
     *
     * @param callback the callback
     * @return this builder
     */
    public Builder onStopped(Runnable callback) {
      this.onStopped.add(Objects.requireNonNull(callback, "callback"));
      return this;
    }

    /**
     * Builds the dispatcher in state {@link DispatcherState#IDLE}.
     *
     * @return a new {@link RouteDispatcher}
     * @throws NullPointerException if {@code source}, {@code sink} or {@code registry} is null
     * @throws IllegalArgumentException if {@code maxConcurrency < 1}
     */
    public RouteDispatcher build() {
      return new RouteDispatcher(this);
    }
  }
}
