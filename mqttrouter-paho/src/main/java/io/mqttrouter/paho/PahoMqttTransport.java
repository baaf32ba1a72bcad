package io.mqttrouter.paho;

import io.mqttrouter.MessageProperties;
import io.mqttrouter.MqttRouterException;
import io.mqttrouter.PublishException;
import io.mqttrouter.QoS;
import io.mqttrouter.RawMessage;
import io.mqttrouter.source.QueueMessageSource;
import io.mqttrouter.spi.MessageSink;
import io.mqttrouter.spi.MessageSource;
import io.mqttrouter.spi.SourceClosedException;
import io.mqttrouter.spi.Subscription;
import org.eclipse.paho.mqttv5.client.IMqttToken;
import org.eclipse.paho.mqttv5.client.MqttCallback;
import org.eclipse.paho.mqttv5.client.MqttClient;
import org.eclipse.paho.mqttv5.client.MqttConnectionOptions;
import org.eclipse.paho.mqttv5.client.MqttDisconnectResponse;
import org.eclipse.paho.mqttv5.client.persist.MemoryPersistence;
import org.eclipse.paho.mqttv5.common.MqttException;
import org.eclipse.paho.mqttv5.common.MqttMessage;
import org.eclipse.paho.mqttv5.common.MqttSubscription;
import org.eclipse.paho.mqttv5.common.packet.MqttProperties;
import org.eclipse.paho.mqttv5.common.packet.UserProperty;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * MQTT v5 connection backed by the Eclipse Paho synchronous client. Acts as the router's
 * {@link MessageSink} and hands out a {@link MessageSource} via {@link #source()}.
 *
 * <p>Inbound messages arrive on Paho's callback thread and are put into a bounded queue;
 * when the queue is full the callback thread blocks, which stops reading from the broker.
 * Acknowledgements for outbound publishes are read by that same thread, so every synchronous
 * client call waits at most the publish timeout and then fails with a {@link PublishException}.
 * A lost connection fails the source unless automatic reconnect is enabled, in which case
 * subscriptions are restored once the client reconnects.
 *
 * <pre>{@code
 * PahoMqttTransport transport = PahoMqttTransport.builder()
 *     .serverUri("tcp://broker:1883")
 *     .clientId("telemetry-router")
 *     .build();
 *
 * MqttRouter router = MqttRouter.builder()
 *     .source(transport.source())
 *     .sink(transport)
 *     .build();
 * }</pre>
 */
public final class PahoMqttTransport implements MessageSink, MqttCallback, AutoCloseable {
  private static final Logger logger = Logger.getLogger(PahoMqttTransport.class.getName());

  static final int DEFAULT_INBOUND_CAPACITY = 1000;
  static final Duration DEFAULT_PUBLISH_TIMEOUT = Duration.ofSeconds(10);

  private final MqttClient client;
  private final MqttConnectionOptions options;
  private final QueueMessageSource inbound;
  private final PahoMessageSource source;
  private volatile List<Subscription> subscriptions = List.of();
  private boolean closed;

  PahoMqttTransport(MqttClient client, MqttConnectionOptions options, int inboundCapacity) {
    this(client, options, inboundCapacity, DEFAULT_PUBLISH_TIMEOUT);
  }

  PahoMqttTransport(MqttClient client, MqttConnectionOptions options, int inboundCapacity,
      Duration publishTimeout) {
    this.client = Objects.requireNonNull(client, "client");
    this.options = Objects.requireNonNull(options, "options");
    this.inbound = new QueueMessageSource(inboundCapacity);
    this.source = new PahoMessageSource(this);
    client.setTimeToWait(requirePositive(publishTimeout).toMillis());
    client.setCallback(this);
  }

  private static Duration requirePositive(Duration timeout) {
    Objects.requireNonNull(timeout, "publishTimeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("publishTimeout must be positive: " + timeout);
    }
    return timeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** The source delivering messages received on this connection. */
  public MessageSource source() {
    return source;
  }

  /** Connects to the broker if not already connected. */
  public synchronized void connect() {
    if (client.isConnected()) {
      return;
    }
    try {
      client.connect(options);
      logger.log(Level.INFO, "Connected to MQTT broker {0} as {1}",
          new Object[]{client.getServerURI(), client.getClientId()});
    } catch (MqttException e) {
      throw new SourceClosedException("Failed to connect to " + client.getServerURI() + ": " + e.getMessage(), e);
    }
  }

  public boolean isConnected() {
    return client.isConnected();
  }

  synchronized void subscribe(List<Subscription> subscriptions) {
    this.subscriptions = List.copyOf(subscriptions);
    inbound.open(this.subscriptions);
    if (subscriptions.isEmpty()) {
      return;
    }
    MqttSubscription[] requests = new MqttSubscription[subscriptions.size()];
    for (int i = 0; i < requests.length; i++) {
      Subscription subscription = subscriptions.get(i);
      requests[i] = new MqttSubscription(subscription.filter(), subscription.qos().value());
    }
    try {
      client.subscribe(requests);
      logger.log(Level.INFO, "Subscribed to {0} filter(s)", requests.length);
    } catch (MqttException e) {
      throw new SourceClosedException("Failed to subscribe: " + e.getMessage(), e);
    }
  }

  synchronized void unsubscribe() {
    List<Subscription> current = subscriptions;
    subscriptions = List.of();
    inbound.close();
    if (current.isEmpty() || !client.isConnected()) {
      return;
    }
    String[] filters = new String[current.size()];
    for (int i = 0; i < filters.length; i++) {
      filters[i] = current.get(i).filter();
    }
    try {
      client.unsubscribe(filters);
    } catch (MqttException e) {
      logger.log(Level.WARNING, "Failed to unsubscribe from " + filters.length + " filter(s)", e);
    }
  }

  /** Milliseconds a synchronous client call waits before failing. */
  long publishTimeoutMillis() {
    return client.getTimeToWait();
  }

  RawMessage take() throws InterruptedException {
    return inbound.next();
  }

  @Override
  public void publish(String topic, byte[] payload, QoS qos, boolean retain, MessageProperties properties) {
    MqttMessage message = new MqttMessage(payload, qos.value(), retain, toMqttProperties(properties));
    try {
      client.publish(topic, message);
    } catch (MqttException e) {
      throw new PublishException("Failed to publish to " + topic + ": " + e.getMessage(), e);
    }
  }

  // ── Paho callbacks ──────────────────────────────────────────────

  @Override
  public void messageArrived(String topic, MqttMessage message) {
    RawMessage raw;
    try {
      raw = new RawMessage(topic, message.getPayload(), QoS.of(message.getQos()),
          message.isRetained(), toProperties(message.getProperties()));
    } catch (MqttRouterException | IllegalArgumentException e) {
      logger.log(Level.WARNING, "Dropping malformed message on " + topic, e);
      return;
    }
    try {
      inbound.put(raw);
    } catch (SourceClosedException e) {
      logger.log(Level.FINE, "Source closed; dropping message on {0}", topic);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.FINE, "Interrupted; dropping message on {0}", topic);
    }
  }

  @Override
  public void disconnected(MqttDisconnectResponse response) {
    connectionLost(response.getException() != null
        ? response.getException()
        : new MqttRouterException("Disconnected by broker: " + response.getReasonString()));
  }

  void connectionLost(Throwable cause) {
    if (options.isAutomaticReconnect()) {
      logger.log(Level.WARNING, "Connection lost; waiting for automatic reconnect", cause);
      return;
    }
    inbound.fail(new SourceClosedException("Connection lost: " + cause.getMessage(), cause));
  }

  @Override
  public void mqttErrorOccurred(MqttException exception) {
    logger.log(Level.WARNING, "MQTT client error", exception);
  }

  @Override
  public void deliveryComplete(IMqttToken token) {
  }

  @Override
  public void connectComplete(boolean reconnect, String serverURI) {
    if (!reconnect) {
      return;
    }
    logger.log(Level.INFO, "Reconnected to {0}", serverURI);
    List<Subscription> current = subscriptions;
    if (!current.isEmpty()) {
      try {
        subscribe(current);
      } catch (SourceClosedException e) {
        inbound.fail(e);
      }
    }
  }

  @Override
  public void authPacketArrived(int reasonCode, MqttProperties properties) {
  }

  /**
   * Disconnects from the broker and releases the client. Idempotent.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    inbound.close();
    MqttException first = null;
    try {
      if (client.isConnected()) {
        client.disconnect();
      }
    } catch (MqttException e) {
      first = e;
    }
    try {
      client.close();
    } catch (MqttException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (first != null) {
      throw new MqttRouterException("Failed to close MQTT client: " + first.getMessage(), first);
    }
  }

  // ── Property mapping ────────────────────────────────────────────

  static MessageProperties toProperties(MqttProperties properties) {
    if (properties == null) {
      return MessageProperties.EMPTY;
    }
    MessageProperties.Builder builder = MessageProperties.builder()
        .responseTopic(properties.getResponseTopic())
        .correlationData(properties.getCorrelationData());
    List<UserProperty> userProperties = properties.getUserProperties();
    if (userProperties != null) {
      for (UserProperty property : userProperties) {
        builder.userProperty(property.getKey(), property.getValue());
      }
    }
    MessageProperties mapped = builder.build();
    return mapped.isEmpty() ? MessageProperties.EMPTY : mapped;
  }

  static MqttProperties toMqttProperties(MessageProperties properties) {
    MqttProperties mqtt = new MqttProperties();
    if (properties == null || properties.isEmpty()) {
      return mqtt;
    }
    if (properties.responseTopic() != null) {
      mqtt.setResponseTopic(properties.responseTopic());
    }
    if (properties.correlationData() != null) {
      mqtt.setCorrelationData(properties.correlationData());
    }
    if (!properties.userProperties().isEmpty()) {
      List<UserProperty> userProperties = new ArrayList<>();
      for (Map.Entry<String, String> entry : properties.userProperties().entrySet()) {
        userProperties.add(new UserProperty(entry.getKey(), entry.getValue()));
      }
      mqtt.setUserProperties(userProperties);
    }
    return mqtt;
  }

  /**
   * Builder for {@link PahoMqttTransport}.
   */
  public static final class Builder {
    private String serverUri;
    private String clientId;
    private String username;
    private String password;
    private boolean automaticReconnect;
    private boolean cleanStart = true;
    private int keepAliveSeconds = 60;
    private int inboundCapacity = DEFAULT_INBOUND_CAPACITY;
    private Duration publishTimeout = DEFAULT_PUBLISH_TIMEOUT;

    private Builder() {}

    /**
     * Broker URI, e.g. {@code tcp://localhost:1883} or {@code ssl://broker:8883}.
     *
     * <p><b>Required.</b>
     */
    public Builder serverUri(String serverUri) {
      this.serverUri = serverUri;
      return this;
    }

    /** Optional. Defaults to a random {@code mqttrouter-} prefixed id. */
    public Builder clientId(String clientId) {
      this.clientId = clientId;
      return this;
    }

    /** Optional. */
    public Builder username(String username) {
      this.username = username;
      return this;
    }

    /** Optional. */
    public Builder password(String password) {
      this.password = password;
      return this;
    }

    /**
     * Whether Paho reconnects on its own after a lost connection. When disabled, a lost
     * connection ends dispatch with a {@link SourceClosedException}.
     *
     * <p>Optional. Defaults to {@code false}.
     */
    public Builder automaticReconnect(boolean automaticReconnect) {
      this.automaticReconnect = automaticReconnect;
      return this;
    }

    /** Optional. Defaults to {@code true}. */
    public Builder cleanStart(boolean cleanStart) {
      this.cleanStart = cleanStart;
      return this;
    }

    /** Optional. Defaults to 60 seconds. */
    public Builder keepAliveSeconds(int keepAliveSeconds) {
      this.keepAliveSeconds = keepAliveSeconds;
      return this;
    }

    /**
     * Maximum number of received messages buffered ahead of the dispatcher.
     *
     * <p>Optional. Defaults to {@value PahoMqttTransport#DEFAULT_INBOUND_CAPACITY}.
     */
    public Builder inboundCapacity(int inboundCapacity) {
      this.inboundCapacity = inboundCapacity;
      return this;
    }

    /**
     * How long a publish waits for the broker before failing with a {@link PublishException}.
     * Also bounds subscribe and unsubscribe calls.
     *
     * <p>Optional. Defaults to 10 seconds.
     */
    public Builder publishTimeout(Duration publishTimeout) {
      this.publishTimeout = publishTimeout;
      return this;
    }

    public PahoMqttTransport build() {
      Objects.requireNonNull(serverUri, "serverUri");
      if (keepAliveSeconds < 0) {
        throw new IllegalArgumentException("keepAliveSeconds must be >= 0");
      }
      requirePositive(publishTimeout);
      String id = clientId != null ? clientId : "mqttrouter-" + UUID.randomUUID();
      MqttConnectionOptions options = new MqttConnectionOptions();
      options.setAutomaticReconnect(automaticReconnect);
      options.setCleanStart(cleanStart);
      options.setKeepAliveInterval(keepAliveSeconds);
      if (username != null) {
        options.setUserName(username);
      }
      if (password != null) {
        options.setPassword(password.getBytes(StandardCharsets.UTF_8));
      }
      try {
        return new PahoMqttTransport(new MqttClient(serverUri, id, new MemoryPersistence()), options,
            inboundCapacity, publishTimeout);
      } catch (MqttException e) {
        throw new IllegalArgumentException("Invalid MQTT client settings: " + e.getMessage(), e);
      }
    }
  }
}
