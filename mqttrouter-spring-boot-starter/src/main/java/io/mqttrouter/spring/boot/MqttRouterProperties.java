package io.mqttrouter.spring.boot;

import io.mqttrouter.QoS;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the MQTT router.
 *
 * @see MqttRouterAutoConfiguration
 */
@ConfigurationProperties(prefix = "mqttrouter")
public class MqttRouterProperties {

  /**
   * Whether the router starts dispatching when the application context starts.
   */
  private boolean autoStartup = true;

  private final Dispatcher dispatcher = new Dispatcher();
  private final Publish publish = new Publish();
  private final Metrics metrics = new Metrics();
  private final Paho paho = new Paho();

  public boolean isAutoStartup() {
    return autoStartup;
  }

  public void setAutoStartup(boolean autoStartup) {
    this.autoStartup = autoStartup;
  }

  public Dispatcher getDispatcher() {
    return dispatcher;
  }

  public Publish getPublish() {
    return publish;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public Paho getPaho() {
    return paho;
  }

  public static class Dispatcher {
    /**
     * Maximum number of handler invocations running at once.
     */
    private int maxConcurrency = 16;

    public int getMaxConcurrency() {
      return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
      this.maxConcurrency = maxConcurrency;
    }
  }

  public static class Publish {
    /**
     * QoS for publishes and replies that do not name one.
     */
    private QoS defaultQos = QoS.AT_LEAST_ONCE;

    public QoS getDefaultQos() {
      return defaultQos;
    }

    public void setDefaultQos(QoS defaultQos) {
      this.defaultQos = defaultQos;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "mqttrouter";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }

  public static class Paho {
    /**
     * Broker URI. Setting it enables the Paho transport.
     */
    private String serverUri;
    private String clientId;
    private String username;
    private String password;
    private boolean automaticReconnect = false;
    private boolean cleanStart = true;
    private int keepAliveSeconds = 60;
    private int inboundCapacity = 1000;
    /**
     * Upper bound on a blocking publish, subscribe or unsubscribe call.
     */
    private Duration publishTimeout = Duration.ofSeconds(10);

    public String getServerUri() {
      return serverUri;
    }

    public void setServerUri(String serverUri) {
      this.serverUri = serverUri;
    }

    public String getClientId() {
      return clientId;
    }

    public void setClientId(String clientId) {
      this.clientId = clientId;
    }

    public String getUsername() {
      return username;
    }

    public void setUsername(String username) {
      this.username = username;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(String password) {
      this.password = password;
    }

    public boolean isAutomaticReconnect() {
      return automaticReconnect;
    }

    public void setAutomaticReconnect(boolean automaticReconnect) {
      this.automaticReconnect = automaticReconnect;
    }

    public boolean isCleanStart() {
      return cleanStart;
    }

    public void setCleanStart(boolean cleanStart) {
      this.cleanStart = cleanStart;
    }

    public int getKeepAliveSeconds() {
      return keepAliveSeconds;
    }

    public void setKeepAliveSeconds(int keepAliveSeconds) {
      this.keepAliveSeconds = keepAliveSeconds;
    }

    public int getInboundCapacity() {
      return inboundCapacity;
    }

    public void setInboundCapacity(int inboundCapacity) {
      this.inboundCapacity = inboundCapacity;
    }

    public Duration getPublishTimeout() {
      return publishTimeout;
    }

    public void setPublishTimeout(Duration publishTimeout) {
      this.publishTimeout = publishTimeout;
    }
  }
}
