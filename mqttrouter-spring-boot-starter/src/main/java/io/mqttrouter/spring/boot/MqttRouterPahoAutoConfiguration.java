package io.mqttrouter.spring.boot;

import io.mqttrouter.paho.PahoMqttTransport;
import io.mqttrouter.spi.MessageSource;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the Eclipse Paho transport.
 *
 * <p>Creates a {@link PahoMqttTransport} and its {@link MessageSource} when Paho is on the
 * classpath and {@code mqttrouter.paho.server-uri} is set. Runs before
 * {@link MqttRouterAutoConfiguration} so the router picks both up.
 */
@AutoConfiguration(before = MqttRouterAutoConfiguration.class)
@ConditionalOnClass(PahoMqttTransport.class)
@ConditionalOnProperty(prefix = "mqttrouter.paho", name = "server-uri")
@EnableConfigurationProperties(MqttRouterProperties.class)
public class MqttRouterPahoAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public PahoMqttTransport pahoMqttTransport(MqttRouterProperties props) {
    MqttRouterProperties.Paho paho = props.getPaho();
    return PahoMqttTransport.builder()
        .serverUri(paho.getServerUri())
        .clientId(paho.getClientId())
        .username(paho.getUsername())
        .password(paho.getPassword())
        .automaticReconnect(paho.isAutomaticReconnect())
        .cleanStart(paho.isCleanStart())
        .keepAliveSeconds(paho.getKeepAliveSeconds())
        .inboundCapacity(paho.getInboundCapacity())
        .publishTimeout(paho.getPublishTimeout())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean(MessageSource.class)
  public MessageSource pahoMessageSource(PahoMqttTransport pahoMqttTransport) {
    return pahoMqttTransport.source();
  }
}
