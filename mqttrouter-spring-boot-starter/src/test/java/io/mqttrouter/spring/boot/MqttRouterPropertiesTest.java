package io.mqttrouter.spring.boot;

import io.mqttrouter.QoS;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MqttRouterPropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropertiesConfig.class);

  @Test
  void defaults() {
    runner.run(ctx -> {
      MqttRouterProperties props = ctx.getBean(MqttRouterProperties.class);
      assertTrue(props.isAutoStartup());
      assertEquals(16, props.getDispatcher().getMaxConcurrency());
      assertEquals(QoS.AT_LEAST_ONCE, props.getPublish().getDefaultQos());
      assertTrue(props.getMetrics().isEnabled());
      assertEquals("mqttrouter", props.getMetrics().getNamePrefix());
      assertNull(props.getPaho().getServerUri());
      assertFalse(props.getPaho().isAutomaticReconnect());
      assertTrue(props.getPaho().isCleanStart());
      assertEquals(60, props.getPaho().getKeepAliveSeconds());
      assertEquals(1000, props.getPaho().getInboundCapacity());
      assertEquals(Duration.ofSeconds(10), props.getPaho().getPublishTimeout());
    });
  }

  @Test
  void bindsRelaxedNames() {
    runner.withPropertyValues(
            "mqttrouter.dispatcher.max-concurrency=4",
            "mqttrouter.publish.default-qos=exactly-once",
            "mqttrouter.paho.server-uri=ssl://broker:8883",
            "mqttrouter.paho.automatic-reconnect=true",
            "mqttrouter.paho.publish-timeout=250ms")
        .run(ctx -> {
          MqttRouterProperties props = ctx.getBean(MqttRouterProperties.class);
          assertEquals(4, props.getDispatcher().getMaxConcurrency());
          assertEquals(QoS.EXACTLY_ONCE, props.getPublish().getDefaultQos());
          assertEquals("ssl://broker:8883", props.getPaho().getServerUri());
          assertTrue(props.getPaho().isAutomaticReconnect());
          assertEquals(Duration.ofMillis(250), props.getPaho().getPublishTimeout());
        });
  }

  @Configuration
  @EnableConfigurationProperties(MqttRouterProperties.class)
  static class PropertiesConfig {
  }
}
