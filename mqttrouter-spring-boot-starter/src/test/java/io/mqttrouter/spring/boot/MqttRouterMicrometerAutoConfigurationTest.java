package io.mqttrouter.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.mqttrouter.HandlerResult;
import io.mqttrouter.micrometer.MicrometerDispatchMetrics;
import io.mqttrouter.spi.DispatchMetrics;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MqttRouterMicrometerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(MqttRouterMicrometerAutoConfiguration.class))
      .withUserConfiguration(MeterRegistryConfig.class);

  @Test
  void createsMicrometerMetricsByDefault() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("micrometerDispatchMetrics"));
      assertInstanceOf(MicrometerDispatchMetrics.class, ctx.getBean(DispatchMetrics.class));
      assertNotNull(ctx.getBean(MeterRegistry.class).find("mqttrouter.messages.received").counter());
    });
  }

  @Test
  void respectsCustomNamePrefix() {
    runner.withPropertyValues("mqttrouter.metrics.name-prefix=plant.router").run(ctx -> {
      var registry = ctx.getBean(MeterRegistry.class);
      assertNotNull(registry.find("plant.router.messages.received").counter());
    });
  }

  @Test
  void disabledWhenPropertyFalse() {
    runner.withPropertyValues("mqttrouter.metrics.enabled=false").run(ctx -> {
      assertFalse(ctx.containsBean("micrometerDispatchMetrics"));
    });
  }

  @Test
  void backsOffWithoutMeterRegistry() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(MqttRouterMicrometerAutoConfiguration.class))
        .run(ctx -> assertFalse(ctx.containsBean("micrometerDispatchMetrics")));
  }

  @Test
  void backsOffWhenCustomMetricsPresent() {
    runner.withUserConfiguration(CustomMetricsConfig.class).run(ctx -> {
      var metrics = ctx.getBean(DispatchMetrics.class);
      assertFalse(metrics instanceof MicrometerDispatchMetrics);
    });
  }

  @Configuration
  static class MeterRegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Configuration
  static class CustomMetricsConfig {
    @Bean
    DispatchMetrics customMetrics() {
      return new DispatchMetrics() {
        @Override
        public void incrementReceived() {
        }

        @Override
        public void incrementUnrouted() {
        }

        @Override
        public void incrementHandlerSuccess() {
        }

        @Override
        public void incrementHandlerFailure(HandlerResult.Stage stage) {
        }

        @Override
        public void incrementPublished() {
        }
      };
    }
  }
}
