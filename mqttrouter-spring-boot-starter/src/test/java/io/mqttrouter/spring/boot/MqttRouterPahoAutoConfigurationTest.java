package io.mqttrouter.spring.boot;

import io.mqttrouter.MqttRouter;
import io.mqttrouter.dispatch.DispatcherState;
import io.mqttrouter.paho.PahoMqttTransport;
import io.mqttrouter.spi.MessageSource;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

class MqttRouterPahoAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          MqttRouterPahoAutoConfiguration.class,
          MqttRouterAutoConfiguration.class))
      .withPropertyValues("mqttrouter.auto-startup=false");

  @Test
  void createsTransportWhenServerUriIsSet() {
    runner.withPropertyValues(
            "mqttrouter.paho.server-uri=tcp://localhost:1883",
            "mqttrouter.paho.client-id=starter-test")
        .run(ctx -> {
          PahoMqttTransport transport = ctx.getBean(PahoMqttTransport.class);
          assertFalse(transport.isConnected());
          assertSame(transport.source(), ctx.getBean(MessageSource.class));
          assertEquals(DispatcherState.IDLE, ctx.getBean(MqttRouter.class).state());
        });
  }

  @Test
  void backsOffWithoutServerUri() {
    runner.run(ctx -> {
      assertFalse(ctx.containsBean("pahoMqttTransport"));
      assertFalse(ctx.containsBean("mqttRouter"));
    });
  }
}
