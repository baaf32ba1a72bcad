package io.mqttrouter.spring.boot;

import io.mqttrouter.MessageProperties;
import io.mqttrouter.MqttRouter;
import io.mqttrouter.Outbound;
import io.mqttrouter.QoS;
import io.mqttrouter.RawMessage;
import io.mqttrouter.codec.Codecs;
import io.mqttrouter.codec.PayloadType;
import io.mqttrouter.dispatch.DispatcherState;
import io.mqttrouter.registry.Router;
import io.mqttrouter.source.QueueMessageSource;
import io.mqttrouter.spi.MessageSink;
import io.mqttrouter.spi.Subscription;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MqttRouterAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(MqttRouterAutoConfiguration.class));

  @Test
  void createsRouterAndStartsIt() {
    runner.withUserConfiguration(TransportConfig.class, RoutesConfig.class).run(ctx -> {
      assertTrue(ctx.containsBean("mqttRouter"));
      assertTrue(ctx.containsBean("mqttRouterLifecycle"));

      MqttRouter router = ctx.getBean(MqttRouter.class);
      assertEquals(DispatcherState.RUNNING, router.state());
      assertEquals(2, router.routes().size());
      assertEquals(Set.of(new Subscription("sensors/+/temp", QoS.AT_MOST_ONCE),
              new Subscription("echo", QoS.AT_MOST_ONCE)),
          Set.copyOf(ctx.getBean(QueueMessageSource.class).subscriptions()));
    });
  }

  @Test
  void dispatchesThroughRouterBeans() {
    runner.withUserConfiguration(TransportConfig.class, RoutesConfig.class).run(ctx -> {
      QueueMessageSource source = ctx.getBean(QueueMessageSource.class);
      CollectingSink sink = ctx.getBean(CollectingSink.class);

      source.offer(new RawMessage("echo", Codecs.string().encode("ping"), QoS.AT_MOST_ONCE, false,
          MessageProperties.builder().responseTopic("replies/1").build()));

      assertTrue(sink.latch.await(5, TimeUnit.SECONDS));
      assertEquals("replies/1", sink.topics.get(0));
    });
  }

  @Test
  void stopsRouterWhenContextCloses() {
    MqttRouter[] captured = new MqttRouter[1];
    runner.withUserConfiguration(TransportConfig.class).run(ctx -> captured[0] = ctx.getBean(MqttRouter.class));
    assertEquals(DispatcherState.STOPPED, captured[0].state());
  }

  @Test
  void autoStartupCanBeDisabled() {
    runner.withUserConfiguration(TransportConfig.class)
        .withPropertyValues("mqttrouter.auto-startup=false")
        .run(ctx -> assertEquals(DispatcherState.IDLE, ctx.getBean(MqttRouter.class).state()));
  }

  @Test
  void appliesCustomizers() {
    runner.withUserConfiguration(TransportConfig.class, CustomizerConfig.class).run(ctx -> {
      MqttRouter router = ctx.getBean(MqttRouter.class);
      assertTrue(router.codecs().isBound(CustomizerConfig.UPPER));
    });
  }

  @Test
  void backsOffWithoutTransport() {
    runner.run(ctx -> {
      assertNull(ctx.getStartupFailure());
      assertFalse(ctx.containsBean("mqttRouter"));
    });
  }

  @Test
  void rejectsInvalidConcurrency() {
    runner.withUserConfiguration(TransportConfig.class)
        .withPropertyValues("mqttrouter.dispatcher.max-concurrency=0")
        .run(ctx -> assertNotNull(ctx.getStartupFailure()));
  }

  static final class CollectingSink implements MessageSink {
    final List<String> topics = new CopyOnWriteArrayList<>();
    final CountDownLatch latch = new CountDownLatch(1);

    @Override
    public void publish(String topic, byte[] payload, QoS qos, boolean retain, MessageProperties properties) {
      topics.add(topic);
      latch.countDown();
    }
  }

  @Configuration
  static class TransportConfig {
    @Bean
    QueueMessageSource messageSource() {
      return new QueueMessageSource();
    }

    @Bean
    CollectingSink messageSink() {
      return new CollectingSink();
    }
  }

  @Configuration
  static class RoutesConfig {
    @Bean
    Router sensorRoutes() {
      return new Router("sensors").route("{id}/temp", Codecs.DOUBLE, message -> Outbound.none());
    }

    @Bean
    Router echoRoutes() {
      return new Router().route("echo", Codecs.STRING, message -> Outbound.reply(message.payload()));
    }
  }

  @Configuration
  static class CustomizerConfig {
    static final PayloadType<String> UPPER = PayloadType.of("upper", String.class);

    @Bean
    MqttRouterCustomizer upperCodec() {
      return builder -> builder.codec(UPPER, Codecs.string());
    }
  }
}
