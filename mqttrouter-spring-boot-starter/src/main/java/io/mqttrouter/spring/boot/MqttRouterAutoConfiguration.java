package io.mqttrouter.spring.boot;

import io.mqttrouter.MqttRouter;
import io.mqttrouter.dispatch.DeliveryListener;
import io.mqttrouter.registry.Router;
import io.mqttrouter.spi.DispatchMetrics;
import io.mqttrouter.spi.MessageSink;
import io.mqttrouter.spi.MessageSource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the MQTT router.
 *
 * <p>Builds an {@link MqttRouter} from the context's {@link MessageSource} and
 * {@link MessageSink}, registers every {@link Router} bean and starts dispatching with the
 * application context.
 *
 * @see MqttRouterProperties
 * @see MqttRouterPahoAutoConfiguration
 * @see MqttRouterMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(MqttRouter.class)
@ConditionalOnBean({MessageSource.class, MessageSink.class})
@EnableConfigurationProperties(MqttRouterProperties.class)
public class MqttRouterAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public MqttRouter mqttRouter(MqttRouterProperties props,
                               MessageSource source,
                               MessageSink sink,
                               ObjectProvider<DispatchMetrics> metricsProvider,
                               ObjectProvider<DeliveryListener> listenerProvider,
                               ObjectProvider<MqttRouterCustomizer> customizerProvider,
                               ObjectProvider<Router> routerProvider) {
    MqttRouter.Builder builder = MqttRouter.builder()
        .source(source)
        .sink(sink)
        .maxConcurrency(props.getDispatcher().getMaxConcurrency())
        .defaultQos(props.getPublish().getDefaultQos());
    DispatchMetrics metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    listenerProvider.orderedStream().forEach(builder::listener);
    customizerProvider.orderedStream().forEach(customizer -> customizer.customize(builder));

    MqttRouter router = builder.build();
    routerProvider.orderedStream().forEach(router::include);
    return router;
  }

  @Bean
  @ConditionalOnMissingBean
  public MqttRouterLifecycle mqttRouterLifecycle(MqttRouter mqttRouter, MqttRouterProperties props) {
    return new MqttRouterLifecycle(mqttRouter, props.isAutoStartup());
  }
}
