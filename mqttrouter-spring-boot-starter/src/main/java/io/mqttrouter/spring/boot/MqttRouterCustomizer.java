package io.mqttrouter.spring.boot;

import io.mqttrouter.MqttRouter;

/**
 * Callback for adjusting the {@link MqttRouter.Builder} before the auto-configured router
 * is built, e.g. to bind extra codecs or exception mappers. Routes are contributed as
 * {@link io.mqttrouter.registry.Router} beans instead.
 */
@FunctionalInterface
public interface MqttRouterCustomizer {

  void customize(MqttRouter.Builder builder);
}
