/**
 * Spring Boot auto-configuration for the MQTT router.
 *
 * <p>Declare a {@link io.mqttrouter.spi.MessageSource} and {@link io.mqttrouter.spi.MessageSink},
 * or set {@code mqttrouter.paho.server-uri}, and contribute routes as
 * {@link io.mqttrouter.registry.Router} beans.
 */
package io.mqttrouter.spring.boot;
