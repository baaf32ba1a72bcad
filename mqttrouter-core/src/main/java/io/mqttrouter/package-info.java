/**
 * Topic routing and dispatch for MQTT with typed payloads.
 *
 * <p>{@link io.mqttrouter.MqttRouter} is the entry point: register routes, start it, and
 * it consumes messages from a {@link io.mqttrouter.spi.MessageSource}, decodes them and
 * runs the matching {@link io.mqttrouter.RouteHandler}s, publishing their
 * {@link io.mqttrouter.Outbound} results through a {@link io.mqttrouter.spi.MessageSink}.
 *
 * @see io.mqttrouter.MqttRouter
 * @see io.mqttrouter.RouteHandler
 * @see io.mqttrouter.HandlerResult
 */
package io.mqttrouter;
