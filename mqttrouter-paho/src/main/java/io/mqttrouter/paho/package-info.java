/**
 * Eclipse Paho MQTT v5 transport: a {@link io.mqttrouter.spi.MessageSink} that also
 * provides the router's {@link io.mqttrouter.spi.MessageSource}.
 */
package io.mqttrouter.paho;
