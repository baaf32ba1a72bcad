/**
 * Service provider interfaces for the MQTT connection and metrics.
 *
 * @see io.mqttrouter.spi.MessageSource
 * @see io.mqttrouter.spi.MessageSink
 * @see io.mqttrouter.spi.DispatchMetrics
 */
package io.mqttrouter.spi;
