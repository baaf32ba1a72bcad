/**
 * Micrometer binding for router dispatch metrics.
 *
 * @see io.mqttrouter.micrometer.MicrometerDispatchMetrics
 */
package io.mqttrouter.micrometer;
