/**
 * Message dispatch with bounded concurrency.
 *
 * <p>{@link io.mqttrouter.dispatch.RouteDispatcher} takes messages from the source on one
 * consumer thread and runs one invocation per matching route on a bounded handler pool,
 * publishing results and error replies through the {@link io.mqttrouter.dispatch.OutboundPublisher}.
 *
 * @see io.mqttrouter.dispatch.RouteDispatcher
 * @see io.mqttrouter.dispatch.DeliveryListener
 * @see io.mqttrouter.dispatch.ExceptionMappers
 */
package io.mqttrouter.dispatch;
