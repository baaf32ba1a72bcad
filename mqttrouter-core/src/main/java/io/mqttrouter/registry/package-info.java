/**
 * Route table and reusable route groups.
 *
 * @see io.mqttrouter.registry.DefaultRouteRegistry
 * @see io.mqttrouter.registry.Router
 */
package io.mqttrouter.registry;
