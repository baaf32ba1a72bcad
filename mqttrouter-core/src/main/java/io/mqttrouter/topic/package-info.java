/**
 * MQTT topic filters: parsing, validation, wildcard matching and path parameter extraction.
 *
 * @see io.mqttrouter.topic.TopicFilter
 */
package io.mqttrouter.topic;
