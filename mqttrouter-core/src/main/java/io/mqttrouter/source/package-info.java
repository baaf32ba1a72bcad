/**
 * In-memory message sources.
 */
package io.mqttrouter.source;
