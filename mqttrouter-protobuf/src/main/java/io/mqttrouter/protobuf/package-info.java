/**
 * Protocol Buffers payload codec.
 */
package io.mqttrouter.protobuf;
