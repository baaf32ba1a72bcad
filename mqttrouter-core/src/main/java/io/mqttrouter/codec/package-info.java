/**
 * Payload types and the codecs that convert them to and from bytes.
 *
 * <p>Built-in codecs ({@link io.mqttrouter.codec.Codecs}) prefix the body with a one-byte
 * type tag so that a payload of the wrong type is rejected instead of misread.
 *
 * @see io.mqttrouter.codec.CodecRegistry
 * @see io.mqttrouter.codec.PayloadCodec
 * @see io.mqttrouter.codec.TaggedCodec
 */
package io.mqttrouter.codec;
