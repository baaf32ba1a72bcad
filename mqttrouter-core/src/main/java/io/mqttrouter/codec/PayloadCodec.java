package io.mqttrouter.codec;

/**
 * Converts between raw payload bytes and typed values of one payload type.
 *
 * <p>Implementations must be thread-safe; one instance serves all concurrent handler
 * invocations.
 *
 * @param <T> decoded value type
 * @see CodecRegistry
 * @see Codecs
 */
public interface PayloadCodec<T> {

  /**
   * Encodes a value.
   *
   * @param value the value to encode
   * @return encoded bytes
   * @throws EncodeException if the value cannot be encoded
   */
  byte[] encode(T value);

  /**
   * Decodes raw payload bytes.
   *
   * @param payload raw bytes as received
   * @return the decoded value
   * @throws DecodeException if the bytes are malformed or belong to another payload type
   */
  T decode(byte[] payload);
}
