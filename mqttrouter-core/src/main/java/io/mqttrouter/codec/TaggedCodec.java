package io.mqttrouter.codec;

import java.util.Arrays;

/**
 * Base class for codecs whose wire format is a one-byte type tag followed by the body.
 *
 * <p>Decoding rejects empty payloads, a tag other than {@link #tag()} and bodies larger
 * than {@link Codecs#MAX_PAYLOAD_SIZE}. Subclasses only deal with the body.
 *
 * @param <T> decoded value type
 */
public abstract class TaggedCodec<T> implements PayloadCodec<T> {
  private final byte tag;

  protected TaggedCodec(int tag) {
    if (tag < 0 || tag > 0xFF) {
      throw new IllegalArgumentException("tag must fit in one unsigned byte: " + tag);
    }
    this.tag = (byte) tag;
  }

  public final int tag() {
    return tag & 0xFF;
  }

  @Override
  public final byte[] encode(T value) {
    byte[] body = encodeBody(value);
    byte[] out = new byte[body.length + 1];
    out[0] = tag;
    System.arraycopy(body, 0, out, 1, body.length);
    return out;
  }

  @Override
  public final T decode(byte[] payload) {
    if (payload == null || payload.length == 0) {
      throw new DecodeException("Empty payload; expected type tag 0x" + hex(tag));
    }
    if (payload[0] != tag) {
      throw new DecodeException("Unexpected type tag 0x" + hex(payload[0])
          + "; expected 0x" + hex(tag));
    }
    int bodyLength = payload.length - 1;
    if (bodyLength > Codecs.MAX_PAYLOAD_SIZE) {
      throw new DecodeException("Payload too large: " + bodyLength
          + " bytes (max " + Codecs.MAX_PAYLOAD_SIZE + ")");
    }
    return decodeBody(Arrays.copyOfRange(payload, 1, payload.length));
  }

  /**
   * Encodes the body, without the tag.
   *
   * @throws EncodeException if the value cannot be encoded
   */
  protected abstract byte[] encodeBody(T value);

  /**
   * Decodes the body, without the tag.
   *
   * @throws DecodeException if the body is malformed
   */
  protected abstract T decodeBody(byte[] body);

  private static String hex(byte b) {
    return String.format("%02x", b & 0xFF);
  }
}
