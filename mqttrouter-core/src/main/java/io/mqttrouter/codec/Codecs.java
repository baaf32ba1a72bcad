package io.mqttrouter.codec;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Built-in payload types and their tagged codecs.
 *
 * <table>
 *   <caption>Wire format (tag byte + body)</caption>
 *   <tr><th>Type</th><th>Tag</th><th>Body</th></tr>
 *   <tr><td>{@link #NONE}</td><td>0x00</td><td>empty</td></tr>
 *   <tr><td>{@link #BYTES}</td><td>0x01</td><td>raw bytes</td></tr>
 *   <tr><td>{@link #STRING}</td><td>0x02</td><td>UTF-8, malformed input rejected</td></tr>
 *   <tr><td>{@link #LONG}</td><td>0x03</td><td>big-endian two's complement, minimal length, 1..8 bytes</td></tr>
 *   <tr><td>{@link #DOUBLE}</td><td>0x04</td><td>IEEE-754 binary64, big-endian</td></tr>
 *   <tr><td>{@link #BOOLEAN}</td><td>0x05</td><td>0x00 or 0x01</td></tr>
 * </table>
 *
 * <p>Tag {@code 0x06} is taken by the protobuf codec module.
 */
public final class Codecs {

  /** Largest accepted body size on decode, tag excluded. */
  public static final int MAX_PAYLOAD_SIZE = 1_048_576;

  public static final int TAG_NONE = 0x00;
  public static final int TAG_BYTES = 0x01;
  public static final int TAG_STRING = 0x02;
  public static final int TAG_LONG = 0x03;
  public static final int TAG_DOUBLE = 0x04;
  public static final int TAG_BOOLEAN = 0x05;
  public static final int TAG_PROTOBUF = 0x06;

  public static final PayloadType<Void> NONE = PayloadType.of("none", Void.class);
  public static final PayloadType<byte[]> BYTES = PayloadType.of("bytes", byte[].class);
  public static final PayloadType<String> STRING = PayloadType.of("string", String.class);
  public static final PayloadType<Long> LONG = PayloadType.of("long", Long.class);
  public static final PayloadType<Double> DOUBLE = PayloadType.of("double", Double.class);
  public static final PayloadType<Boolean> BOOLEAN = PayloadType.of("boolean", Boolean.class);

  private static final int DOUBLE_LENGTH = 8;
  private static final int LONG_MAX_LENGTH = 8;
  private static final byte FALSE = 0x00;
  private static final byte TRUE = 0x01;

  private Codecs() {
  }

  /** Binds every built-in type to its codec, in the order declared above. */
  public static void bindDefaults(CodecRegistry registry) {
    registry.bind(NONE, none());
    registry.bind(BYTES, bytes());
    registry.bind(STRING, string());
    registry.bind(LONG, longs());
    registry.bind(DOUBLE, doubles());
    registry.bind(BOOLEAN, booleans());
  }

  public static PayloadCodec<Void> none() {
    return NoneCodec.INSTANCE;
  }

  public static PayloadCodec<byte[]> bytes() {
    return BytesCodec.INSTANCE;
  }

  public static PayloadCodec<String> string() {
    return StringCodec.INSTANCE;
  }

  public static PayloadCodec<Long> longs() {
    return LongCodec.INSTANCE;
  }

  public static PayloadCodec<Double> doubles() {
    return DoubleCodec.INSTANCE;
  }

  public static PayloadCodec<Boolean> booleans() {
    return BooleanCodec.INSTANCE;
  }

  /**
   * Decodes UTF-8, rejecting malformed and unmappable input instead of substituting.
   */
  private static String decodeUtf8(byte[] body) {
    try {
      CharBuffer chars = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(body));
      return chars.toString();
    } catch (CharacterCodingException e) {
      throw new DecodeException("Failed to decode UTF-8 string", e);
    }
  }

  private static final class NoneCodec extends TaggedCodec<Void> {
    static final NoneCodec INSTANCE = new NoneCodec();

    private NoneCodec() {
      super(TAG_NONE);
    }

    @Override
    protected byte[] encodeBody(Void value) {
      return new byte[0];
    }

    @Override
    protected Void decodeBody(byte[] body) {
      if (body.length != 0) {
        throw new DecodeException("Invalid none payload length: " + body.length);
      }
      return null;
    }
  }

  private static final class BytesCodec extends TaggedCodec<byte[]> {
    static final BytesCodec INSTANCE = new BytesCodec();

    private BytesCodec() {
      super(TAG_BYTES);
    }

    @Override
    protected byte[] encodeBody(byte[] value) {
      return value.clone();
    }

    @Override
    protected byte[] decodeBody(byte[] body) {
      return body;
    }
  }

  private static final class StringCodec extends TaggedCodec<String> {
    static final StringCodec INSTANCE = new StringCodec();

    private StringCodec() {
      super(TAG_STRING);
    }

    @Override
    protected byte[] encodeBody(String value) {
      return value.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    protected String decodeBody(byte[] body) {
      return decodeUtf8(body);
    }
  }

  private static final class LongCodec extends TaggedCodec<Long> {
    static final LongCodec INSTANCE = new LongCodec();

    private LongCodec() {
      super(TAG_LONG);
    }

    @Override
    protected byte[] encodeBody(Long value) {
      return BigInteger.valueOf(value).toByteArray();
    }

    @Override
    protected Long decodeBody(byte[] body) {
      if (body.length == 0 || body.length > LONG_MAX_LENGTH) {
        throw new DecodeException("Invalid integer payload length: " + body.length);
      }
      return new BigInteger(body).longValue();
    }
  }

  private static final class DoubleCodec extends TaggedCodec<Double> {
    static final DoubleCodec INSTANCE = new DoubleCodec();

    private DoubleCodec() {
      super(TAG_DOUBLE);
    }

    @Override
    protected byte[] encodeBody(Double value) {
      return ByteBuffer.allocate(DOUBLE_LENGTH).putDouble(value).array();
    }

    @Override
    protected Double decodeBody(byte[] body) {
      if (body.length != DOUBLE_LENGTH) {
        throw new DecodeException("Invalid float payload length: " + body.length);
      }
      return ByteBuffer.wrap(body).getDouble();
    }
  }

  private static final class BooleanCodec extends TaggedCodec<Boolean> {
    static final BooleanCodec INSTANCE = new BooleanCodec();

    private BooleanCodec() {
      super(TAG_BOOLEAN);
    }

    @Override
    protected byte[] encodeBody(Boolean value) {
      return new byte[] {value ? TRUE : FALSE};
    }

    @Override
    protected Boolean decodeBody(byte[] body) {
      if (body.length != 1) {
        throw new DecodeException("Invalid boolean payload length: " + body.length);
      }
      if (body[0] != TRUE && body[0] != FALSE) {
        throw new DecodeException("Invalid boolean payload value: 0x"
            + String.format("%02x", body[0] & 0xFF));
      }
      return body[0] == TRUE;
    }
  }
}
