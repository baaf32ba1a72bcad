package io.mqttrouter.protobuf;

import com.google.protobuf.Int64Value;
import com.google.protobuf.StringValue;
import io.mqttrouter.codec.CodecRegistry;
import io.mqttrouter.codec.Codecs;
import io.mqttrouter.codec.DecodeException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class ProtobufCodecTest {

  private final ProtobufCodec<StringValue> codec = new ProtobufCodec<>(StringValue.class);

  @Test
  void encodesTagFollowedByProtobufBody() {
    StringValue value = StringValue.of("hello");

    byte[] encoded = codec.encode(value);

    assertEquals(Codecs.TAG_PROTOBUF, encoded[0]);
    assertArrayEquals(value.toByteArray(), Arrays.copyOfRange(encoded, 1, encoded.length));
    assertEquals(value, codec.decode(encoded));
  }

  @Test
  void defaultInstanceEncodesToTagOnly() {
    byte[] encoded = codec.encode(StringValue.getDefaultInstance());
    assertArrayEquals(new byte[] {Codecs.TAG_PROTOBUF}, encoded);
    assertEquals(StringValue.getDefaultInstance(), codec.decode(encoded));
  }

  @Test
  void payloadTypeIsNamedByDescriptor() {
    assertEquals("google.protobuf.StringValue", codec.payloadType().name());
    assertEquals(StringValue.class, codec.payloadType().javaType());
    assertEquals(codec.payloadType(), new ProtobufCodec<>(StringValue.getDefaultInstance()).payloadType());
  }

  @Test
  void rejectsTruncatedBody() {
    // field 1, length 5, one byte present
    byte[] truncated = {Codecs.TAG_PROTOBUF, 0x0A, 0x05, 'a'};
    assertThrows(DecodeException.class, () -> codec.decode(truncated));
  }

  @Test
  void rejectsForeignTag() {
    byte[] string = Codecs.string().encode("hello");
    assertThrows(DecodeException.class, () -> codec.decode(string));
    assertThrows(DecodeException.class, () -> codec.decode(new byte[0]));
  }

  @Test
  void bindsIntoRegistryAlongsideDefaults() {
    ProtobufCodec<Int64Value> counts = new ProtobufCodec<>(Int64Value.class);
    CodecRegistry registry = CodecRegistry.withDefaults()
        .bind(codec.payloadType(), codec)
        .bind(counts.payloadType(), counts);

    byte[] bytes = registry.encode(counts.payloadType(), Int64Value.of(42));

    assertEquals(42L, registry.decode(counts.payloadType(), bytes).getValue());
    assertEquals(codec.payloadType(), registry.typeOf(StringValue.of("x")));
  }
}
