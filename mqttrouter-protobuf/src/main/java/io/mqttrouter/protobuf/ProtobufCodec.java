package io.mqttrouter.protobuf;

import com.google.protobuf.Internal;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.Parser;
import io.mqttrouter.codec.Codecs;
import io.mqttrouter.codec.DecodeException;
import io.mqttrouter.codec.EncodeException;
import io.mqttrouter.codec.PayloadType;
import io.mqttrouter.codec.TaggedCodec;

import java.util.Objects;

/**
 * Codec for generated Protocol Buffers messages. Wire format is the {@link Codecs#TAG_PROTOBUF}
 * tag followed by the message in standard protobuf binary encoding.
 *
 * <pre>{@code
 * ProtobufCodec<SensorReading> codec = new ProtobufCodec<>(SensorReading.class);
 * router = MqttRouter.builder()
 *     .codec(codec.payloadType(), codec)
 *     ...
 * }</pre>
 *
 * @param <M> generated message type
 */
public final class ProtobufCodec<M extends Message> extends TaggedCodec<M> {
  private final M prototype;
  private final Parser<M> parser;
  private final PayloadType<M> payloadType;

  /**
   * Creates a codec for the given generated message class.
   *
   * @param messageClass generated message class, e.g. {@code SensorReading.class}
   */
  public ProtobufCodec(Class<M> messageClass) {
    this(Internal.getDefaultInstance(Objects.requireNonNull(messageClass, "messageClass")));
  }

  /**
   * Creates a codec from the message's default instance.
   *
   * @param prototype default instance, e.g. {@code SensorReading.getDefaultInstance()}
   */
  @SuppressWarnings("unchecked")
  public ProtobufCodec(M prototype) {
    super(Codecs.TAG_PROTOBUF);
    this.prototype = Objects.requireNonNull(prototype, "prototype");
    this.parser = (Parser<M>) prototype.getParserForType();
    this.payloadType = PayloadType.of(prototype.getDescriptorForType().getFullName(),
        (Class<M>) prototype.getClass());
  }

  /**
   * Payload type named after the message's full protobuf name, e.g.
   * {@code google.protobuf.StringValue}.
   */
  public PayloadType<M> payloadType() {
    return payloadType;
  }

  /** The message's default instance. */
  public M prototype() {
    return prototype;
  }

  @Override
  protected byte[] encodeBody(M value) {
    if (value == null) {
      throw new EncodeException("Cannot encode null " + payloadType);
    }
    byte[] body = value.toByteArray();
    if (body.length > Codecs.MAX_PAYLOAD_SIZE) {
      throw new EncodeException("Payload too large: " + body.length
          + " bytes (max " + Codecs.MAX_PAYLOAD_SIZE + ")");
    }
    return body;
  }

  @Override
  protected M decodeBody(byte[] body) {
    try {
      return parser.parseFrom(body);
    } catch (InvalidProtocolBufferException e) {
      throw new DecodeException("Failed to decode " + payloadType + ": " + e.getMessage(), e);
    }
  }
}
