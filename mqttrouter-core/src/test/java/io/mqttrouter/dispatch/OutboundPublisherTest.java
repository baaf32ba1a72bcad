package io.mqttrouter.dispatch;

import io.mqttrouter.MessageProperties;
import io.mqttrouter.OutboundMessage;
import io.mqttrouter.PublishException;
import io.mqttrouter.QoS;
import io.mqttrouter.RecordingSink;
import io.mqttrouter.codec.CodecRegistry;
import io.mqttrouter.codec.Codecs;
import io.mqttrouter.codec.EncodeException;
import io.mqttrouter.spi.DispatchMetrics;
import io.mqttrouter.topic.InvalidTopicException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutboundPublisherTest {

  private final RecordingSink sink = new RecordingSink();
  private final OutboundPublisher publisher =
      new OutboundPublisher(CodecRegistry.withDefaults(), sink, DispatchMetrics.NOOP);

  @Test
  void resolvesPayloadTypeFromValue() {
    OutboundMessage sent = publisher.publish("status", true, QoS.AT_LEAST_ONCE, true, MessageProperties.EMPTY);

    assertEquals("boolean", sent.payloadType());
    assertEquals(2, sent.size());
    RecordingSink.Published published = sink.published.get(0);
    assertEquals("status", published.topic());
    assertTrue(Codecs.booleans().decode(published.payload()));
    assertTrue(published.retain());
  }

  @Test
  void rejectsWildcardTopicsBeforeEncoding() {
    assertThrows(InvalidTopicException.class,
        () -> publisher.publish("a/+", Codecs.STRING, "x", QoS.AT_MOST_ONCE, false, null));
    assertTrue(sink.published.isEmpty());
  }

  @Test
  void encodeFailuresAreThrownToCaller() {
    assertThrows(EncodeException.class,
        () -> publisher.publish("a", Codecs.LONG, "not a number", QoS.AT_MOST_ONCE, false, null));
  }

  @Test
  void sinkFailuresAreWrappedInPublishException() {
    IllegalStateException cause = new IllegalStateException("offline");
    sink.failWith = cause;
    PublishException e = assertThrows(PublishException.class,
        () -> publisher.publish("a", "x", QoS.AT_MOST_ONCE, false, null));
    assertSame(cause, e.getCause());
  }

  @Test
  void publishExceptionsFromSinkPassThrough() {
    PublishException failure = new PublishException("rejected");
    sink.failWith = failure;
    assertSame(failure, assertThrows(PublishException.class,
        () -> publisher.publish("a", "x", QoS.AT_MOST_ONCE, false, null)));
  }
}
