package io.mqttrouter.paho;

import io.mqttrouter.MessageProperties;
import io.mqttrouter.PublishException;
import io.mqttrouter.QoS;
import io.mqttrouter.RawMessage;
import io.mqttrouter.spi.SourceClosedException;
import org.eclipse.paho.mqttv5.common.MqttMessage;
import org.eclipse.paho.mqttv5.common.packet.MqttProperties;
import org.eclipse.paho.mqttv5.common.packet.UserProperty;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PahoMqttTransportTest {

  private PahoMqttTransport transport;

  @AfterEach
  void tearDown() {
    if (transport != null) {
      transport.close();
    }
  }

  private PahoMqttTransport newTransport(boolean automaticReconnect) {
    transport = PahoMqttTransport.builder()
        .serverUri("tcp://localhost:1883")
        .clientId("paho-transport-test")
        .automaticReconnect(automaticReconnect)
        .inboundCapacity(4)
        .build();
    return transport;
  }

  // ── Inbound ─────────────────────────────────────────────────────

  @Test
  void arrivedMessagesAreDeliveredBySource() throws Exception {
    newTransport(false);
    MqttProperties properties = new MqttProperties();
    properties.setResponseTopic("replies/7");
    properties.setCorrelationData(new byte[] {7});
    properties.setUserProperties(List.of(new UserProperty("origin", "gateway")));

    transport.messageArrived("sensors/7/temp",
        new MqttMessage("21.5".getBytes(StandardCharsets.UTF_8), 1, true, properties));

    RawMessage raw = transport.source().next();
    assertEquals("sensors/7/temp", raw.topic());
    assertArrayEquals("21.5".getBytes(StandardCharsets.UTF_8), raw.payload());
    assertEquals(QoS.AT_LEAST_ONCE, raw.qos());
    assertTrue(raw.retain());
    assertEquals("replies/7", raw.properties().responseTopic());
    assertArrayEquals(new byte[] {7}, raw.properties().correlationData());
    assertEquals(Map.of("origin", "gateway"), raw.properties().userProperties());
  }

  @Test
  void connectionLossFailsSourceAfterQueuedMessages() throws Exception {
    newTransport(false);
    transport.messageArrived("a", new MqttMessage(new byte[] {1}));

    transport.connectionLost(new IllegalStateException("socket reset"));

    assertEquals("a", transport.source().next().topic());
    SourceClosedException e = assertThrows(SourceClosedException.class, () -> transport.source().next());
    assertTrue(e.getMessage().contains("socket reset"));
  }

  @Test
  void connectionLossIsToleratedWithAutomaticReconnect() throws Exception {
    newTransport(true);

    transport.connectionLost(new IllegalStateException("socket reset"));
    transport.messageArrived("a", new MqttMessage(new byte[] {1}));

    assertEquals("a", transport.source().next().topic());
  }

  @Test
  void closingSourceDropsLaterMessages() {
    newTransport(false);
    transport.source().close();

    transport.messageArrived("a", new MqttMessage(new byte[] {1}));

    assertThrows(SourceClosedException.class, () -> transport.source().next());
  }

  // ── Outbound ────────────────────────────────────────────────────

  @Test
  void publishWhileDisconnectedFails() {
    newTransport(false);
    assertFalse(transport.isConnected());
    assertThrows(PublishException.class,
        () -> transport.publish("a", new byte[] {1}, QoS.AT_LEAST_ONCE, false));
  }

  @Test
  void publishTimeoutIsFiniteByDefault() {
    newTransport(false);
    assertEquals(PahoMqttTransport.DEFAULT_PUBLISH_TIMEOUT.toMillis(), transport.publishTimeoutMillis());
    assertTrue(transport.publishTimeoutMillis() > 0);
  }

  @Test
  void publishTimeoutIsConfigurable() {
    transport = PahoMqttTransport.builder()
        .serverUri("tcp://localhost:1883")
        .publishTimeout(Duration.ofMillis(250))
        .build();
    assertEquals(250, transport.publishTimeoutMillis());
  }

  @Test
  void builderRejectsNonPositivePublishTimeout() {
    assertThrows(IllegalArgumentException.class, () -> PahoMqttTransport.builder()
        .serverUri("tcp://localhost:1883")
        .publishTimeout(Duration.ZERO)
        .build());
    assertThrows(NullPointerException.class, () -> PahoMqttTransport.builder()
        .serverUri("tcp://localhost:1883")
        .publishTimeout(null)
        .build());
  }

  @Test
  void publishDoesNotBlockWhileInboundQueueIsFull() {
    newTransport(false);
    for (int i = 0; i < 4; i++) {
      transport.messageArrived("a", new MqttMessage(new byte[] {(byte) i}));
    }

    assertTimeoutPreemptively(Duration.ofSeconds(5), () -> assertThrows(PublishException.class,
        () -> transport.publish("b", new byte[] {1}, QoS.AT_LEAST_ONCE, false)));
  }

  @Test
  void builderRequiresServerUri() {
    assertThrows(NullPointerException.class, () -> PahoMqttTransport.builder().build());
  }

  // ── Property mapping ────────────────────────────────────────────

  @Test
  void mapsPropertiesToMqtt() {
    MessageProperties properties = MessageProperties.builder()
        .responseTopic("replies/1")
        .correlationData(new byte[] {1, 2})
        .userProperty("error", "None")
        .build();

    MqttProperties mqtt = PahoMqttTransport.toMqttProperties(properties);

    assertEquals("replies/1", mqtt.getResponseTopic());
    assertArrayEquals(new byte[] {1, 2}, mqtt.getCorrelationData());
    assertEquals(1, mqtt.getUserProperties().size());
    assertEquals("error", mqtt.getUserProperties().get(0).getKey());
    assertEquals("None", mqtt.getUserProperties().get(0).getValue());
    assertEquals(properties, PahoMqttTransport.toProperties(mqtt));
  }

  @Test
  void absentPropertiesMapToEmpty() {
    assertSame(MessageProperties.EMPTY, PahoMqttTransport.toProperties(null));
    assertSame(MessageProperties.EMPTY, PahoMqttTransport.toProperties(new MqttProperties()));

    MqttProperties mqtt = PahoMqttTransport.toMqttProperties(MessageProperties.EMPTY);
    assertNull(mqtt.getResponseTopic());
    assertTrue(mqtt.getUserProperties().isEmpty());
  }
}
