package io.mqttrouter.paho;

import io.mqttrouter.RawMessage;
import io.mqttrouter.spi.MessageSource;
import io.mqttrouter.spi.Subscription;

import java.util.List;

/**
 * {@link MessageSource} view of a {@link PahoMqttTransport}. Opening connects and
 * subscribes; closing unsubscribes but leaves the connection to the transport.
 */
final class PahoMessageSource implements MessageSource {
  private final PahoMqttTransport transport;

  PahoMessageSource(PahoMqttTransport transport) {
    this.transport = transport;
  }

  @Override
  public void open(List<Subscription> subscriptions) {
    transport.connect();
    transport.subscribe(subscriptions);
  }

  @Override
  public RawMessage next() throws InterruptedException {
    return transport.take();
  }

  @Override
  public void close() {
    transport.unsubscribe();
  }
}
