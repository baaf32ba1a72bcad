package io.mqttrouter.spring.boot;

import io.mqttrouter.MqttRouter;
import io.mqttrouter.dispatch.DispatcherState;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the router with the application context and stops it, draining in-flight
 * handlers, on shutdown.
 */
public class MqttRouterLifecycle implements SmartLifecycle {

  private final MqttRouter router;
  private final boolean autoStartup;

  public MqttRouterLifecycle(MqttRouter router, boolean autoStartup) {
    this.router = router;
    this.autoStartup = autoStartup;
  }

  @Override
  public void start() {
    if (router.state() == DispatcherState.IDLE) {
      router.start();
    }
  }

  @Override
  public void stop() {
    router.stop();
  }

  @Override
  public boolean isRunning() {
    return router.state() == DispatcherState.RUNNING;
  }

  @Override
  public boolean isAutoStartup() {
    return autoStartup;
  }
}
