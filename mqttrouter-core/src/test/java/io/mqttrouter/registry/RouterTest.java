package io.mqttrouter.registry;

import io.mqttrouter.Outbound;
import io.mqttrouter.QoS;
import io.mqttrouter.codec.Codecs;
import io.mqttrouter.topic.InvalidTopicException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RouterTest {

  @Test
  void prefixIsAppliedToRoutes() {
    Router sensors = new Router("sensors")
        .route("{id}/temperature", Codecs.DOUBLE, message -> Outbound.none());
    Route<?> route = sensors.routes().get(0);
    assertEquals("sensors/{id}/temperature", route.filter().pattern());
    assertEquals(Route.DEFAULT_QOS, route.qos());
  }

  @Test
  void nestedRoutersStackPrefixes() {
    Router devices = new Router("devices")
        .route("{id}/status", Codecs.STRING, QoS.AT_LEAST_ONCE, message -> Outbound.none());
    Router site = new Router("site/{site}")
        .route("alerts/#", Codecs.STRING, message -> Outbound.none())
        .include(devices);

    List<Route<?>> routes = site.routes();
    assertEquals(2, routes.size());
    assertEquals("site/{site}/alerts/#", routes.get(0).filter().pattern());
    assertEquals("site/{site}/devices/{id}/status", routes.get(1).filter().pattern());
    assertEquals(QoS.AT_LEAST_ONCE, routes.get(1).qos());
  }

  @Test
  void routerWithoutPrefixKeepsFilters() {
    Router router = new Router().route("a/b", Codecs.STRING, message -> Outbound.none());
    assertEquals("a/b", router.routes().get(0).filter().pattern());
  }

  @Test
  void invalidFiltersFailAtDeclaration() {
    Router router = new Router("x");
    assertThrows(InvalidTopicException.class,
        () -> router.route("a/#/b", Codecs.STRING, message -> Outbound.none()));
    assertThrows(InvalidTopicException.class, () -> new Router("a/#/b"));
  }

  @Test
  void routerCannotIncludeItself() {
    Router router = new Router("x");
    assertThrows(IllegalArgumentException.class, () -> router.include(router));
  }

  @Test
  void includeCyclesAreRejected() {
    Router a = new Router("a");
    Router b = new Router("b");
    Router c = new Router("c").route("x", Codecs.STRING, message -> Outbound.none());
    a.include(b);
    b.include(c);

    assertThrows(IllegalArgumentException.class, () -> b.include(a));
    assertThrows(IllegalArgumentException.class, () -> c.include(a));
    assertEquals(List.of("a/b/c/x"), patterns(a));
  }

  @Test
  void sharedGroupMayBeIncludedTwice() {
    Router shared = new Router("s").route("x", Codecs.STRING, message -> Outbound.none());
    Router left = new Router("l").include(shared);
    Router root = new Router().include(left).include(shared);

    assertEquals(List.of("l/s/x", "s/x"), patterns(root));
  }

  private static List<String> patterns(Router router) {
    return router.routes().stream().map(route -> route.filter().pattern()).toList();
  }
}
