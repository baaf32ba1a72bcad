package io.mqttrouter.topic;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TopicFilterTest {

  // ── Matching ────────────────────────────────────────────────────

  @Test
  void literalFilterMatchesOnlyExactTopic() {
    TopicFilter filter = TopicFilter.of("a/b");
    assertTrue(filter.matches("a/b"));
    assertFalse(filter.matches("a/b/c"));
    assertFalse(filter.matches("a"));
    assertFalse(filter.matches("A/b"));
  }

  @Test
  void singleLevelWildcardMatchesExactlyOneLevel() {
    TopicFilter filter = TopicFilter.of("a/+/c");
    assertTrue(filter.matches("a/b/c"));
    assertTrue(filter.matches("a/x/c"));
    assertFalse(filter.matches("a/b/x/c"));
    assertFalse(filter.matches("a/c"));
  }

  @Test
  void singleLevelWildcardMatchesEmptyLevel() {
    assertTrue(TopicFilter.of("a/+/c").matches("a//c"));
    assertTrue(TopicFilter.of("a/+").matches("a/"));
  }

  @Test
  void singleLevelWildcardDoesNotMatchMissingLevel() {
    assertFalse(TopicFilter.of("a/+").matches("a"));
  }

  @Test
  void multiLevelWildcardMatchesAnyRemainder() {
    TopicFilter filter = TopicFilter.of("a/#");
    assertTrue(filter.matches("a/b"));
    assertTrue(filter.matches("a/b/c"));
    assertTrue(filter.matches("a/b/c/d/e"));
    assertFalse(filter.matches("b/a"));
  }

  @Test
  void multiLevelWildcardMatchesParentLevel() {
    assertTrue(TopicFilter.of("a/#").matches("a"));
    assertTrue(TopicFilter.of("a/b/#").matches("a/b"));
    assertFalse(TopicFilter.of("a/b/#").matches("a"));
  }

  @Test
  void bareMultiLevelWildcardMatchesEverything() {
    TopicFilter filter = TopicFilter.of("#");
    assertTrue(filter.matches("a"));
    assertTrue(filter.matches("a/b/c"));
    assertTrue(filter.matches("/leading"));
  }

  @Test
  void systemTopicsAreNotMatchedByLeadingWildcards() {
    assertFalse(TopicFilter.of("#").matches("$SYS/broker/uptime"));
    assertFalse(TopicFilter.of("+/broker/uptime").matches("$SYS/broker/uptime"));
    assertFalse(TopicFilter.of("{root}/broker/uptime").matches("$SYS/broker/uptime"));
    assertTrue(TopicFilter.of("$SYS/#").matches("$SYS/broker/uptime"));
    assertTrue(TopicFilter.of("$SYS/+/uptime").matches("$SYS/broker/uptime"));
  }

  @Test
  void namedParameterMatchesLikeSingleLevelWildcard() {
    TopicFilter filter = TopicFilter.of("sensors/{id}/temperature");
    assertTrue(filter.matches("sensors/kitchen/temperature"));
    assertFalse(filter.matches("sensors/kitchen/humidity"));
    assertFalse(filter.matches("sensors/a/b/temperature"));
  }

  // ── Extraction ──────────────────────────────────────────────────

  @Test
  void extractReturnsNamedParametersInOrder() {
    TopicFilter filter = TopicFilter.of("sites/{site}/devices/{device}");
    Map<String, String> captures = filter.extract("sites/berlin/devices/pump-1");
    assertEquals(Map.of("site", "berlin", "device", "pump-1"), captures);
    assertEquals("site", captures.keySet().iterator().next());
  }

  @Test
  void extractCapturesMultiLevelRemainderAsWildcard() {
    TopicFilter filter = TopicFilter.of("logs/{service}/#");
    assertEquals(Map.of("service", "api", "wildcard", "eu/west/1"), filter.extract("logs/api/eu/west/1"));
    assertEquals(Map.of("service", "api", "wildcard", ""), filter.extract("logs/api"));
  }

  @Test
  void extractIgnoresAnonymousWildcards() {
    assertEquals(Map.of(), TopicFilter.of("a/+/c").extract("a/b/c"));
  }

  @Test
  void extractRejectsNonMatchingTopic() {
    TopicFilter filter = TopicFilter.of("a/{x}");
    assertThrows(IllegalArgumentException.class, () -> filter.extract("b/c"));
  }

  // ── Validation ──────────────────────────────────────────────────

  @Test
  void rejectsEmptyFilter() {
    assertThrows(InvalidTopicException.class, () -> TopicFilter.of(""));
    assertThrows(InvalidTopicException.class, () -> TopicFilter.of(null));
  }

  @Test
  void rejectsMultiLevelWildcardNotLast() {
    assertThrows(InvalidTopicException.class, () -> TopicFilter.of("a/#/c"));
  }

  @Test
  void rejectsPartialSegmentWildcards() {
    assertThrows(InvalidTopicException.class, () -> TopicFilter.of("a/b#"));
    assertThrows(InvalidTopicException.class, () -> TopicFilter.of("a/b+/c"));
  }

  @Test
  void rejectsMalformedParameters() {
    assertThrows(InvalidTopicException.class, () -> TopicFilter.of("a/pre{id}"));
    assertThrows(InvalidTopicException.class, () -> TopicFilter.of("a/{1id}"));
    assertThrows(InvalidTopicException.class, () -> TopicFilter.of("a/{id"));
  }

  @Test
  void rejectsDuplicateAndReservedParameterNames() {
    assertThrows(InvalidTopicException.class, () -> TopicFilter.of("{id}/{id}"));
    assertThrows(InvalidTopicException.class, () -> TopicFilter.of("a/{wildcard}"));
  }

  // ── Identity ────────────────────────────────────────────────────

  @Test
  void subscriptionRendersParametersAsSingleLevelWildcards() {
    assertEquals("sensors/+/temperature/#", TopicFilter.of("sensors/{id}/temperature/#").subscription());
  }

  @Test
  void filtersWithSameSubscriptionAreEqual() {
    assertEquals(TopicFilter.of("a/{x}"), TopicFilter.of("a/+"));
    assertEquals(TopicFilter.of("a/{x}").hashCode(), TopicFilter.of("a/{y}").hashCode());
    assertNotEquals(TopicFilter.of("a/+"), TopicFilter.of("a/#"));
  }

  @Test
  void withPrefixPrependsLevels() {
    TopicFilter filter = TopicFilter.of("{id}/temp").withPrefix("sensors/");
    assertEquals("sensors/{id}/temp", filter.pattern());
    assertTrue(filter.matches("sensors/1/temp"));
  }

  @Test
  void hasWildcardsDetectsAnyNonLiteralSegment() {
    assertFalse(TopicFilter.of("a/b").hasWildcards());
    assertTrue(TopicFilter.of("a/{b}").hasWildcards());
    assertTrue(TopicFilter.of("a/#").hasWildcards());
  }
}
