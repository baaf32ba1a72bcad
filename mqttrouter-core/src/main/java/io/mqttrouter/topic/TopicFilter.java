package io.mqttrouter.topic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable MQTT topic filter.
 *
 * <p>A filter is a {@code /}-separated sequence of segments. Each segment is either a
 * literal, a single-level wildcard ({@code +}, or a named parameter such as {@code {id}})
 * or the multi-level wildcard {@code #}, which may only appear as the last segment.
 *
 * <h2>Matching</h2>
 * <ul>
 *   <li>literal segments must equal the topic level exactly (case-sensitive)</li>
 *   <li>a single-level wildcard matches exactly one level, never a missing one</li>
 *   <li>{@code #} matches all remaining levels, including none ({@code a/#} matches {@code a})</li>
 *   <li>topics starting with {@code $} are only matched when the filter's first segment
 *       is that literal; wildcards in the first position never match them</li>
 * </ul>
 *
 * <p>Named parameters capture the matched level, see {@link #extract(String)}. Two filters
 * are equal when their {@linkplain #subscription() subscription forms} are equal, so
 * {@code a/{id}} and {@code a/+} denote the same filter.
 */
public final class TopicFilter {
  private static final Pattern PARAMETER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)}");

  /** Kind of a filter segment. */
  public enum SegmentKind {
    LITERAL,
    SINGLE_LEVEL,
    MULTI_LEVEL
  }

  /**
   * One filter segment.
   *
   * @param kind  the segment kind
   * @param value literal text for {@link SegmentKind#LITERAL}, parameter name for a named
   *              single-level wildcard, {@code null} otherwise
   */
  public record Segment(SegmentKind kind, String value) {
    public Segment {
      Objects.requireNonNull(kind, "kind");
    }
  }

  private final String pattern;
  private final List<Segment> segments;
  private final String subscription;

  private TopicFilter(String pattern, List<Segment> segments) {
    this.pattern = pattern;
    this.segments = Collections.unmodifiableList(segments);
    this.subscription = render(segments);
  }

  /**
   * Parses a topic filter.
   *
   * @param pattern the filter text, e.g. {@code sensors/{id}/temperature} or {@code alerts/#}
   * @return the parsed filter
   * @throws InvalidTopicException if the pattern is empty or malformed
   */
  public static TopicFilter of(String pattern) {
    if (pattern == null || pattern.isEmpty()) {
      throw new InvalidTopicException("Invalid topic filter; topic filter cannot be empty");
    }
    if (pattern.indexOf('\0') >= 0) {
      throw new InvalidTopicException("Invalid topic filter; NUL character in " + pattern);
    }
    String[] parts = Topics.levels(pattern);
    List<Segment> segments = new ArrayList<>(parts.length);
    Set<String> names = new HashSet<>();
    for (int i = 0; i < parts.length; i++) {
      String part = parts[i];
      if (part.equals(Topics.MULTI_LEVEL_WILDCARD)) {
        if (i != parts.length - 1) {
          throw new InvalidTopicException(
              "Invalid topic filter; multi-level wildcard must be the last segment in " + pattern);
        }
        segments.add(new Segment(SegmentKind.MULTI_LEVEL, null));
      } else if (part.contains(Topics.MULTI_LEVEL_WILDCARD)) {
        throw new InvalidTopicException(
            "Invalid topic filter; multi-level wildcard must occupy an entire segment in " + pattern);
      } else if (part.equals(Topics.SINGLE_LEVEL_WILDCARD)) {
        segments.add(new Segment(SegmentKind.SINGLE_LEVEL, null));
      } else if (part.contains(Topics.SINGLE_LEVEL_WILDCARD)) {
        throw new InvalidTopicException(
            "Invalid topic filter; single-level wildcard must occupy an entire segment in " + pattern);
      } else if (part.indexOf('{') >= 0 || part.indexOf('}') >= 0) {
        segments.add(parameter(part, pattern, names));
      } else {
        segments.add(new Segment(SegmentKind.LITERAL, part));
      }
    }
    return new TopicFilter(pattern, segments);
  }

  private static Segment parameter(String part, String pattern, Set<String> names) {
    Matcher matcher = PARAMETER.matcher(part);
    if (!matcher.matches()) {
      throw new InvalidTopicException(
          "Invalid topic filter; path parameters must occupy the entire segment (e.g. '{param}'): " + pattern);
    }
    String name = matcher.group(1);
    if (Topics.WILDCARD_PARAMETER.equals(name)) {
      throw new InvalidTopicException(
          "Invalid topic filter; path parameter name '" + name + "' is reserved: " + pattern);
    }
    if (!names.add(name)) {
      throw new InvalidTopicException(
          "Invalid topic filter; duplicate path parameter '" + name + "' in " + pattern);
    }
    return new Segment(SegmentKind.SINGLE_LEVEL, name);
  }

  /**
   * Returns whether the concrete {@code topic} matches this filter. Pure and deterministic.
   *
   * @param topic the published topic (no wildcards)
   * @return {@code true} on a match
   */
  public boolean matches(String topic) {
    Objects.requireNonNull(topic, "topic");
    return matchLevels(Topics.levels(topic));
  }

  /**
   * Extracts the named captures of a matching topic: every named single-level parameter
   * and, when the filter ends in {@code #}, the remaining levels under
   * {@value Topics#WILDCARD_PARAMETER} (empty when nothing remains).
   *
   * @param topic the published topic
   * @return immutable map of captures in filter order, empty when the filter names none
   * @throws IllegalArgumentException if the topic does not match this filter
   */
  public Map<String, String> extract(String topic) {
    Objects.requireNonNull(topic, "topic");
    String[] levels = Topics.levels(topic);
    if (!matchLevels(levels)) {
      throw new IllegalArgumentException("Topic " + topic + " does not match filter " + pattern);
    }
    Map<String, String> captures = new LinkedHashMap<>();
    for (int i = 0; i < segments.size(); i++) {
      Segment segment = segments.get(i);
      if (segment.kind() == SegmentKind.SINGLE_LEVEL && segment.value() != null) {
        captures.put(segment.value(), levels[i]);
      } else if (segment.kind() == SegmentKind.MULTI_LEVEL) {
        String rest = i < levels.length
            ? String.join(Topics.SEPARATOR, List.of(levels).subList(i, levels.length))
            : "";
        captures.put(Topics.WILDCARD_PARAMETER, rest);
      }
    }
    return captures.isEmpty() ? Map.of() : Collections.unmodifiableMap(captures);
  }

  private boolean matchLevels(String[] levels) {
    if (levels[0].startsWith(Topics.SYSTEM_PREFIX) && segments.get(0).kind() != SegmentKind.LITERAL) {
      return false;
    }
    int count = segments.size();
    for (int i = 0; i < count; i++) {
      Segment segment = segments.get(i);
      if (segment.kind() == SegmentKind.MULTI_LEVEL) {
        return true;
      }
      if (i >= levels.length) {
        return false;
      }
      if (segment.kind() == SegmentKind.LITERAL && !segment.value().equals(levels[i])) {
        return false;
      }
    }
    return count == levels.length;
  }

  /**
   * Returns a new filter with {@code prefix} prepended as leading segment(s).
   */
  public TopicFilter withPrefix(String prefix) {
    if (prefix == null || prefix.isEmpty()) {
      return this;
    }
    return of(Topics.join(prefix, pattern));
  }

  /** The filter as declared, including parameter names. */
  public String pattern() {
    return pattern;
  }

  public List<Segment> segments() {
    return segments;
  }

  /** The filter as sent to the broker: named parameters rendered as {@code +}. */
  public String subscription() {
    return subscription;
  }

  public boolean hasWildcards() {
    for (Segment segment : segments) {
      if (segment.kind() != SegmentKind.LITERAL) {
        return true;
      }
    }
    return false;
  }

  private static String render(List<Segment> segments) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < segments.size(); i++) {
      if (i > 0) {
        sb.append(Topics.SEPARATOR);
      }
      Segment segment = segments.get(i);
      switch (segment.kind()) {
        case LITERAL -> sb.append(segment.value());
        case SINGLE_LEVEL -> sb.append(Topics.SINGLE_LEVEL_WILDCARD);
        case MULTI_LEVEL -> sb.append(Topics.MULTI_LEVEL_WILDCARD);
      }
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TopicFilter other)) return false;
    return subscription.equals(other.subscription);
  }

  @Override
  public int hashCode() {
    return subscription.hashCode();
  }

  @Override
  public String toString() {
    return pattern;
  }
}
