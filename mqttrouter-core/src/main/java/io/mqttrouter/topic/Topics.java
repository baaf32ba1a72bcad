package io.mqttrouter.topic;

/**
 * MQTT topic constants and validation helpers.
 */
public final class Topics {

  /** Separator between topic levels. */
  public static final String SEPARATOR = "/";

  /** Wildcard matching exactly one topic level. */
  public static final String SINGLE_LEVEL_WILDCARD = "+";

  /** Wildcard matching any number of trailing topic levels, including none. */
  public static final String MULTI_LEVEL_WILDCARD = "#";

  /** Prefix of broker-internal topics such as {@code $SYS/...}. */
  public static final String SYSTEM_PREFIX = "$";

  /** Capture name under which a multi-level wildcard match is extracted. */
  public static final String WILDCARD_PARAMETER = "wildcard";

  private Topics() {
  }

  /**
   * Validates a concrete topic as used for publishing: non-empty, no wildcards, no NUL.
   *
   * @param topic the topic to validate
   * @return the topic, unchanged
   * @throws InvalidTopicException if the topic is not a valid publish topic
   */
  public static String requireValidTopic(String topic) {
    if (topic == null || topic.isEmpty()) {
      throw new InvalidTopicException("Topic must not be empty");
    }
    if (topic.contains(SINGLE_LEVEL_WILDCARD) || topic.contains(MULTI_LEVEL_WILDCARD)) {
      throw new InvalidTopicException("Topic must not contain wildcards: " + topic);
    }
    if (topic.indexOf('\0') >= 0) {
      throw new InvalidTopicException("Topic must not contain NUL characters");
    }
    return topic;
  }

  /**
   * Joins a prefix and a topic pattern with a single separator. Leading and trailing
   * separators of the prefix are not doubled; an empty prefix returns the pattern.
   */
  public static String join(String prefix, String pattern) {
    if (prefix == null || prefix.isEmpty()) {
      return pattern;
    }
    String head = prefix.endsWith(SEPARATOR) ? prefix.substring(0, prefix.length() - 1) : prefix;
    return head + SEPARATOR + pattern;
  }

  static String[] levels(String topic) {
    return topic.split(SEPARATOR, -1);
  }
}
