package io.mqttrouter;

/**
 * MQTT delivery guarantee levels.
 */
public enum QoS {
  AT_MOST_ONCE(0),
  AT_LEAST_ONCE(1),
  EXACTLY_ONCE(2);

  private final int value;

  QoS(int value) {
    this.value = value;
  }

  /** The numeric level as used on the wire. */
  public int value() {
    return value;
  }

  /**
   * Resolves a numeric QoS level.
   *
   * @param value 0, 1 or 2
   * @return the matching constant
   * @throws IllegalArgumentException for any other value
   */
  public static QoS of(int value) {
    for (QoS qos : values()) {
      if (qos.value == value) {
        return qos;
      }
    }
    throw new IllegalArgumentException("Invalid QoS: " + value);
  }

  /** Returns the higher of two levels. */
  public static QoS max(QoS a, QoS b) {
    return a.value >= b.value ? a : b;
  }
}
