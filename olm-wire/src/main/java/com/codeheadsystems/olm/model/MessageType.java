package com.codeheadsystems.olm.model;

/**
 * Numeric message type that Olm transports send next to the message body.
 */
public enum MessageType {
  PRE_KEY(0),
  NORMAL(1);

  private final int value;

  MessageType(int value) {
    this.value = value;
  }

  public int value() {
    return value;
  }

  /**
   * Returns the message type for the given transport value.
   *
   * @param value the value
   * @return the message type
   * @throws IllegalArgumentException for unknown values
   */
  public static MessageType fromValue(int value) {
    return switch (value) {
      case 0 -> PRE_KEY;
      case 1 -> NORMAL;
      default -> throw new IllegalArgumentException("Unknown Olm message type: " + value
          + ". Valid values: 0 (pre-key), 1 (normal)");
    };
  }
}
