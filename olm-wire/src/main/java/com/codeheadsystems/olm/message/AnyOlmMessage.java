package com.codeheadsystems.olm.message;

import com.codeheadsystems.olm.model.MessageType;

/**
 * Either kind of Olm message, as carried by a transport next to its numeric type.
 *
 * @param messageType the kind of message
 * @param normal      set when the type is {@link MessageType#NORMAL}
 * @param preKey      set when the type is {@link MessageType#PRE_KEY}
 */
public record AnyOlmMessage(MessageType messageType, OlmMessage normal, PreKeyMessage preKey) {

  /**
   * Checks that exactly the message matching the type is present.
   */
  public AnyOlmMessage {
    if (messageType == null) {
      throw new IllegalArgumentException("Message type is required");
    }
    boolean consistent = switch (messageType) {
      case NORMAL -> normal != null && preKey == null;
      case PRE_KEY -> preKey != null && normal == null;
    };
    if (!consistent) {
      throw new IllegalArgumentException("Message content does not match type " + messageType);
    }
  }

  public static AnyOlmMessage normal(OlmMessage message) {
    return new AnyOlmMessage(MessageType.NORMAL, message, null);
  }

  public static AnyOlmMessage preKey(PreKeyMessage message) {
    return new AnyOlmMessage(MessageType.PRE_KEY, null, message);
  }

  /**
   * Rebuilds a message from its transport form. The body is wrapped, not decoded.
   *
   * @param messageType the numeric type, 0 for pre-key and 1 for normal
   * @param base64Body  the unpadded base64 body
   * @return the any olm message
   * @throws IllegalArgumentException for an unknown type or a body that is not base64
   */
  public static AnyOlmMessage fromParts(int messageType, String base64Body) {
    return switch (MessageType.fromValue(messageType)) {
      case NORMAL -> normal(OlmMessage.fromBase64(base64Body));
      case PRE_KEY -> preKey(PreKeyMessage.fromBase64(base64Body));
    };
  }

  /**
   * Splits the message into its transport form.
   *
   * @return the parts
   */
  public Parts toParts() {
    return new Parts(messageType.value(), switch (messageType) {
      case NORMAL -> normal.toBase64();
      case PRE_KEY -> preKey.toBase64();
    });
  }

  public byte[] toBytes() {
    return switch (messageType) {
      case NORMAL -> normal.toBytes();
      case PRE_KEY -> preKey.toBytes();
    };
  }

  /**
   * Transport form of a message.
   *
   * @param messageType the numeric type
   * @param body        the unpadded base64 body
   */
  public record Parts(int messageType, String body) {
  }
}
