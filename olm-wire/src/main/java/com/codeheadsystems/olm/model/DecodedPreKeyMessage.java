package com.codeheadsystems.olm.model;

import com.codeheadsystems.olm.message.OlmMessage;
import java.util.Arrays;

/**
 * Fields of a decoded pre-key message. The embedded normal message is left undecoded.
 *
 * @param oneTimeKey  the one-time key of the recipient that the sender used
 * @param baseKey     the sender's base key
 * @param identityKey the sender's identity key
 * @param message     raw bytes of the embedded normal message
 */
public record DecodedPreKeyMessage(Curve25519PublicKey oneTimeKey, Curve25519PublicKey baseKey,
                                   Curve25519PublicKey identityKey, byte[] message) {

  public DecodedPreKeyMessage {
    message = message.clone();
  }

  @Override
  public byte[] message() {
    return message.clone();
  }

  /**
   * Wraps the embedded bytes for a second decode step, without validating them.
   *
   * @return the olm message
   */
  public OlmMessage olmMessage() {
    return OlmMessage.fromBytes(message);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DecodedPreKeyMessage other
        && oneTimeKey.equals(other.oneTimeKey)
        && baseKey.equals(other.baseKey)
        && identityKey.equals(other.identityKey)
        && Arrays.equals(message, other.message);
  }

  @Override
  public int hashCode() {
    int result = oneTimeKey.hashCode();
    result = 31 * result + baseKey.hashCode();
    result = 31 * result + identityKey.hashCode();
    result = 31 * result + Arrays.hashCode(message);
    return result;
  }

  @Override
  public String toString() {
    return "DecodedPreKeyMessage[oneTimeKey=" + oneTimeKey + ", baseKey=" + baseKey
        + ", identityKey=" + identityKey + ", messageLength=" + message.length + "]";
  }
}
