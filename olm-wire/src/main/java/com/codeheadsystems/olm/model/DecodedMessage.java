package com.codeheadsystems.olm.model;

import java.util.Arrays;

/**
 * Fields of a decoded normal message. The MAC is carried as received; verifying it is up to the ratchet layer.
 *
 * @param ratchetKey the sender's ratchet public key
 * @param chainIndex the chain index, unsigned
 * @param ciphertext the ciphertext
 * @param mac        the truncated MAC from the end of the message
 */
public record DecodedMessage(Curve25519PublicKey ratchetKey, long chainIndex, byte[] ciphertext, byte[] mac) {

  /**
   * Takes private copies of the arrays.
   */
  public DecodedMessage {
    ciphertext = ciphertext.clone();
    mac = mac.clone();
  }

  @Override
  public byte[] ciphertext() {
    return ciphertext.clone();
  }

  @Override
  public byte[] mac() {
    return mac.clone();
  }

  /**
   * Checks the received tag against one the caller computed, in constant time.
   *
   * @param expectedMac the truncated MAC computed over the payload bytes
   * @return true if they are equal
   */
  public boolean macMatches(byte[] expectedMac) {
    return org.bouncycastle.util.Arrays.constantTimeAreEqual(mac, expectedMac);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DecodedMessage other
        && ratchetKey.equals(other.ratchetKey)
        && chainIndex == other.chainIndex
        && Arrays.equals(ciphertext, other.ciphertext)
        && Arrays.equals(mac, other.mac);
  }

  @Override
  public int hashCode() {
    int result = ratchetKey.hashCode();
    result = 31 * result + Long.hashCode(chainIndex);
    result = 31 * result + Arrays.hashCode(ciphertext);
    result = 31 * result + Arrays.hashCode(mac);
    return result;
  }

  @Override
  public String toString() {
    return "DecodedMessage[ratchetKey=" + ratchetKey + ", chainIndex=" + Long.toUnsignedString(chainIndex)
        + ", ciphertextLength=" + ciphertext.length + "]";
  }
}
