package com.codeheadsystems.olm.message;

import com.codeheadsystems.olm.common.ByteUtils;
import com.codeheadsystems.olm.common.VarInt;
import com.codeheadsystems.olm.exception.DecodeException;
import com.codeheadsystems.olm.message.internal.InnerMessage;
import com.codeheadsystems.olm.model.Curve25519PublicKey;
import com.codeheadsystems.olm.model.DecodedMessage;
import com.codeheadsystems.olm.model.Mac;
import com.google.protobuf.InvalidProtocolBufferException;
import java.util.Arrays;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A normal Olm message.
 * Wire format: version(1) || 0x0A len ratchetKey || 0x10 varint(chainIndex) || 0x22 len ciphertext || mac(8)
 * <p>
 * Built messages start with a zeroed MAC. The ratchet layer computes the MAC over {@link #payloadBytes()} and
 * writes it once with {@link #appendMac(Mac)}; after that the buffer never changes.
 */
public final class OlmMessage {

  private static final Logger log = LoggerFactory.getLogger(OlmMessage.class);

  /**
   * Protocol version, shared with pre-key messages.
   */
  public static final byte VERSION = 3;

  /**
   * Field 1, length-delimited.
   */
  static final byte RATCHET_TAG = 0x0A;
  /**
   * Field 2, varint.
   */
  static final byte INDEX_TAG = 0x10;
  /**
   * Field 4, length-delimited.
   */
  static final byte CIPHER_TAG = 0x22;

  /**
   * Shortest buffer that decode will look at: version, MAC and one tag/length pair.
   */
  public static final int MIN_LENGTH = Mac.TRUNCATED_LENGTH + 2;

  private final byte[] inner;
  private boolean macWritten;

  private OlmMessage(byte[] inner, boolean macWritten) {
    this.inner = inner;
    this.macWritten = macWritten;
  }

  /**
   * Builds a message with a zeroed MAC placeholder.
   *
   * @param ratchetKey the sender's current ratchet key
   * @param chainIndex the chain index, unsigned
   * @param ciphertext the ciphertext
   * @return the olm message
   */
  public static OlmMessage fromParts(Curve25519PublicKey ratchetKey, long chainIndex, byte[] ciphertext) {
    return fromPartsUntyped(ratchetKey.toBytes(), chainIndex, ciphertext);
  }

  /**
   * Assembles the bytes directly instead of going through {@link InnerMessage#serialize()}, which would drop a
   * zero chain index.
   */
  static OlmMessage fromPartsUntyped(byte[] ratchetKey, long chainIndex, byte[] ciphertext) {
    byte[] message = ByteUtils.concat(
        new byte[]{VERSION},
        new byte[]{RATCHET_TAG},
        VarInt.encode(ratchetKey.length),
        ratchetKey,
        new byte[]{INDEX_TAG},
        VarInt.encode(chainIndex),
        new byte[]{CIPHER_TAG},
        VarInt.encode(ciphertext.length),
        ciphertext,
        new byte[Mac.TRUNCATED_LENGTH]
    );
    return new OlmMessage(message, false);
  }

  /**
   * Wraps bytes received from a transport. Nothing is validated until {@link #decode()}. The MAC of a wrapped
   * message is considered written.
   *
   * @param bytes the bytes
   * @return the olm message
   */
  public static OlmMessage fromBytes(byte[] bytes) {
    return new OlmMessage(bytes.clone(), true);
  }

  /**
   * Wraps the unpadded base64 form of a message.
   *
   * @param base64 the base 64
   * @return the olm message
   * @throws IllegalArgumentException if the input is not base64
   */
  public static OlmMessage fromBase64(String base64) {
    return new OlmMessage(Base64.getDecoder().decode(base64), true);
  }

  /**
   * Everything except the trailing MAC: the input of the MAC computation.
   *
   * @return the byte [ ]
   * @throws IllegalStateException if the buffer is shorter than a MAC
   */
  public byte[] payloadBytes() {
    if (inner.length < Mac.TRUNCATED_LENGTH) {
      throw new IllegalStateException("Message is shorter than its MAC: " + inner.length + " bytes");
    }
    return Arrays.copyOf(inner, inner.length - Mac.TRUNCATED_LENGTH);
  }

  /**
   * Truncates the MAC and writes it over the placeholder. The length of the message does not change.
   *
   * @param mac the MAC computed over {@link #payloadBytes()}
   * @throws IllegalStateException if a MAC was already written
   */
  public void appendMac(Mac mac) {
    appendMacBytes(mac.truncate());
  }

  void appendMacBytes(byte[] truncatedMac) {
    if (truncatedMac.length != Mac.TRUNCATED_LENGTH) {
      throw new IllegalArgumentException("Truncated MAC must be " + Mac.TRUNCATED_LENGTH + " bytes, got "
          + truncatedMac.length);
    }
    if (macWritten) {
      throw new IllegalStateException("The message MAC has already been written");
    }
    System.arraycopy(truncatedMac, 0, inner, inner.length - Mac.TRUNCATED_LENGTH, Mac.TRUNCATED_LENGTH);
    macWritten = true;
  }

  public boolean hasMac() {
    return macWritten;
  }

  /**
   * Validates and parses the message. The MAC is returned as found, not verified.
   *
   * @return the decoded message
   * @throws DecodeException if the message is not a valid normal message
   */
  public DecodedMessage decode() {
    log.trace("decode(length={})", inner.length);
    if (inner.length == 0) {
      throw reject(DecodeException.missingVersion());
    }
    int version = inner[0] & 0xFF;
    if (version != VERSION) {
      throw reject(DecodeException.invalidVersion(VERSION, version));
    }
    if (inner.length < MIN_LENGTH) {
      throw reject(DecodeException.messageTooShort(inner.length));
    }

    int macOffset = inner.length - Mac.TRUNCATED_LENGTH;
    InnerMessage body;
    try {
      body = InnerMessage.deserialize(inner, 1, macOffset - 1);
    } catch (InvalidProtocolBufferException e) {
      throw reject(DecodeException.malformedPayload(e));
    }

    if (body.ratchetKey().length != Curve25519PublicKey.KEY_LENGTH) {
      throw reject(DecodeException.invalidKeyLength(Curve25519PublicKey.KEY_LENGTH, body.ratchetKey().length));
    }
    byte[] mac = ByteUtils.slice(inner, macOffset, inner.length - macOffset);
    if (mac.length != Mac.TRUNCATED_LENGTH) {
      throw reject(DecodeException.invalidMacLength(Mac.TRUNCATED_LENGTH, mac.length));
    }

    return new DecodedMessage(Curve25519PublicKey.fromBytes(body.ratchetKey()), body.chainIndex(),
        body.ciphertext(), mac);
  }

  private static DecodeException reject(DecodeException e) {
    log.debug("Rejected normal message: {}", e.getMessage());
    return e;
  }

  /**
   * The version byte, or -1 for an empty buffer.
   *
   * @return the int
   */
  public int version() {
    return inner.length == 0 ? -1 : inner[0] & 0xFF;
  }

  public int length() {
    return inner.length;
  }

  public byte[] toBytes() {
    return inner.clone();
  }

  public String toBase64() {
    return Base64.getEncoder().withoutPadding().encodeToString(inner);
  }

  /**
   * Two messages are equal when their current bytes are equal, MAC included. A built message therefore stops being
   * equal to its unsealed twin once {@link #appendMac(Mac)} runs.
   */
  @Override
  public boolean equals(Object o) {
    return o instanceof OlmMessage other && Arrays.equals(inner, other.inner);
  }

  /**
   * Hashes only the bytes in front of the MAC slot, which {@link #appendMac(Mac)} never writes, so the hash of a
   * message held in a hash collection survives the MAC write.
   */
  @Override
  public int hashCode() {
    int end = Math.max(0, inner.length - Mac.TRUNCATED_LENGTH);
    int result = 1;
    for (int i = 0; i < end; i++) {
      result = 31 * result + inner[i];
    }
    return 31 * result + inner.length;
  }

  @Override
  public String toString() {
    return "OlmMessage[length=" + inner.length + ", hasMac=" + macWritten + "]";
  }
}
