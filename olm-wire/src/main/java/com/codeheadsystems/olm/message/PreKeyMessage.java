package com.codeheadsystems.olm.message;

import com.codeheadsystems.olm.exception.DecodeException;
import com.codeheadsystems.olm.message.internal.InnerPreKeyMessage;
import com.codeheadsystems.olm.model.Curve25519PublicKey;
import com.codeheadsystems.olm.model.DecodedPreKeyMessage;
import com.google.protobuf.InvalidProtocolBufferException;
import java.util.Arrays;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The first message of a session.
 * Wire format: version(1) || oneTimeKey(field 1) || baseKey(field 2) || identityKey(field 3) || message(field 4)
 * <p>
 * There is no MAC here; the embedded normal message carries its own.
 */
public final class PreKeyMessage {

  private static final Logger log = LoggerFactory.getLogger(PreKeyMessage.class);

  public static final byte VERSION = OlmMessage.VERSION;

  private final byte[] inner;

  private PreKeyMessage(byte[] inner) {
    this.inner = inner;
  }

  /**
   * Builds a pre-key message around the bytes of an already MAC'd normal message.
   *
   * @param oneTimeKey  the recipient's one-time key
   * @param baseKey     the sender's base key
   * @param identityKey the sender's identity key
   * @param message     the embedded message bytes
   * @return the pre key message
   */
  public static PreKeyMessage fromParts(Curve25519PublicKey oneTimeKey, Curve25519PublicKey baseKey,
                                        Curve25519PublicKey identityKey, byte[] message) {
    InnerPreKeyMessage body = new InnerPreKeyMessage(oneTimeKey.toBytes(), baseKey.toBytes(),
        identityKey.toBytes(), message.clone());
    byte[] out = new byte[body.serializedSize() + 1];
    out[0] = VERSION;
    body.serializeInto(out, 1);
    return new PreKeyMessage(out);
  }

  /**
   * Builds a pre-key message around a normal message.
   *
   * @param oneTimeKey  the recipient's one-time key
   * @param baseKey     the sender's base key
   * @param identityKey the sender's identity key
   * @param message     the embedded message, with its MAC written
   * @return the pre key message
   */
  public static PreKeyMessage fromParts(Curve25519PublicKey oneTimeKey, Curve25519PublicKey baseKey,
                                        Curve25519PublicKey identityKey, OlmMessage message) {
    return fromParts(oneTimeKey, baseKey, identityKey, message.toBytes());
  }

  /**
   * Wraps bytes received from a transport. Nothing is validated until {@link #decode()}.
   *
   * @param bytes the bytes
   * @return the pre key message
   */
  public static PreKeyMessage fromBytes(byte[] bytes) {
    return new PreKeyMessage(bytes.clone());
  }

  /**
   * Wraps the unpadded base64 form of a message.
   *
   * @param base64 the base 64
   * @return the pre key message
   * @throws IllegalArgumentException if the input is not base64
   */
  public static PreKeyMessage fromBase64(String base64) {
    return new PreKeyMessage(Base64.getDecoder().decode(base64));
  }

  /**
   * Validates and parses the message. The embedded message is returned as raw bytes; decode it with
   * {@link DecodedPreKeyMessage#olmMessage()} when the session layer is ready to.
   *
   * @return the decoded pre key message
   * @throws DecodeException if the message is not a valid pre-key message
   */
  public DecodedPreKeyMessage decode() {
    log.trace("decode(length={})", inner.length);
    if (inner.length == 0) {
      throw reject(DecodeException.missingVersion());
    }
    int version = inner[0] & 0xFF;
    if (version != VERSION) {
      throw reject(DecodeException.invalidVersion(VERSION, version));
    }

    InnerPreKeyMessage body;
    try {
      body = InnerPreKeyMessage.deserialize(inner, 1, inner.length - 1);
    } catch (InvalidProtocolBufferException e) {
      throw reject(DecodeException.malformedPayload(e));
    }

    requireKeyLength(body.oneTimeKey());
    requireKeyLength(body.baseKey());
    requireKeyLength(body.identityKey());

    return new DecodedPreKeyMessage(
        Curve25519PublicKey.fromBytes(body.oneTimeKey()),
        Curve25519PublicKey.fromBytes(body.baseKey()),
        Curve25519PublicKey.fromBytes(body.identityKey()),
        body.message());
  }

  private static void requireKeyLength(byte[] key) {
    if (key.length != Curve25519PublicKey.KEY_LENGTH) {
      throw reject(DecodeException.invalidKeyLength(Curve25519PublicKey.KEY_LENGTH, key.length));
    }
  }

  private static DecodeException reject(DecodeException e) {
    log.debug("Rejected pre-key message: {}", e.getMessage());
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

  @Override
  public boolean equals(Object o) {
    return o instanceof PreKeyMessage other && Arrays.equals(inner, other.inner);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(inner);
  }

  @Override
  public String toString() {
    return "PreKeyMessage[length=" + inner.length + "]";
  }
}
