package com.codeheadsystems.olm.message.internal;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.WireFormat;
import java.io.IOException;
import java.util.Arrays;

/**
 * Body of a normal message.
 * Schema: 1 = ratchet key (bytes), 2 = chain index (uint64), 4 = ciphertext (bytes). Field 3 is reserved.
 * <p>
 * {@link #serialize()} follows protobuf rules and drops a zero chain index, which legacy decoders reject, so
 * outgoing normal messages are assembled by hand in {@code OlmMessage} and this type is used to read them.
 */
public record InnerMessage(byte[] ratchetKey, long chainIndex, byte[] ciphertext) {

  public static final int RATCHET_KEY_FIELD = 1;
  public static final int CHAIN_INDEX_FIELD = 2;
  public static final int CIPHERTEXT_FIELD = 4;

  /**
   * Parses a body. The last occurrence of a field wins, unknown fields are skipped and absent fields take their
   * default value.
   *
   * @param bytes  the buffer
   * @param offset where the body starts
   * @param length body length
   * @return the inner message
   * @throws InvalidProtocolBufferException if the body is not well formed
   */
  public static InnerMessage deserialize(byte[] bytes, int offset, int length)
      throws InvalidProtocolBufferException {
    CodedInputStream input = WireFields.newInput(bytes, offset, length);
    byte[] ratchetKey = new byte[0];
    long chainIndex = 0;
    byte[] ciphertext = new byte[0];

    int tag;
    while ((tag = WireFields.readTag(input)) != 0) {
      switch (WireFormat.getTagFieldNumber(tag)) {
        case RATCHET_KEY_FIELD -> ratchetKey = WireFields.readBytes(input, tag);
        case CHAIN_INDEX_FIELD -> chainIndex = WireFields.readUInt64(input, tag);
        case CIPHERTEXT_FIELD -> ciphertext = WireFields.readBytes(input, tag);
        default -> WireFields.skip(input, tag);
      }
    }
    return new InnerMessage(ratchetKey, chainIndex, ciphertext);
  }

  /**
   * Parses a whole buffer as a body.
   *
   * @param bytes the bytes
   * @return the inner message
   * @throws InvalidProtocolBufferException if the body is not well formed
   */
  public static InnerMessage deserialize(byte[] bytes) throws InvalidProtocolBufferException {
    return deserialize(bytes, 0, bytes.length);
  }

  /**
   * Size of {@link #serialize()}.
   *
   * @return the int
   */
  public int serializedSize() {
    int size = 0;
    if (ratchetKey.length > 0) {
      size += CodedOutputStream.computeByteArraySize(RATCHET_KEY_FIELD, ratchetKey);
    }
    if (chainIndex != 0) {
      size += CodedOutputStream.computeUInt64Size(CHAIN_INDEX_FIELD, chainIndex);
    }
    if (ciphertext.length > 0) {
      size += CodedOutputStream.computeByteArraySize(CIPHERTEXT_FIELD, ciphertext);
    }
    return size;
  }

  /**
   * Serializes non-default fields in ascending field order.
   *
   * @return the byte [ ]
   */
  public byte[] serialize() {
    byte[] out = new byte[serializedSize()];
    CodedOutputStream output = CodedOutputStream.newInstance(out);
    try {
      if (ratchetKey.length > 0) {
        output.writeByteArray(RATCHET_KEY_FIELD, ratchetKey);
      }
      if (chainIndex != 0) {
        output.writeUInt64(CHAIN_INDEX_FIELD, chainIndex);
      }
      if (ciphertext.length > 0) {
        output.writeByteArray(CIPHERTEXT_FIELD, ciphertext);
      }
      output.checkNoSpaceLeft();
    } catch (IOException e) {
      throw new IllegalStateException("Couldn't encode the message body", e);
    }
    return out;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof InnerMessage other
        && Arrays.equals(ratchetKey, other.ratchetKey)
        && chainIndex == other.chainIndex
        && Arrays.equals(ciphertext, other.ciphertext);
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(ratchetKey);
    result = 31 * result + Long.hashCode(chainIndex);
    result = 31 * result + Arrays.hashCode(ciphertext);
    return result;
  }

  @Override
  public String toString() {
    return "InnerMessage[ratchetKeyLength=" + ratchetKey.length + ", chainIndex="
        + Long.toUnsignedString(chainIndex) + ", ciphertextLength=" + ciphertext.length + "]";
  }
}
