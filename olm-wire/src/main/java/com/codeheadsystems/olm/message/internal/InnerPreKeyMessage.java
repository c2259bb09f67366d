package com.codeheadsystems.olm.message.internal;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.WireFormat;
import java.io.IOException;
import java.util.Arrays;

/**
 * Body of a pre-key message.
 * Schema: 1 = one-time key, 2 = base key, 3 = identity key, 4 = embedded normal message (all bytes).
 */
public record InnerPreKeyMessage(byte[] oneTimeKey, byte[] baseKey, byte[] identityKey, byte[] message) {

  public static final int ONE_TIME_KEY_FIELD = 1;
  public static final int BASE_KEY_FIELD = 2;
  public static final int IDENTITY_KEY_FIELD = 3;
  public static final int MESSAGE_FIELD = 4;

  /**
   * Parses a body. The last occurrence of a field wins, unknown fields are skipped and absent fields are empty.
   *
   * @param bytes  the buffer
   * @param offset where the body starts
   * @param length body length
   * @return the inner pre key message
   * @throws InvalidProtocolBufferException if the body is not well formed
   */
  public static InnerPreKeyMessage deserialize(byte[] bytes, int offset, int length)
      throws InvalidProtocolBufferException {
    CodedInputStream input = WireFields.newInput(bytes, offset, length);
    byte[] oneTimeKey = new byte[0];
    byte[] baseKey = new byte[0];
    byte[] identityKey = new byte[0];
    byte[] message = new byte[0];

    int tag;
    while ((tag = WireFields.readTag(input)) != 0) {
      switch (WireFormat.getTagFieldNumber(tag)) {
        case ONE_TIME_KEY_FIELD -> oneTimeKey = WireFields.readBytes(input, tag);
        case BASE_KEY_FIELD -> baseKey = WireFields.readBytes(input, tag);
        case IDENTITY_KEY_FIELD -> identityKey = WireFields.readBytes(input, tag);
        case MESSAGE_FIELD -> message = WireFields.readBytes(input, tag);
        default -> WireFields.skip(input, tag);
      }
    }
    return new InnerPreKeyMessage(oneTimeKey, baseKey, identityKey, message);
  }

  /**
   * Parses a whole buffer as a body.
   *
   * @param bytes the bytes
   * @return the inner pre key message
   * @throws InvalidProtocolBufferException if the body is not well formed
   */
  public static InnerPreKeyMessage deserialize(byte[] bytes) throws InvalidProtocolBufferException {
    return deserialize(bytes, 0, bytes.length);
  }

  /**
   * Size of {@link #serialize()}.
   *
   * @return the int
   */
  public int serializedSize() {
    return fieldSize(ONE_TIME_KEY_FIELD, oneTimeKey)
        + fieldSize(BASE_KEY_FIELD, baseKey)
        + fieldSize(IDENTITY_KEY_FIELD, identityKey)
        + fieldSize(MESSAGE_FIELD, message);
  }

  /**
   * Serializes non-empty fields in ascending field order.
   *
   * @return the byte [ ]
   */
  public byte[] serialize() {
    byte[] out = new byte[serializedSize()];
    serializeInto(out, 0);
    return out;
  }

  /**
   * Serializes into {@code out} starting at {@code offset}; exactly {@link #serializedSize()} bytes must be free.
   *
   * @param out    the destination
   * @param offset where to start writing
   */
  public void serializeInto(byte[] out, int offset) {
    CodedOutputStream output = CodedOutputStream.newInstance(out, offset, serializedSize());
    try {
      writeField(output, ONE_TIME_KEY_FIELD, oneTimeKey);
      writeField(output, BASE_KEY_FIELD, baseKey);
      writeField(output, IDENTITY_KEY_FIELD, identityKey);
      writeField(output, MESSAGE_FIELD, message);
      output.checkNoSpaceLeft();
    } catch (IOException e) {
      throw new IllegalStateException("Couldn't encode the pre-key message body", e);
    }
  }

  private static int fieldSize(int field, byte[] value) {
    return value.length == 0 ? 0 : CodedOutputStream.computeByteArraySize(field, value);
  }

  private static void writeField(CodedOutputStream output, int field, byte[] value) throws IOException {
    if (value.length > 0) {
      output.writeByteArray(field, value);
    }
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof InnerPreKeyMessage other
        && Arrays.equals(oneTimeKey, other.oneTimeKey)
        && Arrays.equals(baseKey, other.baseKey)
        && Arrays.equals(identityKey, other.identityKey)
        && Arrays.equals(message, other.message);
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(oneTimeKey);
    result = 31 * result + Arrays.hashCode(baseKey);
    result = 31 * result + Arrays.hashCode(identityKey);
    result = 31 * result + Arrays.hashCode(message);
    return result;
  }

  @Override
  public String toString() {
    return "InnerPreKeyMessage[oneTimeKeyLength=" + oneTimeKey.length + ", baseKeyLength=" + baseKey.length
        + ", identityKeyLength=" + identityKey.length + ", messageLength=" + message.length + "]";
  }
}
