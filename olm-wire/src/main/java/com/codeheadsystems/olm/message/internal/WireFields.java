package com.codeheadsystems.olm.message.internal;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.WireFormat;
import java.io.IOException;

/**
 * Strict field reading for the hand-written schema readers.
 * <p>
 * Varints are read byte by byte and must fit in 64 bits: a tenth byte above {@code 0x01} or an eleventh byte is
 * malformed. Lengths are read as 64-bit values and must fit in what is left of the body. Tags must fit in 32 bits.
 * The lenient varint readers of {@link CodedInputStream} would instead drop the high bits.
 */
final class WireFields {

  private static final int MAX_VARINT_BYTES = 10;
  private static final long MAX_TAG = 0xFFFFFFFFL;

  private WireFields() {
  }

  /**
   * Opens a stream over {@code length} bytes of {@code bytes} with a limit, so the remaining size is known.
   */
  static CodedInputStream newInput(byte[] bytes, int offset, int length) throws InvalidProtocolBufferException {
    CodedInputStream input = CodedInputStream.newInstance(bytes, offset, length);
    input.pushLimit(length);
    return input;
  }

  /**
   * Reads the next tag, or 0 at the end of the buffer.
   */
  static int readTag(CodedInputStream input) throws InvalidProtocolBufferException {
    if (atEnd(input)) {
      return 0;
    }
    long key = readVarint64(input);
    if (Long.compareUnsigned(key, MAX_TAG) > 0) {
      throw new InvalidProtocolBufferException("Protocol message tag is wider than 32 bits: "
          + Long.toUnsignedString(key));
    }
    int tag = (int) key;
    if (WireFormat.getTagFieldNumber(tag) == 0) {
      throw new InvalidProtocolBufferException("Protocol message contained an invalid tag (zero).");
    }
    if (WireFormat.getTagWireType(tag) == WireFormat.WIRETYPE_END_GROUP) {
      throw new InvalidProtocolBufferException("Protocol message end-group tag did not match expected tag.");
    }
    return tag;
  }

  /**
   * Rejects a known field number that arrives with a different wire type than the schema declares.
   */
  static void requireWireType(int tag, int wireType) throws InvalidProtocolBufferException {
    if (WireFormat.getTagWireType(tag) != wireType) {
      throw new InvalidProtocolBufferException("Field " + WireFormat.getTagFieldNumber(tag)
          + " had invalid wire type " + WireFormat.getTagWireType(tag) + ", expected " + wireType);
    }
  }

  static byte[] readBytes(CodedInputStream input, int tag) throws InvalidProtocolBufferException {
    requireWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED);
    int length = readLength(input);
    try {
      return input.readRawBytes(length);
    } catch (InvalidProtocolBufferException e) {
      throw e;
    } catch (IOException e) {
      throw new InvalidProtocolBufferException(e);
    }
  }

  static long readUInt64(CodedInputStream input, int tag) throws InvalidProtocolBufferException {
    requireWireType(tag, WireFormat.WIRETYPE_VARINT);
    return readVarint64(input);
  }

  /**
   * Skips a field the schema does not know. Groups are skipped up to their matching end tag.
   */
  static void skip(CodedInputStream input, int tag) throws InvalidProtocolBufferException {
    switch (WireFormat.getTagWireType(tag)) {
      case WireFormat.WIRETYPE_VARINT -> readVarint64(input);
      case WireFormat.WIRETYPE_FIXED64 -> skipRaw(input, 8);
      case WireFormat.WIRETYPE_FIXED32 -> skipRaw(input, 4);
      case WireFormat.WIRETYPE_LENGTH_DELIMITED -> skipRaw(input, readLength(input));
      case WireFormat.WIRETYPE_START_GROUP -> skipGroup(input, WireFormat.getTagFieldNumber(tag));
      default -> throw new InvalidProtocolBufferException("Protocol message tag had invalid wire type "
          + WireFormat.getTagWireType(tag));
    }
  }

  /**
   * Reads an unsigned varint of at most 64 bits.
   */
  static long readVarint64(CodedInputStream input) throws InvalidProtocolBufferException {
    long result = 0;
    for (int i = 0; i < MAX_VARINT_BYTES; i++) {
      int b = readByte(input) & 0xFF;
      if (i == MAX_VARINT_BYTES - 1 && b > 0x01) {
        throw new InvalidProtocolBufferException("Varint is wider than 64 bits.");
      }
      result |= (long) (b & 0x7F) << (7 * i);
      if ((b & 0x80) == 0) {
        return result;
      }
    }
    throw new InvalidProtocolBufferException("Varint is longer than " + MAX_VARINT_BYTES + " bytes.");
  }

  /**
   * Reads a length prefix and checks it against the bytes left in the body.
   */
  static int readLength(CodedInputStream input) throws InvalidProtocolBufferException {
    long length = readVarint64(input);
    int remaining = input.getBytesUntilLimit();
    if (length < 0 || length > remaining) {
      throw new InvalidProtocolBufferException("Length-delimited field claims "
          + Long.toUnsignedString(length) + " bytes but only " + remaining + " remain.");
    }
    return (int) length;
  }

  private static void skipGroup(CodedInputStream input, int fieldNumber) throws InvalidProtocolBufferException {
    while (true) {
      if (atEnd(input)) {
        throw new InvalidProtocolBufferException("Group " + fieldNumber + " was not closed.");
      }
      long key = readVarint64(input);
      if (Long.compareUnsigned(key, MAX_TAG) > 0) {
        throw new InvalidProtocolBufferException("Protocol message tag is wider than 32 bits.");
      }
      int tag = (int) key;
      if (WireFormat.getTagFieldNumber(tag) == 0) {
        throw new InvalidProtocolBufferException("Protocol message contained an invalid tag (zero).");
      }
      if (WireFormat.getTagWireType(tag) == WireFormat.WIRETYPE_END_GROUP) {
        if (WireFormat.getTagFieldNumber(tag) != fieldNumber) {
          throw new InvalidProtocolBufferException("Protocol message end-group tag did not match expected tag.");
        }
        return;
      }
      skip(input, tag);
    }
  }

  private static boolean atEnd(CodedInputStream input) throws InvalidProtocolBufferException {
    try {
      return input.isAtEnd();
    } catch (InvalidProtocolBufferException e) {
      throw e;
    } catch (IOException e) {
      throw new InvalidProtocolBufferException(e);
    }
  }

  private static byte readByte(CodedInputStream input) throws InvalidProtocolBufferException {
    try {
      return input.readRawByte();
    } catch (InvalidProtocolBufferException e) {
      throw e;
    } catch (IOException e) {
      throw new InvalidProtocolBufferException(e);
    }
  }

  private static void skipRaw(CodedInputStream input, int length) throws InvalidProtocolBufferException {
    try {
      input.skipRawBytes(length);
    } catch (InvalidProtocolBufferException e) {
      throw e;
    } catch (IOException e) {
      throw new InvalidProtocolBufferException(e);
    }
  }
}
