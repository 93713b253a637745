package com.codeheadsystems.mtproto.tl;

import com.codeheadsystems.mtproto.exceptions.SerializationException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Read cursor, the inverse of {@link TlWriter}. Every failure is a {@link SerializationException};
 * callers never see an index error.
 */
public class TlReader {

  private final byte[] data;
  private int position;

  /**
   * Instantiates a new Tl reader.
   *
   * @param data the data to read; trailing bytes after the record are allowed
   */
  public TlReader(byte[] data) {
    this.data = data;
    this.position = 0;
  }

  public int readInt32() {
    require(4);
    int value = (data[position] & 0xFF)
        | (data[position + 1] & 0xFF) << 8
        | (data[position + 2] & 0xFF) << 16
        | (data[position + 3] & 0xFF) << 24;
    position += 4;
    return value;
  }

  public long readInt64() {
    require(8);
    long value = 0;
    for (int i = 7; i >= 0; i--) {
      value = (value << 8) | (data[position + i] & 0xFFL);
    }
    position += 8;
    return value;
  }

  /**
   * Reads a byte blob and skips its alignment padding.
   *
   * @return the byte [ ]
   */
  public byte[] readBytes() {
    require(1);
    int first = data[position] & 0xFF;
    int header;
    int length;
    if (first < TlWriter.SHORT_BLOB_LIMIT) {
      header = 1;
      length = first;
    } else if (first == TlWriter.SHORT_BLOB_LIMIT) {
      require(4);
      header = 4;
      length = (data[position + 1] & 0xFF)
          | (data[position + 2] & 0xFF) << 8
          | (data[position + 3] & 0xFF) << 16;
    } else {
      throw new SerializationException("Invalid blob length prefix " + first + " at offset " + position);
    }
    int total = (header + length + 3) & ~3;
    require(total);
    byte[] out = Arrays.copyOfRange(data, position + header, position + header + length);
    position += total;
    return out;
  }

  /**
   * Reads a blob and decodes it as strict UTF-8.
   *
   * @return the string
   */
  public String readString() {
    byte[] raw = readBytes();
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(raw))
          .toString();
    } catch (CharacterCodingException e) {
      throw new SerializationException("String field is not valid UTF-8", e);
    }
  }

  /**
   * Reads a constructor identifier and checks it.
   *
   * @param expected the expected constructor
   */
  public void expectConstructor(int expected) {
    int actual = readInt32();
    if (actual != expected) {
      throw new SerializationException("Expected constructor " + TlConstructors.hex(expected)
          + " but found " + TlConstructors.hex(actual));
    }
  }

  /**
   * Reads a boxed vector, delegating each element to {@code elementReader}.
   *
   * @param elementReader reads one boxed element
   * @param <T>           element type
   * @return the list
   */
  public <T> List<T> readVector(Function<TlReader, T> elementReader) {
    expectConstructor(TlConstructors.VECTOR);
    int count = readInt32();
    // Every element is at least a 4-byte constructor.
    if (count < 0 || (long) count * 4 > remaining()) {
      throw new SerializationException("Invalid vector length " + count);
    }
    List<T> items = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      items.add(elementReader.apply(this));
    }
    return items;
  }

  /**
   * Offset of the next unread byte; after reading a record this is the record's length.
   *
   * @return the int
   */
  public int position() {
    return position;
  }

  public int remaining() {
    return data.length - position;
  }

  private void require(int count) {
    if (count > data.length - position) {
      throw new SerializationException("Truncated input: need " + count + " bytes at offset "
          + position + ", have " + (data.length - position));
    }
  }
}
