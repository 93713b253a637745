package com.codeheadsystems.mtproto.tl;

import com.codeheadsystems.mtproto.exceptions.SerializationException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Append-only cursor over a growable buffer.
 * <p>
 * The encoders are also exposed as pure static functions ({@link #encodeInt32(int)},
 * {@link #encodeBytes(byte[])}, ...). The instance methods append their results.
 */
public class TlWriter {

  /**
   * Blobs shorter than this use a one-byte length prefix.
   */
  public static final int SHORT_BLOB_LIMIT = 254;
  /**
   * Largest blob the three-byte extended length can describe.
   */
  public static final int MAX_BLOB_LENGTH = (1 << 24) - 1;

  private byte[] buffer;
  private int position;

  /**
   * Instantiates a new Tl writer.
   */
  public TlWriter() {
    this(256);
  }

  /**
   * Instantiates a new Tl writer.
   *
   * @param initialCapacity the initial capacity
   */
  public TlWriter(int initialCapacity) {
    this.buffer = new byte[Math.max(16, initialCapacity)];
    this.position = 0;
  }

  // ─── Pure encoders ─────────────────────────────────────────────────────────

  /**
   * 32-bit little-endian.
   *
   * @param value the value
   * @return the byte [ ]
   */
  public static byte[] encodeInt32(int value) {
    return new byte[]{
        (byte) value, (byte) (value >>> 8), (byte) (value >>> 16), (byte) (value >>> 24)
    };
  }

  /**
   * 64-bit little-endian.
   *
   * @param value the value
   * @return the byte [ ]
   */
  public static byte[] encodeInt64(long value) {
    byte[] out = new byte[8];
    for (int i = 0; i < 8; i++) {
      out[i] = (byte) (value >>> (8 * i));
    }
    return out;
  }

  /**
   * Byte blob: {@code [len][bytes][zero padding to a 4-byte boundary]}. The length is one byte
   * when below 254, otherwise the byte 254 followed by a three-byte little-endian length.
   *
   * @param data the data
   * @return the byte [ ]
   * @throws SerializationException if the blob is too long for a three-byte length
   */
  public static byte[] encodeBytes(byte[] data) {
    int length = data.length;
    if (length > MAX_BLOB_LENGTH) {
      throw new SerializationException("Blob of " + length + " bytes exceeds " + MAX_BLOB_LENGTH);
    }
    int header = length < SHORT_BLOB_LIMIT ? 1 : 4;
    int unpadded = header + length;
    byte[] out = new byte[(unpadded + 3) & ~3];
    if (header == 1) {
      out[0] = (byte) length;
    } else {
      out[0] = (byte) SHORT_BLOB_LIMIT;
      out[1] = (byte) length;
      out[2] = (byte) (length >>> 8);
      out[3] = (byte) (length >>> 16);
    }
    System.arraycopy(data, 0, out, header, length);
    return out;
  }

  /**
   * UTF-8 text as a byte blob.
   *
   * @param text the text
   * @return the byte [ ]
   */
  public static byte[] encodeString(String text) {
    return encodeBytes(text.getBytes(StandardCharsets.UTF_8));
  }

  // ─── Cursor ────────────────────────────────────────────────────────────────

  public TlWriter writeInt32(int value) {
    return append(encodeInt32(value));
  }

  public TlWriter writeInt64(long value) {
    return append(encodeInt64(value));
  }

  public TlWriter writeBytes(byte[] data) {
    return append(encodeBytes(data));
  }

  public TlWriter writeString(String text) {
    return append(encodeString(text));
  }

  /**
   * Writes {@code [0x1cb5c415][count][elements...]}; each element writes its own constructor.
   *
   * @param items the items
   * @return this writer
   */
  public TlWriter writeVector(List<? extends TlObject> items) {
    writeInt32(TlConstructors.VECTOR);
    writeInt32(items.size());
    for (TlObject item : items) {
      item.serialize(this);
    }
    return this;
  }

  /**
   * Number of bytes written so far.
   *
   * @return the int
   */
  public int size() {
    return position;
  }

  /**
   * Copy of the bytes written so far.
   *
   * @return the byte [ ]
   */
  public byte[] toByteArray() {
    return Arrays.copyOf(buffer, position);
  }

  private TlWriter append(byte[] bytes) {
    ensureCapacity(bytes.length);
    System.arraycopy(bytes, 0, buffer, position, bytes.length);
    position += bytes.length;
    return this;
  }

  private void ensureCapacity(int extra) {
    int required = position + extra;
    if (required > buffer.length) {
      buffer = Arrays.copyOf(buffer, Math.max(required, buffer.length * 2));
    }
  }
}
