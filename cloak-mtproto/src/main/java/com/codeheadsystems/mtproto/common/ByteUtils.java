package com.codeheadsystems.mtproto.common;

import java.util.Arrays;

/**
 * Utility methods for byte array slicing, concatenation and little-endian integer handling.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Copies {@code length} bytes of {@code source} starting at {@code offset}.
   *
   * @param source the source
   * @param offset the offset
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] slice(byte[] source, int offset, int length) {
    if (offset < 0 || length < 0 || offset + length > source.length) {
      throw new IllegalArgumentException("Slice [" + offset + ", " + (offset + length)
          + ") out of bounds for length " + source.length);
    }
    return Arrays.copyOfRange(source, offset, offset + length);
  }

  /**
   * XOR two byte arrays of equal length.
   *
   * @param a the a
   * @param b the b
   * @return the byte [ ]
   */
  public static byte[] xor(byte[] a, byte[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException("XOR arrays must have equal length: " + a.length + " vs " + b.length);
    }
    byte[] out = new byte[a.length];
    for (int i = 0; i < a.length; i++) {
      out[i] = (byte) (a[i] ^ b[i]);
    }
    return out;
  }

  /**
   * Reads a signed 32-bit little-endian integer.
   *
   * @param bytes  the bytes
   * @param offset the offset of the lowest-order byte
   * @return the int
   */
  public static int readInt32LE(byte[] bytes, int offset) {
    return (bytes[offset] & 0xFF)
        | (bytes[offset + 1] & 0xFF) << 8
        | (bytes[offset + 2] & 0xFF) << 16
        | (bytes[offset + 3] & 0xFF) << 24;
  }

  /**
   * Encodes a 32-bit integer as four little-endian bytes.
   *
   * @param value the value
   * @return the byte [ ]
   */
  public static byte[] int32LE(int value) {
    return new byte[]{
        (byte) value,
        (byte) (value >>> 8),
        (byte) (value >>> 16),
        (byte) (value >>> 24)
    };
  }

  /**
   * Overwrites the array with zeros. Null is ignored.
   *
   * @param bytes the bytes
   */
  public static void wipe(byte[] bytes) {
    if (bytes != null) {
      Arrays.fill(bytes, (byte) 0);
    }
  }
}
