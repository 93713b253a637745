package com.codeheadsystems.mtproto.crypto;

import com.codeheadsystems.mtproto.common.ByteUtils;
import com.codeheadsystems.mtproto.exceptions.CipherException;

/**
 * The 256-byte long-term key of one secret chat, established by the key exchange outside this
 * library. Read-only: the bytes are copied on the way in and on the way out.
 */
public final class SharedSecret {

  public static final int LENGTH = 256;

  private final byte[] key;

  /**
   * Instantiates a new Shared secret.
   *
   * @param key exactly 256 bytes
   * @throws CipherException for any other length
   */
  public SharedSecret(final byte[] key) {
    if (key == null || key.length != LENGTH) {
      throw new CipherException("Shared secret must be " + LENGTH + " bytes, got "
          + (key == null ? "null" : key.length));
    }
    this.key = key.clone();
  }

  /**
   * Copy of {@code length} bytes starting at {@code offset}.
   *
   * @param offset the offset
   * @param length the length
   * @return the byte [ ]
   */
  public byte[] slice(int offset, int length) {
    return ByteUtils.slice(key, offset, length);
  }

  /**
   * Copy of the full secret.
   *
   * @return the byte [ ]
   */
  public byte[] bytes() {
    return key.clone();
  }

  @Override
  public String toString() {
    return "SharedSecret[" + LENGTH + " bytes]";
  }
}
