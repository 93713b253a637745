package com.codeheadsystems.mtproto.crypto;

import com.codeheadsystems.mtproto.common.ByteUtils;
import com.codeheadsystems.mtproto.exceptions.CipherException;

/**
 * Per-file AES key and IV, plus the fingerprint the receiver checks before decrypting.
 * Generated once per file by {@link FileKeyGenerator}; never derived from a shared secret.
 *
 * @param key         32-byte AES key
 * @param iv          32-byte IGE IV
 * @param fingerprint {@link FileKeyGenerator#fingerprint(byte[], byte[])} of key and iv
 */
public record FileKeyMaterial(byte[] key, byte[] iv, int fingerprint) {

  /**
   * Validates sizes.
   */
  public FileKeyMaterial {
    if (key == null || key.length != AesIge.KEY_SIZE) {
      throw new CipherException("File key must be " + AesIge.KEY_SIZE + " bytes");
    }
    if (iv == null || iv.length != AesIge.IV_SIZE) {
      throw new CipherException("File iv must be " + AesIge.IV_SIZE + " bytes");
    }
  }

  /**
   * Builds key material from a received key and IV, computing the fingerprint.
   *
   * @param key the key
   * @param iv  the iv
   * @return the file key material
   */
  public static FileKeyMaterial of(byte[] key, byte[] iv) {
    return new FileKeyMaterial(key, iv, FileKeyGenerator.fingerprint(key, iv));
  }

  /**
   * Zero-fills the key and IV.
   */
  public void destroy() {
    ByteUtils.wipe(key);
    ByteUtils.wipe(iv);
  }

  @Override
  public String toString() {
    return "FileKeyMaterial[fingerprint=" + fingerprint + "]";
  }
}
