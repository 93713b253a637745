package com.codeheadsystems.mtproto.crypto;

import com.codeheadsystems.mtproto.common.ByteUtils;

/**
 * Keys for one message, derived from the shared secret and the message key. Never random.
 * Holders call {@link #destroy()} as soon as the message has been processed.
 *
 * @param msgKey 16-byte message key
 * @param aesKey 32-byte AES key
 * @param aesIv  32-byte IGE IV
 */
public record MessageKeyMaterial(byte[] msgKey, byte[] aesKey, byte[] aesIv) {

  /**
   * Zero-fills the derived key and IV. The message key itself is transmitted in clear and is
   * left intact.
   */
  public void destroy() {
    ByteUtils.wipe(aesKey);
    ByteUtils.wipe(aesIv);
  }

  @Override
  public String toString() {
    return "MessageKeyMaterial[]";
  }
}
