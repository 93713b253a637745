package com.codeheadsystems.mtproto.crypto;

import com.codeheadsystems.mtproto.common.ByteUtils;
import com.codeheadsystems.mtproto.exceptions.CipherException;
import org.bouncycastle.crypto.digests.SHA256Digest;

/**
 * MTProto 2.0 message-key KDF.
 * <pre>
 *   x       = outgoing ? 0 : 8
 *   a       = SHA256(msg_key || secret[x : x+36])
 *   b       = SHA256(secret[40+x : 40+x+36] || msg_key)
 *   aes_key = a[0:8]  || b[8:24] || a[24:32]
 *   aes_iv  = b[0:8]  || a[8:24] || b[24:32]
 * </pre>
 * The direction offset makes the two peers' keys differ for the same message key.
 */
public class MessageKeyDerivation {

  public static final int MSG_KEY_SIZE = 16;

  private MessageKeyDerivation() {
  }

  /**
   * Direction offset into the shared secret.
   *
   * @param isOutgoing true for the sending direction
   * @return 0 or 8
   */
  public static int directionOffset(boolean isOutgoing) {
    return isOutgoing ? 0 : 8;
  }

  /**
   * Derives the AES key and IV for a message.
   *
   * @param msgKey     16-byte message key
   * @param secret     the chat's shared secret
   * @param isOutgoing direction flag
   * @return the message key material
   * @throws CipherException if {@code msgKey} is not 16 bytes
   */
  public static MessageKeyMaterial derive(byte[] msgKey, SharedSecret secret, boolean isOutgoing) {
    if (msgKey == null || msgKey.length != MSG_KEY_SIZE) {
      throw new CipherException("msg_key must be " + MSG_KEY_SIZE + " bytes, got "
          + (msgKey == null ? "null" : msgKey.length));
    }
    int x = directionOffset(isOutgoing);
    byte[] a = sha256(msgKey, secret.slice(x, 36));
    byte[] b = sha256(secret.slice(40 + x, 36), msgKey);

    byte[] aesKey = ByteUtils.concat(
        ByteUtils.slice(a, 0, 8),
        ByteUtils.slice(b, 8, 16),
        ByteUtils.slice(a, 24, 8));
    byte[] aesIv = ByteUtils.concat(
        ByteUtils.slice(b, 0, 8),
        ByteUtils.slice(a, 8, 16),
        ByteUtils.slice(b, 24, 8));
    ByteUtils.wipe(a);
    ByteUtils.wipe(b);
    return new MessageKeyMaterial(msgKey.clone(), aesKey, aesIv);
  }

  static byte[] sha256(byte[]... parts) {
    SHA256Digest digest = new SHA256Digest();
    for (byte[] part : parts) {
      digest.update(part, 0, part.length);
    }
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return out;
  }
}
