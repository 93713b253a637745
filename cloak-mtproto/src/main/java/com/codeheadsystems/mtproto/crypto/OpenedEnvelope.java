package com.codeheadsystems.mtproto.crypto;

import java.security.MessageDigest;

/**
 * A decrypted envelope: the transmitted message key and the padded plaintext.
 *
 * @param msgKey          the 16-byte message key taken from the envelope
 * @param paddedPlaintext the decrypted record followed by its random padding
 */
public record OpenedEnvelope(byte[] msgKey, byte[] paddedPlaintext) {

  /**
   * Whether the transmitted message key matches the one recomputed from the plaintext.
   *
   * @param recomputed the recomputed message key
   * @return true on match
   */
  public boolean msgKeyMatches(byte[] recomputed) {
    return MessageDigest.isEqual(msgKey, recomputed);
  }
}
