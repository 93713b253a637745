package com.codeheadsystems.mtproto.crypto;

import com.codeheadsystems.mtproto.common.ByteUtils;
import com.codeheadsystems.mtproto.common.RandomProvider;
import com.codeheadsystems.mtproto.exceptions.CipherException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encrypts serialized secret-chat records into {@code msg_key || ciphertext} envelopes.
 * <p>
 * Steps for a record {@code P}:
 * <ol>
 *   <li>{@code P' = P || random padding}, padding in [12, 1024] and {@code |P'|} a multiple of 16.</li>
 *   <li>{@code msg_key = SHA256(secret[88+x : 88+x+32] || P')[8:24]}.</li>
 *   <li>{@code (aes_key, aes_iv)} from {@link MessageKeyDerivation}.</li>
 *   <li>{@code envelope = msg_key || AES-IGE(P')}.</li>
 * </ol>
 * The receiver re-derives the keys from the transmitted message key. This class does not check
 * integrity on decryption; callers compare {@link #computeMessageKey} against
 * {@link OpenedEnvelope#msgKey()}.
 */
public class SecretMessageCipher {

  private static final Logger log = LoggerFactory.getLogger(SecretMessageCipher.class);

  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Secret message cipher.
   *
   * @param randomProvider source of padding bytes and padding lengths
   */
  public SecretMessageCipher(final RandomProvider randomProvider) {
    log.info("SecretMessageCipher()");
    this.randomProvider = randomProvider;
  }

  /**
   * Encrypts a serialized record.
   *
   * @param plaintext  the serialized record
   * @param secret     the shared secret
   * @param isOutgoing direction flag
   * @return {@code msg_key || ciphertext}
   */
  public byte[] encrypt(byte[] plaintext, SharedSecret secret, boolean isOutgoing) {
    int paddingLength = Padding.messagePaddingLength(plaintext.length, randomProvider);
    byte[] padded = ByteUtils.concat(plaintext, randomProvider.randomBytes(paddingLength));
    byte[] msgKey = computeMessageKey(secret, padded, isOutgoing);
    MessageKeyMaterial keys = MessageKeyDerivation.derive(msgKey, secret, isOutgoing);
    try {
      byte[] ciphertext = AesIge.encrypt(padded, keys.aesKey(), keys.aesIv());
      log.debug("encrypt(record={}, padding={}, outgoing={})", plaintext.length, paddingLength, isOutgoing);
      return ByteUtils.concat(msgKey, ciphertext);
    } finally {
      keys.destroy();
      ByteUtils.wipe(padded);
    }
  }

  /**
   * Splits and decrypts an envelope.
   *
   * @param envelope           {@code msg_key || ciphertext}
   * @param secret             the shared secret
   * @param senderWasOutgoing  the direction flag the sender used
   * @return the opened envelope, padding still attached
   * @throws CipherException if the envelope is too short or misaligned
   */
  public static OpenedEnvelope decrypt(byte[] envelope, SharedSecret secret, boolean senderWasOutgoing) {
    int msgKeySize = MessageKeyDerivation.MSG_KEY_SIZE;
    if (envelope == null || envelope.length < msgKeySize + AesIge.BLOCK_SIZE) {
      throw new CipherException("Envelope too short: " + (envelope == null ? "null" : envelope.length));
    }
    byte[] msgKey = ByteUtils.slice(envelope, 0, msgKeySize);
    byte[] ciphertext = ByteUtils.slice(envelope, msgKeySize, envelope.length - msgKeySize);
    MessageKeyMaterial keys = MessageKeyDerivation.derive(msgKey, secret, senderWasOutgoing);
    try {
      return new OpenedEnvelope(msgKey, AesIge.decrypt(ciphertext, keys.aesKey(), keys.aesIv()));
    } finally {
      keys.destroy();
    }
  }

  /**
   * {@code SHA256(secret[88+x : 88+x+32] || paddedPlaintext)[8:24]}.
   *
   * @param secret          the shared secret
   * @param paddedPlaintext the plaintext including its padding
   * @param isOutgoing      direction flag
   * @return the 16-byte message key
   */
  public static byte[] computeMessageKey(SharedSecret secret, byte[] paddedPlaintext, boolean isOutgoing) {
    int x = MessageKeyDerivation.directionOffset(isOutgoing);
    byte[] full = MessageKeyDerivation.sha256(secret.slice(88 + x, 32), paddedPlaintext);
    return ByteUtils.slice(full, 8, MessageKeyDerivation.MSG_KEY_SIZE);
  }
}
