package com.codeheadsystems.mtproto.crypto;

import com.codeheadsystems.mtproto.common.ByteUtils;
import com.codeheadsystems.mtproto.common.RandomProvider;
import com.codeheadsystems.mtproto.exceptions.KeyFingerprintMismatchException;
import java.util.Arrays;
import org.bouncycastle.crypto.digests.MD5Digest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Random per-file keys and the file encryption path.
 * <p>
 * File keys come only from the {@link RandomProvider}; this class has no access to the chat's
 * shared secret, so the file path and the message path cannot be mixed.
 */
public class FileKeyGenerator {

  private static final Logger log = LoggerFactory.getLogger(FileKeyGenerator.class);

  private final RandomProvider randomProvider;

  /**
   * Instantiates a new File key generator.
   *
   * @param randomProvider the random provider
   */
  public FileKeyGenerator(final RandomProvider randomProvider) {
    log.info("FileKeyGenerator()");
    this.randomProvider = randomProvider;
  }

  /**
   * Fresh key and IV with their fingerprint.
   *
   * @return the file key material
   */
  public FileKeyMaterial generate() {
    byte[] key = randomProvider.randomBytes(AesIge.KEY_SIZE);
    byte[] iv = randomProvider.randomBytes(AesIge.IV_SIZE);
    return new FileKeyMaterial(key, iv, fingerprint(key, iv));
  }

  /**
   * Key fingerprint: {@code digest = MD5(key || iv)}, then
   * {@code fp[i] = digest[i] XOR digest[i + 4]} for i in 0..3, read as a little-endian int32.
   *
   * @param key the key
   * @param iv  the iv
   * @return the fingerprint
   */
  public static int fingerprint(byte[] key, byte[] iv) {
    MD5Digest md5 = new MD5Digest();
    md5.update(key, 0, key.length);
    md5.update(iv, 0, iv.length);
    byte[] digest = new byte[md5.getDigestSize()];
    md5.doFinal(digest, 0);
    byte[] folded = ByteUtils.xor(ByteUtils.slice(digest, 0, 4), ByteUtils.slice(digest, 4, 4));
    return ByteUtils.readInt32LE(folded, 0);
  }

  /**
   * Pads the file to the block size with random bytes and encrypts it under a new key.
   *
   * @param data the plaintext file
   * @return the encrypted file
   */
  public EncryptedFile encryptFile(byte[] data) {
    FileKeyMaterial material = generate();
    byte[] padded = Padding.padToBlock(data, randomProvider);
    byte[] ciphertext = AesIge.encrypt(padded, material.key(), material.iv());
    ByteUtils.wipe(padded);
    log.debug("encryptFile(size={}, encrypted={}, fingerprint={})", data.length, ciphertext.length,
        material.fingerprint());
    return new EncryptedFile(ciphertext, material, data.length);
  }

  /**
   * Verifies the fingerprint and decrypts. The result still carries the random padding.
   *
   * @param ciphertext  the ciphertext
   * @param key         the key
   * @param iv          the iv
   * @param fingerprint the fingerprint that was transmitted
   * @return the padded plaintext
   * @throws KeyFingerprintMismatchException if the fingerprint does not match key and iv
   */
  public static byte[] decryptFile(byte[] ciphertext, byte[] key, byte[] iv, int fingerprint) {
    int computed = fingerprint(key, iv);
    if (computed != fingerprint) {
      throw new KeyFingerprintMismatchException(fingerprint, computed);
    }
    return AesIge.decrypt(ciphertext, key, iv);
  }

  /**
   * Verifies the key and IV from a media descriptor against the fingerprint transmitted with the
   * file reference, then decrypts and truncates to the descriptor's plaintext size.
   *
   * @param ciphertext             the ciphertext
   * @param material               the key and IV from the descriptor
   * @param transmittedFingerprint the fingerprint sent alongside the file, not recomputed locally
   * @param plaintextSize          the size from the descriptor
   * @return the original file bytes
   * @throws KeyFingerprintMismatchException if key and IV do not hash to the transmitted fingerprint
   */
  public static byte[] decryptFile(byte[] ciphertext, FileKeyMaterial material, int transmittedFingerprint,
                                   int plaintextSize) {
    byte[] padded = decryptFile(ciphertext, material.key(), material.iv(), transmittedFingerprint);
    if (plaintextSize < 0 || plaintextSize > padded.length) {
      throw new IllegalArgumentException("Plaintext size " + plaintextSize
          + " exceeds decrypted length " + padded.length);
    }
    return Arrays.copyOf(padded, plaintextSize);
  }
}
