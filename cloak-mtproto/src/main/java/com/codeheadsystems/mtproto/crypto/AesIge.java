package com.codeheadsystems.mtproto.crypto;

import com.codeheadsystems.mtproto.common.ByteUtils;
import com.codeheadsystems.mtproto.exceptions.CipherException;
import org.bouncycastle.crypto.BlockCipher;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * AES-256 in Infinite Garble Extension (IGE) mode, built on the raw single-block AES engine.
 * <p>
 * The 32-byte IV is split into two halves {@code (iv1, iv2)}. Encryption of block {@code p}:
 * <pre>
 *   c    = AES_enc(p XOR iv1) XOR iv2
 *   iv1  = c
 *   iv2  = p
 * </pre>
 * Decryption of block {@code c}:
 * <pre>
 *   p    = AES_dec(c XOR iv2) XOR iv1
 *   iv1  = c
 *   iv2  = p
 * </pre>
 * Inputs must already be block aligned; this class never pads.
 */
public class AesIge {

  public static final int BLOCK_SIZE = 16;
  public static final int KEY_SIZE = 32;
  public static final int IV_SIZE = 32;

  private AesIge() {
  }

  /**
   * Encrypts block-aligned plaintext.
   *
   * @param plaintext data whose length is a multiple of 16
   * @param key       32-byte AES key
   * @param iv        32-byte IGE initialization vector
   * @return ciphertext of the same length
   * @throws CipherException if any size precondition is violated
   */
  public static byte[] encrypt(byte[] plaintext, byte[] key, byte[] iv) {
    return process(true, plaintext, key, iv);
  }

  /**
   * Decrypts block-aligned ciphertext.
   *
   * @param ciphertext data whose length is a multiple of 16
   * @param key        32-byte AES key
   * @param iv         32-byte IGE initialization vector
   * @return plaintext of the same length
   * @throws CipherException if any size precondition is violated
   */
  public static byte[] decrypt(byte[] ciphertext, byte[] key, byte[] iv) {
    return process(false, ciphertext, key, iv);
  }

  private static byte[] process(boolean forEncryption, byte[] input, byte[] key, byte[] iv) {
    checkSizes(input, key, iv);
    BlockCipher aes = AESEngine.newInstance();
    aes.init(forEncryption, new KeyParameter(key));

    // XOR applied before the block cipher, and XOR applied after it.
    byte[] inMask = forEncryption ? ByteUtils.slice(iv, 0, BLOCK_SIZE) : ByteUtils.slice(iv, BLOCK_SIZE, BLOCK_SIZE);
    byte[] outMask = forEncryption ? ByteUtils.slice(iv, BLOCK_SIZE, BLOCK_SIZE) : ByteUtils.slice(iv, 0, BLOCK_SIZE);

    byte[] output = new byte[input.length];
    byte[] block = new byte[BLOCK_SIZE];
    byte[] processed = new byte[BLOCK_SIZE];
    for (int offset = 0; offset < input.length; offset += BLOCK_SIZE) {
      for (int i = 0; i < BLOCK_SIZE; i++) {
        block[i] = (byte) (input[offset + i] ^ inMask[i]);
      }
      aes.processBlock(block, 0, processed, 0);
      for (int i = 0; i < BLOCK_SIZE; i++) {
        output[offset + i] = (byte) (processed[i] ^ outMask[i]);
      }
      System.arraycopy(output, offset, inMask, 0, BLOCK_SIZE);
      System.arraycopy(input, offset, outMask, 0, BLOCK_SIZE);
    }
    ByteUtils.wipe(block);
    ByteUtils.wipe(processed);
    return output;
  }

  private static void checkSizes(byte[] data, byte[] key, byte[] iv) {
    if (data == null || data.length % BLOCK_SIZE != 0) {
      throw new CipherException("IGE input must be a multiple of " + BLOCK_SIZE + " bytes, got "
          + (data == null ? "null" : data.length));
    }
    if (key == null || key.length != KEY_SIZE) {
      throw new CipherException("IGE key must be " + KEY_SIZE + " bytes, got "
          + (key == null ? "null" : key.length));
    }
    if (iv == null || iv.length != IV_SIZE) {
      throw new CipherException("IGE iv must be " + IV_SIZE + " bytes, got "
          + (iv == null ? "null" : iv.length));
    }
  }
}
