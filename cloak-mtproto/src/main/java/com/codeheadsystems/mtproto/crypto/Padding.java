package com.codeheadsystems.mtproto.crypto;

import com.codeheadsystems.mtproto.common.ByteUtils;
import com.codeheadsystems.mtproto.common.RandomProvider;

/**
 * Random padding. Padding carries no length marker; the true length travels out of band
 * (the descriptor's size field, or the self-delimiting record layout).
 */
public class Padding {

  /**
   * Smallest padding appended to a message plaintext.
   */
  public static final int MIN_MESSAGE_PADDING = 12;
  /**
   * Largest padding appended to a message plaintext.
   */
  public static final int MAX_MESSAGE_PADDING = 1024;

  private Padding() {
  }

  /**
   * Appends random bytes until the length is a multiple of 16. Aligned input is returned as a
   * copy with nothing appended.
   *
   * @param data   the data
   * @param random the random source
   * @return the padded copy
   */
  public static byte[] padToBlock(byte[] data, RandomProvider random) {
    int remainder = data.length % AesIge.BLOCK_SIZE;
    if (remainder == 0) {
      return data.clone();
    }
    return ByteUtils.concat(data, random.randomBytes(AesIge.BLOCK_SIZE - remainder));
  }

  /**
   * Chooses a message padding length: uniform in [12, 1024], then grown so that
   * {@code dataLength + padding} is block aligned. A result that would pass 1024 is pulled back
   * by one block so receivers that bound the padding accept it.
   *
   * @param dataLength the serialized record length
   * @param random     the random source
   * @return the padding length
   */
  public static int messagePaddingLength(int dataLength, RandomProvider random) {
    int padding = random.nextIntInclusive(MIN_MESSAGE_PADDING, MAX_MESSAGE_PADDING);
    int remainder = (dataLength + padding) % AesIge.BLOCK_SIZE;
    if (remainder != 0) {
      padding += AesIge.BLOCK_SIZE - remainder;
    }
    if (padding > MAX_MESSAGE_PADDING) {
      padding -= AesIge.BLOCK_SIZE;
    }
    return padding;
  }
}
