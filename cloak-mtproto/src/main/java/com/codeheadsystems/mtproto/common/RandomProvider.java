package com.codeheadsystems.mtproto.common;

import java.security.SecureRandom;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random byte generation.
 * Used for file keys, padding and random identifiers; tests substitute a seeded instance.
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Uniform integer in {@code [min, max]}, both ends inclusive.
   *
   * @param min the lower bound
   * @param max the upper bound
   * @return the int
   */
  public int nextIntInclusive(int min, int max) {
    return min + random.nextInt(max - min + 1);
  }

  /**
   * A random non-zero 64-bit identifier.
   *
   * @return the long
   */
  public long nextId() {
    long id;
    do {
      id = random.nextLong();
    } while (id == 0L);
    return id;
  }
}
