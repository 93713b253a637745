package com.codeheadsystems.mtproto.exceptions;

/**
 * The fingerprint recomputed from a file key and IV does not match the one that was transmitted.
 * Decryption is never attempted once this is thrown.
 */
public class KeyFingerprintMismatchException extends MtprotoException {

  private final int expected;
  private final int actual;

  /**
   * Instantiates a new Key fingerprint mismatch exception.
   *
   * @param expected the fingerprint that was transmitted
   * @param actual   the fingerprint computed from the key and IV
   */
  public KeyFingerprintMismatchException(final int expected, final int actual) {
    super("Key fingerprint mismatch: expected " + expected + ", computed " + actual);
    this.expected = expected;
    this.actual = actual;
  }

  public int expected() {
    return expected;
  }

  public int actual() {
    return actual;
  }
}
