package com.codeheadsystems.mtproto.exceptions;

/**
 * Raised when a cipher input is misaligned or mis-sized (data not a multiple of 16 bytes, key or
 * IV not 32 bytes, message key not 16 bytes, shared secret not 256 bytes).
 */
public class CipherException extends MtprotoException {

  /**
   * Instantiates a new Cipher exception.
   *
   * @param message the message
   */
  public CipherException(final String message) {
    super(message);
  }
}
