package com.codeheadsystems.mtproto.exceptions;

/**
 * Base type for every failure raised by the secret-chat protocol layer. All subtypes are fatal:
 * they indicate a programming error, corrupted data or a protocol desync, never a transient
 * condition, and must not be retried.
 */
public class MtprotoException extends RuntimeException {

  /**
   * Instantiates a new Mtproto exception.
   *
   * @param message the message
   */
  public MtprotoException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Mtproto exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public MtprotoException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
