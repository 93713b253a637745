package com.codeheadsystems.mtproto.exceptions;

/**
 * A record could not be written or read: truncated input, an unknown constructor, a bad vector
 * tag, or a value that does not fit its wire encoding.
 */
public class SerializationException extends MtprotoException {

  /**
   * Instantiates a new Serialization exception.
   *
   * @param message the message
   */
  public SerializationException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Serialization exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SerializationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
