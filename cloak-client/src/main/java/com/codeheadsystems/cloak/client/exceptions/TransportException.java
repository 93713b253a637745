package com.codeheadsystems.cloak.client.exceptions;

/**
 * The transport failed a call. Client-side rejections are fatal; server-side and I/O failures
 * are marked retryable by the accessor.
 */
public class TransportException extends TransferException {

  /**
   * Instantiates a fatal Transport exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public TransportException(final String message, final Throwable cause) {
    super(message, cause, false);
  }

  /**
   * Instantiates a new Transport exception.
   *
   * @param message   the message
   * @param cause     the cause
   * @param retryable whether another attempt may succeed
   */
  public TransportException(final String message, final Throwable cause, final boolean retryable) {
    super(message, cause, retryable);
  }
}
