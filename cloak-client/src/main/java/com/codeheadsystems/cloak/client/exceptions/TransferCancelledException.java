package com.codeheadsystems.cloak.client.exceptions;

/**
 * The transfer was cancelled by the caller or because its chat was torn down.
 */
public class TransferCancelledException extends TransferException {

  /**
   * Instantiates a new Transfer cancelled exception.
   *
   * @param message the message
   */
  public TransferCancelledException(final String message) {
    super(message, null, false);
  }
}
