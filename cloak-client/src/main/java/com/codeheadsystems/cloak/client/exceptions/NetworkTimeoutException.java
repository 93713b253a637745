package com.codeheadsystems.cloak.client.exceptions;

/**
 * A network call did not complete within its timeout. Retryable.
 */
public class NetworkTimeoutException extends TransferException {

  /**
   * Instantiates a new Network timeout exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public NetworkTimeoutException(final String message, final Throwable cause) {
    super(message, cause, true);
  }
}
