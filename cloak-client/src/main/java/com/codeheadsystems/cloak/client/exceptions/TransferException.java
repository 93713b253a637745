package com.codeheadsystems.cloak.client.exceptions;

/**
 * Base type for transfer failures. The {@link #retryable()} flag tells the retry loop whether
 * another attempt may succeed; a failed transfer reports exactly one of these.
 */
public class TransferException extends RuntimeException {

  private final boolean retryable;

  /**
   * Instantiates a new Transfer exception.
   *
   * @param message   the message
   * @param cause     the cause
   * @param retryable whether another attempt may succeed
   */
  public TransferException(final String message, final Throwable cause, final boolean retryable) {
    super(message, cause);
    this.retryable = retryable;
  }

  /**
   * Instantiates a non-retryable Transfer exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public TransferException(final String message, final Throwable cause) {
    this(message, cause, false);
  }

  public boolean retryable() {
    return retryable;
  }
}
