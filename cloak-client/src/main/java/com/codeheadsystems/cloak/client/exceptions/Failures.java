package com.codeheadsystems.cloak.client.exceptions;

import com.codeheadsystems.mtproto.exceptions.MtprotoException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps whatever a future failed with onto the transfer exception hierarchy.
 */
public final class Failures {

  private Failures() {
  }

  /**
   * Strips the {@link CompletionException} and {@link ExecutionException} wrappers added by
   * future composition.
   *
   * @param error the error
   * @return the underlying cause
   */
  public static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * Classifies a failure. Transfer exceptions pass through; timeouts become retryable
   * {@link NetworkTimeoutException}s; protocol errors and everything else become fatal.
   *
   * @param error   the error
   * @param context what was being attempted, for the message
   * @return the transfer exception
   */
  public static TransferException toTransferException(Throwable error, String context) {
    Throwable cause = unwrap(error);
    if (cause instanceof TransferException transferException) {
      return transferException;
    }
    if (cause instanceof TimeoutException) {
      return new NetworkTimeoutException(context + " timed out", cause);
    }
    if (cause instanceof CancellationException) {
      return new TransferCancelledException(context + " was cancelled");
    }
    if (cause instanceof MtprotoException) {
      return new TransferException(context + " failed: " + cause.getMessage(), cause);
    }
    return new TransportException(context + " failed unexpectedly", cause);
  }
}
