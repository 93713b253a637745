package com.codeheadsystems.cloak.client.model;

import com.codeheadsystems.cloak.client.exceptions.TransferException;
import java.util.Optional;

/**
 * Outcome of a send. Exactly one of {@code handle} and {@code error} is present.
 *
 * @param randomId   the message's random id
 * @param finalState {@link TransferState#SENT} or {@link TransferState#FAILED}
 * @param handle     the transport's handle when sent
 * @param error      the terminal error when failed
 */
public record TransferResult(long randomId, TransferState finalState, Optional<MessageHandle> handle,
                             Optional<TransferException> error) {

  public static TransferResult sent(long randomId, MessageHandle handle) {
    return new TransferResult(randomId, TransferState.SENT, Optional.of(handle), Optional.empty());
  }

  public static TransferResult failed(long randomId, TransferException error) {
    return new TransferResult(randomId, TransferState.FAILED, Optional.empty(), Optional.of(error));
  }

  public boolean isSent() {
    return finalState == TransferState.SENT;
  }
}
