package com.codeheadsystems.cloak.client.manager;

import com.codeheadsystems.cloak.client.accessor.SecretChatTransport;
import com.codeheadsystems.cloak.client.exceptions.TransferCancelledException;
import com.codeheadsystems.cloak.client.exceptions.TransferException;
import com.codeheadsystems.cloak.client.exceptions.TransportException;
import com.codeheadsystems.cloak.client.model.MessageHandle;
import com.codeheadsystems.cloak.client.model.SecretChatPeer;
import com.codeheadsystems.cloak.client.model.TransferResult;
import com.codeheadsystems.cloak.client.model.TransferState;
import com.codeheadsystems.mtproto.crypto.FileKeyMaterial;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One send in flight. Owns its state, its file key material and the id of its upload; nothing
 * here is shared with other transfers.
 * <p>
 * The state only moves forward and stops at {@link TransferState#SENT} or
 * {@link TransferState#FAILED}. On failure the upload is discarded and the key material zeroed.
 */
public class SecretMediaTransfer {

  private static final Logger log = LoggerFactory.getLogger(SecretMediaTransfer.class);

  private final long randomId;
  private final SecretChatPeer peer;
  private final SecretChatTransport transport;
  private final CompletableFuture<TransferResult> result = new CompletableFuture<>();
  private final List<TransferState> history = new ArrayList<>();
  private final List<CompletableFuture<?>> pending = new ArrayList<>();

  private TransferState state = TransferState.IDLE;
  private FileKeyMaterial keyMaterial;
  private Long fileId;
  private volatile boolean cancelled;

  SecretMediaTransfer(final long randomId, final SecretChatPeer peer, final SecretChatTransport transport) {
    this.randomId = randomId;
    this.peer = peer;
    this.transport = transport;
    this.history.add(TransferState.IDLE);
  }

  public long randomId() {
    return randomId;
  }

  public SecretChatPeer peer() {
    return peer;
  }

  public synchronized TransferState state() {
    return state;
  }

  /**
   * Every state this transfer has been in, oldest first.
   *
   * @return the list
   */
  public synchronized List<TransferState> history() {
    return List.copyOf(history);
  }

  /**
   * Completes with the outcome; never completes exceptionally.
   *
   * @return the completable future
   */
  public CompletableFuture<TransferResult> result() {
    return result;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * Stops the transfer: outstanding calls are cancelled and the transfer fails with a
   * {@link TransferCancelledException}. Does nothing once the transfer has finished.
   */
  public void cancel() {
    List<CompletableFuture<?>> outstanding;
    synchronized (this) {
      if (state.isTerminal()) {
        return;
      }
      cancelled = true;
      outstanding = List.copyOf(pending);
    }
    log.debug("cancel(randomId={})", randomId);
    outstanding.forEach(future -> future.cancel(true));
    fail(new TransferCancelledException("Transfer " + randomId + " was cancelled"));
  }

  // ── Used by the manager ─────────────────────────────────────────────────────

  synchronized boolean advance(TransferState next) {
    if (state.isTerminal() || cancelled) {
      return false;
    }
    log.debug("advance(randomId={}, from={}, to={})", randomId, state, next);
    state = next;
    history.add(next);
    return true;
  }

  synchronized <T> CompletableFuture<T> track(CompletableFuture<T> future) {
    pending.add(future);
    future.whenComplete((v, error) -> untrack(future));
    return future;
  }

  synchronized void keyMaterial(FileKeyMaterial keyMaterial) {
    this.keyMaterial = keyMaterial;
  }

  synchronized void fileId(long fileId) {
    this.fileId = fileId;
  }

  synchronized Long fileId() {
    return fileId;
  }

  void succeed(MessageHandle handle) {
    if (handle == null) {
      fail(new TransportException("Transfer " + randomId + " was sent but no message handle came back", null));
      return;
    }
    TransferResult sent = TransferResult.sent(randomId, handle);
    if (!advance(TransferState.SENT)) {
      return;
    }
    try {
      destroyKeyMaterial();
    } finally {
      result.complete(sent);
    }
  }

  void fail(TransferException error) {
    Long abandoned;
    synchronized (this) {
      if (state.isTerminal()) {
        return;
      }
      log.debug("advance(randomId={}, from={}, to={}): {}", randomId, state, TransferState.FAILED,
          error.getMessage());
      state = TransferState.FAILED;
      history.add(TransferState.FAILED);
      abandoned = fileId;
    }
    try {
      if (abandoned != null) {
        discard(abandoned);
      }
      destroyKeyMaterial();
    } finally {
      result.complete(TransferResult.failed(randomId, error));
    }
  }

  private synchronized void untrack(CompletableFuture<?> future) {
    pending.remove(future);
  }

  // Fire and forget; the transfer's outcome does not wait on the gateway.
  private void discard(long abandoned) {
    CompletableFuture<Void> discarded;
    try {
      discarded = transport.discardUpload(abandoned);
    } catch (RuntimeException e) {
      log.warn("Unable to discard upload {} of transfer {}", abandoned, randomId, e);
      return;
    }
    if (discarded == null) {
      return;
    }
    discarded.whenComplete((v, error) -> {
      if (error != null) {
        log.warn("Unable to discard upload {} of transfer {}", abandoned, randomId, error);
      }
    });
  }

  private synchronized void destroyKeyMaterial() {
    if (keyMaterial != null) {
      keyMaterial.destroy();
      keyMaterial = null;
    }
  }
}
