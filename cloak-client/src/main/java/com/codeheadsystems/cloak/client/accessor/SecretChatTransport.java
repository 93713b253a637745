package com.codeheadsystems.cloak.client.accessor;

import com.codeheadsystems.cloak.client.model.MessageHandle;
import com.codeheadsystems.cloak.client.model.SecretChatPeer;
import com.codeheadsystems.cloak.client.model.UploadedFileRef;
import java.util.concurrent.CompletableFuture;

/**
 * The network calls a transfer needs. Implementations complete futures exceptionally with a
 * {@link com.codeheadsystems.cloak.client.exceptions.TransferException} whose
 * {@code retryable()} flag says whether the call may be repeated; any other exception is treated
 * as fatal.
 */
public interface SecretChatTransport {

  /**
   * Stores one encrypted part.
   *
   * @param fileId    the file id
   * @param partIndex the part index
   * @param bytes     the part
   * @return completes when the part is acknowledged
   */
  CompletableFuture<Void> uploadPart(long fileId, int partIndex, byte[] bytes);

  /**
   * Sends an envelope that references an uploaded file.
   *
   * @param peer     the peer
   * @param randomId the message's random id
   * @param envelope {@code msg_key || ciphertext}
   * @param file     the uploaded file
   * @return the message handle
   */
  CompletableFuture<MessageHandle> sendEncryptedFile(SecretChatPeer peer, long randomId, byte[] envelope,
                                                     UploadedFileRef file);

  /**
   * Sends an envelope without a file.
   *
   * @param peer     the peer
   * @param randomId the message's random id
   * @param envelope {@code msg_key || ciphertext}
   * @return the message handle
   */
  CompletableFuture<MessageHandle> sendEncrypted(SecretChatPeer peer, long randomId, byte[] envelope);

  /**
   * Drops the parts of an upload that will never be referenced. Does nothing by default.
   *
   * @param fileId the file id
   * @return completes when the discard is acknowledged
   */
  default CompletableFuture<Void> discardUpload(long fileId) {
    return CompletableFuture.completedFuture(null);
  }
}
