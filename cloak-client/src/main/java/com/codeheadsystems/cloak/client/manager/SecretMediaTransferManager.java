package com.codeheadsystems.cloak.client.manager;

import com.codeheadsystems.cloak.client.accessor.SecretChatTransport;
import com.codeheadsystems.cloak.client.config.TransferConfig;
import com.codeheadsystems.cloak.client.exceptions.Failures;
import com.codeheadsystems.cloak.client.exceptions.TransferCancelledException;
import com.codeheadsystems.cloak.client.model.MediaMeta;
import com.codeheadsystems.cloak.client.model.MessageHandle;
import com.codeheadsystems.cloak.client.model.SecretChatPeer;
import com.codeheadsystems.cloak.client.model.TransferResult;
import com.codeheadsystems.cloak.client.model.TransferState;
import com.codeheadsystems.cloak.client.model.UploadedFileRef;
import com.codeheadsystems.mtproto.common.RandomProvider;
import com.codeheadsystems.mtproto.crypto.EncryptedFile;
import com.codeheadsystems.mtproto.crypto.FileKeyGenerator;
import com.codeheadsystems.mtproto.crypto.SecretMessageCipher;
import com.codeheadsystems.mtproto.crypto.SharedSecret;
import com.codeheadsystems.mtproto.tl.model.MediaDescriptor;
import com.codeheadsystems.mtproto.tl.model.WireMessage;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends secret chat messages, with or without an encrypted file.
 * <p>
 * Two key paths are kept apart. The file is encrypted under fresh random key material from the
 * {@link FileKeyGenerator}; that key material travels inside the media descriptor. The message
 * record holding the descriptor is then encrypted by the {@link SecretMessageCipher} with keys
 * derived from the chat's {@link SharedSecret}.
 * <p>
 * <strong>States of a send with a file:</strong>
 * <ol>
 *   <li>{@code IDLE -> ENCRYPTING}: file key material generated, file padded and encrypted.</li>
 *   <li>{@code ENCRYPTING -> UPLOADING}: parts dispatched by the {@link ChunkedUploader}.</li>
 *   <li>{@code UPLOADING -> DESCRIPTOR_BUILT}: every part acknowledged, descriptor built.</li>
 *   <li>{@code DESCRIPTOR_BUILT -> MESSAGE_SERIALIZED -> MESSAGE_ENCRYPTED}: record serialized
 *       and sealed into an envelope.</li>
 *   <li>{@code MESSAGE_ENCRYPTED -> SENT}: envelope and file reference sent.</li>
 * </ol>
 * A message without a file goes straight from {@code IDLE} to {@code MESSAGE_SERIALIZED}. Any
 * failure ends in {@code FAILED}: network failures after the retry policy gives up, protocol
 * failures immediately.
 */
@Singleton
public class SecretMediaTransferManager {

  private static final Logger log = LoggerFactory.getLogger(SecretMediaTransferManager.class);

  private final SecretChatTransport transport;
  private final RandomProvider randomProvider;
  private final FileKeyGenerator fileKeyGenerator;
  private final SecretMessageCipher messageCipher;
  private final BackoffRetrier retrier;
  private final ChunkedUploader uploader;
  private final Executor executor;
  private final Map<Long, SecretMediaTransfer> inFlight = new ConcurrentHashMap<>();

  /**
   * Instantiates a new Secret media transfer manager on the common pool.
   *
   * @param transport      the transport
   * @param config         the config
   * @param randomProvider the random provider
   */
  @Inject
  public SecretMediaTransferManager(final SecretChatTransport transport,
                                    final TransferConfig config,
                                    final RandomProvider randomProvider) {
    this(transport, config, randomProvider, ForkJoinPool.commonPool());
  }

  /**
   * Instantiates a new Secret media transfer manager.
   *
   * @param transport      the transport
   * @param config         the config
   * @param randomProvider the random provider
   * @param executor       runs encryption and delayed retries
   */
  public SecretMediaTransferManager(final SecretChatTransport transport,
                                    final TransferConfig config,
                                    final RandomProvider randomProvider,
                                    final Executor executor) {
    log.info("SecretMediaTransferManager()");
    log.debug("layer={}, chunkSize={}, maxConcurrentParts={}, maxAttempts={}",
        config.protocolLayer().number(), config.chunkSize(), config.maxConcurrentParts(), config.maxAttempts());
    this.transport = transport;
    this.randomProvider = randomProvider;
    this.fileKeyGenerator = new FileKeyGenerator(randomProvider);
    this.messageCipher = new SecretMessageCipher(randomProvider);
    this.executor = executor;
    this.retrier = new BackoffRetrier(config, executor);
    this.uploader = new ChunkedUploader(transport, config, retrier);
  }

  /**
   * Sends a message, uploading and attaching the file when one is given.
   *
   * @param secret    the chat's shared secret
   * @param peer      the chat
   * @param text      the message text
   * @param fileBytes the file, if any
   * @param meta      describes the file; may be null when there is no file
   * @return completes with the outcome, never exceptionally
   */
  public CompletableFuture<TransferResult> sendEncryptedMedia(final SharedSecret secret,
                                                              final SecretChatPeer peer,
                                                              final String text,
                                                              final Optional<byte[]> fileBytes,
                                                              final MediaMeta meta) {
    return begin(secret, peer, text, fileBytes, meta).result();
  }

  /**
   * Starts a send and returns it for observation and cancellation.
   *
   * @param secret    the chat's shared secret
   * @param peer      the chat
   * @param text      the message text
   * @param fileBytes the file, if any
   * @param meta      describes the file; may be null when there is no file
   * @return the transfer
   */
  public SecretMediaTransfer begin(final SharedSecret secret,
                                   final SecretChatPeer peer,
                                   final String text,
                                   final Optional<byte[]> fileBytes,
                                   final MediaMeta meta) {
    if (fileBytes.isPresent() && meta == null) {
      throw new IllegalArgumentException("Media metadata is required when a file is attached");
    }
    long randomId = randomProvider.nextId();
    log.debug("begin(peer={}, randomId={}, file={})", peer, randomId, fileBytes.map(b -> b.length).orElse(null));
    SecretMediaTransfer transfer = new SecretMediaTransfer(randomId, peer, transport);
    inFlight.put(randomId, transfer);
    transfer.result().whenComplete((result, error) -> inFlight.remove(randomId));

    Integer ttl = meta == null ? null : meta.ttl();
    CompletableFuture<MessageHandle> sent = fileBytes.isPresent()
        ? sendWithFile(transfer, secret, text, fileBytes.get(), meta)
        : sendTextOnly(transfer, secret, text, ttl);
    sent.whenComplete((handle, error) -> {
      try {
        if (error != null) {
          transfer.fail(Failures.toTransferException(error, "Transfer " + randomId));
        } else {
          transfer.succeed(handle);
        }
      } catch (RuntimeException e) {
        log.error("Unable to settle transfer {}", randomId, e);
        transfer.fail(Failures.toTransferException(e, "Transfer " + randomId));
      }
    });
    return transfer;
  }

  /**
   * Cancels every in-flight transfer to the peer, for when the chat is torn down.
   *
   * @param peer the peer
   * @return how many transfers were cancelled
   */
  public int cancelAll(final SecretChatPeer peer) {
    log.debug("cancelAll(peer={})", peer);
    List<SecretMediaTransfer> matching = inFlight.values().stream()
        .filter(transfer -> transfer.peer().equals(peer))
        .toList();
    matching.forEach(SecretMediaTransfer::cancel);
    return matching.size();
  }

  /**
   * Transfers that have not finished yet.
   *
   * @return the list
   */
  public List<SecretMediaTransfer> inFlight() {
    return List.copyOf(inFlight.values());
  }

  private CompletableFuture<MessageHandle> sendWithFile(SecretMediaTransfer transfer, SharedSecret secret,
                                                        String text, byte[] fileBytes, MediaMeta meta) {
    long randomId = transfer.randomId();
    return CompletableFuture.supplyAsync(() -> {
      step(transfer, TransferState.ENCRYPTING);
      EncryptedFile encrypted = fileKeyGenerator.encryptFile(fileBytes);
      transfer.keyMaterial(encrypted.keyMaterial());
      return encrypted;
    }, executor).thenCompose(encrypted -> {
      long fileId = randomProvider.nextId();
      transfer.fileId(fileId);
      step(transfer, TransferState.UPLOADING);
      return transfer.track(uploader.upload(fileId, encrypted.ciphertext(), transfer::isCancelled))
          .thenCompose(parts -> {
            MediaDescriptor media = meta.describe(encrypted.keyMaterial(), encrypted.plaintextSize());
            step(transfer, TransferState.DESCRIPTOR_BUILT);
            byte[] envelope = seal(transfer, secret, new WireMessage(randomId, meta.ttl(), text, media,
                null, null, null));
            UploadedFileRef file = UploadedFileRef.of(fileId, parts, encrypted.keyMaterial().fingerprint());
            return transfer.track(retrier.call("Send of message " + randomId,
                () -> transport.sendEncryptedFile(transfer.peer(), randomId, envelope, file),
                transfer::isCancelled));
          });
    });
  }

  private CompletableFuture<MessageHandle> sendTextOnly(SecretMediaTransfer transfer, SharedSecret secret,
                                                        String text, Integer ttl) {
    long randomId = transfer.randomId();
    return CompletableFuture.supplyAsync(
            () -> seal(transfer, secret, new WireMessage(randomId, ttl, text, null, null, null, null)), executor)
        .thenCompose(envelope -> transfer.track(retrier.call("Send of message " + randomId,
            () -> transport.sendEncrypted(transfer.peer(), randomId, envelope),
            transfer::isCancelled)));
  }

  private byte[] seal(SecretMediaTransfer transfer, SharedSecret secret, WireMessage message) {
    byte[] record = message.toBytes();
    step(transfer, TransferState.MESSAGE_SERIALIZED);
    byte[] envelope = messageCipher.encrypt(record, secret, true);
    step(transfer, TransferState.MESSAGE_ENCRYPTED);
    return envelope;
  }

  private void step(SecretMediaTransfer transfer, TransferState next) {
    if (!transfer.advance(next)) {
      throw new TransferCancelledException("Transfer " + transfer.randomId() + " stopped before " + next);
    }
  }
}
