package com.codeheadsystems.cloak.client.manager;

import com.codeheadsystems.cloak.client.accessor.SecretChatTransport;
import com.codeheadsystems.cloak.client.config.TransferConfig;
import com.codeheadsystems.cloak.client.exceptions.Failures;
import com.codeheadsystems.cloak.client.exceptions.TransferCancelledException;
import com.codeheadsystems.cloak.client.exceptions.TransferException;
import com.codeheadsystems.cloak.client.exceptions.UploadPartException;
import com.codeheadsystems.cloak.client.model.UploadPart;
import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits an encrypted file into parts and uploads them.
 * <p>
 * At most {@code maxConcurrentParts} parts are in flight. Each part goes through the
 * {@link BackoffRetrier}. The returned future is a join barrier: it completes once every part
 * is acknowledged, or once the in-flight parts have settled after the first part ran out of
 * attempts. No new part is started after a failure or a cancellation.
 */
public class ChunkedUploader {

  private static final Logger log = LoggerFactory.getLogger(ChunkedUploader.class);

  private final SecretChatTransport transport;
  private final BackoffRetrier retrier;
  private final int chunkSize;
  private final int maxConcurrentParts;

  /**
   * Instantiates a new Chunked uploader.
   *
   * @param transport the transport
   * @param config    the transfer config
   * @param retrier   the retry policy
   */
  public ChunkedUploader(final SecretChatTransport transport,
                         final TransferConfig config,
                         final BackoffRetrier retrier) {
    log.info("ChunkedUploader()");
    this.transport = transport;
    this.retrier = retrier;
    this.chunkSize = config.chunkSize();
    this.maxConcurrentParts = config.maxConcurrentParts();
  }

  /**
   * Number of parts a file of {@code length} bytes splits into.
   *
   * @param length    the length
   * @param chunkSize the chunk size
   * @return the int
   */
  public static int partCount(int length, int chunkSize) {
    return (length + chunkSize - 1) / chunkSize;
  }

  /**
   * Cuts the ciphertext into consecutive parts; only the last may be shorter. Empty input has no
   * parts.
   *
   * @param fileId     the file id
   * @param ciphertext the ciphertext
   * @param chunkSize  the chunk size
   * @return the parts, ordered by index
   */
  public static List<UploadPart> split(long fileId, byte[] ciphertext, int chunkSize) {
    int count = partCount(ciphertext.length, chunkSize);
    List<UploadPart> parts = new ArrayList<>(count);
    for (int index = 0; index < count; index++) {
      int from = index * chunkSize;
      int to = Math.min(from + chunkSize, ciphertext.length);
      parts.add(new UploadPart(fileId, index, Arrays.copyOfRange(ciphertext, from, to)));
    }
    return parts;
  }

  /**
   * Reassembles parts in index order, whatever order they arrive in.
   *
   * @param parts the parts of one file
   * @return the concatenated bytes
   * @throws IllegalArgumentException if an index is missing or repeated
   */
  public static byte[] join(List<UploadPart> parts) {
    List<UploadPart> sorted = new ArrayList<>(parts);
    sorted.sort(Comparator.comparingInt(UploadPart::partIndex));
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (int i = 0; i < sorted.size(); i++) {
      UploadPart part = sorted.get(i);
      if (part.partIndex() != i) {
        throw new IllegalArgumentException("Expected part " + i + " but found " + part.partIndex());
      }
      out.writeBytes(part.bytes());
    }
    return out.toByteArray();
  }

  /**
   * Uploads every part of the ciphertext.
   *
   * @param fileId     random id for this file
   * @param ciphertext the encrypted, block-padded file
   * @param cancelled  stops new parts and retries once true
   * @return the number of parts uploaded
   */
  public CompletableFuture<Integer> upload(long fileId, byte[] ciphertext, BooleanSupplier cancelled) {
    List<UploadPart> parts = split(fileId, ciphertext, chunkSize);
    log.debug("upload(fileId={}, size={}, parts={})", fileId, ciphertext.length, parts.size());
    if (parts.isEmpty()) {
      return CompletableFuture.completedFuture(0);
    }
    AtomicInteger next = new AtomicInteger();
    AtomicReference<TransferException> firstFailure = new AtomicReference<>();
    Set<CompletableFuture<?>> active = ConcurrentHashMap.newKeySet();
    CompletableFuture<Integer> done = new CompletableFuture<>();
    BooleanSupplier stopped = () -> done.isCancelled() || cancelled.getAsBoolean();
    int lanes = Math.min(maxConcurrentParts, parts.size());
    CompletableFuture<?>[] laneFutures = new CompletableFuture<?>[lanes];
    for (int i = 0; i < lanes; i++) {
      laneFutures[i] = lane(parts, next, firstFailure, active, stopped);
    }

    done.whenComplete((count, error) -> {
      if (done.isCancelled()) {
        log.debug("upload(fileId={}): cancelling {} parts in flight", fileId, active.size());
        List.copyOf(active).forEach(part -> part.cancel(true));
      }
    });
    CompletableFuture.allOf(laneFutures).whenComplete((v, error) -> {
      if (firstFailure.get() != null) {
        done.completeExceptionally(firstFailure.get());
      } else if (cancelled.getAsBoolean()) {
        done.completeExceptionally(new TransferCancelledException("Upload of file " + fileId + " was cancelled"));
      } else if (error != null) {
        done.completeExceptionally(Failures.toTransferException(error, "Upload of file " + fileId));
      } else {
        done.complete(parts.size());
      }
    });
    return done;
  }

  // One lane uploads parts one after another, taking the next unclaimed index each time.
  private CompletableFuture<Void> lane(List<UploadPart> parts, AtomicInteger next,
                                       AtomicReference<TransferException> firstFailure,
                                       Set<CompletableFuture<?>> active, BooleanSupplier cancelled) {
    if (firstFailure.get() != null || cancelled.getAsBoolean()) {
      return CompletableFuture.completedFuture(null);
    }
    int index = next.getAndIncrement();
    if (index >= parts.size()) {
      return CompletableFuture.completedFuture(null);
    }
    UploadPart part = parts.get(index);
    CompletableFuture<Void> attempt = retrier.call("Upload of part " + index + " of file " + part.fileId(),
        () -> transport.uploadPart(part.fileId(), part.partIndex(), part.bytes()), cancelled);
    active.add(attempt);
    if (cancelled.getAsBoolean()) {
      attempt.cancel(true);
    }
    return attempt
        .whenComplete((v, error) -> {
          active.remove(attempt);
          if (error != null) {
            firstFailure.compareAndSet(null, asPartFailure(part, error));
          } else {
            log.debug("uploaded(fileId={}, partIndex={})", part.fileId(), part.partIndex());
          }
        })
        .thenCompose(v -> lane(parts, next, firstFailure, active, cancelled));
  }

  private TransferException asPartFailure(UploadPart part, Throwable error) {
    TransferException failure = Failures.toTransferException(error, "Upload of part " + part.partIndex());
    if (failure instanceof UploadPartException || !failure.retryable()) {
      return failure;
    }
    return new UploadPartException(part.fileId(), part.partIndex(),
        "Part " + part.partIndex() + " of file " + part.fileId() + " failed after "
            + retrier.maxAttempts() + " attempts", failure);
  }
}
