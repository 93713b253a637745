package com.codeheadsystems.cloak.client.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.cloak.client.accessor.SecretChatTransport;
import com.codeheadsystems.cloak.client.config.TransferConfig;
import com.codeheadsystems.cloak.client.exceptions.Failures;
import com.codeheadsystems.cloak.client.exceptions.TransportException;
import com.codeheadsystems.cloak.client.exceptions.UploadPartException;
import com.codeheadsystems.cloak.client.model.MessageHandle;
import com.codeheadsystems.cloak.client.model.SecretChatPeer;
import com.codeheadsystems.cloak.client.model.UploadPart;
import com.codeheadsystems.cloak.client.model.UploadedFileRef;
import com.codeheadsystems.mtproto.common.RandomProvider;
import com.codeheadsystems.mtproto.config.ProtocolLayer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChunkedUploaderTest {

  private static final int CHUNK = 524_288;
  private static final TransferConfig CONFIG = TransferConfig.forTesting();

  @Mock private SecretChatTransport transport;

  private final RandomProvider randomProvider = new RandomProvider();

  private ChunkedUploader uploader(SecretChatTransport target, TransferConfig config) {
    return new ChunkedUploader(target, config, new BackoffRetrier(config, ForkJoinPool.commonPool()));
  }

  @ParameterizedTest
  @CsvSource({
      "0,0",
      "1,1",
      "524288,1",
      "524289,2",
      "1048576,2",
      "1572880,4"
  })
  void split_partCountAndSizes(int length, int expectedParts) {
    List<UploadPart> parts = ChunkedUploader.split(7L, new byte[length], CHUNK);

    assertThat(parts).hasSize(expectedParts);
    assertThat(ChunkedUploader.partCount(length, CHUNK)).isEqualTo(expectedParts);
    for (int i = 0; i < parts.size(); i++) {
      assertThat(parts.get(i).partIndex()).isEqualTo(i);
      assertThat(parts.get(i).fileId()).isEqualTo(7L);
      if (i < parts.size() - 1) {
        assertThat(parts.get(i).bytes()).hasSize(CHUNK);
      }
    }
  }

  @Test
  void join_reassemblesInIndexOrder() {
    byte[] data = randomProvider.randomBytes(3 * CHUNK + 17);
    List<UploadPart> parts = new ArrayList<>(ChunkedUploader.split(1L, data, CHUNK));
    Collections.reverse(parts);

    assertThat(ChunkedUploader.join(parts)).isEqualTo(data);
  }

  @Test
  void join_missingPart() {
    List<UploadPart> parts = new ArrayList<>(ChunkedUploader.split(1L, new byte[3 * 1024], 1024));
    parts.remove(1);

    assertThatThrownBy(() -> ChunkedUploader.join(parts))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Expected part 1");
  }

  @Test
  void upload_sendsEveryPart() throws Exception {
    byte[] data = randomProvider.randomBytes(2 * CHUNK + 100);
    when(transport.uploadPart(eq(9L), anyInt(), any(byte[].class)))
        .thenReturn(CompletableFuture.completedFuture(null));

    int parts = uploader(transport, CONFIG).upload(9L, data, () -> false).get(5, TimeUnit.SECONDS);

    assertThat(parts).isEqualTo(3);
    verify(transport).uploadPart(eq(9L), eq(0), any(byte[].class));
    verify(transport).uploadPart(eq(9L), eq(1), any(byte[].class));
    verify(transport).uploadPart(eq(9L), eq(2), any(byte[].class));
  }

  @Test
  void upload_emptyCiphertextHasNoParts() throws Exception {
    assertThat(uploader(transport, CONFIG).upload(9L, new byte[0], () -> false).get(5, TimeUnit.SECONDS)).isZero();
    verify(transport, never()).uploadPart(anyLong(), anyInt(), any(byte[].class));
  }

  @Test
  void upload_retriesFailingPart() throws Exception {
    when(transport.uploadPart(eq(9L), anyInt(), any(byte[].class)))
        .thenReturn(CompletableFuture.failedFuture(new UploadPartException(9L, 0, "flood", null)))
        .thenReturn(CompletableFuture.failedFuture(new UploadPartException(9L, 0, "flood", null)))
        .thenReturn(CompletableFuture.completedFuture(null));

    int parts = uploader(transport, CONFIG).upload(9L, new byte[100], () -> false).get(5, TimeUnit.SECONDS);

    assertThat(parts).isEqualTo(1);
    verify(transport, times(3)).uploadPart(eq(9L), eq(0), any(byte[].class));
  }

  @Test
  void upload_exhaustedPartFailsUpload() {
    when(transport.uploadPart(eq(9L), anyInt(), any(byte[].class)))
        .thenReturn(CompletableFuture.failedFuture(new TransportException("503", null, true)));

    CompletableFuture<Integer> result = uploader(transport, CONFIG).upload(9L, new byte[100], () -> false);

    Throwable failure = Failures.unwrap(catchThrowable(() -> result.get(5, TimeUnit.SECONDS)));
    assertThat(failure).isInstanceOf(UploadPartException.class).hasCauseInstanceOf(TransportException.class);
    assertThat(((UploadPartException) failure).partIndex()).isZero();
    assertThat(((UploadPartException) failure).fileId()).isEqualTo(9L);
    verify(transport, times(3)).uploadPart(eq(9L), eq(0), any(byte[].class));
  }

  @Test
  void upload_fatalPartFailureIsNotRetried() {
    when(transport.uploadPart(eq(9L), anyInt(), any(byte[].class)))
        .thenReturn(CompletableFuture.failedFuture(new TransportException("400", null)));

    CompletableFuture<Integer> result = uploader(transport, CONFIG).upload(9L, new byte[100], () -> false);

    assertThat(Failures.unwrap(catchThrowable(() -> result.get(5, TimeUnit.SECONDS))))
        .isInstanceOf(TransportException.class);
    verify(transport, times(1)).uploadPart(eq(9L), eq(0), any(byte[].class));
  }

  @Test
  void upload_boundsPartsInFlight() throws Exception {
    TransferConfig config = new TransferConfig(ProtocolLayer.LAYER_73, 1024, 3, 3,
        Duration.ofMillis(1), Duration.ofSeconds(5));
    SlowTransport slow = new SlowTransport();

    int parts = uploader(slow, config).upload(4L, new byte[20 * 1024], () -> false).get(10, TimeUnit.SECONDS);

    assertThat(parts).isEqualTo(20);
    assertThat(slow.calls).hasValue(20);
    assertThat(slow.maxInFlight.get()).isBetween(1, 3);
  }

  @Test
  void upload_cancellingResultCancelsPartsInFlight() {
    TransferConfig config = new TransferConfig(ProtocolLayer.LAYER_73, 1024, 2, 3,
        Duration.ofMillis(1), Duration.ofSeconds(5));
    List<CompletableFuture<Void>> dispatched = Collections.synchronizedList(new ArrayList<>());
    when(transport.uploadPart(eq(6L), anyInt(), any(byte[].class))).thenAnswer(invocation -> {
      CompletableFuture<Void> part = new CompletableFuture<>();
      dispatched.add(part);
      return part;
    });

    CompletableFuture<Integer> result = uploader(transport, config).upload(6L, new byte[5 * 1024], () -> false);
    assertThat(dispatched).hasSize(2);
    result.cancel(true);

    assertThat(dispatched).hasSize(2).allMatch(CompletableFuture::isCancelled);
    verify(transport, times(2)).uploadPart(eq(6L), anyInt(), any(byte[].class));
  }

  /**
   * Acknowledges each part after a short delay while counting concurrent calls.
   */
  static class SlowTransport implements SecretChatTransport {

    final AtomicInteger inFlight = new AtomicInteger();
    final AtomicInteger maxInFlight = new AtomicInteger();
    final AtomicInteger calls = new AtomicInteger();

    @Override
    public CompletableFuture<Void> uploadPart(long fileId, int partIndex, byte[] bytes) {
      calls.incrementAndGet();
      maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
      return CompletableFuture.runAsync(() -> inFlight.decrementAndGet(),
          CompletableFuture.delayedExecutor(5, TimeUnit.MILLISECONDS));
    }

    @Override
    public CompletableFuture<MessageHandle> sendEncryptedFile(SecretChatPeer peer, long randomId, byte[] envelope,
                                                              UploadedFileRef file) {
      throw new UnsupportedOperationException();
    }

    @Override
    public CompletableFuture<MessageHandle> sendEncrypted(SecretChatPeer peer, long randomId, byte[] envelope) {
      throw new UnsupportedOperationException();
    }
  }
}
