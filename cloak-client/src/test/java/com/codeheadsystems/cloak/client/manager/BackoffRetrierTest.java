package com.codeheadsystems.cloak.client.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import com.codeheadsystems.cloak.client.config.TransferConfig;
import com.codeheadsystems.cloak.client.exceptions.Failures;
import com.codeheadsystems.cloak.client.exceptions.NetworkTimeoutException;
import com.codeheadsystems.cloak.client.exceptions.TransferCancelledException;
import com.codeheadsystems.cloak.client.exceptions.TransferException;
import com.codeheadsystems.cloak.client.exceptions.TransportException;
import com.codeheadsystems.mtproto.config.ProtocolLayer;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class BackoffRetrierTest {

  private final BackoffRetrier retrier = new BackoffRetrier(TransferConfig.forTesting(), ForkJoinPool.commonPool());

  private static Throwable failureOf(CompletableFuture<?> future) {
    return Failures.unwrap(catchThrowable(() -> future.get(5, TimeUnit.SECONDS)));
  }

  @Test
  void call_succeedsAfterRetryableFailures() throws Exception {
    AtomicInteger calls = new AtomicInteger();

    CompletableFuture<String> result = retrier.call("flaky", () -> calls.incrementAndGet() < 3
        ? CompletableFuture.<String>failedFuture(new TransportException("503", null, true))
        : CompletableFuture.completedFuture("ok"), () -> false);

    assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo("ok");
    assertThat(calls).hasValue(3);
  }

  @Test
  void call_surfacesLastFailureWhenAttemptsRunOut() {
    AtomicInteger calls = new AtomicInteger();
    TransportException last = new TransportException("503 again", null, true);

    CompletableFuture<String> result = retrier.call("down", () -> {
      calls.incrementAndGet();
      return CompletableFuture.failedFuture(last);
    }, () -> false);

    assertThat(failureOf(result)).isSameAs(last);
    assertThat(calls).hasValue(3);
  }

  @Test
  void call_doesNotRetryFatalFailures() {
    AtomicInteger calls = new AtomicInteger();

    CompletableFuture<String> result = retrier.call("rejected", () -> {
      calls.incrementAndGet();
      return CompletableFuture.failedFuture(new TransportException("400", null));
    }, () -> false);

    assertThat(failureOf(result)).isInstanceOf(TransportException.class);
    assertThat(calls).hasValue(1);
  }

  @Test
  void call_timesOutEachAttempt() {
    BackoffRetrier quick = new BackoffRetrier(new TransferConfig(ProtocolLayer.LAYER_73, 1024, 1, 2,
        Duration.ofMillis(1), Duration.ofMillis(20)), ForkJoinPool.commonPool());
    AtomicInteger calls = new AtomicInteger();

    CompletableFuture<String> result = quick.call("hang", () -> {
      calls.incrementAndGet();
      return new CompletableFuture<>();
    }, () -> false);

    Throwable failure = failureOf(result);
    assertThat(failure).isInstanceOf(NetworkTimeoutException.class);
    assertThat(((TransferException) failure).retryable()).isTrue();
    assertThat(calls).hasValue(2);
  }

  @Test
  void call_thrownExceptionCountsAsFailure() {
    CompletableFuture<String> result = retrier.call("throws", () -> {
      throw new IllegalStateException("boom");
    }, () -> false);

    assertThat(failureOf(result)).isInstanceOf(TransportException.class).hasCauseInstanceOf(IllegalStateException.class);
  }

  @Test
  void call_stopsRetryingOnceCancelled() {
    AtomicInteger calls = new AtomicInteger();

    CompletableFuture<String> result = retrier.call("cancelled", () -> {
      calls.incrementAndGet();
      return CompletableFuture.failedFuture(new TransportException("503", null, true));
    }, () -> true);

    assertThat(failureOf(result)).isInstanceOf(TransferCancelledException.class);
    assertThat(calls).hasValue(1);
  }

  @Test
  void call_timedOutAttemptIsCancelled() {
    BackoffRetrier quick = new BackoffRetrier(new TransferConfig(ProtocolLayer.LAYER_73, 1024, 1, 2,
        Duration.ofMillis(1), Duration.ofMillis(20)), ForkJoinPool.commonPool());
    List<CompletableFuture<String>> attempts = new CopyOnWriteArrayList<>();

    CompletableFuture<String> result = quick.call("hang", () -> {
      CompletableFuture<String> attempt = new CompletableFuture<>();
      attempts.add(attempt);
      return attempt;
    }, () -> false);

    assertThat(failureOf(result)).isInstanceOf(NetworkTimeoutException.class);
    assertThat(attempts).hasSize(2).allMatch(CompletableFuture::isCancelled);
  }

  @Test
  void call_cancellingResultCancelsAttemptInFlight() {
    CompletableFuture<String> attempt = new CompletableFuture<>();
    AtomicInteger calls = new AtomicInteger();

    CompletableFuture<String> result = retrier.call("in flight", () -> {
      calls.incrementAndGet();
      return attempt;
    }, () -> false);
    result.cancel(true);

    assertThat(attempt).isCancelled();
    assertThat(calls).hasValue(1);
  }

  @Test
  void call_cancellingResultDuringBackoffStopsRetries() throws Exception {
    BackoffRetrier slow = new BackoffRetrier(new TransferConfig(ProtocolLayer.LAYER_73, 1024, 1, 3,
        Duration.ofMillis(50), Duration.ofSeconds(5)), ForkJoinPool.commonPool());
    AtomicInteger calls = new AtomicInteger();

    CompletableFuture<String> result = slow.call("backing off", () -> {
      calls.incrementAndGet();
      return CompletableFuture.failedFuture(new TransportException("503", null, true));
    }, () -> false);
    result.cancel(true);
    Thread.sleep(300);

    assertThat(calls).hasValue(1);
  }
}
