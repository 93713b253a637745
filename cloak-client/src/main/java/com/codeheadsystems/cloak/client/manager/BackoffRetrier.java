package com.codeheadsystems.cloak.client.manager;

import com.codeheadsystems.cloak.client.config.TransferConfig;
import com.codeheadsystems.cloak.client.exceptions.Failures;
import com.codeheadsystems.cloak.client.exceptions.TransferCancelledException;
import com.codeheadsystems.cloak.client.exceptions.TransferException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a network call under the transfer retry policy: each attempt is bounded by the call
 * timeout, retryable failures are attempted again after {@code baseDelay * 2^attempt}, and the
 * last failure is surfaced once {@code maxAttempts} is used up. Fatal failures are surfaced
 * immediately.
 */
public class BackoffRetrier {

  private static final Logger log = LoggerFactory.getLogger(BackoffRetrier.class);

  private final TransferConfig config;
  private final Executor executor;

  /**
   * Instantiates a new Backoff retrier.
   *
   * @param config   the retry settings
   * @param executor runs the delayed retries
   */
  public BackoffRetrier(final TransferConfig config, final Executor executor) {
    this.config = config;
    this.executor = executor;
  }

  /**
   * Calls {@code call} until it succeeds, fails fatally, runs out of attempts or
   * {@code cancelled} turns true.
   * <p>
   * Cancelling the returned future cancels the attempt in flight. An attempt that times out has
   * its future cancelled before the next one starts.
   *
   * @param label     names the call in logs and messages
   * @param call      starts one attempt
   * @param cancelled checked before each retry
   * @param <T>       result type
   * @return the result of the first successful attempt; failures are {@link TransferException}s
   */
  public <T> CompletableFuture<T> call(String label, Supplier<CompletableFuture<T>> call,
                                       BooleanSupplier cancelled) {
    CompletableFuture<T> result = new CompletableFuture<>();
    AtomicReference<CompletableFuture<?>> current = new AtomicReference<>();
    BooleanSupplier stopped = () -> result.isDone() || cancelled.getAsBoolean();
    attempt(label, call, stopped, current, 0).whenComplete((value, error) -> {
      if (error != null) {
        result.completeExceptionally(Failures.unwrap(error));
      } else {
        result.complete(value);
      }
    });
    result.whenComplete((value, error) -> {
      CompletableFuture<?> inFlight = current.get();
      if (inFlight != null && !inFlight.isDone()) {
        log.debug("call(label={}): abandoning the attempt in flight", label);
        inFlight.cancel(true);
      }
    });
    return result;
  }

  private <T> CompletableFuture<T> attempt(String label, Supplier<CompletableFuture<T>> call,
                                           BooleanSupplier stopped, AtomicReference<CompletableFuture<?>> current,
                                           int attempt) {
    if (attempt > 0 && stopped.getAsBoolean()) {
      return CompletableFuture.failedFuture(new TransferCancelledException(label + " was cancelled"));
    }
    CompletableFuture<T> original;
    CompletableFuture<T> started;
    try {
      original = call.get();
      started = original.copy();
    } catch (RuntimeException e) {
      original = null;
      started = CompletableFuture.failedFuture(e);
    }
    CompletableFuture<T> inFlight = original;
    if (inFlight != null) {
      current.set(inFlight);
      // The caller may have given up while the attempt was being started.
      if (stopped.getAsBoolean()) {
        inFlight.cancel(true);
      }
    }
    return started
        .orTimeout(config.callTimeout().toMillis(), TimeUnit.MILLISECONDS)
        .exceptionallyCompose(error -> {
          if (inFlight != null && !inFlight.isDone()) {
            inFlight.cancel(true);
          }
          TransferException failure = Failures.toTransferException(error, label);
          if (stopped.getAsBoolean()) {
            return CompletableFuture.failedFuture(new TransferCancelledException(label + " was cancelled"));
          }
          if (!failure.retryable() || attempt + 1 >= config.maxAttempts()) {
            return CompletableFuture.failedFuture(failure);
          }
          long delay = config.baseDelay().toMillis() * (1L << attempt);
          log.debug("attempt(label={}, attempt={}, delayMillis={}): {}", label, attempt + 1, delay,
              failure.getMessage());
          return CompletableFuture.supplyAsync(() -> null,
                  CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS, executor))
              .thenCompose(v -> attempt(label, call, stopped, current, attempt + 1));
        });
  }

  public int maxAttempts() {
    return config.maxAttempts();
  }
}
