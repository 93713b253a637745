package com.codeheadsystems.cloak.client.exceptions;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.mtproto.exceptions.SerializationException;
import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

class FailuresTest {

  @Test
  void unwrap_stripsNestedWrappers() {
    IOException root = new IOException("reset");

    Throwable unwrapped = Failures.unwrap(new CompletionException(new ExecutionException(root)));

    assertThat(unwrapped).isSameAs(root);
  }

  @Test
  void unwrap_leavesOtherExceptions() {
    IllegalStateException e = new IllegalStateException();
    assertThat(Failures.unwrap(e)).isSameAs(e);
  }

  @Test
  void transferExceptions_passThrough() {
    UploadPartException failure = new UploadPartException(1L, 2, "lost", null);

    assertThat(Failures.toTransferException(new CompletionException(failure), "ctx")).isSameAs(failure);
  }

  @Test
  void timeout_isRetryable() {
    TransferException failure = Failures.toTransferException(new TimeoutException(), "Send");

    assertThat(failure).isInstanceOf(NetworkTimeoutException.class);
    assertThat(failure.retryable()).isTrue();
    assertThat(failure).hasMessage("Send timed out");
  }

  @Test
  void cancellation_isCancelled() {
    assertThat(Failures.toTransferException(new CancellationException(), "Send"))
        .isInstanceOf(TransferCancelledException.class);
  }

  @Test
  void protocolErrors_areFatal() {
    SerializationException cause = new SerializationException("bad");

    TransferException failure = Failures.toTransferException(cause, "Send");

    assertThat(failure.retryable()).isFalse();
    assertThat(failure).hasCause(cause);
  }

  @Test
  void unknownErrors_areFatal() {
    TransferException failure = Failures.toTransferException(new IllegalStateException("?"), "Send");

    assertThat(failure).isInstanceOf(TransportException.class);
    assertThat(failure.retryable()).isFalse();
  }
}
