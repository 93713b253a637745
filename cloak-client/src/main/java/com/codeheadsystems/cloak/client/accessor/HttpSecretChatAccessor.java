package com.codeheadsystems.cloak.client.accessor;

import com.codeheadsystems.cloak.client.config.TransferConfig;
import com.codeheadsystems.cloak.client.exceptions.Failures;
import com.codeheadsystems.cloak.client.exceptions.NetworkTimeoutException;
import com.codeheadsystems.cloak.client.exceptions.TransferException;
import com.codeheadsystems.cloak.client.exceptions.TransportException;
import com.codeheadsystems.cloak.client.exceptions.UploadPartException;
import com.codeheadsystems.cloak.client.model.GatewayConnectionInfo;
import com.codeheadsystems.cloak.client.model.MessageHandle;
import com.codeheadsystems.cloak.client.model.SecretChatPeer;
import com.codeheadsystems.cloak.client.model.UploadedFileRef;
import com.codeheadsystems.cloak.client.model.wire.DiscardUploadRequest;
import com.codeheadsystems.cloak.client.model.wire.SendEncryptedFileRequest;
import com.codeheadsystems.cloak.client.model.wire.SendEncryptedRequest;
import com.codeheadsystems.cloak.client.model.wire.UploadPartRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for a gateway that relays secret chat calls to the network.
 * <p>
 * Requests are JSON with base64 byte fields. The {@code endpoint} in
 * {@link GatewayConnectionInfo} is the gateway's base URL; path segments are appended per call.
 * <p>
 * Failure mapping: I/O errors, HTTP 429 and 5xx are retryable ({@link UploadPartException} for
 * parts, a retryable {@link TransportException} for sends); request timeouts and HTTP 408 are
 * {@link NetworkTimeoutException}s; any other 4xx is a fatal {@link TransportException}.
 */
@Singleton
public class HttpSecretChatAccessor implements SecretChatTransport {

  private static final Logger log = LoggerFactory.getLogger(HttpSecretChatAccessor.class);

  static final String UPLOAD_PART = "/upload/part";
  static final String UPLOAD_DISCARD = "/upload/discard";
  static final String SEND_ENCRYPTED_FILE = "/messages/sendEncryptedFile";
  static final String SEND_ENCRYPTED = "/messages/sendEncrypted";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final GatewayConnectionInfo gateway;
  private final Duration callTimeout;

  /**
   * Instantiates a new Http secret chat accessor.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param gateway      the gateway
   * @param config       the transfer config, for the per-request timeout
   */
  @Inject
  public HttpSecretChatAccessor(final HttpClient httpClient,
                                final ObjectMapper objectMapper,
                                final GatewayConnectionInfo gateway,
                                final TransferConfig config) {
    log.info("HttpSecretChatAccessor()");
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.gateway = gateway;
    this.callTimeout = config.callTimeout();
  }

  // ── Upload ────────────────────────────────────────────────────────────────

  @Override
  public CompletableFuture<Void> uploadPart(final long fileId, final int partIndex, final byte[] bytes) {
    log.debug("uploadPart(fileId={}, partIndex={}, size={})", fileId, partIndex, bytes.length);
    BiFunction<String, Throwable, TransferException> retryable =
        (message, cause) -> new UploadPartException(fileId, partIndex, message, cause);
    return postAsync(UPLOAD_PART, new UploadPartRequest(fileId, partIndex, bytes))
        .handle((response, error) -> {
          if (error != null) {
            throw mapFailure(UPLOAD_PART, error, retryable);
          }
          checkStatus(UPLOAD_PART, response.statusCode(), retryable);
          return null;
        });
  }

  /**
   * Best effort: the gateway drops the parts of an abandoned upload.
   *
   * @param fileId the file id
   * @return completes when the gateway acknowledges the discard
   */
  @Override
  public CompletableFuture<Void> discardUpload(final long fileId) {
    log.debug("discardUpload(fileId={})", fileId);
    return postAsync(UPLOAD_DISCARD, new DiscardUploadRequest(fileId))
        .handle((response, error) -> {
          if (error != null) {
            throw mapFailure(UPLOAD_DISCARD, error, this::retryableTransport);
          }
          checkStatus(UPLOAD_DISCARD, response.statusCode(), this::retryableTransport);
          return null;
        });
  }

  // ── Messages ──────────────────────────────────────────────────────────────

  @Override
  public CompletableFuture<MessageHandle> sendEncryptedFile(final SecretChatPeer peer,
                                                            final long randomId,
                                                            final byte[] envelope,
                                                            final UploadedFileRef file) {
    log.debug("sendEncryptedFile(peer={}, randomId={}, fileId={})", peer, randomId, file.fileId());
    return send(SEND_ENCRYPTED_FILE, new SendEncryptedFileRequest(peer, randomId, envelope, file));
  }

  @Override
  public CompletableFuture<MessageHandle> sendEncrypted(final SecretChatPeer peer,
                                                        final long randomId,
                                                        final byte[] envelope) {
    log.debug("sendEncrypted(peer={}, randomId={})", peer, randomId);
    return send(SEND_ENCRYPTED, new SendEncryptedRequest(peer, randomId, envelope));
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private CompletableFuture<MessageHandle> send(String path, Object body) {
    return postAsync(path, body).handle((response, error) -> {
      if (error != null) {
        throw mapFailure(path, error, this::retryableTransport);
      }
      checkStatus(path, response.statusCode(), this::retryableTransport);
      MessageHandle handle;
      try {
        handle = objectMapper.readValue(response.body(), MessageHandle.class);
      } catch (JsonProcessingException e) {
        throw new TransportException("Unreadable response from " + path, e);
      }
      if (handle == null) {
        throw new TransportException("Empty response from " + path, null);
      }
      return handle;
    });
  }

  private CompletableFuture<HttpResponse<String>> postAsync(String path, Object body) {
    try {
      return httpClient.sendAsync(jsonPost(path, body), HttpResponse.BodyHandlers.ofString());
    } catch (JsonProcessingException e) {
      return CompletableFuture.failedFuture(new TransportException("Unable to serialize request for " + path, e));
    }
  }

  private HttpRequest jsonPost(String path, Object body) throws JsonProcessingException {
    String requestBody = objectMapper.writeValueAsString(body);
    return HttpRequest.newBuilder()
        .uri(uri(path))
        .timeout(callTimeout)
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(requestBody))
        .build();
  }

  private URI uri(String path) {
    URI base = gateway.endpoint();
    return base.resolve(base.getPath() + path);
  }

  private TransferException retryableTransport(String message, Throwable cause) {
    return new TransportException(message, cause, true);
  }

  private TransferException mapFailure(String path, Throwable error,
                                       BiFunction<String, Throwable, TransferException> retryable) {
    Throwable cause = Failures.unwrap(error);
    if (cause instanceof TransferException transferException) {
      return transferException;
    }
    if (cause instanceof HttpTimeoutException) {
      return new NetworkTimeoutException("HTTP request timed out for " + path, cause);
    }
    if (cause instanceof IOException) {
      return retryable.apply("HTTP request failed for " + path, cause);
    }
    return new TransportException("HTTP request failed for " + path, cause);
  }

  private void checkStatus(String path, int statusCode,
                           BiFunction<String, Throwable, TransferException> retryable) {
    if (statusCode == 408) {
      throw new NetworkTimeoutException("Gateway returned HTTP 408 for " + path, null);
    }
    if (statusCode == 429 || statusCode >= 500) {
      throw retryable.apply("Gateway returned HTTP " + statusCode + " for " + path, null);
    }
    if (statusCode >= 400) {
      throw new TransportException("Gateway returned HTTP " + statusCode + " for " + path, null);
    }
  }
}
