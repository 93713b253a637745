package com.codeheadsystems.cloak.client.config;

import com.codeheadsystems.mtproto.config.ProtocolLayer;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;

/**
 * Transfer tuning: wire layer, part size, upload concurrency and the retry policy shared by part
 * uploads and the final send.
 * <p>
 * For production use {@link #defaults()} or {@link #fromClasspath()}, which reads
 * {@value #RESOURCE_NAME}. For tests use {@link #forTesting()}, which keeps the same sizes but
 * backs off in milliseconds.
 *
 * @param protocolLayer      the secret chat wire layer
 * @param chunkSize          upload part size in bytes
 * @param maxConcurrentParts upload parts in flight per file
 * @param maxAttempts        attempts per network call, the first included
 * @param baseDelay          backoff before retry {@code n} is {@code baseDelay * 2^n}
 * @param callTimeout        bound on each network call
 */
public record TransferConfig(ProtocolLayer protocolLayer, int chunkSize, int maxConcurrentParts,
                             int maxAttempts, Duration baseDelay, Duration callTimeout) {

  public static final String RESOURCE_NAME = "cloak-transfer.json";
  public static final int DEFAULT_CHUNK_SIZE = 512 * 1024;
  public static final int DEFAULT_MAX_CONCURRENT_PARTS = 4;
  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(500);
  public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(30);

  /**
   * Validates the values. Part sizes must divide 512 KiB and be a multiple of 1 KiB.
   */
  public TransferConfig {
    if (protocolLayer == null) {
      throw new IllegalArgumentException("Protocol layer is required");
    }
    if (chunkSize <= 0 || chunkSize % 1024 != 0 || DEFAULT_CHUNK_SIZE % chunkSize != 0) {
      throw new IllegalArgumentException("Invalid chunk size: " + chunkSize);
    }
    if (maxConcurrentParts < 1) {
      throw new IllegalArgumentException("maxConcurrentParts must be positive: " + maxConcurrentParts);
    }
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
    }
    if (baseDelay == null || baseDelay.isNegative()) {
      throw new IllegalArgumentException("Invalid base delay: " + baseDelay);
    }
    if (callTimeout == null || callTimeout.isNegative() || callTimeout.isZero()) {
      throw new IllegalArgumentException("Invalid call timeout: " + callTimeout);
    }
  }

  public static TransferConfig defaults() {
    return new TransferConfig(ProtocolLayer.LAYER_73, DEFAULT_CHUNK_SIZE, DEFAULT_MAX_CONCURRENT_PARTS,
        DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_CALL_TIMEOUT);
  }

  /**
   * Production sizes with a 1 ms backoff and a 5 s call timeout. Do not use in production.
   *
   * @return the transfer config
   */
  public static TransferConfig forTesting() {
    return new TransferConfig(ProtocolLayer.LAYER_73, DEFAULT_CHUNK_SIZE, DEFAULT_MAX_CONCURRENT_PARTS,
        DEFAULT_MAX_ATTEMPTS, Duration.ofMillis(1), Duration.ofSeconds(5));
  }

  /**
   * Reads a JSON document. Missing fields take their defaults; an unsupported {@code layer} fails
   * with {@link com.codeheadsystems.mtproto.exceptions.ProtocolLayerUnsupportedException}.
   *
   * @param in the json
   * @return the transfer config
   */
  public static TransferConfig fromJson(InputStream in) {
    try {
      return new ObjectMapper().readValue(in, Settings.class).toConfig();
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read transfer configuration", e);
    }
  }

  /**
   * Reads {@value #RESOURCE_NAME} from the classpath, or returns {@link #defaults()} if it is
   * absent.
   *
   * @return the transfer config
   */
  public static TransferConfig fromClasspath() {
    InputStream in = TransferConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME);
    if (in == null) {
      return defaults();
    }
    try (in) {
      return fromJson(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to close " + RESOURCE_NAME, e);
    }
  }

  /**
   * JSON shape of the configuration file.
   */
  record Settings(
      @JsonProperty("layer") Integer layer,
      @JsonProperty("chunkSize") Integer chunkSize,
      @JsonProperty("maxConcurrentParts") Integer maxConcurrentParts,
      @JsonProperty("maxAttempts") Integer maxAttempts,
      @JsonProperty("baseDelayMillis") Long baseDelayMillis,
      @JsonProperty("callTimeoutMillis") Long callTimeoutMillis) {

    TransferConfig toConfig() {
      return new TransferConfig(
          layer == null ? ProtocolLayer.LAYER_73 : ProtocolLayer.fromNumber(layer),
          chunkSize == null ? DEFAULT_CHUNK_SIZE : chunkSize,
          maxConcurrentParts == null ? DEFAULT_MAX_CONCURRENT_PARTS : maxConcurrentParts,
          maxAttempts == null ? DEFAULT_MAX_ATTEMPTS : maxAttempts,
          baseDelayMillis == null ? DEFAULT_BASE_DELAY : Duration.ofMillis(baseDelayMillis),
          callTimeoutMillis == null ? DEFAULT_CALL_TIMEOUT : Duration.ofMillis(callTimeoutMillis));
    }
  }
}
