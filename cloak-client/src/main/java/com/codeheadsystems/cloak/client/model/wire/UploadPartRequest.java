package com.codeheadsystems.cloak.client.model.wire;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Base64;

/**
 * Wire model for one encrypted file part.
 * <p>
 * Used by: {@code POST /upload/part}
 *
 * @param fileId      random id shared by every part of the file
 * @param partIndex   zero-based part index
 * @param bytesBase64 base64-encoded encrypted chunk
 */
public record UploadPartRequest(
    @JsonProperty("fileId") long fileId,
    @JsonProperty("partIndex") int partIndex,
    @JsonProperty("bytes") String bytesBase64) {

  public UploadPartRequest(long fileId, int partIndex, byte[] bytes) {
    this(fileId, partIndex, Base64.getEncoder().encodeToString(bytes));
  }
}
