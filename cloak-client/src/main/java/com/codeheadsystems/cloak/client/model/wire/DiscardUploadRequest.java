package com.codeheadsystems.cloak.client.model.wire;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model asking the gateway to drop the parts of an abandoned upload.
 * <p>
 * Used by: {@code POST /upload/discard}
 *
 * @param fileId the abandoned file id
 */
public record DiscardUploadRequest(@JsonProperty("fileId") long fileId) {
}
