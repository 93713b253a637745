package com.codeheadsystems.cloak.client.model;

/**
 * One chunk of an encrypted file. Parts of a file are ordered by {@code partIndex}, starting at 0.
 *
 * @param fileId    the random file id shared by every part of the file
 * @param partIndex the part index
 * @param bytes     the chunk
 */
public record UploadPart(long fileId, int partIndex, byte[] bytes) {

  @Override
  public String toString() {
    return "UploadPart[fileId=" + fileId + ", partIndex=" + partIndex + ", size=" + bytes.length + "]";
  }
}
