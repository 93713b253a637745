package com.codeheadsystems.cloak.client.model;

/**
 * Reference to a fully uploaded encrypted file, sent alongside the message envelope.
 *
 * @param fileId         the file id used for every part
 * @param parts          number of parts uploaded
 * @param md5Checksum    always empty for encrypted uploads
 * @param keyFingerprint fingerprint of the file key material
 */
public record UploadedFileRef(long fileId, int parts, String md5Checksum, int keyFingerprint) {

  /**
   * Reference with an empty checksum.
   *
   * @param fileId         the file id
   * @param parts          the parts
   * @param keyFingerprint the key fingerprint
   * @return the uploaded file ref
   */
  public static UploadedFileRef of(long fileId, int parts, int keyFingerprint) {
    return new UploadedFileRef(fileId, parts, "", keyFingerprint);
  }
}
