package com.codeheadsystems.cloak.client.exceptions;

/**
 * A single upload part was rejected or lost. Retryable; surfaced only after the part's attempts
 * are exhausted.
 */
public class UploadPartException extends TransferException {

  private final long fileId;
  private final int partIndex;

  /**
   * Instantiates a new Upload part exception.
   *
   * @param fileId    the file id
   * @param partIndex the part index
   * @param message   the message
   * @param cause     the cause
   */
  public UploadPartException(final long fileId, final int partIndex, final String message, final Throwable cause) {
    super(message, cause, true);
    this.fileId = fileId;
    this.partIndex = partIndex;
  }

  public long fileId() {
    return fileId;
  }

  public int partIndex() {
    return partIndex;
  }
}
