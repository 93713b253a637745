package com.codeheadsystems.cloak.client.model;

/**
 * Lifecycle of one send.
 */
public enum TransferState {
  IDLE,
  ENCRYPTING,
  UPLOADING,
  DESCRIPTOR_BUILT,
  MESSAGE_SERIALIZED,
  MESSAGE_ENCRYPTED,
  SENT,
  FAILED;

  /**
   * Whether no further transition can happen.
   *
   * @return the boolean
   */
  public boolean isTerminal() {
    return this == SENT || this == FAILED;
  }
}
