package com.codeheadsystems.mtproto.tl;

/**
 * A boxed TL record: a constructor identifier followed by its fields.
 */
public interface TlObject {

  /**
   * The record's constructor identifier.
   *
   * @return the int
   */
  int constructor();

  /**
   * Writes the constructor identifier and then every field in declaration order.
   *
   * @param writer the writer
   */
  void serialize(TlWriter writer);

  /**
   * Serializes this record on its own.
   *
   * @return the byte [ ]
   */
  default byte[] toBytes() {
    TlWriter writer = new TlWriter();
    serialize(writer);
    return writer.toByteArray();
  }
}
