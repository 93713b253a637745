package com.codeheadsystems.mtproto.tl.model;

import com.codeheadsystems.mtproto.tl.TlConstructors;
import com.codeheadsystems.mtproto.tl.TlWriter;

/**
 * {@code documentAttributeFilename file_name:string}.
 *
 * @param fileName the file name shown to the receiver
 */
public record FilenameAttribute(String fileName) implements DocumentAttribute {

  @Override
  public int constructor() {
    return TlConstructors.ATTRIBUTE_FILENAME;
  }

  @Override
  public void serialize(TlWriter writer) {
    writer.writeInt32(constructor()).writeString(fileName);
  }
}
