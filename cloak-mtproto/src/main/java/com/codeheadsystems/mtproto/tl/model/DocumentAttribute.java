package com.codeheadsystems.mtproto.tl.model;

import com.codeheadsystems.mtproto.exceptions.SerializationException;
import com.codeheadsystems.mtproto.tl.TlConstructors;
import com.codeheadsystems.mtproto.tl.TlObject;
import com.codeheadsystems.mtproto.tl.TlReader;

/**
 * Typed attribute attached to a document.
 */
public interface DocumentAttribute extends TlObject {

  /**
   * Reads one boxed attribute.
   *
   * @param reader the reader
   * @return the document attribute
   */
  static DocumentAttribute read(TlReader reader) {
    int constructor = reader.readInt32();
    return switch (constructor) {
      case TlConstructors.ATTRIBUTE_VIDEO -> VideoAttribute.readFields(reader);
      case TlConstructors.ATTRIBUTE_IMAGE_SIZE -> new ImageSizeAttribute(reader.readInt32(), reader.readInt32());
      case TlConstructors.ATTRIBUTE_FILENAME -> new FilenameAttribute(reader.readString());
      default -> throw new SerializationException("Unknown document attribute " + TlConstructors.hex(constructor));
    };
  }
}
