package com.codeheadsystems.mtproto.tl.model;

import com.codeheadsystems.mtproto.tl.TlConstructors;
import com.codeheadsystems.mtproto.tl.TlWriter;

/**
 * {@code documentAttributeImageSize w:int h:int}.
 *
 * @param w width
 * @param h height
 */
public record ImageSizeAttribute(int w, int h) implements DocumentAttribute {

  @Override
  public int constructor() {
    return TlConstructors.ATTRIBUTE_IMAGE_SIZE;
  }

  @Override
  public void serialize(TlWriter writer) {
    writer.writeInt32(constructor()).writeInt32(w).writeInt32(h);
  }
}
