package com.codeheadsystems.mtproto.tl.model;

import com.codeheadsystems.mtproto.crypto.FileKeyMaterial;
import com.codeheadsystems.mtproto.tl.TlConstructors;
import com.codeheadsystems.mtproto.tl.TlReader;
import com.codeheadsystems.mtproto.tl.TlWriter;

/**
 * {@code decryptedMessageMediaPhoto thumb:bytes thumb_w:int thumb_h:int w:int h:int size:int
 * key:bytes iv:bytes caption:string}. Photos are always JPEG on the receiving side.
 */
public record PhotoMedia(byte[] thumb, int thumbW, int thumbH, int w, int h, int size,
                         FileKeyMaterial keyMaterial, String caption) implements MediaDescriptor {

  public static final String MIME_TYPE = "image/jpeg";

  static PhotoMedia readFields(TlReader reader) {
    byte[] thumb = reader.readBytes();
    int thumbW = reader.readInt32();
    int thumbH = reader.readInt32();
    int w = reader.readInt32();
    int h = reader.readInt32();
    int size = reader.readInt32();
    FileKeyMaterial keyMaterial = MediaDescriptor.readKeyMaterial(reader);
    String caption = reader.readString();
    return new PhotoMedia(thumb, thumbW, thumbH, w, h, size, keyMaterial, caption);
  }

  @Override
  public String mimeType() {
    return MIME_TYPE;
  }

  @Override
  public int constructor() {
    return TlConstructors.MEDIA_PHOTO;
  }

  @Override
  public void serialize(TlWriter writer) {
    writer.writeInt32(constructor())
        .writeBytes(thumb)
        .writeInt32(thumbW)
        .writeInt32(thumbH)
        .writeInt32(w)
        .writeInt32(h)
        .writeInt32(size)
        .writeBytes(keyMaterial.key())
        .writeBytes(keyMaterial.iv())
        .writeString(caption);
  }
}
