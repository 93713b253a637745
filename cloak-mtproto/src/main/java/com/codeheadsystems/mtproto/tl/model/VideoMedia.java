package com.codeheadsystems.mtproto.tl.model;

import com.codeheadsystems.mtproto.crypto.FileKeyMaterial;
import com.codeheadsystems.mtproto.tl.TlConstructors;
import com.codeheadsystems.mtproto.tl.TlReader;
import com.codeheadsystems.mtproto.tl.TlWriter;

/**
 * {@code decryptedMessageMediaVideo thumb:bytes thumb_w:int thumb_h:int duration:int
 * mime_type:string w:int h:int size:int key:bytes iv:bytes caption:string}.
 */
public record VideoMedia(byte[] thumb, int thumbW, int thumbH, int duration, String mimeType,
                         int w, int h, int size, FileKeyMaterial keyMaterial, String caption)
    implements MediaDescriptor {

  static VideoMedia readFields(TlReader reader) {
    byte[] thumb = reader.readBytes();
    int thumbW = reader.readInt32();
    int thumbH = reader.readInt32();
    int duration = reader.readInt32();
    String mimeType = reader.readString();
    int w = reader.readInt32();
    int h = reader.readInt32();
    int size = reader.readInt32();
    FileKeyMaterial keyMaterial = MediaDescriptor.readKeyMaterial(reader);
    String caption = reader.readString();
    return new VideoMedia(thumb, thumbW, thumbH, duration, mimeType, w, h, size, keyMaterial, caption);
  }

  @Override
  public int constructor() {
    return TlConstructors.MEDIA_VIDEO;
  }

  @Override
  public void serialize(TlWriter writer) {
    writer.writeInt32(constructor())
        .writeBytes(thumb)
        .writeInt32(thumbW)
        .writeInt32(thumbH)
        .writeInt32(duration)
        .writeString(mimeType)
        .writeInt32(w)
        .writeInt32(h)
        .writeInt32(size)
        .writeBytes(keyMaterial.key())
        .writeBytes(keyMaterial.iv())
        .writeString(caption);
  }
}
