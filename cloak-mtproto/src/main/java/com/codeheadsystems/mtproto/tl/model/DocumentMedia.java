package com.codeheadsystems.mtproto.tl.model;

import com.codeheadsystems.mtproto.crypto.FileKeyMaterial;
import com.codeheadsystems.mtproto.tl.TlConstructors;
import com.codeheadsystems.mtproto.tl.TlReader;
import com.codeheadsystems.mtproto.tl.TlWriter;
import java.util.List;

/**
 * {@code decryptedMessageMediaDocument thumb:bytes thumb_w:int thumb_h:int mime_type:string
 * size:int key:bytes iv:bytes attributes:Vector<DocumentAttribute> caption:string}.
 */
public record DocumentMedia(byte[] thumb, int thumbW, int thumbH, String mimeType, int size,
                            FileKeyMaterial keyMaterial, List<DocumentAttribute> attributes,
                            String caption) implements MediaDescriptor {

  /**
   * Copies the attribute list.
   */
  public DocumentMedia {
    attributes = List.copyOf(attributes);
  }

  static DocumentMedia readFields(TlReader reader) {
    byte[] thumb = reader.readBytes();
    int thumbW = reader.readInt32();
    int thumbH = reader.readInt32();
    String mimeType = reader.readString();
    int size = reader.readInt32();
    FileKeyMaterial keyMaterial = MediaDescriptor.readKeyMaterial(reader);
    List<DocumentAttribute> attributes = reader.readVector(DocumentAttribute::read);
    String caption = reader.readString();
    return new DocumentMedia(thumb, thumbW, thumbH, mimeType, size, keyMaterial, attributes, caption);
  }

  @Override
  public int constructor() {
    return TlConstructors.MEDIA_DOCUMENT;
  }

  @Override
  public void serialize(TlWriter writer) {
    writer.writeInt32(constructor())
        .writeBytes(thumb)
        .writeInt32(thumbW)
        .writeInt32(thumbH)
        .writeString(mimeType)
        .writeInt32(size)
        .writeBytes(keyMaterial.key())
        .writeBytes(keyMaterial.iv())
        .writeVector(attributes)
        .writeString(caption);
  }
}
