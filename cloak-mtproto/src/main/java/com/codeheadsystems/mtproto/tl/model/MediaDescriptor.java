package com.codeheadsystems.mtproto.tl.model;

import com.codeheadsystems.mtproto.crypto.FileKeyMaterial;
import com.codeheadsystems.mtproto.exceptions.CipherException;
import com.codeheadsystems.mtproto.exceptions.SerializationException;
import com.codeheadsystems.mtproto.tl.TlConstructors;
import com.codeheadsystems.mtproto.tl.TlObject;
import com.codeheadsystems.mtproto.tl.TlReader;

/**
 * Media attached to a secret-chat message. Each variant carries the <em>file</em> key material
 * the receiver needs to decrypt the uploaded file; the message's own keys never appear here.
 */
public interface MediaDescriptor extends TlObject {

  /**
   * Key and IV of the attached file. The media record carries no fingerprint, so on a descriptor
   * read from the wire {@link FileKeyMaterial#fingerprint()} is only the hash of whatever key and
   * IV arrived. It is checked against the fingerprint sent with the file reference before any
   * decryption.
   *
   * @return the file key material
   */
  FileKeyMaterial keyMaterial();

  /**
   * Size of the file before padding and encryption.
   *
   * @return the int
   */
  int size();

  String mimeType();

  byte[] thumb();

  int thumbW();

  int thumbH();

  String caption();

  /**
   * Reads one boxed media record.
   *
   * @param reader the reader
   * @return the media descriptor
   */
  static MediaDescriptor read(TlReader reader) {
    int constructor = reader.readInt32();
    return switch (constructor) {
      case TlConstructors.MEDIA_PHOTO -> PhotoMedia.readFields(reader);
      case TlConstructors.MEDIA_VIDEO -> VideoMedia.readFields(reader);
      case TlConstructors.MEDIA_DOCUMENT -> DocumentMedia.readFields(reader);
      default -> throw new SerializationException("Unknown media constructor " + TlConstructors.hex(constructor));
    };
  }

  /**
   * Reads the key and IV fields. The fingerprint is hashed from the received bytes and is not
   * evidence that they are the ones the sender fingerprinted.
   *
   * @param reader the reader
   * @return the file key material
   */
  static FileKeyMaterial readKeyMaterial(TlReader reader) {
    byte[] key = reader.readBytes();
    byte[] iv = reader.readBytes();
    try {
      return FileKeyMaterial.of(key, iv);
    } catch (CipherException e) {
      throw new SerializationException("Media carries malformed file key material", e);
    }
  }
}
