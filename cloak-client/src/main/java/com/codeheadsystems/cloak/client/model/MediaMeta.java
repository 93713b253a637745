package com.codeheadsystems.cloak.client.model;

import com.codeheadsystems.mtproto.crypto.FileKeyMaterial;
import com.codeheadsystems.mtproto.tl.model.DocumentAttribute;
import com.codeheadsystems.mtproto.tl.model.DocumentMedia;
import com.codeheadsystems.mtproto.tl.model.MediaDescriptor;
import com.codeheadsystems.mtproto.tl.model.PhotoMedia;
import com.codeheadsystems.mtproto.tl.model.VideoAttribute;
import com.codeheadsystems.mtproto.tl.model.VideoMedia;
import java.util.List;

/**
 * Caller-supplied description of an attached file and the message options that go with it.
 * The file key and size are not part of this; they are filled in once the file is encrypted.
 *
 * @param kind        which media record to emit
 * @param mimeType    MIME type; ignored for photos
 * @param thumb       thumbnail bytes, empty when there is none
 * @param thumbW      thumbnail width
 * @param thumbH      thumbnail height
 * @param w           width
 * @param h           height
 * @param duration    duration in seconds, videos only
 * @param caption     caption shown under the media
 * @param attributes  document attributes, documents only
 * @param ttl         self-destruct timer in seconds, or null
 */
public record MediaMeta(Kind kind, String mimeType, byte[] thumb, int thumbW, int thumbH, int w, int h,
                        int duration, String caption, List<DocumentAttribute> attributes, Integer ttl) {

  /**
   * Normalizes optional fields.
   */
  public MediaMeta {
    if (kind == null) {
      throw new IllegalArgumentException("Media kind is required");
    }
    mimeType = mimeType == null ? "" : mimeType;
    thumb = thumb == null ? new byte[0] : thumb;
    caption = caption == null ? "" : caption;
    attributes = attributes == null ? List.of() : List.copyOf(attributes);
  }

  public static MediaMeta photo(int w, int h) {
    return new MediaMeta(Kind.PHOTO, PhotoMedia.MIME_TYPE, null, 0, 0, w, h, 0, null, null, null);
  }

  public static MediaMeta video(String mimeType, int duration, int w, int h) {
    return new MediaMeta(Kind.VIDEO, mimeType, null, 0, 0, w, h, duration, null, null, null);
  }

  public static MediaMeta document(String mimeType, List<DocumentAttribute> attributes) {
    return new MediaMeta(Kind.DOCUMENT, mimeType, null, 0, 0, 0, 0, 0, null, attributes, null);
  }

  /**
   * A video sent as a document carrying a streamable video attribute, which current clients play
   * inline.
   *
   * @param mimeType the mime type
   * @param duration the duration
   * @param w        the w
   * @param h        the h
   * @return the media meta
   */
  public static MediaMeta streamingVideo(String mimeType, int duration, int w, int h) {
    return new MediaMeta(Kind.DOCUMENT, mimeType, null, 0, 0, w, h, duration, null,
        List.of(new VideoAttribute(false, true, duration, w, h)), null);
  }

  public MediaMeta withThumb(byte[] thumb, int thumbW, int thumbH) {
    return new MediaMeta(kind, mimeType, thumb, thumbW, thumbH, w, h, duration, caption, attributes, ttl);
  }

  public MediaMeta withCaption(String caption) {
    return new MediaMeta(kind, mimeType, thumb, thumbW, thumbH, w, h, duration, caption, attributes, ttl);
  }

  public MediaMeta withTtl(Integer ttl) {
    return new MediaMeta(kind, mimeType, thumb, thumbW, thumbH, w, h, duration, caption, attributes, ttl);
  }

  /**
   * Builds the wire descriptor around freshly generated file key material.
   *
   * @param keyMaterial   the file's key material
   * @param plaintextSize the file size before padding
   * @return the media descriptor
   */
  public MediaDescriptor describe(FileKeyMaterial keyMaterial, int plaintextSize) {
    return switch (kind) {
      case PHOTO -> new PhotoMedia(thumb, thumbW, thumbH, w, h, plaintextSize, keyMaterial, caption);
      case VIDEO -> new VideoMedia(thumb, thumbW, thumbH, duration, mimeType, w, h, plaintextSize,
          keyMaterial, caption);
      case DOCUMENT -> new DocumentMedia(thumb, thumbW, thumbH, mimeType, plaintextSize, keyMaterial,
          attributes, caption);
    };
  }

  /**
   * Media record kinds.
   */
  public enum Kind {
    PHOTO,
    VIDEO,
    DOCUMENT
  }
}
