package com.codeheadsystems.mtproto.tl.model;

import com.codeheadsystems.mtproto.tl.TlConstructors;
import com.codeheadsystems.mtproto.tl.TlReader;
import com.codeheadsystems.mtproto.tl.TlWriter;

/**
 * {@code documentAttributeVideo flags:# round_message:flags.0?true
 * supports_streaming:flags.1?true duration:int w:int h:int}.
 *
 * @param roundMessage      round video message
 * @param supportsStreaming playable before fully downloaded
 * @param duration          seconds
 * @param w                 width
 * @param h                 height
 */
public record VideoAttribute(boolean roundMessage, boolean supportsStreaming, int duration, int w, int h)
    implements DocumentAttribute {

  static final int FLAG_ROUND_MESSAGE = 1;
  static final int FLAG_SUPPORTS_STREAMING = 1 << 1;

  static VideoAttribute readFields(TlReader reader) {
    int flags = reader.readInt32();
    return new VideoAttribute(
        (flags & FLAG_ROUND_MESSAGE) != 0,
        (flags & FLAG_SUPPORTS_STREAMING) != 0,
        reader.readInt32(),
        reader.readInt32(),
        reader.readInt32());
  }

  @Override
  public int constructor() {
    return TlConstructors.ATTRIBUTE_VIDEO;
  }

  @Override
  public void serialize(TlWriter writer) {
    int flags = 0;
    if (roundMessage) {
      flags |= FLAG_ROUND_MESSAGE;
    }
    if (supportsStreaming) {
      flags |= FLAG_SUPPORTS_STREAMING;
    }
    writer.writeInt32(constructor())
        .writeInt32(flags)
        .writeInt32(duration)
        .writeInt32(w)
        .writeInt32(h);
  }
}
