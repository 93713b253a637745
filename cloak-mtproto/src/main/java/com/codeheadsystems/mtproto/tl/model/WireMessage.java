package com.codeheadsystems.mtproto.tl.model;

import com.codeheadsystems.mtproto.tl.TlConstructors;
import com.codeheadsystems.mtproto.tl.TlObject;
import com.codeheadsystems.mtproto.tl.TlReader;
import com.codeheadsystems.mtproto.tl.TlWriter;
import java.util.List;

/**
 * The plaintext secret-chat message:
 * <pre>
 * decryptedMessage flags:#
 *     ttl:flags.2?int
 *     message:string
 *     media:flags.9?DecryptedMessageMedia
 *     entities:flags.7?Vector&lt;MessageEntity&gt;
 *     via_bot_name:flags.11?string
 *     reply_to_random_id:flags.3?long
 *     random_id:long
 * </pre>
 * Optional components are {@code null} when absent; the flags word is computed from which are
 * present. The record is self-delimiting, so a reader stops exactly at its end even when random
 * padding follows.
 *
 * @param randomId        unique per chat, used by the receiver to drop duplicates
 * @param ttl             self-destruct timer in seconds, or null
 * @param text            message text, never null
 * @param media           attached media, or null
 * @param entities        formatting entities, or null
 * @param viaBotName      inline bot username, or null
 * @param replyToRandomId random id of the message being replied to, or null
 */
public record WireMessage(long randomId, Integer ttl, String text, MediaDescriptor media,
                          List<MessageEntity> entities, String viaBotName, Long replyToRandomId)
    implements TlObject {

  static final int FLAG_TTL = 1 << 2;
  static final int FLAG_REPLY_TO = 1 << 3;
  static final int FLAG_ENTITIES = 1 << 7;
  static final int FLAG_MEDIA = 1 << 9;
  static final int FLAG_VIA_BOT = 1 << 11;

  /**
   * Normalizes text and copies the entity list.
   */
  public WireMessage {
    text = text == null ? "" : text;
    entities = entities == null ? null : List.copyOf(entities);
  }

  /**
   * A message with text and optional media only.
   *
   * @param randomId the random id
   * @param text     the text
   * @param media    the media, or null
   * @return the wire message
   */
  public static WireMessage of(long randomId, String text, MediaDescriptor media) {
    return new WireMessage(randomId, null, text, media, null, null, null);
  }

  /**
   * Reads one boxed message. Bytes after the record are left unread.
   *
   * @param reader the reader
   * @return the wire message
   */
  public static WireMessage read(TlReader reader) {
    reader.expectConstructor(TlConstructors.DECRYPTED_MESSAGE);
    int flags = reader.readInt32();
    Integer ttl = (flags & FLAG_TTL) != 0 ? reader.readInt32() : null;
    String text = reader.readString();
    MediaDescriptor media = (flags & FLAG_MEDIA) != 0 ? MediaDescriptor.read(reader) : null;
    List<MessageEntity> entities = (flags & FLAG_ENTITIES) != 0 ? reader.readVector(MessageEntity::read) : null;
    String viaBotName = (flags & FLAG_VIA_BOT) != 0 ? reader.readString() : null;
    Long replyTo = (flags & FLAG_REPLY_TO) != 0 ? reader.readInt64() : null;
    long randomId = reader.readInt64();
    return new WireMessage(randomId, ttl, text, media, entities, viaBotName, replyTo);
  }

  /**
   * The flags word for the optional components that are present.
   *
   * @return the int
   */
  public int flags() {
    int flags = 0;
    if (ttl != null) {
      flags |= FLAG_TTL;
    }
    if (replyToRandomId != null) {
      flags |= FLAG_REPLY_TO;
    }
    if (entities != null) {
      flags |= FLAG_ENTITIES;
    }
    if (media != null) {
      flags |= FLAG_MEDIA;
    }
    if (viaBotName != null) {
      flags |= FLAG_VIA_BOT;
    }
    return flags;
  }

  @Override
  public int constructor() {
    return TlConstructors.DECRYPTED_MESSAGE;
  }

  @Override
  public void serialize(TlWriter writer) {
    writer.writeInt32(constructor());
    writer.writeInt32(flags());
    if (ttl != null) {
      writer.writeInt32(ttl);
    }
    writer.writeString(text);
    if (media != null) {
      media.serialize(writer);
    }
    if (entities != null) {
      writer.writeVector(entities);
    }
    if (viaBotName != null) {
      writer.writeString(viaBotName);
    }
    if (replyToRandomId != null) {
      writer.writeInt64(replyToRandomId);
    }
    writer.writeInt64(randomId);
  }
}
