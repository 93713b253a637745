package com.codeheadsystems.mtproto.tl.model;

import com.codeheadsystems.mtproto.exceptions.SerializationException;
import com.codeheadsystems.mtproto.tl.TlConstructors;
import com.codeheadsystems.mtproto.tl.TlObject;
import com.codeheadsystems.mtproto.tl.TlReader;
import com.codeheadsystems.mtproto.tl.TlWriter;

/**
 * Formatting span over the message text: {@code messageEntityX offset:int length:int}.
 *
 * @param type   the entity type
 * @param offset start, in UTF-16 code units
 * @param length length, in UTF-16 code units
 */
public record MessageEntity(Type type, int offset, int length) implements TlObject {

  public static MessageEntity read(TlReader reader) {
    Type type = Type.fromConstructor(reader.readInt32());
    return new MessageEntity(type, reader.readInt32(), reader.readInt32());
  }

  @Override
  public int constructor() {
    return type.constructor();
  }

  @Override
  public void serialize(TlWriter writer) {
    writer.writeInt32(type.constructor())
        .writeInt32(offset)
        .writeInt32(length);
  }

  /**
   * Supported entity kinds.
   */
  public enum Type {
    BOLD(TlConstructors.ENTITY_BOLD),
    ITALIC(TlConstructors.ENTITY_ITALIC),
    CODE(TlConstructors.ENTITY_CODE),
    URL(TlConstructors.ENTITY_URL);

    private final int constructor;

    Type(int constructor) {
      this.constructor = constructor;
    }

    static Type fromConstructor(int constructor) {
      for (Type type : values()) {
        if (type.constructor == constructor) {
          return type;
        }
      }
      throw new SerializationException("Unknown message entity " + TlConstructors.hex(constructor));
    }

    public int constructor() {
      return constructor;
    }
  }
}
