package com.codeheadsystems.mtproto.tl;

/**
 * Constructor identifiers of the secret-chat records this library reads and writes, as the
 * gateway's {@link com.codeheadsystems.mtproto.config.ProtocolLayer#LAYER_73} layout uses them.
 * Receivers dispatch on these values; they must match bit for bit.
 * <p>
 * {@link #DECRYPTED_MESSAGE} pairs the flags-based field set with {@code 0x204d3878}, the id the
 * published schema gives to the older record without flags. The published layer 73 record is
 * not readable with this table.
 */
public final class TlConstructors {

  public static final int VECTOR = 0x1cb5c415;

  public static final int DECRYPTED_MESSAGE = 0x204d3878;

  public static final int MEDIA_PHOTO = 0xf1fa8d78;
  public static final int MEDIA_VIDEO = 0x970c8c0e;
  public static final int MEDIA_DOCUMENT = 0x7afe8ae2;

  public static final int ATTRIBUTE_VIDEO = 0x0ef02ce6;
  public static final int ATTRIBUTE_IMAGE_SIZE = 0x6c37c15c;
  public static final int ATTRIBUTE_FILENAME = 0x15590068;

  public static final int ENTITY_BOLD = 0xbd610bc9;
  public static final int ENTITY_ITALIC = 0x826f8b60;
  public static final int ENTITY_CODE = 0x28a20571;
  public static final int ENTITY_URL = 0x6ed02538;

  private TlConstructors() {
  }

  /**
   * Hex rendering for log and error messages.
   *
   * @param constructor the constructor
   * @return e.g. {@code 0x1cb5c415}
   */
  public static String hex(int constructor) {
    return String.format("0x%08x", constructor);
  }
}
