package com.codeheadsystems.mtproto.config;

import com.codeheadsystems.mtproto.exceptions.ProtocolLayerUnsupportedException;

/**
 * The secret-chat wire layout this library encodes.
 * <p>
 * Exactly one layer is supported. The record layouts and constructor identifiers in
 * {@link com.codeheadsystems.mtproto.tl.TlConstructors} are those of this layer; asking for any
 * other number fails fast instead of falling back to an older layout.
 */
public enum ProtocolLayer {

  /**
   * The gateway's layer 73 layout: the flags-based field set (optional ttl, entities,
   * via_bot_name, reply_to_random_id) written under constructor {@code 0x204d3878}.
   * <p>
   * This is not the published layer 73 schema. The published record uses a different
   * constructor and field order, so peers that speak the published schema cannot read it. The
   * number only names what the gateway expects.
   */
  LAYER_73(73);

  private final int number;

  ProtocolLayer(int number) {
    this.number = number;
  }

  /**
   * Resolves a configured layer number.
   *
   * @param number the number
   * @return the protocol layer
   * @throws ProtocolLayerUnsupportedException for any number other than a supported layer
   */
  public static ProtocolLayer fromNumber(int number) {
    for (ProtocolLayer layer : values()) {
      if (layer.number == number) {
        return layer;
      }
    }
    throw new ProtocolLayerUnsupportedException(number);
  }

  public int number() {
    return number;
  }
}
