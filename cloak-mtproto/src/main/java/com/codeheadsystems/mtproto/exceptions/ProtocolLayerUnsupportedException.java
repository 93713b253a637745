package com.codeheadsystems.mtproto.exceptions;

/**
 * The configured secret-chat protocol layer is not the one this library encodes. Layers are a
 * configuration choice and are never negotiated or downgraded at runtime.
 */
public class ProtocolLayerUnsupportedException extends MtprotoException {

  /**
   * Instantiates a new Protocol layer unsupported exception.
   *
   * @param layer the requested layer number
   */
  public ProtocolLayerUnsupportedException(final int layer) {
    super("Unsupported secret chat protocol layer: " + layer);
  }
}
