package com.codeheadsystems.cloak.client.manager;

import com.codeheadsystems.cloak.client.model.UploadPart;
import com.codeheadsystems.cloak.client.model.UploadedFileRef;
import com.codeheadsystems.mtproto.crypto.FileKeyGenerator;
import com.codeheadsystems.mtproto.crypto.OpenedEnvelope;
import com.codeheadsystems.mtproto.crypto.Padding;
import com.codeheadsystems.mtproto.crypto.SecretMessageCipher;
import com.codeheadsystems.mtproto.crypto.SharedSecret;
import com.codeheadsystems.mtproto.exceptions.CipherException;
import com.codeheadsystems.mtproto.exceptions.SerializationException;
import com.codeheadsystems.mtproto.tl.TlReader;
import com.codeheadsystems.mtproto.tl.model.MediaDescriptor;
import com.codeheadsystems.mtproto.tl.model.WireMessage;
import java.util.List;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The receiving side: opens envelopes and decrypts the files they point to.
 * <p>
 * An envelope is accepted only if the message key recomputed from the decrypted plaintext equals
 * the transmitted one and the padding after the record is within bounds. A file is decrypted only
 * after the descriptor's key material hashes to the fingerprint sent with the file reference.
 */
@Singleton
public class SecretMediaReceiver {

  private static final Logger log = LoggerFactory.getLogger(SecretMediaReceiver.class);

  /**
   * Instantiates a new Secret media receiver.
   */
  public SecretMediaReceiver() {
    log.info("SecretMediaReceiver()");
  }

  /**
   * Decrypts, verifies and parses an envelope.
   *
   * @param envelope          {@code msg_key || ciphertext}
   * @param secret            the chat's shared secret
   * @param senderWasOutgoing the direction flag the sender encrypted with
   * @return the message
   * @throws CipherException        if the message key does not verify
   * @throws SerializationException if the record is malformed or the padding is out of bounds
   */
  public WireMessage openMessage(final byte[] envelope, final SharedSecret secret, final boolean senderWasOutgoing) {
    OpenedEnvelope opened = SecretMessageCipher.decrypt(envelope, secret, senderWasOutgoing);
    byte[] recomputed = SecretMessageCipher.computeMessageKey(secret, opened.paddedPlaintext(), senderWasOutgoing);
    if (!opened.msgKeyMatches(recomputed)) {
      throw new CipherException("Message key does not match the decrypted content");
    }
    TlReader reader = new TlReader(opened.paddedPlaintext());
    WireMessage message = WireMessage.read(reader);
    int padding = reader.remaining();
    if (padding < Padding.MIN_MESSAGE_PADDING || padding > Padding.MAX_MESSAGE_PADDING) {
      throw new SerializationException("Message padding of " + padding + " bytes is out of bounds");
    }
    log.debug("openMessage(randomId={}, media={})", message.randomId(), message.media() != null);
    return message;
  }

  /**
   * Decrypts the file attached to a message.
   * <p>
   * The fingerprint must be the one that travelled with the file reference, not one recomputed
   * from the descriptor, so that a descriptor whose key or IV was altered is caught.
   *
   * @param message        the opened message
   * @param ciphertext     the downloaded encrypted file
   * @param keyFingerprint the fingerprint sent with the file reference
   * @return the original file bytes
   * @throws IllegalArgumentException if the message carries no media
   */
  public byte[] decryptAttachment(final WireMessage message, final byte[] ciphertext, final int keyFingerprint) {
    MediaDescriptor media = message.media();
    if (media == null) {
      throw new IllegalArgumentException("Message " + message.randomId() + " has no attachment");
    }
    log.debug("decryptAttachment(randomId={}, size={})", message.randomId(), media.size());
    return FileKeyGenerator.decryptFile(ciphertext, media.keyMaterial(), keyFingerprint, media.size());
  }

  /**
   * Reassembles downloaded parts and decrypts the file.
   *
   * @param message the opened message
   * @param file    the file reference the parts were announced with
   * @param parts   the parts, in any order
   * @return the original file bytes
   * @throws IllegalArgumentException if the parts do not belong to the reference or some are missing
   */
  public byte[] decryptAttachment(final WireMessage message, final UploadedFileRef file, final List<UploadPart> parts) {
    if (parts.size() != file.parts()) {
      throw new IllegalArgumentException("Expected " + file.parts() + " parts for file " + file.fileId()
          + " but got " + parts.size());
    }
    for (UploadPart part : parts) {
      if (part.fileId() != file.fileId()) {
        throw new IllegalArgumentException("Part " + part.partIndex() + " belongs to file " + part.fileId()
            + ", not " + file.fileId());
      }
    }
    return decryptAttachment(message, ChunkedUploader.join(parts), file.keyFingerprint());
  }
}
