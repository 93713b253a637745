package com.codeheadsystems.cloak.client.model.wire;

import com.codeheadsystems.cloak.client.model.SecretChatPeer;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Base64;

/**
 * Wire model for a message envelope without an attached file.
 * <p>
 * Used by: {@code POST /messages/sendEncrypted}
 *
 * @param chatId         secret chat id
 * @param accessHash     secret chat access hash
 * @param randomId       the message's random id
 * @param envelopeBase64 base64-encoded {@code msg_key || ciphertext}
 */
public record SendEncryptedRequest(
    @JsonProperty("chatId") int chatId,
    @JsonProperty("accessHash") long accessHash,
    @JsonProperty("randomId") long randomId,
    @JsonProperty("envelope") String envelopeBase64) {

  public SendEncryptedRequest(SecretChatPeer peer, long randomId, byte[] envelope) {
    this(peer.chatId(), peer.accessHash(), randomId, Base64.getEncoder().encodeToString(envelope));
  }
}
