package com.codeheadsystems.cloak.client.model.wire;

import com.codeheadsystems.cloak.client.model.SecretChatPeer;
import com.codeheadsystems.cloak.client.model.UploadedFileRef;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Base64;

/**
 * Wire model for a message envelope that references an uploaded encrypted file.
 * <p>
 * Used by: {@code POST /messages/sendEncryptedFile}
 *
 * @param chatId         secret chat id
 * @param accessHash     secret chat access hash
 * @param randomId       the message's random id
 * @param envelopeBase64 base64-encoded {@code msg_key || ciphertext}
 * @param fileId         uploaded file id
 * @param parts          number of uploaded parts
 * @param md5Checksum    empty for encrypted files
 * @param keyFingerprint file key fingerprint
 */
public record SendEncryptedFileRequest(
    @JsonProperty("chatId") int chatId,
    @JsonProperty("accessHash") long accessHash,
    @JsonProperty("randomId") long randomId,
    @JsonProperty("envelope") String envelopeBase64,
    @JsonProperty("fileId") long fileId,
    @JsonProperty("parts") int parts,
    @JsonProperty("md5Checksum") String md5Checksum,
    @JsonProperty("keyFingerprint") int keyFingerprint) {

  public SendEncryptedFileRequest(SecretChatPeer peer, long randomId, byte[] envelope, UploadedFileRef file) {
    this(peer.chatId(), peer.accessHash(), randomId, Base64.getEncoder().encodeToString(envelope),
        file.fileId(), file.parts(), file.md5Checksum(), file.keyFingerprint());
  }
}
