package com.codeheadsystems.cloak.client.model;

/**
 * Addresses one established secret chat.
 *
 * @param chatId     the chat identifier
 * @param accessHash the access hash issued with the chat
 */
public record SecretChatPeer(int chatId, long accessHash) {
}
