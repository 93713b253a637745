package com.codeheadsystems.mtproto.crypto;

/**
 * Output of {@link FileKeyGenerator#encryptFile(byte[])}.
 *
 * @param ciphertext    the padded, encrypted file
 * @param keyMaterial   the key material the receiver needs
 * @param plaintextSize length of the original file, used to strip the padding after decryption
 */
public record EncryptedFile(byte[] ciphertext, FileKeyMaterial keyMaterial, int plaintextSize) {
}
