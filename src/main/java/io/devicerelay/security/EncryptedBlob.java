package io.devicerelay.security;

/**
 * Base64 text fields of one AES-GCM encryption, in the shape they are stored and sent.
 */
public record EncryptedBlob(String ciphertext, String iv, String authTag) {
}
