package io.devicerelay.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.devicerelay.util.Hashing;
import io.devicerelay.util.Jsons;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.Optional;

/**
 * AES-256-GCM codec for command and result payloads.
 *
 * <p>The key is the SHA-256 digest of an operator-configured secret, so any secret length
 * works. This protects payloads at rest in the shared store only: the server holds the key
 * and can read every payload. It is not end-to-end encryption between operator and device.
 *
 * <p>Decryption treats its input as untrusted. A forged tag, a truncated IV or non-base64
 * text all produce {@link Optional#empty()}, never an exception.
 */
public final class PayloadCodec {
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_TAG_BYTES = GCM_TAG_BITS / 8;
    private static final int GCM_IV_BYTES = 12;

    private final SecretKeySpec key;
    private final SecureRandom secureRandom;

    public PayloadCodec(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Encryption secret must not be empty");
        }
        this.key = new SecretKeySpec(Hashing.sha256(secret), "AES");
        this.secureRandom = new SecureRandom();
    }

    public EncryptedBlob encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            // JCE appends the tag to the ciphertext; the wire format keeps them apart.
            byte[] cipherText = Arrays.copyOfRange(sealed, 0, sealed.length - GCM_TAG_BYTES);
            byte[] tag = Arrays.copyOfRange(sealed, sealed.length - GCM_TAG_BYTES, sealed.length);
            Base64.Encoder b64 = Base64.getEncoder();
            return new EncryptedBlob(b64.encodeToString(cipherText), b64.encodeToString(iv), b64.encodeToString(tag));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to encrypt payload", e);
        }
    }

    public EncryptedBlob encryptJson(Object value) {
        try {
            return encrypt(Jsons.mapper().writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable", e);
        }
    }

    public Optional<String> decrypt(String ciphertext, String iv, String authTag) {
        if (ciphertext == null || iv == null || authTag == null) {
            return Optional.empty();
        }
        try {
            Base64.Decoder b64 = Base64.getDecoder();
            byte[] cipherBytes = b64.decode(ciphertext.trim());
            byte[] ivBytes = b64.decode(iv.trim());
            byte[] tagBytes = b64.decode(authTag.trim());
            if (ivBytes.length != GCM_IV_BYTES || tagBytes.length != GCM_TAG_BYTES) {
                return Optional.empty();
            }
            byte[] sealed = new byte[cipherBytes.length + tagBytes.length];
            System.arraycopy(cipherBytes, 0, sealed, 0, cipherBytes.length);
            System.arraycopy(tagBytes, 0, sealed, cipherBytes.length, tagBytes.length);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, ivBytes));
            return Optional.of(new String(cipher.doFinal(sealed), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException | java.security.GeneralSecurityException e) {
            return Optional.empty();
        }
    }

    public Optional<String> decrypt(EncryptedBlob blob) {
        return blob == null ? Optional.empty() : decrypt(blob.ciphertext(), blob.iv(), blob.authTag());
    }

    public <T> Optional<T> decryptJson(String ciphertext, String iv, String authTag, Class<T> type) {
        Optional<String> plain = decrypt(ciphertext, iv, authTag);
        if (plain.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(Jsons.mapper().readValue(plain.get(), type));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
