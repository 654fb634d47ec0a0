package io.devicerelay.security;

import io.devicerelay.model.CommandPayload;
import io.devicerelay.model.CommandType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.Optional;

final class PayloadCodecTest {

    @Test
    void decryptRestoresPlaintext() {
        PayloadCodec codec = new PayloadCodec("operator-secret");
        EncryptedBlob blob = codec.encrypt("ls -la ~/projects 한글");

        Assertions.assertEquals(Optional.of("ls -la ~/projects 한글"), codec.decrypt(blob));
        Assertions.assertEquals(12, Base64.getDecoder().decode(blob.iv()).length);
        Assertions.assertEquals(16, Base64.getDecoder().decode(blob.authTag()).length);
    }

    @Test
    void freshIvPerEncryption() {
        PayloadCodec codec = new PayloadCodec("operator-secret");
        EncryptedBlob a = codec.encrypt("same");
        EncryptedBlob b = codec.encrypt("same");

        Assertions.assertNotEquals(a.iv(), b.iv());
        Assertions.assertNotEquals(a.ciphertext(), b.ciphertext());
    }

    @Test
    void emptyPlaintextIsSupported() {
        PayloadCodec codec = new PayloadCodec("operator-secret");
        Assertions.assertEquals(Optional.of(""), codec.decrypt(codec.encrypt("")));
    }

    @Test
    void tamperedOrMalformedInputYieldsEmpty() {
        PayloadCodec codec = new PayloadCodec("operator-secret");
        EncryptedBlob blob = codec.encrypt("cat ~/notes.txt");

        byte[] tag = Base64.getDecoder().decode(blob.authTag());
        tag[0] ^= 0x01;
        String badTag = Base64.getEncoder().encodeToString(tag);
        byte[] cipher = Base64.getDecoder().decode(blob.ciphertext());
        cipher[cipher.length - 1] ^= 0x01;
        String badCipher = Base64.getEncoder().encodeToString(cipher);

        Assertions.assertTrue(codec.decrypt(blob.ciphertext(), blob.iv(), badTag).isEmpty());
        Assertions.assertTrue(codec.decrypt(badCipher, blob.iv(), blob.authTag()).isEmpty());
        Assertions.assertTrue(codec.decrypt(blob.ciphertext(), codec.encrypt("x").iv(), blob.authTag()).isEmpty());
        Assertions.assertTrue(codec.decrypt(blob.ciphertext(), "AAAA", blob.authTag()).isEmpty());
        Assertions.assertTrue(codec.decrypt("not base64 !!", blob.iv(), blob.authTag()).isEmpty());
        Assertions.assertTrue(codec.decrypt(blob.ciphertext(), blob.iv(), null).isEmpty());
        Assertions.assertTrue(codec.decrypt(null).isEmpty());
    }

    @Test
    void otherSecretCannotDecrypt() {
        EncryptedBlob blob = new PayloadCodec("secret-a").encrypt("payload");
        Assertions.assertTrue(new PayloadCodec("secret-b").decrypt(blob).isEmpty());
    }

    @Test
    void jsonPayloadRoundTripsThroughCodec() {
        PayloadCodec codec = new PayloadCodec("operator-secret");
        EncryptedBlob blob = codec.encryptJson(CommandPayload.shell("git pull"));

        Optional<CommandPayload> back = codec.decryptJson(blob.ciphertext(), blob.iv(), blob.authTag(), CommandPayload.class);
        Assertions.assertTrue(back.isPresent());
        Assertions.assertEquals(CommandType.SHELL, back.get().type());
        Assertions.assertEquals("git pull", back.get().command());
        Assertions.assertEquals(60, back.get().timeout());
        Assertions.assertTrue(codec.decrypt(blob).orElseThrow().contains("\"type\":\"shell\""));
    }

    @Test
    void emptySecretIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new PayloadCodec(""));
    }
}
