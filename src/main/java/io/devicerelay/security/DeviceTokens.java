package io.devicerelay.security;

import io.devicerelay.util.Hashing;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Bearer tokens for paired devices. Only {@link #hash(String)} of a token is persisted.
 */
public final class DeviceTokens {
    private static final String PREFIX = "dr_";
    private static final int TOKEN_BYTES = 32;

    private final String signingSecret;
    private final SecureRandom secureRandom;

    public DeviceTokens(String signingSecret) {
        this.signingSecret = signingSecret == null ? "" : signingSecret;
        this.secureRandom = new SecureRandom();
    }

    public String newToken() {
        byte[] raw = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(raw);
        String body = HexFormat.of().formatHex(raw);
        String check = Hashing.hmacSha256Hex(signingSecret.isEmpty() ? PREFIX : signingSecret, body).substring(0, 8);
        return PREFIX + body + "_" + check;
    }

    public String newPairingCode() {
        return Integer.toString(100_000 + secureRandom.nextInt(900_000));
    }

    public static String hash(String token) {
        return Hashing.sha256Hex(token == null ? "" : token.trim());
    }
}
