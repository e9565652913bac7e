package com.ai.consultas.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.ai.consultas.config.FormBotProperties;

/**
 * Checks submitted secrets against the configured SHA-256 digest of the shared secret.
 */
@Component
public class PasswordVerifier {

    private static final String ALGORITHM = "SHA-256";

    private final String expectedHash;

    @Autowired
    public PasswordVerifier(FormBotProperties properties) {
        this(properties.getAuthHash());
    }

    public PasswordVerifier(String expectedHash) {
        if (expectedHash == null || expectedHash.isBlank()) {
            throw new IllegalStateException("Shared secret hash is not configured (app.form.auth-hash)");
        }
        this.expectedHash = expectedHash.trim().toLowerCase(Locale.ROOT);
    }

    public AuthOutcome verify(String secret) {
        if (secret == null) {
            return AuthOutcome.REJECTED;
        }
        return expectedHash.equals(hash(secret)) ? AuthOutcome.ACCEPTED : AuthOutcome.REJECTED;
    }

    /**
     * Lower-case hex SHA-256 digest of the UTF-8 bytes of {@code text}.
     */
    public static String hash(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
