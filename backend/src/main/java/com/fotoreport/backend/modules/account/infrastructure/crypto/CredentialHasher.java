package com.fotoreport.backend.modules.account.infrastructure.crypto;

import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.spec.KeySpec;
import java.util.Objects;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.keygen.BytesKeyGenerator;
import org.springframework.security.crypto.keygen.KeyGenerators;
import org.springframework.stereotype.Component;

/**
 * Derives the {@code pw_salt}/{@code pw_hash} pair stored for each user.
 * PBKDF2-HMAC-SHA256 over the UTF-8 password, 16-byte random salt, 32-byte key.
 */
@Component
public class CredentialHasher {

    public static final int DEFAULT_ITERATIONS = 120_000;

    private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final int SALT_LENGTH = 16;
    private static final int KEY_LENGTH_BITS = 256;

    private final BytesKeyGenerator saltGenerator = KeyGenerators.secureRandom(SALT_LENGTH);
    private final int iterations;

    public CredentialHasher(@Value("${fotoreport.credentials.iterations:120000}") int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        this.iterations = iterations;
    }

    public byte[] newSalt() {
        return saltGenerator.generateKey();
    }

    public byte[] hash(String rawPassword, byte[] salt) {
        Objects.requireNonNull(rawPassword, "rawPassword is required");
        Objects.requireNonNull(salt, "salt is required");
        KeySpec spec = new PBEKeySpec(rawPassword.toCharArray(), salt, iterations, KEY_LENGTH_BITS);
        try {
            return SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Unable to derive password hash", ex);
        }
    }

    public boolean matches(String rawPassword, byte[] salt, byte[] expectedHash) {
        if (rawPassword == null || salt == null || expectedHash == null) {
            return false;
        }
        return MessageDigest.isEqual(hash(rawPassword, salt), expectedHash);
    }

    public int getIterations() {
        return iterations;
    }
}
