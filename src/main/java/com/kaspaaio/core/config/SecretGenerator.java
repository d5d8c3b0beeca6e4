package com.kaspaaio.core.config;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Generates alphanumeric secrets for database passwords and similar settings.
 */
@Component
public class SecretGenerator {

    public static final int MIN_LENGTH = 32;

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final SecureRandom random = new SecureRandom();

    public String generate() {
        return generate(MIN_LENGTH);
    }

    /** Lengths below {@link #MIN_LENGTH} are raised to it. */
    public String generate(int length) {
        int size = Math.max(length, MIN_LENGTH);
        var sb = new StringBuilder(size);
        for (int i = 0; i < size; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
