package com.williamcallahan.media_library.util;

import java.security.SecureRandom;

/**
 * NanoId-style identifiers for libraries, series and books.
 * Callers may supply their own ids; these are only the default.
 */
public final class IdGenerator {

    // Base62: digits + lowercase + uppercase
    private static final char[] ALPHABET =
            "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ".toCharArray();
    private static final int DEFAULT_SIZE = 12;

    private static final SecureRandom RANDOM = new SecureRandom();

    private IdGenerator() {
    }

    public static String generate() {
        return generate(DEFAULT_SIZE);
    }

    public static String generate(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be > 0");
        }
        char[] id = new char[size];
        for (int i = 0; i < size; i++) {
            id[i] = ALPHABET[RANDOM.nextInt(ALPHABET.length)];
        }
        return new String(id);
    }
}
