package com.acme.invoicemail.core.util;

import java.security.SecureRandom;
import java.time.Instant;

/**
 * Generates ULIDs: 48-bit millisecond timestamp followed by 80 random bits,
 * Crockford Base32 encoded into 26 characters. Lexicographic order follows
 * creation time at millisecond resolution.
 */
public final class UlidGenerator {

    private static final char[] ENCODING = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();

    private UlidGenerator() {
    }

    public static String generate() {
        return generate(Instant.now());
    }

    public static String generate(Instant instant) {
        byte[] randomness = new byte[10];
        RANDOM.nextBytes(randomness);
        return encode(instant.toEpochMilli(), randomness);
    }

    static String encode(long timestamp, byte[] randomness) {
        char[] chars = new char[26];

        for (int i = 9; i >= 0; i--) {
            chars[i] = ENCODING[(int) (timestamp & 0x1F)];
            timestamp >>>= 5;
        }

        // 80 bits split into 16 groups of five, most significant first
        int bitBuffer = 0;
        int bitCount = 0;
        int pos = 10;
        for (byte b : randomness) {
            bitBuffer = (bitBuffer << 8) | (b & 0xFF);
            bitCount += 8;
            while (bitCount >= 5) {
                bitCount -= 5;
                chars[pos++] = ENCODING[(bitBuffer >>> bitCount) & 0x1F];
            }
        }

        return new String(chars);
    }
}
