package com.agl.grammar.codec;

import com.agl.grammar.core.GrammarDecodeException;
import java.util.Objects;
import java.util.Random;

/**
 * Reversible scrambling of a grammar's canonical text so that a participant peeking at a saved
 * session cannot read the rules off it. This is obfuscation, not encryption.
 *
 * <p>Two coprime integers {@code base} and {@code modulus} are drawn from the printable band and
 * written as a two character header. Every printable ASCII character at position {@code i} of
 * the payload is then rotated within the 95 character band by {@code base^i mod modulus}.
 * Characters outside the band are copied unchanged.
 */
public final class ObfuscationCodec {

    public static final int BAND_START = ' ';
    public static final int BAND_WIDTH = 95;

    private final Random random;

    public ObfuscationCodec(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public String encode(String plain) {
        int base;
        int modulus;
        do {
            base = 2 + random.nextInt(BAND_WIDTH - 2);
            modulus = 2 + random.nextInt(BAND_WIDTH - 2);
        } while (gcd(base, modulus) != 1);
        return encode(plain, base, modulus);
    }

    public static String encode(String plain, int base, int modulus) {
        Objects.requireNonNull(plain, "plain");
        checkKey(base, modulus);
        StringBuilder sb = new StringBuilder(plain.length() + 2);
        sb.append((char) (BAND_START + base)).append((char) (BAND_START + modulus));
        rotate(plain, base, modulus, 1, sb);
        return sb.toString();
    }

    public static String decode(String obfuscated) {
        if (obfuscated == null || obfuscated.length() < 2) {
            throw new GrammarDecodeException("obfuscated text is missing its header");
        }
        int base = obfuscated.charAt(0) - BAND_START;
        int modulus = obfuscated.charAt(1) - BAND_START;
        try {
            checkKey(base, modulus);
        } catch (IllegalArgumentException e) {
            throw new GrammarDecodeException("invalid obfuscation header: " + e.getMessage(), e);
        }
        StringBuilder sb = new StringBuilder(obfuscated.length() - 2);
        rotate(obfuscated.substring(2), base, modulus, -1, sb);
        return sb.toString();
    }

    private static void rotate(String text, int base, int modulus, int direction, StringBuilder out) {
        int power = 1 % modulus;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            int offset = c - BAND_START;
            if (offset >= 0 && offset < BAND_WIDTH) {
                int shifted = Math.floorMod(offset + direction * power, BAND_WIDTH);
                out.append((char) (BAND_START + shifted));
            } else {
                out.append(c);
            }
            power = power * base % modulus;
        }
    }

    private static void checkKey(int base, int modulus) {
        if (base < 0 || base >= BAND_WIDTH || modulus < 1 || modulus >= BAND_WIDTH) {
            throw new IllegalArgumentException(
                    "key (" + base + ", " + modulus + ") outside [0, " + BAND_WIDTH + ")");
        }
        if (gcd(base, modulus) != 1) {
            throw new IllegalArgumentException(base + " and " + modulus + " are not coprime");
        }
    }

    static int gcd(int a, int b) {
        while (b != 0) {
            int t = a % b;
            a = b;
            b = t;
        }
        return a;
    }
}
