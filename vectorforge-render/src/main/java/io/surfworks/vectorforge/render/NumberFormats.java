package io.surfworks.vectorforge.render;

import java.math.BigInteger;

/**
 * Literal formatting shared by the dialects.
 */
final class NumberFormats {

    private NumberFormats() {}

    /**
     * Hex digits of {@code |value|}, left-padded with zeros to {@code digits}.
     */
    static String paddedHex(BigInteger value, int digits) {
        String hex = value.abs().toString(16);
        if (hex.length() >= digits) {
            return hex;
        }
        return "0".repeat(digits - hex.length()) + hex;
    }

    /**
     * Number of hex digits needed for a {@code width}-bit value.
     */
    static int hexDigits(int width) {
        return (width + 3) / 4;
    }

    /**
     * Sign-aware {@code 0x} literal, zero-padded to the width's digit count.
     * Negative values are written as a minus sign in front of their magnitude.
     */
    static String signedHex(BigInteger value, int width) {
        String body = "0x" + paddedHex(value, hexDigits(width));
        return value.signum() < 0 ? "-" + body : body;
    }

    /**
     * Sign-aware {@code 0x} literal without padding.
     */
    static String signedHex(BigInteger value) {
        String body = "0x" + value.abs().toString(16);
        return value.signum() < 0 ? "-" + body : body;
    }

    /**
     * Left-justifies {@code text} in a field of {@code width} characters.
     */
    static String padRight(String text, int width) {
        if (text.length() >= width) {
            return text;
        }
        return text + " ".repeat(width - text.length());
    }
}
