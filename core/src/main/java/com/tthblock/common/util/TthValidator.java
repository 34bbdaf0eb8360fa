package com.tthblock.common.util;

/**
 * Checks the textual form of a Tiger Tree Hash: 39 characters of base32 (A-Z, 2-7).
 */
public final class TthValidator {
    public static final int TTH_LENGTH = 39;

    private TthValidator() {
    }

    public static boolean isValid(String tth) {
        if (tth == null || tth.length() != TTH_LENGTH) return false;
        for (int i = 0; i < tth.length(); i++) {
            if (!isBase32(tth.charAt(i))) return false;
        }
        return true;
    }

    /**
     * Returns the characters of {@code tth} that are outside the base32 alphabet,
     * in order of appearance. Used for log diagnostics only.
     */
    public static String invalidCharacters(String tth) {
        if (tth == null) return "";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < tth.length(); i++) {
            char c = tth.charAt(i);
            if (!isBase32(c)) sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Human readable reason why {@code tth} was rejected, e.g. for a WARN log line.
     */
    public static String describeInvalid(String tth) {
        String bad = invalidCharacters(tth);
        return "Invalid TTH: " + tth + " (must be 39 characters, base32 A-Z/2-7"
                + (bad.isEmpty() ? "" : ", found invalid characters: " + bad) + ")";
    }

    private static boolean isBase32(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= '2' && c <= '7');
    }
}
