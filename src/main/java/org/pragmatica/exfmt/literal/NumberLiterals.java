package org.pragmatica.exfmt.literal;

import com.google.common.base.Ascii;

/**
 * Normalisation of numeric literal tokens as written in the source.
 */
public final class NumberLiterals {
    private static final int GROUPING_THRESHOLD = 6;

    private NumberLiterals() {}

    /**
     * Normalise an integer token: hexadecimal digits are upper-cased, binary, octal and
     * character tokens stay as written, decimal tokens get digit grouping.
     */
    public static String integer(String token) {
        if (token.startsWith("0x")) {
            return "0x" + Ascii.toUpperCase(token.substring(2));
        }
        if (token.startsWith("0b") || token.startsWith("0o") || token.startsWith("?")) {
            return token;
        }
        return insertUnderscores(token);
    }

    /**
     * Normalise a float token: the integer part gets digit grouping, the rest is lower-cased.
     */
    public static String floating(String token) {
        var dot = token.indexOf('.');

        if (dot < 0) {
            return token;
        }

        return insertUnderscores(token.substring(0, dot)) + "." + Ascii.toLowerCase(token.substring(dot + 1));
    }

    /**
     * Group decimal digits by three from the right, when there are at least six of them
     * and the token does not already use underscores.
     */
    public static String insertUnderscores(String digits) {
        if (digits.startsWith("-")) {
            return "-" + insertUnderscores(digits.substring(1));
        }
        if (digits.contains("_") || digits.length() < GROUPING_THRESHOLD) {
            return digits;
        }

        var offset = digits.length() % 3;
        var result = new StringBuilder(digits.substring(0, offset));

        for (int i = offset; i < digits.length(); i += 3) {
            if (result.length() > 0) {
                result.append('_');
            }
            result.append(digits, i, i + 3);
        }
        return result.toString();
    }
}
