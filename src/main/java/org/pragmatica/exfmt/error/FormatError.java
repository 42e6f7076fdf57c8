package org.pragmatica.exfmt.error;

import java.math.BigInteger;

/**
 * Errors reported to the caller of a formatting call.
 */
public sealed interface FormatError {
    String message();

    /**
     * Option value outside of its domain.
     */
    record InvalidOption(String option, String reason) implements FormatError {
        @Override
        public String message() {
            return "Invalid option " + option + ": " + reason;
        }
    }

    /**
     * Malformed entry in the sigil callback table.
     */
    record InvalidSigil(String name, String reason) implements FormatError {
        @Override
        public String message() {
            return "Invalid sigil callback for ~" + name + ": " + reason
                   + ". Sigil names must be upper-case letters and callbacks must not be null";
        }
    }

    /**
     * Sigil callback returned something other than text.
     */
    record SigilCallbackResult(String sigil, Object returned) implements FormatError {
        @Override
        public String message() {
            return "Expected sigil callback for ~" + sigil + " to return text, got: " + describe(returned);
        }

        private static String describe(Object value) {
            if (value == null) {
                return "null";
            }
            return value + " (" + value.getClass().getName() + ")";
        }
    }

    /**
     * Charlist element that is not a Unicode code point.
     */
    record InvalidCodePoint(BigInteger value) implements FormatError {
        @Override
        public String message() {
            return "Invalid code point in charlist: " + value;
        }
    }

    /**
     * Tree nested deeper than the formatter can walk.
     */
    record NestingTooDeep(String reason) implements FormatError {
        @Override
        public String message() {
            return "Expression is nested too deeply to format: " + reason;
        }
    }
}
