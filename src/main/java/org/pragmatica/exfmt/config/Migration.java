package org.pragmatica.exfmt.config;

/**
 * Opt-in source rewrites applied while formatting. Each one keeps the meaning of the code.
 */
public enum Migration {
    /** {@code unless c, do: x} becomes {@code if !c, do: x}. */
    UNLESS,
    /** Calls on the right side of {@code |>} always get parentheses. */
    CALL_PARENS_ON_PIPE,
    /** Known bitstring modifiers lose empty parentheses, custom ones gain them. */
    BITSTRING_MODIFIERS,
    /** Single-quoted charlists are written as {@code ~c} sigils. */
    CHARLISTS_AS_SIGILS
}
