package org.pragmatica.exfmt.format;

/**
 * Treatment of the last element of an argument sequence.
 */
public enum LastArgMode {
    NONE,
    /** Followed by a comma, as more arguments come after the sequence. */
    FORCE_COMMA,
    /** May break on its own while the sequence stays on one line. */
    NEXT_BREAK_FITS
}
