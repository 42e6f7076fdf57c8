package org.pragmatica.exfmt.format;

/**
 * Separator between the elements of an argument sequence.
 */
public enum Join {
    /** Elements on separate lines. */
    LINE,
    /** All elements on one line or each on its own. */
    BREAK,
    /** Fill lines with as many elements as fit. */
    FLEX_BREAK,
    /** The sequence was empty. */
    EMPTY
}
