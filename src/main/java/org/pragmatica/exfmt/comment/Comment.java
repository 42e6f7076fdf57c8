package org.pragmatica.exfmt.comment;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Comment collected by the parser, in source order.
 *
 * @param line           line of the comment
 * @param text           comment text starting with {@code #}
 * @param newlinesBefore end-of-line markers between the previous token and the comment;
 *                       0 means the comment shares its line with code, 2 or more means a blank line
 * @param newlinesAfter  end-of-line markers between the comment and the next token
 */
public record Comment(int line, String text, int newlinesBefore, int newlinesAfter) {
    public Comment {
        checkNotNull(text, "text");
        checkArgument(newlinesBefore >= 0 && newlinesAfter >= 0, "newline counts must not be negative");
    }

    /**
     * Comment on a line of its own, directly after the previous line and before the next one.
     */
    public static Comment of(int line, String text) {
        return new Comment(line, text, 1, 1);
    }
}
