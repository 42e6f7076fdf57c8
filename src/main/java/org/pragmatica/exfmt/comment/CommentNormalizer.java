package org.pragmatica.exfmt.comment;

import org.pragmatica.exfmt.doc.Doc;

import java.util.ArrayList;
import java.util.List;

import static org.pragmatica.exfmt.doc.Docs.line;
import static org.pragmatica.exfmt.doc.Docs.text;

/**
 * Turns the parser's comments into placeable documents.
 */
public final class CommentNormalizer {
    private static final int BLANK_LINE = 2;

    private CommentNormalizer() {}

    /**
     * Put a space after the leading {@code #} run. A lone {@code #}, shebangs and comments that
     * already have the space are kept.
     */
    public static String normalizeText(String text) {
        if (text.equals("#") || text.startsWith("#!") || text.startsWith("# ") || !text.startsWith("#")) {
            return text;
        }
        if (text.startsWith("##")) {
            return "#" + normalizeText(text.substring(1));
        }
        return "# " + text.substring(1);
    }

    /**
     * Normalise and merge comments on consecutive lines into single multi-line entries.
     * A comment sharing its line with code is never merged with the comments after it,
     * and is treated as if a blank line preceded it.
     */
    public static List<GatheredComment> gather(List<Comment> comments) {
        var result = new ArrayList<GatheredComment>();
        var index = 0;

        while (index < comments.size()) {
            var comment = comments.get(index++);
            Doc doc = text(normalizeText(comment.text()));

            if (comment.newlinesBefore() == 0) {
                result.add(new GatheredComment(comment.line(), doc, BLANK_LINE, comment.newlinesAfter()));
                continue;
            }

            var nextEol = comment.newlinesAfter();
            var expectedLine = comment.line() + 1;

            while (index < comments.size()) {
                var followup = comments.get(index);

                if (followup.line() != expectedLine || followup.newlinesBefore() == 0) {
                    break;
                }
                doc = line(doc, text(normalizeText(followup.text())));
                nextEol = followup.newlinesAfter();
                expectedLine++;
                index++;
            }
            result.add(new GatheredComment(comment.line(), doc, comment.newlinesBefore(), nextEol));
        }
        return result;
    }
}
