package org.pragmatica.exfmt.comment;

import com.google.common.collect.ImmutableList;
import org.pragmatica.exfmt.doc.Doc;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.pragmatica.exfmt.doc.Docs.collapseLines;
import static org.pragmatica.exfmt.doc.Docs.concat;
import static org.pragmatica.exfmt.doc.Docs.empty;
import static org.pragmatica.exfmt.doc.Docs.group;
import static org.pragmatica.exfmt.doc.Docs.hardLine;
import static org.pragmatica.exfmt.doc.Docs.isEmpty;

/**
 * Places comments between the documents of a sibling sequence.
 *
 * <p>Each step takes the pending comments and returns what is left of them. Siblings are
 * formatted through a callback, so the pending queue is handed to the callback through
 * {@link #comments()}: nested sequences consume the comments inside them before the
 * enclosing sequence continues with what is left.
 *
 * <p>Placement rules:
 * <ul>
 *   <li>comments before a sibling's first line go before the sibling;</li>
 *   <li>comments inside a sibling's lines that its children did not take go right after it,
 *       unless the sibling is the last one, in which case they are left to the end of the
 *       sequence or to the enclosing sequence;</li>
 *   <li>comments before the closing line go at the end of the sequence;</li>
 *   <li>blank lines are kept, at most one in a row.</li>
 * </ul>
 */
public final class CommentInterleaver {
    private static final int BLANK_LINE = 2;

    private CommentQueue comments;

    public CommentInterleaver(CommentQueue comments) {
        this.comments = comments;
    }

    /**
     * A formatted sibling: its document, the separator to use when it is followed by a blank
     * line it did not ask for, and the newlines that originally followed it.
     */
    public record Entry(Doc doc, Doc nextLine, int newlines) {
        public static Entry of(Doc doc) {
            return new Entry(doc, empty(), 1);
        }

        Entry withNewlines(int value) {
            return new Entry(doc, nextLine, value);
        }
    }

    /**
     * Merged documents of a sequence and whether any comment was placed in it.
     */
    public record Interleaved(List<Doc> docs, boolean hasComments) {}

    @FunctionalInterface
    public interface EntryFunction<T> {
        /**
         * Format one item, given the items that follow it.
         */
        Entry apply(T item, List<T> rest);
    }

    public CommentQueue comments() {
        return comments;
    }

    /**
     * Whether any pending comment lies strictly between the two lines.
     */
    public boolean anyBetween(int fromLine, int toLine) {
        return comments.anyLine(line -> line > fromLine && line < toLine);
    }

    /**
     * Line of the first pending comment after {@code line}, or a line past {@link LineRange#MAX_LINE} if there is none.
     */
    public int firstLineAfter(int line) {
        return comments.dropWhile(commentLine -> commentLine <= line)
                       .peek()
                       .map(GatheredComment::line)
                       .orElse(LineRange.MAX_LINE + 1);
    }

    /**
     * Format the items and merge the comments found between {@code minLine} and {@code maxLine}
     * into the result. Comments at or before {@code minLine} are not touched.
     *
     * @param items   items to format
     * @param acc     entries already formatted in front of the items
     * @param span    source lines of an item
     * @param format  formatting callback
     */
    public <T> Interleaved interleave(List<T> items,
                                      List<Entry> acc,
                                      int minLine,
                                      int maxLine,
                                      Function<T, LineRange> span,
                                      EntryFunction<T> format) {
        var split = comments.splitWhile(line -> line <= minLine);
        var entries = new ArrayList<>(acc);
        var pending = split.rest();
        var hasComments = false;

        if (pending.isEmpty()) {
            for (int i = 0; i < items.size(); i++) {
                var formatted = formatItem(pending, items.get(i), items.subList(i + 1, items.size()), format);
                entries.add(formatted.value());
                pending = formatted.comments();
            }
        } else {
            var interleaved = interleaveEach(pending, items, entries, maxLine, span, format);
            hasComments = interleaved.value();
            pending = interleaved.comments();
        }

        comments = pending.prependAll(split.taken());
        return new Interleaved(merge(entries), hasComments);
    }

    /**
     * Result of one step together with the comments still pending after it.
     */
    record Step<R>(R value, CommentQueue comments) {}

    // Nested sequences formatted by the callback take their comments from the shared cursor
    private <T> Step<Entry> formatItem(CommentQueue pending, T item, List<T> rest, EntryFunction<T> format) {
        comments = pending;
        var entry = format.apply(item, rest);
        return new Step<>(entry, comments);
    }

    private <T> Step<Boolean> interleaveEach(CommentQueue pending,
                                             List<T> items,
                                             List<Entry> entries,
                                             int maxLine,
                                             Function<T, LineRange> span,
                                             EntryFunction<T> format) {
        var queue = pending;
        var hasComments = false;

        for (int i = 0; i < items.size(); i++) {
            var item = items.get(i);
            var rest = items.subList(i + 1, items.size());
            var range = span.apply(item);

            if (range.isNone()) {
                var formatted = formatItem(queue, item, rest, format);
                entries.add(formatted.value());
                queue = formatted.comments();
                continue;
            }

            var before = extractBefore(queue, range.min(), entries);
            hasComments |= before.value();

            var formatted = formatItem(before.comments(), item, rest, format);
            var entry = formatted.value();
            queue = formatted.comments();

            if (rest.isEmpty()) {
                entries.add(adjustTrailingNewlines(entry, range.max(), queue));
                continue;
            }

            var trailing = queue.splitWhile(line -> line >= range.min() && line <= range.max());
            queue = trailing.rest();

            if (trailing.taken().isEmpty()) {
                entries.add(adjustTrailingNewlines(entry, range.max(), queue));
                continue;
            }

            hasComments = true;
            entries.add(entry.withNewlines(1));

            var last = trailing.taken().size() - 1;
            for (int c = 0; c < last; c++) {
                entries.add(Entry.of(trailing.taken().get(c).doc()));
            }
            var lastComment = new Entry(trailing.taken().get(last).doc(), empty(), entry.newlines());
            entries.add(adjustTrailingNewlines(lastComment, range.max(), queue));
        }

        var closing = extractBefore(queue, maxLine, entries);
        return new Step<>(hasComments || closing.value(), closing.comments());
    }

    static Step<Boolean> extractBefore(CommentQueue pending, int line, List<Entry> entries) {
        var queue = pending;
        var found = false;

        while (!queue.isEmpty() && queue.head().line() < line) {
            var comment = queue.head();
            var lastIndex = entries.size() - 1;

            if (lastIndex >= 0 && entries.get(lastIndex).newlines() < comment.previousEolCount()) {
                entries.set(lastIndex, entries.get(lastIndex).withNewlines(comment.previousEolCount()));
            }
            entries.add(new Entry(comment.doc(), empty(), comment.nextEolCount()));
            queue = queue.tail();
            found = true;
        }
        return new Step<>(found, queue);
    }

    // A comment right below the sibling was not counted in the sibling's own trailing newlines
    static Entry adjustTrailingNewlines(Entry entry, int docEnd, CommentQueue pending) {
        var next = pending.peek();

        if (entry.newlines() > 1 && next.isPresent() && next.get().line() == docEnd + 1) {
            return entry.withNewlines(1);
        }
        return entry;
    }

    /**
     * Join the entries with the separators their newline counts ask for. Each resulting document is
     * a group, so a separator that is a soft break turns into a blank line when its neighbour breaks.
     */
    static List<Doc> merge(List<Entry> entries) {
        var result = ImmutableList.<Doc>builder();
        var left = empty();

        for (int i = 0; i < entries.size(); i++) {
            var entry = entries.get(i);
            var right = entry.newlines() >= BLANK_LINE ? hardLine() : entry.nextLine();
            var doc = isEmpty(left) ? entry.doc() : concat(left, entry.doc());

            if (i < entries.size() - 1 && !isEmpty(right)) {
                doc = concat(doc, concat(collapseLines(BLANK_LINE), right));
            }
            result.add(group(doc));
            left = right;
        }
        return result.build();
    }
}
