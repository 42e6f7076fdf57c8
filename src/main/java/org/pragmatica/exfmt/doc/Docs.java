package org.pragmatica.exfmt.doc;

import org.pragmatica.exfmt.doc.Doc.BreakMode;
import org.pragmatica.exfmt.doc.Doc.GroupMode;
import org.pragmatica.exfmt.doc.Doc.Indent;
import org.pragmatica.exfmt.doc.Doc.NestMode;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Builders for {@link Doc} values.
 *
 * <p>Builders never simplify their input: {@code concat(empty(), x)} is a concatenation,
 * so callers can still recognise the shape they built.
 */
public final class Docs {
    private static final Doc SPACE_BREAK = new Doc.Break(" ", BreakMode.STRICT);
    private static final Doc EMPTY_BREAK = new Doc.Break("", BreakMode.STRICT);
    private static final Doc FLEX_SPACE_BREAK = new Doc.Break(" ", BreakMode.FLEX);

    private Docs() {}

    public static Doc empty() {
        return Doc.Empty.INSTANCE;
    }

    public static boolean isEmpty(Doc doc) {
        return doc == Doc.Empty.INSTANCE;
    }

    /**
     * Text document. The text is expected to be free of newlines, use {@link #hardLine()} between lines.
     */
    public static Doc text(String text) {
        return Doc.Text.of(text);
    }

    public static Doc concat(Doc left, Doc right) {
        return new Doc.Concat(left, right);
    }

    /**
     * Left-to-right concatenation, equivalent to chaining {@link #concat(Doc, Doc)}.
     */
    public static Doc concat(Doc first, Doc... rest) {
        var result = first;
        for (var doc : rest) {
            result = concat(result, doc);
        }
        return result;
    }

    public static Doc concat(Doc left, String right) {
        return concat(left, text(right));
    }

    public static Doc concat(String left, Doc right) {
        return concat(text(left), right);
    }

    public static Doc nest(Doc doc, int amount) {
        return amount == 0 ? doc : new Doc.Nest(doc, Indent.of(amount), NestMode.ALWAYS);
    }

    public static Doc nest(Doc doc, int amount, NestMode mode) {
        return amount == 0 ? doc : new Doc.Nest(doc, Indent.of(amount), mode);
    }

    public static Doc nest(Doc doc, Indent indent) {
        return nest(doc, indent, NestMode.ALWAYS);
    }

    public static Doc nest(Doc doc, Indent indent, NestMode mode) {
        if (indent.kind() == Indent.Kind.FIXED) {
            return nest(doc, indent.amount(), mode);
        }
        return new Doc.Nest(doc, indent, mode);
    }

    /**
     * Strict break rendered as a single space when flat.
     */
    public static Doc softBreak() {
        return SPACE_BREAK;
    }

    public static Doc softBreak(String text) {
        return text.isEmpty() ? EMPTY_BREAK : new Doc.Break(text, BreakMode.STRICT);
    }

    public static Doc flexBreak() {
        return FLEX_SPACE_BREAK;
    }

    public static Doc flexBreak(String text) {
        return new Doc.Break(text, BreakMode.FLEX);
    }

    public static Doc hardLine() {
        return Doc.Line.INSTANCE;
    }

    public static Doc glue(Doc left, Doc right) {
        return concat(left, SPACE_BREAK, right);
    }

    public static Doc glue(Doc left, String separator, Doc right) {
        return concat(left, softBreak(separator), right);
    }

    public static Doc flexGlue(Doc left, Doc right) {
        return concat(left, FLEX_SPACE_BREAK, right);
    }

    /**
     * Joins two documents with a mandatory line break.
     */
    public static Doc line(Doc left, Doc right) {
        return concat(left, hardLine(), right);
    }

    public static Doc group(Doc doc) {
        return new Doc.Group(doc, GroupMode.NORMAL);
    }

    public static Doc group(Doc doc, GroupMode mode) {
        return new Doc.Group(doc, mode);
    }

    public static Doc forceUnfit(Doc doc) {
        return new Doc.ForceUnfit(doc);
    }

    public static Doc collapseLines(int max) {
        checkArgument(max > 0, "max must be positive: %s", max);
        return new Doc.CollapseLines(max);
    }

    public static Doc noLimit(Doc doc) {
        return new Doc.NoLimit(doc);
    }

    public static Doc color(Doc doc, String open, String close) {
        return new Doc.Color(doc, open, close);
    }
}
