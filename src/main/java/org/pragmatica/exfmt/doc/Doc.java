package org.pragmatica.exfmt.doc;

/**
 * Layout document - an immutable tree of algebra primitives consumed by {@link DocRenderer}.
 * Documents are built with the helpers in {@link Docs} and never mutated after construction.
 */
public sealed interface Doc {

    /**
     * The empty document. Renders nothing and is absorbed by {@link Docs#concat}.
     */
    enum Empty implements Doc {
        INSTANCE
    }

    /**
     * Literal text without newlines. Width is measured in code points.
     */
    record Text(String text, int width) implements Doc {
        public static Text of(String text) {
            return new Text(text, text.codePointCount(0, text.length()));
        }
    }

    /**
     * Two documents one after the other.
     */
    record Concat(Doc left, Doc right) implements Doc {}

    /**
     * Indentation applied to the line breaks of the nested document.
     */
    record Nest(Doc doc, Indent indent, NestMode mode) implements Doc {}

    /**
     * Optional line break: renders as {@code text} when flat, as a newline otherwise.
     * Strict breaks follow the enclosing group, flex breaks decide on their own.
     */
    record Break(String text, BreakMode mode) implements Doc {}

    /**
     * Mandatory line break.
     */
    enum Line implements Doc {
        INSTANCE
    }

    /**
     * A region whose strict breaks are rendered all flat or all broken.
     */
    record Group(Doc doc, GroupMode mode) implements Doc {}

    /**
     * Never renders its content flat.
     */
    record ForceUnfit(Doc doc) implements Doc {}

    /**
     * Collapses the newlines that follow into at most {@code max} newlines.
     */
    record CollapseLines(int max) implements Doc {}

    /**
     * Renders the content flat without any width limit.
     */
    record NoLimit(Doc doc) implements Doc {}

    /**
     * Zero-width decorations written around the content.
     */
    record Color(Doc doc, String open, String close) implements Doc {}

    enum BreakMode {
        STRICT,
        FLEX
    }

    enum NestMode {
        ALWAYS,
        BREAK
    }

    /**
     * How a group reacts when it is part of the content an enclosing group measures.
     * {@code OPTIMISTIC} fits when its content fits up to its first break,
     * {@code PESSIMISTIC} must fit completely even if it contains optimistic groups.
     */
    enum GroupMode {
        NORMAL,
        OPTIMISTIC,
        PESSIMISTIC
    }

    /**
     * Indentation amount: fixed columns, the current column, or column zero.
     */
    record Indent(Kind kind, int amount) {
        public static final Indent CURSOR = new Indent(Kind.CURSOR, 0);
        public static final Indent RESET = new Indent(Kind.RESET, 0);

        public static Indent of(int amount) {
            return new Indent(Kind.FIXED, amount);
        }

        public enum Kind {
            FIXED,
            CURSOR,
            RESET
        }
    }
}
