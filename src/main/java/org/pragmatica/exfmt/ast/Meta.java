package org.pragmatica.exfmt.ast;

import java.util.Optional;

/**
 * Source metadata attached to a node by the parser. Every entry is optional:
 * a node without a line has no original position.
 *
 * @param line            line where the node starts
 * @param closing         closing delimiter of a call, list, map or tuple
 * @param doBlock         the {@code do} of a do/end block
 * @param end             the {@code end} of a do/end block
 * @param delimiter       opening delimiter of strings, charlists, sigils and quoted atoms
 * @param newlines        newlines right after the opening delimiter or operator
 * @param endOfExpression newlines after the node when it is a block expression
 * @param token           the numeric literal exactly as written
 * @param keywordFormat   whether an atom was written as a keyword key ({@code foo:})
 */
public record Meta(Optional<Integer> line,
                   Optional<Mark> closing,
                   Optional<Mark> doBlock,
                   Optional<Mark> end,
                   Optional<String> delimiter,
                   int newlines,
                   Optional<Integer> endOfExpression,
                   Optional<String> token,
                   boolean keywordFormat) {
    public static final Meta EMPTY = builder().build();

    /**
     * Position of a delimiter. A mark may exist without a line (for example an explicit {@code ()}
     * on a call that was synthesised).
     */
    public record Mark(Optional<Integer> line) {
        public static final Mark NO_LINE = new Mark(Optional.empty());

        public static Mark at(int line) {
            return new Mark(Optional.of(line));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Meta atLine(int line) {
        return builder().line(line).build();
    }

    public int lineOr(int fallback) {
        return line.orElse(fallback);
    }

    public int closingLineOr(int fallback) {
        return closing.flatMap(Mark::line).orElse(fallback);
    }

    public int endLineOr(int fallback) {
        return end.flatMap(Mark::line).orElse(fallback);
    }

    public boolean hasDelimiter(String value) {
        return delimiter.filter(value::equals).isPresent();
    }

    public Meta withClosing(Mark mark) {
        return toBuilder().closing(mark).build();
    }

    public Meta withoutClosing() {
        return toBuilder().closing(Optional.empty()).build();
    }

    public Builder toBuilder() {
        return new Builder().line(line)
                            .closing(closing)
                            .doBlock(doBlock)
                            .end(end)
                            .delimiter(delimiter)
                            .newlines(newlines)
                            .endOfExpression(endOfExpression)
                            .token(token)
                            .keywordFormat(keywordFormat);
    }

    public static final class Builder {
        private Optional<Integer> line = Optional.empty();
        private Optional<Mark> closing = Optional.empty();
        private Optional<Mark> doBlock = Optional.empty();
        private Optional<Mark> end = Optional.empty();
        private Optional<String> delimiter = Optional.empty();
        private int newlines;
        private Optional<Integer> endOfExpression = Optional.empty();
        private Optional<String> token = Optional.empty();
        private boolean keywordFormat;

        private Builder() {}

        public Builder line(int line) {
            return line(Optional.of(line));
        }

        public Builder line(Optional<Integer> line) {
            this.line = line;
            return this;
        }

        public Builder closing(int line) {
            return closing(Mark.at(line));
        }

        public Builder closing(Mark mark) {
            return closing(Optional.of(mark));
        }

        public Builder closing(Optional<Mark> closing) {
            this.closing = closing;
            return this;
        }

        public Builder doBlock(int line) {
            return doBlock(Optional.of(Mark.at(line)));
        }

        public Builder doBlock(Optional<Mark> doBlock) {
            this.doBlock = doBlock;
            return this;
        }

        public Builder end(int line) {
            return end(Optional.of(Mark.at(line)));
        }

        public Builder end(Optional<Mark> end) {
            this.end = end;
            return this;
        }

        public Builder delimiter(String delimiter) {
            return delimiter(Optional.of(delimiter));
        }

        public Builder delimiter(Optional<String> delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        public Builder newlines(int newlines) {
            this.newlines = newlines;
            return this;
        }

        public Builder endOfExpression(int newlines) {
            return endOfExpression(Optional.of(newlines));
        }

        public Builder endOfExpression(Optional<Integer> newlines) {
            this.endOfExpression = newlines;
            return this;
        }

        public Builder token(String token) {
            return token(Optional.of(token));
        }

        public Builder token(Optional<String> token) {
            this.token = token;
            return this;
        }

        public Builder keywordFormat(boolean keywordFormat) {
            this.keywordFormat = keywordFormat;
            return this;
        }

        public Meta build() {
            return new Meta(line, closing, doBlock, end, delimiter, newlines, endOfExpression, token, keywordFormat);
        }
    }
}
