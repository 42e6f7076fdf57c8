package org.pragmatica.exfmt;

import org.pragmatica.exfmt.ast.Ast;
import org.pragmatica.exfmt.comment.Comment;
import org.pragmatica.exfmt.comment.CommentNormalizer;
import org.pragmatica.exfmt.config.FormatterConfig;
import org.pragmatica.exfmt.config.LocalWithoutParens;
import org.pragmatica.exfmt.config.Migration;
import org.pragmatica.exfmt.config.SigilCallback;
import org.pragmatica.exfmt.config.SyntaxColors;
import org.pragmatica.exfmt.doc.Doc;
import org.pragmatica.exfmt.doc.DocRenderer;
import org.pragmatica.exfmt.error.FormatError;
import org.pragmatica.exfmt.error.FormatException;
import org.pragmatica.exfmt.format.MigrationPass;
import org.pragmatica.exfmt.format.Translator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Entry point for formatting quoted Elixir code.
 *
 * <p>Example usage:
 * <pre>{@code
 * // foo(1, 2, 3)
 * var ast = Asts.call("foo", Asts.integer("1"), Asts.integer("2"), Asts.integer("3"));
 *
 * var text = ExFormatter.builder()
 *                       .localWithoutParens("foo", 3)
 *                       .format(ast);   // "foo 1, 2, 3"
 * }</pre>
 */
public final class ExFormatter {
    private static final Logger log = LoggerFactory.getLogger(ExFormatter.class);

    private ExFormatter() {}

    /**
     * Build the layout document of a tree without comments, using the default configuration.
     */
    public static Doc toDoc(Ast ast) {
        return toDoc(ast, List.of(), FormatterConfig.DEFAULT);
    }

    public static Doc toDoc(Ast ast, List<Comment> comments) {
        return toDoc(ast, comments, FormatterConfig.DEFAULT);
    }

    /**
     * Build the layout document of a tree and place the comments collected alongside it.
     *
     * @param ast      quoted expression, with literals wrapped in blocks
     * @param comments comments in source order
     * @param config   formatter configuration
     */
    public static Doc toDoc(Ast ast, List<Comment> comments, FormatterConfig config) {
        checkNotNull(ast, "ast");
        checkNotNull(comments, "comments");
        checkNotNull(config, "config");

        log.debug("Formatting with line length {}, migrations {}", config.lineLength(), config.migrations());

        var gathered = CommentNormalizer.gather(comments);

        // The tree is walked recursively, the renderer is not
        try {
            var migrated = MigrationPass.apply(ast, config);
            return Translator.translate(migrated, gathered, config);
        } catch (StackOverflowError error) {
            throw new FormatException(new FormatError.NestingTooDeep("out of stack while translating the tree"), error);
        }
    }

    /**
     * Format a tree at the default line length. The result has no trailing newline.
     */
    public static String format(Ast ast) {
        return format(ast, List.of(), FormatterConfig.DEFAULT);
    }

    public static String format(Ast ast, List<Comment> comments) {
        return format(ast, comments, FormatterConfig.DEFAULT);
    }

    public static String format(Ast ast, List<Comment> comments, FormatterConfig config) {
        return DocRenderer.render(toDoc(ast, comments, config), config.lineLength());
    }

    /**
     * The built-in table of calls written without parentheses.
     */
    public static List<LocalWithoutParens> localsWithoutParens() {
        return LocalWithoutParens.DEFAULTS;
    }

    /**
     * Whether {@code name/arity} is written without parentheses according to {@code locals}.
     * Calls without arguments always keep theirs.
     */
    public static boolean isLocalWithoutParens(String name, int arity, List<LocalWithoutParens> locals) {
        return LocalWithoutParens.matches(name, arity, locals);
    }

    /**
     * Create a builder for formatting with a custom configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final FormatterConfig.Builder config = FormatterConfig.builder();

        private Builder() {}

        public Builder lineLength(int lineLength) {
            config.lineLength(lineLength);
            return this;
        }

        public Builder localWithoutParens(String name, int arity) {
            config.localWithoutParens(name, arity);
            return this;
        }

        public Builder sigil(String name, SigilCallback callback) {
            config.sigil(name, callback);
            return this;
        }

        public Builder migration(Migration migration, boolean enabled) {
            config.migration(migration, enabled);
            return this;
        }

        public Builder migrate(boolean enabled) {
            config.migrate(enabled);
            return this;
        }

        public Builder syntaxColors(SyntaxColors colors) {
            config.syntaxColors(colors);
            return this;
        }

        public Builder file(String file) {
            config.file(file);
            return this;
        }

        public Builder forceDoEndBlocks(boolean enabled) {
            config.forceDoEndBlocks(enabled);
            return this;
        }

        public FormatterConfig config() {
            return config.build();
        }

        public String format(Ast ast) {
            return ExFormatter.format(ast, List.of(), config());
        }

        public String format(Ast ast, List<Comment> comments) {
            return ExFormatter.format(ast, comments, config());
        }
    }
}
