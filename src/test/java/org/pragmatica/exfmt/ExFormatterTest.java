package org.pragmatica.exfmt;

import org.junit.jupiter.api.Test;
import org.pragmatica.exfmt.ast.Ast;
import org.pragmatica.exfmt.ast.Ast.Call;
import org.pragmatica.exfmt.ast.Ast.IntegerLiteral;
import org.pragmatica.exfmt.ast.Ast.ListLiteral;
import org.pragmatica.exfmt.ast.Ast.StringLiteral;
import org.pragmatica.exfmt.ast.Asts;
import org.pragmatica.exfmt.ast.Meta;
import org.pragmatica.exfmt.comment.Comment;
import org.pragmatica.exfmt.config.FormatterConfig;
import org.pragmatica.exfmt.config.LocalWithoutParens;
import org.pragmatica.exfmt.config.Migration;
import org.pragmatica.exfmt.config.SyntaxColors;
import org.pragmatica.exfmt.config.SyntaxColors.Category;
import org.pragmatica.exfmt.error.FormatError;
import org.pragmatica.exfmt.error.FormatException;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.pragmatica.exfmt.ast.Asts.call;
import static org.pragmatica.exfmt.ast.Asts.integer;
import static org.pragmatica.exfmt.ast.Asts.kw;
import static org.pragmatica.exfmt.ast.Asts.op;
import static org.pragmatica.exfmt.ast.Asts.parensCall;
import static org.pragmatica.exfmt.ast.Asts.var;

class ExFormatterTest {

    // === Operators ===

    @Test
    void format_binaryOperator_spacesAroundOperator() {
        assertEquals("1 + 2", ExFormatter.format(op("+", integer("1"), integer("2"))));
    }

    @Test
    void format_lowerPrecedenceOperand_getsParentheses() {
        var ast = op("*", op("+", var("a"), var("b")), var("c"));

        assertEquals("(a + b) * c", ExFormatter.format(ast));
    }

    @Test
    void format_leftAssociativeChain_parenthesisedOnlyOnTheRight() {
        assertEquals("a - b - c", ExFormatter.format(op("-", op("-", var("a"), var("b")), var("c"))));
        assertEquals("a - (b - c)", ExFormatter.format(op("-", var("a"), op("-", var("b"), var("c")))));
    }

    @Test
    void format_unaryOperators() {
        assertEquals("!a", ExFormatter.format(call("!", var("a"))));
        assertEquals("not a", ExFormatter.format(call("not", var("a"))));
    }

    @Test
    void format_pipelineTooWide_breaksBeforeEachPipe() {
        var ast = op("|>", op("|>", var("a"), parensCall("b")), parensCall("c"));
        var config = FormatterConfig.builder().lineLength(5).build();

        assertEquals("a\n|> b()\n|> c()", ExFormatter.format(ast, List.of(), config));
        assertEquals("a |> b() |> c()", ExFormatter.format(ast));
    }

    // === Calls ===

    @Test
    void format_localWithoutParens_dropsParentheses() {
        var ast = call("foo", integer("1"), integer("2"), integer("3"));

        var text = ExFormatter.builder()
                              .localWithoutParens("foo", 3)
                              .format(ast);

        assertEquals("foo 1, 2, 3", text);
    }

    @Test
    void format_callTooWide_breaksArgumentsOnePerLine() {
        var ast = call("foo", var("aaaa"), var("bbbb"));
        var config = FormatterConfig.builder().lineLength(10).build();

        assertEquals("foo(aaaa, bbbb)", ExFormatter.format(ast));
        assertEquals("foo(\n  aaaa,\n  bbbb\n)", ExFormatter.format(ast, List.of(), config));
    }

    @Test
    void format_remoteCall() {
        var ast = Asts.remote(Asts.aliases("Enum"), "map", var("list"), var("fun"));

        assertEquals("Enum.map(list, fun)", ExFormatter.format(ast));
    }

    @Test
    void format_trailingKeywordList_writtenWithoutBrackets() {
        var ast = call("config", Asts.atom("app"), new ListLiteral(List.of(kw("key", integer("1")))));

        assertEquals("config :app, key: 1", ExFormatter.format(ast));
    }

    @Test
    void format_doEndBlock() {
        var meta = Meta.builder().line(1).doBlock(1).end(3).build();
        var doKey = Asts.atom("do", Meta.atLine(1));
        var ast = Asts.call("if", meta, var("a", 1), new ListLiteral(List.of(Asts.pair(doKey, var("b", 2)))));

        assertEquals("if a do\n  b\nend", ExFormatter.format(ast));
    }

    @Test
    void format_forceDoEndBlocks_turnsKeywordBlockIntoDoEnd() {
        var ast = call("if", var("a"), new ListLiteral(List.of(kw("do", var("b")))));
        var config = FormatterConfig.builder().forceDoEndBlocks(true).build();

        assertEquals("if a, do: b", ExFormatter.format(ast));
        assertEquals("if a do\n  b\nend", ExFormatter.format(ast, List.of(), config));
    }

    @Test
    void format_anonymousFunctionAndCapture() {
        var arrow = call("->", new ListLiteral(List.of(var("x"))), var("x"));

        assertEquals("fn x -> x end", ExFormatter.format(call("fn", arrow)));
        assertEquals("&foo/1", ExFormatter.format(call("&", op("/", var("foo"), integer("1")))));
    }

    @Test
    void format_anonymousFunctionWithSeveralClauses_breaksEveryClause() {
        var one = call("->", new ListLiteral(List.of(integer("1"))), Asts.atom("one"));
        var two = call("->", new ListLiteral(List.of(integer("2"))), Asts.atom("two"));

        assertEquals("fn\n  1 -> :one\n  2 -> :two\nend", ExFormatter.format(call("fn", one, two)));
    }

    @Test
    void format_anonymousFunctionWithMultiLineBody_breaksTheBody() {
        var body = Asts.block(var("a", 2), var("b", 3));
        var arrow = call("->", new ListLiteral(List.of(var("x"))), body);

        assertEquals("fn x ->\n  a\n  b\nend", ExFormatter.format(call("fn", arrow)));
    }

    // === Literals ===

    @Test
    void format_hexInteger_upperCased() {
        assertEquals("0xAF", ExFormatter.format(integer("0xaf")));
    }

    @Test
    void format_stringsAtomsAndContainers() {
        assertEquals("\"say \\\"hi\\\"\"", ExFormatter.format(Asts.string("say \"hi\"")));
        assertEquals(":ok", ExFormatter.format(Asts.atom("ok")));
        assertEquals(":\"foo bar\"", ExFormatter.format(Asts.atom("foo bar")));
        assertEquals("[a: 1, b: 2]", ExFormatter.format(Asts.keyword(kw("a", integer("1")), kw("b", integer("2")))));
        assertEquals("%{a: 1}", ExFormatter.format(new Call("%{}", Meta.EMPTY, List.of(kw("a", integer("1"))))));
        assertEquals("{1, 2}", ExFormatter.format(Asts.block(Asts.pair(integer("1"), integer("2")))));
    }

    @Test
    void format_interpolatedString_neverBreaksInsideInterpolation() {
        var sum = op("+", var("first_value"), var("second_value"));
        var interpolation = op("::", Asts.remote(Asts.module("Kernel"), "to_string", sum), var("binary"));
        var meta = Meta.builder().delimiter("\"").build();
        var ast = Asts.call("<<>>", meta, new StringLiteral("a"), interpolation, new StringLiteral("b"));
        var config = FormatterConfig.builder().lineLength(5).build();

        assertEquals("\"a#{first_value + second_value}b\"", ExFormatter.format(ast, List.of(), config));
    }

    @Test
    void format_heredocContainingDelimiter_escapesIt() {
        assertEquals("\"\"\"\na\n\\\"\"\"\n\"\"\"", ExFormatter.format(Asts.heredoc("a\n\"\"\"\n")));
    }

    // === Comments ===

    @Test
    void format_commentBetweenListElements_forcesOneElementPerLine() {
        var meta = Meta.builder().line(1).closing(5).newlines(1).build();
        var ast = Asts.list(meta, integer("1", Meta.atLine(2)), integer("2", Meta.atLine(4)));

        var text = ExFormatter.format(ast, List.of(Comment.of(3, "# one")));

        assertEquals("[\n  1,\n  # one\n  2\n]", text);
    }

    @Test
    void format_commentBetweenStatements_isNormalisedAndKept() {
        var ast = Asts.block(var("a", 1), var("b", 3));

        assertEquals("a\n# note\nb", ExFormatter.format(ast, List.of(Comment.of(2, "#note"))));
    }

    @Test
    void format_blankLineBetweenStatements_isKept() {
        var first = var("a", Meta.builder().line(1).endOfExpression(2).build());
        var ast = Asts.block(first, var("b", 3));

        assertEquals("a\n\nb", ExFormatter.format(ast));
    }

    @Test
    void format_severalBlankLinesAroundComments_keepOneBlankLine() {
        var ast = Asts.block(var("a", 1), var("b", 10));
        var comments = List.of(new Comment(4, "# one", 3, 3), new Comment(7, "# two", 3, 3));

        assertEquals("a\n\n# one\n\n# two\n\nb", ExFormatter.format(ast, comments));
    }

    // === Layout ===

    @Test
    void format_acrossLineLengths_staysWithinWidthAndIsStable() {
        var names = List.of("aa", "bb", "cc", "dd", "ee", "ff", "gg", "hh");
        var vars = names.stream().map(Asts::var).toArray(Ast[]::new);
        var pairs = names.stream().map(name -> (Ast) kw(name, integer("1"))).collect(Collectors.toList());
        var samples = List.of(
            Asts.list(vars),
            Asts.list(Asts.list(vars[0], vars[1], vars[2]), Asts.list(vars[3], vars[4], vars[5]), Asts.list(vars[6], vars[7])),
            call("foo", vars),
            new Call("%{}", Meta.EMPTY, pairs),
            op("|>", op("|>", op("|>", var("aa"), parensCall("foo")), parensCall("bar")), parensCall("baz")));

        for (int width = 16; width <= 60; width++) {
            var config = FormatterConfig.builder().lineLength(width).build();

            for (var sample : samples) {
                var text = ExFormatter.format(sample, List.of(), config);

                for (var line : text.split("\n")) {
                    assertThat(line.codePointCount(0, line.length()))
                        .as("line '%s' at width %d", line, width)
                        .isLessThanOrEqualTo(width);
                }
                assertEquals(text, ExFormatter.format(sample, List.of(), config));
            }
        }
    }

    @Test
    void format_tokenWiderThanLine_isWrittenWhole() {
        var config = FormatterConfig.builder().lineLength(4).build();

        assertEquals("a_very_long_name", ExFormatter.format(var("a_very_long_name"), List.of(), config));
    }

    // === Limits ===

    @Test
    void format_deeplyNestedTree_failsWithNestingError() {
        Ast ast = var("x");
        for (int i = 0; i < 50_000; i++) {
            ast = Asts.list(ast);
        }
        var nested = ast;

        assertThatThrownBy(() -> ExFormatter.format(nested))
            .isInstanceOf(FormatException.class)
            .satisfies(error -> assertThat(((FormatException) error).error())
                .isInstanceOf(FormatError.NestingTooDeep.class))
            .hasMessageContaining("nested too deeply");
    }

    @Test
    void format_moderatelyNestedTree_isFormatted() {
        Ast ast = var("x");
        for (int i = 0; i < 20; i++) {
            ast = Asts.list(ast);
        }

        assertEquals("[".repeat(20) + "x" + "]".repeat(20), ExFormatter.format(ast));
    }

    @Test
    void format_charlistWithInvalidCodePoint_fails() {
        var chars = List.<Ast>of(new IntegerLiteral(BigInteger.ONE.shiftLeft(40)));
        var ast = Asts.block(Meta.builder().delimiter("'").build(), new ListLiteral(chars));

        assertThatThrownBy(() -> ExFormatter.format(ast))
            .isInstanceOf(FormatException.class)
            .satisfies(error -> assertThat(((FormatException) error).error())
                .isInstanceOf(FormatError.InvalidCodePoint.class));
    }

    // === Sigils ===

    @Test
    void format_sigilWithModifiers() {
        var ast = sigil("r", "a+", List.of(new IntegerLiteral(BigInteger.valueOf('i'))));

        assertEquals("~r/a+/i", ExFormatter.format(ast));
    }

    @Test
    void format_sigilCallback_replacesContent() {
        var text = ExFormatter.builder()
                              .sigil("X", (content, metadata) -> content.toUpperCase())
                              .format(sigil("X", "abc", List.of()));

        assertEquals("~X/ABC/", text);
    }

    @Test
    void format_sigilCallbackReturningNonText_fails() {
        var formatter = ExFormatter.builder().sigil("X", (content, metadata) -> 42);

        assertThatThrownBy(() -> formatter.format(sigil("X", "abc", List.of())))
            .isInstanceOf(FormatException.class)
            .satisfies(error -> assertThat(((FormatException) error).error())
                .isInstanceOf(FormatError.SigilCallbackResult.class))
            .hasMessageContaining("~X");
    }

    private static Ast sigil(String name, String content, List<Ast> modifiers) {
        var meta = Meta.builder().line(1).delimiter("/").build();
        var string = new Call("<<>>", Meta.EMPTY, List.of(new StringLiteral(content)));
        return new Call("sigil_" + name, meta, List.of(string, new ListLiteral(modifiers)));
    }

    // === Migrations ===

    @Test
    void format_unlessMigration_rewritesToNegatedIf() {
        var ast = call("unless", var("a"), new ListLiteral(List.of(kw("do", var("b")))));

        assertEquals("unless a, do: b", ExFormatter.format(ast));
        assertEquals("if !a, do: b", ExFormatter.builder().migration(Migration.UNLESS, true).format(ast));
    }

    @Test
    void format_callParensOnPipeMigration_addsParentheses() {
        var ast = op("|>", var("x"), var("foo"));

        assertEquals("x |> foo", ExFormatter.format(ast));
        assertEquals("x |> foo()", ExFormatter.builder().migrate(true).format(ast));
    }

    @Test
    void format_bitstringModifiersMigration() {
        var ast = call("<<>>", op("::", var("x"), call("binary")));

        assertEquals("<<x::binary()>>", ExFormatter.format(ast));
        assertEquals("<<x::binary>>", ExFormatter.builder().migration(Migration.BITSTRING_MODIFIERS, true).format(ast));
    }

    @Test
    void format_charlistsAsSigilsMigration() {
        var chars = List.<Ast>of(new IntegerLiteral(BigInteger.valueOf('a')), new IntegerLiteral(BigInteger.valueOf('b')));
        var ast = Asts.block(Meta.builder().delimiter("'").build(), new ListLiteral(chars));

        assertEquals("'ab'", ExFormatter.format(ast));
        assertEquals("~c\"ab\"", ExFormatter.builder().migration(Migration.CHARLISTS_AS_SIGILS, true).format(ast));
    }

    // === Configuration ===

    @Test
    void format_syntaxColors_wrapTokensWithoutChangingLayout() {
        var colors = SyntaxColors.of(Map.of(Category.NUMBER, "<n>"));

        assertEquals("<n>1" + SyntaxColors.ANSI_RESET, ExFormatter.builder().syntaxColors(colors).format(integer("1")));
    }

    @Test
    void format_negativeLineLength_isRejected() {
        assertThatThrownBy(() -> ExFormatter.builder().lineLength(-1).format(var("a")))
            .isInstanceOf(FormatException.class)
            .hasMessageContaining("lineLength");
    }

    @Test
    void isLocalWithoutParens_followsTable() {
        var locals = ExFormatter.localsWithoutParens();

        assertTrue(ExFormatter.isLocalWithoutParens("def", 2, locals));
        assertTrue(ExFormatter.isLocalWithoutParens("for", 5, locals));
        assertFalse(ExFormatter.isLocalWithoutParens("for", 0, locals));
        assertFalse(ExFormatter.isLocalWithoutParens("foo", 1, locals));
        assertTrue(ExFormatter.isLocalWithoutParens("foo", 1, List.of(LocalWithoutParens.anyArity("foo"))));
    }
}
