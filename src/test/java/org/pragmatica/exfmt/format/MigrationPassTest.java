package org.pragmatica.exfmt.format;

import org.junit.jupiter.api.Test;
import org.pragmatica.exfmt.ast.Ast;
import org.pragmatica.exfmt.ast.Ast.Apply;
import org.pragmatica.exfmt.ast.Ast.Call;
import org.pragmatica.exfmt.ast.Ast.ListLiteral;
import org.pragmatica.exfmt.ast.Ast.Variable;
import org.pragmatica.exfmt.config.FormatterConfig;
import org.pragmatica.exfmt.config.Migration;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.exfmt.ast.Asts.call;
import static org.pragmatica.exfmt.ast.Asts.kw;
import static org.pragmatica.exfmt.ast.Asts.op;
import static org.pragmatica.exfmt.ast.Asts.parensCall;
import static org.pragmatica.exfmt.ast.Asts.var;

class MigrationPassTest {

    private static final FormatterConfig ALL = FormatterConfig.builder().migrate(true).build();

    private static Ast doBlock(Ast body) {
        return new ListLiteral(List.of(kw("do", body)));
    }

    // === Condition negation ===

    @Test
    void negateCondition_unwrapsNegations() {
        assertThat(MigrationPass.negateCondition(call("!", var("a")))).isEqualTo(var("a"));
        assertThat(MigrationPass.negateCondition(call("not", var("a")))).isEqualTo(var("a"));
    }

    @Test
    void negateCondition_flipsEqualityOperators() {
        var negated = (Call) MigrationPass.negateCondition(op("==", var("a"), var("b")));
        var strict = (Call) MigrationPass.negateCondition(op("!==", var("a"), var("b")));

        assertThat(negated.name()).isEqualTo("!=");
        assertThat(strict.name()).isEqualTo("===");
    }

    @Test
    void negateCondition_relationalAndGuards_wrapInNot() {
        assertThat(((Call) MigrationPass.negateCondition(op(">", var("a"), var("b")))).name()).isEqualTo("not");
        assertThat(((Call) MigrationPass.negateCondition(call("is_nil", var("a")))).name()).isEqualTo("not");
    }

    @Test
    void negateCondition_otherExpressions_wrapInBang() {
        var negated = (Call) MigrationPass.negateCondition(call("valid?", var("a")));

        assertThat(negated.name()).isEqualTo("!");
        assertThat(negated.args()).containsExactly(call("valid?", var("a")));
    }

    // === unless ===

    @Test
    void apply_unless_becomesIf() {
        var result = (Call) MigrationPass.apply(call("unless", var("a"), doBlock(var("b"))), ALL);

        assertThat(result.name()).isEqualTo("if");
        assertThat(result.args().get(0)).isEqualTo(call("!", var("a")));
    }

    @Test
    void apply_pipelineIntoUnless_insertsKernelNegation() {
        var pipeline = op("|>", op("|>", var("a"), parensCall("b")), call("unless", doBlock(var("c"))));
        var result = (Call) MigrationPass.apply(pipeline, ALL);

        assertThat(result.name()).isEqualTo("|>");
        assertThat(((Call) result.args().get(1)).name()).isEqualTo("if");

        var negation = ((Call) result.args().get(0)).args().get(1);
        assertThat(negation).isInstanceOf(Apply.class);
        assertThat(Shapes.isRemote(negation, Shapes.KERNEL, "!")).isTrue();
    }

    @Test
    void apply_insideDefmacroWithUnlessHead_leavesUnlessAlone() {
        var body = call("unless", var("a"), doBlock(var("b")));
        var macro = call("defmacro", call("unless", var("x"), var("y")), doBlock(body));

        assertThat(MigrationPass.apply(macro, ALL)).isEqualTo(macro);
    }

    @Test
    void apply_withoutMigrations_returnsSameTree() {
        var ast = call("unless", var("a"), doBlock(var("b")));

        assertThat(MigrationPass.apply(ast, FormatterConfig.DEFAULT)).isSameAs(ast);
    }

    // === Pipes ===

    @Test
    void apply_pipeIntoVariable_becomesCall() {
        var result = (Call) MigrationPass.apply(op("|>", var("x"), var("foo")), ALL);

        assertThat(result.args().get(1)).isEqualTo(new Call("foo", var("foo").metaOrEmpty(), List.of()));
    }

    @Test
    void apply_insideDefmacroWithPipeHead_keepsBarePipes() {
        var config = FormatterConfig.builder().migration(Migration.CALL_PARENS_ON_PIPE, true).build();
        var macro = call("defmacro", op("|>", var("a"), var("b")), doBlock(op("|>", var("x"), var("foo"))));

        assertThat(MigrationPass.apply(macro, config)).isEqualTo(macro);
    }

    // === Bitstrings ===

    @Test
    void apply_bitstringModifiers_normalisesParentheses() {
        var config = FormatterConfig.builder().migration(Migration.BITSTRING_MODIFIERS, true).build();
        var spec = op("-", call("integer"), var("my_modifier"));
        var result = (Call) MigrationPass.apply(call("<<>>", op("::", var("x"), spec)), config);

        var normalised = (Call) ((Call) result.args().get(0)).args().get(1);
        assertThat(normalised.args().get(0)).isInstanceOf(Variable.class);
        assertThat(normalised.args().get(1)).isEqualTo(call("my_modifier"));
    }
}
