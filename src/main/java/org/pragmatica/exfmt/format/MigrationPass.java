package org.pragmatica.exfmt.format;

import com.google.common.collect.ImmutableSet;
import org.pragmatica.exfmt.ast.Ast;
import org.pragmatica.exfmt.ast.Ast.Apply;
import org.pragmatica.exfmt.ast.Ast.AtomLiteral;
import org.pragmatica.exfmt.ast.Ast.Call;
import org.pragmatica.exfmt.ast.Ast.ListLiteral;
import org.pragmatica.exfmt.ast.Ast.Pair;
import org.pragmatica.exfmt.ast.Ast.Variable;
import org.pragmatica.exfmt.ast.Meta;
import org.pragmatica.exfmt.config.FormatterConfig;
import org.pragmatica.exfmt.config.Migration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Opt-in rewrites applied to the tree before layout.
 *
 * <ul>
 *   <li>{@link Migration#UNLESS}: {@code unless} becomes {@code if} with the condition negated;</li>
 *   <li>{@link Migration#CALL_PARENS_ON_PIPE}: {@code x |> foo} becomes {@code x |> foo()};</li>
 *   <li>{@link Migration#BITSTRING_MODIFIERS}: built-in bitstring modifiers lose their empty
 *       parentheses, custom ones gain them.</li>
 * </ul>
 * Inside {@code defmacro} definitions whose head is an {@code unless} call or a pipeline the
 * corresponding rewrite is switched off.
 */
public final class MigrationPass {
    private static final Logger log = LoggerFactory.getLogger(MigrationPass.class);

    private static final ImmutableSet<String> MACRO_DEFINITIONS = ImmutableSet.of("defmacro", "defmacrop");
    private static final ImmutableSet<String> RELATIONAL_OPERATORS = ImmutableSet.of(">", ">=", "<", "<=", "in");
    private static final ImmutableSet<String> GUARDS = ImmutableSet.of(
        "is_atom", "is_boolean", "is_nil", "is_number", "is_integer", "is_float", "is_binary", "is_map",
        "is_struct", "is_non_struct_map", "is_exception", "is_list", "is_tuple", "is_function",
        "is_reference", "is_pid", "is_port");
    private static final ImmutableSet<String> BITSTRING_MODIFIERS = ImmutableSet.of(
        "integer", "float", "bits", "bitstring", "binary", "bytes", "utf8", "utf16", "utf32",
        "signed", "unsigned", "big", "little", "native", "_");

    private final boolean unless;
    private final boolean callParensOnPipe;
    private final boolean bitstringModifiers;

    private MigrationPass(boolean unless, boolean callParensOnPipe, boolean bitstringModifiers) {
        this.unless = unless;
        this.callParensOnPipe = callParensOnPipe;
        this.bitstringModifiers = bitstringModifiers;
    }

    /**
     * Apply the tree rewrites enabled in the configuration. Returns the tree unchanged when none is.
     */
    public static Ast apply(Ast ast, FormatterConfig config) {
        var pass = new MigrationPass(config.migrates(Migration.UNLESS),
                                     config.migrates(Migration.CALL_PARENS_ON_PIPE),
                                     config.migrates(Migration.BITSTRING_MODIFIERS));

        if (!pass.unless && !pass.callParensOnPipe && !pass.bitstringModifiers) {
            return ast;
        }

        log.debug("Applying migrations {}", config.migrations());
        return pass.rewrite(ast);
    }

    // === Traversal ===

    private Ast rewrite(Ast ast) {
        if (ast instanceof Call call) {
            return rewriteCall(call);
        }
        if (ast instanceof Apply apply) {
            return new Apply(rewrite(apply.target()), apply.meta(), rewriteAll(apply.args()));
        }
        if (ast instanceof ListLiteral list) {
            return new ListLiteral(rewriteAll(list.elements()));
        }
        if (ast instanceof Pair pair) {
            return new Pair(rewrite(pair.left()), rewrite(pair.right()));
        }
        return ast;
    }

    private List<Ast> rewriteAll(List<Ast> asts) {
        var result = new ArrayList<Ast>(asts.size());

        for (var ast : asts) {
            result.add(rewrite(ast));
        }
        return result;
    }

    private Ast rewriteCall(Call call) {
        var args = call.args();

        if (MACRO_DEFINITIONS.contains(call.name()) && args.size() == 2) {
            var head = args.get(0);

            if (callParensOnPipe && Shapes.isCall(head, "|>")) {
                return new MigrationPass(unless, false, bitstringModifiers).rewriteChildren(call);
            }
            if (unless && Shapes.isCall(head, "unless")) {
                return new MigrationPass(false, callParensOnPipe, bitstringModifiers).rewriteChildren(call);
            }
        }

        if (unless) {
            var rewritten = rewriteUnless(call);

            if (rewritten.isPresent()) {
                return rewriteChildren(rewritten.get());
            }
        }
        if (callParensOnPipe && call.is("|>", 2)) {
            var right = addPipeParens(args.get(1));
            return rewriteChildren(new Call(call.name(), call.meta(), List.of(args.get(0), right)));
        }
        if (bitstringModifiers && call.name().equals("<<>>") && !args.isEmpty() && !Shapes.isInterpolated(args)) {
            var segments = new ArrayList<Ast>(args.size());

            for (var segment : args) {
                segments.add(normalizeSegment(segment));
            }
            return rewriteChildren(new Call(call.name(), call.meta(), segments));
        }
        return rewriteChildren(call);
    }

    private Call rewriteChildren(Call call) {
        return new Call(call.name(), call.meta(), rewriteAll(call.args()));
    }

    // === unless ===

    private static Optional<Call> rewriteUnless(Call call) {
        var args = call.args();

        // unless condition, do: ...
        if (call.is("unless", 2)) {
            return Optional.of(new Call("if", call.meta(), List.of(negateCondition(args.get(0)), args.get(1))));
        }
        if (!call.is("|>", 2) || !(args.get(1) instanceof Call tail) || !tail.is("unless", 1)) {
            return Optional.empty();
        }

        var condition = args.get(0);
        var target = new Call("if", tail.meta(), tail.args());

        // a |> b() |> unless(...)
        if (Shapes.isCall(condition, "|>", 2)) {
            var negation = new Apply(new Call(".", Meta.EMPTY, List.of(new AtomLiteral(Shapes.KERNEL), new AtomLiteral("!"))),
                                     Meta.builder().closing(Meta.Mark.NO_LINE).build(),
                                     List.of());
            var negated = new Call("|>", Meta.EMPTY, List.of(condition, negation));
            return Optional.of(new Call("|>", call.meta(), List.of(negated, target)));
        }
        // condition |> unless(...)
        return Optional.of(new Call("|>", call.meta(), List.of(negateCondition(condition), target)));
    }

    static Ast negateCondition(Ast condition) {
        if (condition instanceof Call call) {
            var args = call.args();
            var name = call.name();

            if (args.size() == 1 && (name.equals("!") || name.equals("not"))) {
                return args.get(0);
            }
            if (args.size() == 2 && RELATIONAL_OPERATORS.contains(name)) {
                return new Call("not", Meta.EMPTY, List.of(condition));
            }
            if (!args.isEmpty() && GUARDS.contains(name)) {
                return new Call("not", Meta.EMPTY, List.of(condition));
            }
            if (args.size() == 2) {
                var opposite = switch (name) {
                    case "==" -> "!=";
                    case "===" -> "!==";
                    case "!=" -> "==";
                    case "!==" -> "===";
                    default -> "";
                };

                if (!opposite.isEmpty()) {
                    return new Call(opposite, call.meta(), args);
                }
            }
        }
        return new Call("!", Meta.EMPTY, List.of(condition));
    }

    // === Pipes ===

    private static Ast addPipeParens(Ast right) {
        // |> var
        if (right instanceof Variable variable) {
            return new Call(variable.name(), variable.meta(), List.of());
        }
        // |> var.fun
        if (right instanceof Apply apply
            && apply.args().isEmpty()
            && apply.meta().closing().isEmpty()
            && apply.target() instanceof Call dot
            && dot.is(".", 2)
            && dot.args().get(1) instanceof AtomLiteral) {
            var meta = apply.meta();
            return new Apply(apply.target(), meta.withClosing(new Meta.Mark(meta.line())), List.of());
        }
        return right;
    }

    // === Bitstrings ===

    private static Ast normalizeSegment(Ast segment) {
        if (segment instanceof Call generator && generator.is("<-", 2)) {
            var left = normalizeSegment(generator.args().get(0));
            return new Call("<-", generator.meta(), List.of(left, generator.args().get(1)));
        }
        if (segment instanceof Call typed && typed.is("::", 2)) {
            var spec = normalizeSpec(typed.args().get(1));
            return new Call("::", typed.meta(), List.of(typed.args().get(0), spec));
        }
        return segment;
    }

    private static Ast normalizeSpec(Ast spec) {
        if (spec instanceof Call call && call.args().size() == 2 && call.name().equals("-")) {
            return new Call("-", call.meta(), List.of(normalizeSpec(call.args().get(0)), normalizeModifier(call.args().get(1))));
        }
        // size * unit keeps its operands as written
        if (Shapes.isCall(spec, "*", 2)) {
            return spec;
        }
        return normalizeModifier(spec);
    }

    private static Ast normalizeModifier(Ast modifier) {
        String name;
        Meta meta;

        if (modifier instanceof Variable variable) {
            name = variable.name();
            meta = variable.meta();
        } else if (modifier instanceof Call call && call.args().isEmpty()) {
            name = call.name();
            meta = call.meta();
        } else {
            return modifier;
        }

        if (BITSTRING_MODIFIERS.contains(name)) {
            return new Variable(name, meta, Optional.empty());
        }
        return new Call(name, meta, List.of());
    }
}
