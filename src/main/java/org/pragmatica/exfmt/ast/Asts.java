package org.pragmatica.exfmt.ast;

import org.pragmatica.exfmt.ast.Ast.AtomLiteral;
import org.pragmatica.exfmt.ast.Ast.Call;
import org.pragmatica.exfmt.ast.Ast.Pair;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Factories for trees in the shape the parser produces.
 *
 * <pre>{@code
 * // foo(1, 2, 3)
 * var ast = Asts.call("foo", Asts.integer("1"), Asts.integer("2"), Asts.integer("3"));
 * }</pre>
 */
public final class Asts {
    public static final String BLOCK = "__block__";
    public static final String ALIASES = "__aliases__";

    private Asts() {}

    // === Literals ===

    public static Ast integer(String token) {
        return integer(token, Meta.EMPTY);
    }

    public static Ast integer(String token, Meta meta) {
        var literal = new Ast.IntegerLiteral(integerValue(token));
        return block(meta.toBuilder().token(token).build(), literal);
    }

    public static Ast floating(String token) {
        var literal = new Ast.FloatLiteral(Double.parseDouble(token.replace("_", "")));
        return block(Meta.builder().token(token).build(), literal);
    }

    public static Ast string(String value) {
        return string(value, Meta.builder().delimiter("\"").build());
    }

    public static Ast string(String value, Meta meta) {
        return block(meta, new Ast.StringLiteral(value));
    }

    public static Ast heredoc(String value) {
        return string(value, Meta.builder().delimiter("\"\"\"").build());
    }

    public static Ast atom(String name) {
        return atom(name, Meta.EMPTY);
    }

    public static Ast atom(String name, Meta meta) {
        return block(meta, new AtomLiteral(name));
    }

    /**
     * Atom written as a keyword key, {@code name:}.
     */
    public static Ast key(String name) {
        return key(name, Meta.EMPTY);
    }

    public static Ast key(String name, Meta meta) {
        return atom(name, meta.toBuilder().keywordFormat(true).build());
    }

    public static Ast nil() {
        return atom("nil");
    }

    /**
     * Bare module atom, {@code module("Kernel")} is {@code :"Elixir.Kernel"}.
     */
    public static Ast module(String name) {
        return new AtomLiteral("Elixir." + name);
    }

    public static Ast aliases(String... segments) {
        return aliases(Meta.EMPTY, segments);
    }

    public static Ast aliases(Meta meta, String... segments) {
        var args = new ArrayList<Ast>();
        for (var segment : segments) {
            args.add(new AtomLiteral(segment));
        }
        return new Call(ALIASES, meta, args);
    }

    // === Collections ===

    public static Ast list(Ast... elements) {
        return list(Meta.EMPTY, elements);
    }

    public static Ast list(Meta meta, Ast... elements) {
        return block(meta, new Ast.ListLiteral(Arrays.asList(elements)));
    }

    public static Pair pair(Ast left, Ast right) {
        return new Pair(left, right);
    }

    /**
     * Keyword entry {@code name: value}.
     */
    public static Pair kw(String name, Ast value) {
        return pair(key(name), value);
    }

    public static Ast keyword(Pair... entries) {
        return list(entries);
    }

    public static Ast tuple(Ast... elements) {
        return new Call("{}", Meta.EMPTY, Arrays.asList(elements));
    }

    // === Nodes ===

    public static Ast var(String name) {
        return var(name, Meta.EMPTY);
    }

    public static Ast var(String name, Meta meta) {
        return new Ast.Variable(name, meta, Optional.empty());
    }

    public static Ast var(String name, int line) {
        return var(name, Meta.atLine(line));
    }

    public static Call call(String name, Ast... args) {
        return new Call(name, Meta.EMPTY, Arrays.asList(args));
    }

    public static Call call(String name, Meta meta, Ast... args) {
        return new Call(name, meta, Arrays.asList(args));
    }

    public static Call call(String name, Meta meta, List<Ast> args) {
        return new Call(name, meta, args);
    }

    /**
     * Local call written with parentheses.
     */
    public static Call parensCall(String name, Ast... args) {
        return call(name, Meta.builder().closing(Meta.Mark.NO_LINE).build(), args);
    }

    public static Call op(String operator, Ast left, Ast right) {
        return call(operator, left, right);
    }

    public static Ast remote(Ast target, String function, Ast... args) {
        return remote(target, function, Meta.builder().closing(Meta.Mark.NO_LINE).build(), args);
    }

    public static Ast remote(Ast target, String function, Meta meta, Ast... args) {
        var dot = call(".", target, new AtomLiteral(function));
        return new Ast.Apply(dot, meta, Arrays.asList(args));
    }

    public static Ast block(Ast... expressions) {
        return block(Meta.EMPTY, expressions);
    }

    public static Ast block(Meta meta, Ast... expressions) {
        return new Call(BLOCK, meta, Arrays.asList(expressions));
    }

    public static Ast block(Meta meta, List<Ast> expressions) {
        return new Call(BLOCK, meta, expressions);
    }

    /**
     * Literal wrapper node whose single argument is the given atom.
     */
    public static Optional<String> blockAtom(Ast ast) {
        if (ast instanceof Call call && call.is(BLOCK, 1) && call.args().get(0) instanceof AtomLiteral atom) {
            return Optional.of(atom.name());
        }
        return Optional.empty();
    }

    static BigInteger integerValue(String token) {
        var digits = token.replace("_", "");
        var negative = digits.startsWith("-");

        if (negative) {
            digits = digits.substring(1);
        }

        BigInteger value;
        if (digits.startsWith("0x")) {
            value = new BigInteger(digits.substring(2), 16);
        } else if (digits.startsWith("0o")) {
            value = new BigInteger(digits.substring(2), 8);
        } else if (digits.startsWith("0b")) {
            value = new BigInteger(digits.substring(2), 2);
        } else if (digits.startsWith("?")) {
            value = BigInteger.valueOf(digits.codePointAt(digits.length() > 2 && digits.charAt(1) == '\\' ? 2 : 1));
        } else {
            value = new BigInteger(digits);
        }
        return negative ? value.negate() : value;
    }
}
