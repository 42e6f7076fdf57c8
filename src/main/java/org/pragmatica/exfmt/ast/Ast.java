package org.pragmatica.exfmt.ast;

import com.google.common.collect.ImmutableList;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Quoted expression tree as produced by the parser, with literals wrapped in
 * {@code __block__} nodes that carry their metadata.
 *
 * <p>Three-element nodes are split by the shape of their head: {@link Call} when the head is
 * an atom, {@link Variable} when the arguments are an atom, {@link Apply} when the head is a node.
 * Bare terms ({@link AtomLiteral}, {@link ListLiteral}, {@link Pair}, ...) appear where the
 * quoted form has them without metadata.
 */
public sealed interface Ast {

    /**
     * Node whose head is an atom: operators, local calls and the special forms
     * {@code __block__}, {@code __aliases__}, {@code {}}, {@code %{}}, {@code <<>>}, {@code .}, ...
     */
    record Call(String name, Meta meta, List<Ast> args) implements Ast {
        public Call {
            args = ImmutableList.copyOf(args);
        }

        public boolean is(String candidate, int arity) {
            return name.equals(candidate) && args.size() == arity;
        }
    }

    /**
     * Variable reference. The context is the module that introduced the variable, if any.
     */
    record Variable(String name, Meta meta, Optional<String> context) implements Ast {}

    /**
     * Node whose head is itself a node: {@code Mod.fun(args)}, {@code fun.(args)}, {@code call(a)(b)}.
     */
    record Apply(Ast target, Meta meta, List<Ast> args) implements Ast {
        public Apply {
            args = ImmutableList.copyOf(args);
        }
    }

    /**
     * Node built by the formatter itself while laying out clause heads and bitstring segments.
     */
    record Special(Kind kind, Meta meta, List<Ast> args) implements Ast {
        public Special {
            args = ImmutableList.copyOf(args);
        }

        public enum Kind {
            CLAUSE_ARGS,
            BITSTRING_SEGMENT
        }
    }

    /**
     * Bare atom, spelled as in the runtime: module names carry the {@code Elixir.} prefix.
     */
    record AtomLiteral(String name) implements Ast {}

    record IntegerLiteral(BigInteger value) implements Ast {}

    record FloatLiteral(double value) implements Ast {}

    record StringLiteral(String value) implements Ast {}

    record ListLiteral(List<Ast> elements) implements Ast {
        public ListLiteral {
            elements = ImmutableList.copyOf(elements);
        }
    }

    /**
     * Two-element tuple: keyword entries, map entries and do/end block entries.
     */
    record Pair(Ast left, Ast right) implements Ast {}

    /**
     * Value the tree cannot represent, rendered with a best-effort dump.
     */
    record Foreign(Object value) implements Ast {}

    /**
     * Metadata of three-element nodes, empty metadata for bare terms.
     */
    default Meta metaOrEmpty() {
        if (this instanceof Call call) {
            return call.meta();
        }
        if (this instanceof Variable variable) {
            return variable.meta();
        }
        if (this instanceof Apply apply) {
            return apply.meta();
        }
        if (this instanceof Special special) {
            return special.meta();
        }
        return Meta.EMPTY;
    }

    /**
     * Whether this is a three-element node.
     */
    default boolean isNode() {
        return this instanceof Call || this instanceof Variable || this instanceof Apply || this instanceof Special;
    }
}
