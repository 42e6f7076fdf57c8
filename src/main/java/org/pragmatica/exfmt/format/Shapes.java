package org.pragmatica.exfmt.format;

import com.google.common.collect.ImmutableSet;
import org.pragmatica.exfmt.ast.Ast;
import org.pragmatica.exfmt.ast.Ast.Apply;
import org.pragmatica.exfmt.ast.Ast.AtomLiteral;
import org.pragmatica.exfmt.ast.Ast.Call;
import org.pragmatica.exfmt.ast.Ast.IntegerLiteral;
import org.pragmatica.exfmt.ast.Ast.ListLiteral;
import org.pragmatica.exfmt.ast.Ast.Pair;
import org.pragmatica.exfmt.ast.Ast.StringLiteral;
import org.pragmatica.exfmt.ast.Ast.Variable;
import org.pragmatica.exfmt.ast.Asts;
import org.pragmatica.exfmt.ast.Meta;
import org.pragmatica.exfmt.comment.LineRange;
import org.pragmatica.exfmt.error.FormatError;
import org.pragmatica.exfmt.error.FormatException;
import org.pragmatica.exfmt.literal.AtomNames;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Recognisers for the tree shapes that get a layout of their own.
 */
final class Shapes {
    static final String KERNEL = "Elixir.Kernel";
    static final String DOUBLE_HEREDOC = "\"\"\"";
    static final String SINGLE_HEREDOC = "'''";
    static final String SIGIL_PREFIX = "sigil_";

    private static final BigInteger MAX_CODE_POINT = BigInteger.valueOf(Character.MAX_CODE_POINT);
    private static final ImmutableSet<String> DO_END_KEYWORDS = ImmutableSet.of("rescue", "catch", "else", "after");

    private Shapes() {}

    // === Nodes ===

    static boolean isCall(Ast ast, String name) {
        return ast instanceof Call call && call.name().equals(name);
    }

    static boolean isCall(Ast ast, String name, int arity) {
        return ast instanceof Call call && call.is(name, arity);
    }

    /**
     * Only argument of a {@code __block__} wrapper.
     */
    static Optional<Ast> blockContent(Ast ast) {
        if (ast instanceof Call call && call.is(Asts.BLOCK, 1)) {
            return Optional.of(call.args().get(0));
        }
        return Optional.empty();
    }

    /**
     * Target of a {@code Module.function(...)} call when it names the given module and function.
     */
    static boolean isRemote(Ast ast, String module, String function) {
        return ast instanceof Apply apply
               && apply.target() instanceof Call dot
               && dot.is(".", 2)
               && dot.args().get(0) instanceof AtomLiteral target
               && target.name().equals(module)
               && dot.args().get(1) instanceof AtomLiteral fun
               && fun.name().equals(function);
    }

    /**
     * Whether the call name follows the sigil naming scheme, {@code sigil_X}.
     */
    static boolean isSigilCall(Call call) {
        return call.name().startsWith(SIGIL_PREFIX);
    }

    // === Interpolation ===

    /**
     * Entries of {@code <<>>} that form an interpolated string rather than a bitstring.
     */
    static boolean isInterpolated(List<Ast> entries) {
        for (var entry : entries) {
            if (entry instanceof StringLiteral) {
                continue;
            }
            if (!(entry instanceof Call call
                  && call.is("::", 2)
                  && isRemote(call.args().get(0), KERNEL, "to_string")
                  && isNamed(call.args().get(1), "binary"))) {
                return false;
            }
        }
        return true;
    }

    static boolean isListInterpolated(List<Ast> entries) {
        for (var entry : entries) {
            if (!(entry instanceof StringLiteral) && !isRemote(entry, KERNEL, "to_string")) {
                return false;
            }
        }
        return true;
    }

    /**
     * The interpolated expression inside {@code Kernel.to_string(expr)}, optionally typed with {@code ::binary}.
     */
    static Ast interpolatedExpression(Ast entry) {
        var call = entry;

        if (entry instanceof Call typed && typed.is("::", 2)) {
            call = typed.args().get(0);
        }
        return ((Apply) call).args().get(0);
    }

    private static boolean isNamed(Ast ast, String name) {
        if (ast instanceof Variable variable) {
            return variable.name().equals(name);
        }
        return isCall(ast, name);
    }

    // === Keywords ===

    static boolean isKeyword(Ast ast) {
        return ast instanceof ListLiteral list && isKeywordList(list.elements());
    }

    static boolean isKeywordList(List<Ast> elements) {
        for (var element : elements) {
            if (!(element instanceof Pair)) {
                return false;
            }
        }
        return true;
    }

    static boolean isKeywordKey(Ast ast) {
        if (Asts.blockAtom(ast).isPresent()) {
            return ast.metaOrEmpty().keywordFormat();
        }
        return isAtomFromBinary(ast) && ast.metaOrEmpty().keywordFormat();
    }

    /**
     * {@code :erlang.binary_to_atom(<<...>>, :utf8)}, the form of quoted atoms with interpolation.
     */
    static boolean isAtomFromBinary(Ast ast) {
        return isRemote(ast, "erlang", "binary_to_atom")
               && ast instanceof Apply apply
               && apply.args().size() == 2
               && isCall(apply.args().get(0), "<<>>")
               && apply.args().get(1) instanceof AtomLiteral encoding
               && encoding.name().equals("utf8");
    }

    // === Operators ===

    static boolean isBinaryOperator(Ast ast) {
        if (ast instanceof Call call) {
            if (call.args().size() == 3 && Operators.MULTI_BINARY.contains(call.name())) {
                return true;
            }
            return call.args().size() == 2 && Operators.isBinary(call.name());
        }
        return false;
    }

    static boolean isUnaryOperator(Ast ast) {
        return ast instanceof Call call && call.args().size() == 1 && Operators.isUnary(call.name());
    }

    static boolean isOperator(Ast ast) {
        return isUnaryOperator(ast) || isBinaryOperator(ast);
    }

    /**
     * {@code @name} without arguments.
     */
    static boolean isModuleAttributeRead(Ast ast) {
        return ast instanceof Call call
               && call.is("@", 1)
               && call.args().get(0) instanceof Variable variable
               && AtomNames.classify(variable.name()) == AtomNames.Kind.IDENTIFIER;
    }

    static boolean isIntegerCapture(Ast ast) {
        return ast instanceof Call call && call.is("&", 1) && call.args().get(0) instanceof IntegerLiteral;
    }

    // === Layout hints ===

    /**
     * Arguments spread over at least two distinct source lines, each argument starting on its own line.
     */
    static boolean forceArgs(List<Ast> args) {
        if (args.isEmpty()) {
            return false;
        }

        var lines = new HashSet<Integer>();

        for (var arg : args) {
            var first = arg instanceof ListLiteral list && !list.elements().isEmpty()
                        ? list.elements().get(0)
                        : arg;
            var line = firstLine(first);

            if (line.isEmpty()) {
                continue;
            }
            if (!lines.add(line.get())) {
                return false;
            }
        }
        return lines.size() >= 2;
    }

    /**
     * Same as {@link #forceArgs(List)} for an argument that is a keyword list.
     */
    static boolean forceArgs(Ast arg) {
        return arg instanceof ListLiteral list && forceArgs(list.elements());
    }

    private static Optional<Integer> firstLine(Ast ast) {
        if (ast instanceof Pair pair) {
            return pair.left().metaOrEmpty().line();
        }
        return ast.metaOrEmpty().line();
    }

    static boolean isMultiLineBlock(Ast ast) {
        return ast instanceof Call call && call.name().equals(Asts.BLOCK) && call.args().size() >= 2;
    }

    static boolean isDoEndKeyword(String key) {
        return DO_END_KEYWORDS.contains(key);
    }

    static boolean isModuleTarget(Ast target) {
        if (target instanceof Variable variable) {
            return variable.name().equals("__MODULE__");
        }
        return Asts.blockAtom(target).isPresent() || isCall(target, Asts.ALIASES);
    }

    // === Lines ===

    static int line(Meta meta) {
        return meta.lineOr(LineRange.MAX_LINE);
    }

    static int closingLine(Meta meta) {
        return meta.closingLineOr(LineRange.MIN_LINE);
    }

    static int endLine(Meta meta) {
        return meta.endLineOr(LineRange.MIN_LINE);
    }

    // === Charlists ===

    /**
     * Text of a charlist: integer elements are code points, string elements are taken as they are.
     */
    static String charlistText(List<Ast> elements) {
        var builder = new StringBuilder();

        for (var element : elements) {
            if (element instanceof IntegerLiteral integer) {
                builder.appendCodePoint(codePoint(integer.value()));
            } else if (element instanceof StringLiteral string) {
                builder.append(string.value());
            }
        }
        return builder.toString();
    }

    private static int codePoint(BigInteger value) {
        if (value.signum() < 0 || value.compareTo(MAX_CODE_POINT) > 0) {
            throw new FormatException(new FormatError.InvalidCodePoint(value));
        }
        return value.intValue();
    }
}
