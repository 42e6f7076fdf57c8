package org.pragmatica.exfmt.format;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.Optional;

/**
 * Operator precedence tables and the operator families that decide spacing, breaking and parentheses.
 */
public final class Operators {
    private Operators() {}

    public enum Associativity {
        LEFT,
        RIGHT,
        NON_ASSOCIATIVE
    }

    /**
     * Associativity and binding strength of an operator. Higher precedence binds tighter.
     */
    public record OperatorInfo(Associativity associativity, int precedence) {
        static OperatorInfo left(int precedence) {
            return new OperatorInfo(Associativity.LEFT, precedence);
        }

        static OperatorInfo right(int precedence) {
            return new OperatorInfo(Associativity.RIGHT, precedence);
        }

        static OperatorInfo nonAssociative(int precedence) {
            return new OperatorInfo(Associativity.NON_ASSOCIATIVE, precedence);
        }
    }

    public static final int CAPTURE_PRECEDENCE = 90;

    private static final ImmutableMap<String, OperatorInfo> UNARY = ImmutableMap.<String, OperatorInfo>builder()
        .put("&", OperatorInfo.nonAssociative(CAPTURE_PRECEDENCE))
        .put("...", OperatorInfo.nonAssociative(CAPTURE_PRECEDENCE))
        .put("!", OperatorInfo.nonAssociative(300))
        .put("^", OperatorInfo.nonAssociative(300))
        .put("not", OperatorInfo.nonAssociative(300))
        .put("+", OperatorInfo.nonAssociative(300))
        .put("-", OperatorInfo.nonAssociative(300))
        .put("~~~", OperatorInfo.nonAssociative(300))
        .put("@", OperatorInfo.nonAssociative(320))
        .build();

    private static final ImmutableMap<String, OperatorInfo> BINARY = binaryTable();

    // === Families ===

    /** Operators made of two binary operators, written with three operands. */
    public static final ImmutableSet<String> MULTI_BINARY = ImmutableSet.of("..//");

    /** No space around the operator: {@code 1..2}. */
    public static final ImmutableSet<String> NO_SPACE = ImmutableSet.of("..", "//");

    /** Never break around the operator: {@code left in right}. */
    public static final ImmutableSet<String> NO_NEWLINE = ImmutableSet.of("\\\\", "in");

    /** Left associative chains that start every operand on a new line when they break. */
    public static final ImmutableSet<String> PIPELINE = ImmutableSet.of("|>", "~>>", "<<~", "~>", "<~", "<~>", "<|>");

    /** Right associative chains that start every operand on a new line when they break. */
    public static final ImmutableSet<String> RIGHT_NEW_LINE_BEFORE = ImmutableSet.of("|", "when");

    /** Logical operators that cannot be mixed without parentheses. */
    public static final ImmutableSet<String> LOGICAL = ImmutableSet.of("|||", "||", "or", "&&&", "&&", "and");

    /** The right operand may break while the operator stays on the first line. */
    public static final ImmutableSet<String> NEXT_BREAK_FITS =
        ImmutableSet.of("<-", "==", "!=", "=~", "===", "!==", "<", ">", "<=", ">=", "=", "::");

    /** Not associative when printed, so parentheses are kept even under the same operator. */
    public static final ImmutableSet<String> PARENS_EVEN_WHEN_PARENT = ImmutableSet.of("--", "---");

    /** Operators that put parentheses around operands using another operator. */
    public static final ImmutableSet<String> PARENS_ON_OPERANDS = ImmutableSet.of(
        "<<<", ">>>", "|>", "<~", "~>", "<<~", "~>>", "<~>", "<|>", "in", "^^^", "//",
        "++", "--", "+++", "---", "<>", "..");

    public static Optional<OperatorInfo> unary(String name) {
        return Optional.ofNullable(UNARY.get(name));
    }

    /**
     * Binary operator info. {@code //} is listed on its own, as it is what remains of
     * {@code first..last//step} once the range is split off.
     */
    public static Optional<OperatorInfo> binary(String name) {
        return Optional.ofNullable(BINARY.get(name));
    }

    public static boolean isUnary(String name) {
        return UNARY.containsKey(name);
    }

    public static boolean isBinary(String name) {
        return BINARY.containsKey(name);
    }

    private static ImmutableMap<String, OperatorInfo> binaryTable() {
        var table = ImmutableMap.<String, OperatorInfo>builder();

        put(table, OperatorInfo.left(40), "<-", "\\\\");
        put(table, OperatorInfo.right(50), "when");
        put(table, OperatorInfo.right(60), "::");
        put(table, OperatorInfo.right(70), "|");
        put(table, OperatorInfo.right(100), "=");
        put(table, OperatorInfo.left(130), "||", "|||", "or");
        put(table, OperatorInfo.left(140), "&&", "&&&", "and");
        put(table, OperatorInfo.left(150), "==", "!=", "=~", "===", "!==");
        put(table, OperatorInfo.left(160), "<", "<=", ">=", ">");
        put(table, OperatorInfo.left(170), "|>", "<<<", ">>>", "<<~", "~>>", "<~", "~>", "<~>", "<|>");
        put(table, OperatorInfo.left(180), "in");
        put(table, OperatorInfo.left(190), "^^^");
        put(table, OperatorInfo.right(190), "//");
        put(table, OperatorInfo.right(200), "++", "--", "..", "<>", "+++", "---");
        put(table, OperatorInfo.left(210), "+", "-");
        put(table, OperatorInfo.left(220), "*", "/");
        put(table, OperatorInfo.left(230), "**");
        put(table, OperatorInfo.left(310), ".");
        return table.build();
    }

    private static void put(ImmutableMap.Builder<String, OperatorInfo> table, OperatorInfo info, String... names) {
        for (var name : names) {
            table.put(name, info);
        }
    }
}
