package org.pragmatica.exfmt.literal;

import com.google.common.collect.ImmutableSet;

/**
 * Quoting rules for atoms and identifiers.
 */
public final class AtomNames {
    private static final String ALIAS_PREFIX = "Elixir.";

    private static final ImmutableSet<String> NOT_CALLABLE = ImmutableSet.of(
        "%", "%{}", "{}", "<<>>", "...", "..", ".", "..//", "->");

    private static final ImmutableSet<String> OPERATORS = ImmutableSet.of(
        "@", ".", "+", "-", "!", "^", "not", "~~~", "&", "*", "/", "**",
        "++", "--", "+++", "---", "..", "<>", "in", "not in",
        "|>", "<<<", ">>>", "<<~", "~>>", "<~", "~>", "<~>", "<|>",
        "<", ">", "<=", ">=", "==", "!=", "=~", "===", "!==",
        "&&", "&&&", "and", "||", "|||", "or",
        "=", "|", "when", "<-", "\\\\", "^^^");

    private AtomNames() {}

    /**
     * How an atom can be written.
     */
    public enum Kind {
        /** Full module name such as {@code Elixir.Foo.Bar}. */
        ALIAS,
        /** Variable-like name, usable unquoted everywhere. */
        IDENTIFIER,
        /** Usable unquoted after a colon: operators, capitalised names and special forms. */
        UNQUOTED,
        /** Needs quotes. */
        QUOTED
    }

    public static Kind classify(String name) {
        if (NOT_CALLABLE.contains(name)) {
            return Kind.UNQUOTED;
        }
        if (name.equals("::")) {
            return Kind.QUOTED;
        }
        if (OPERATORS.contains(name)) {
            return Kind.UNQUOTED;
        }
        if (isModuleName(name)) {
            return Kind.ALIAS;
        }
        if (isIdentifier(name)) {
            return Kind.IDENTIFIER;
        }
        if (isAliasSegment(name)) {
            return Kind.UNQUOTED;
        }
        return Kind.QUOTED;
    }

    public static boolean isOperator(String name) {
        return OPERATORS.contains(name) || name.equals("::");
    }

    /**
     * Atom literal: {@code :foo}, {@code :Foo}, {@code :+} or {@code :"foo bar"}.
     */
    public static String literal(String name) {
        var kind = classify(name);

        if (kind == Kind.IDENTIFIER || kind == Kind.UNQUOTED) {
            return ":" + name;
        }
        return ":\"" + escape(name, '"') + "\"";
    }

    /**
     * Keyword key: {@code foo:} or {@code "foo bar":}.
     */
    public static String key(String name) {
        if (isIdentifier(name) || isAliasSegment(name)) {
            return name + ":";
        }
        return "\"" + escape(name, '"') + "\":";
    }

    /**
     * Function name after a dot: {@code foo}, {@code +} or {@code "foo bar"}.
     */
    public static String remoteCall(String name) {
        if (isIdentifier(name) || OPERATORS.contains(name)) {
            return name;
        }
        return "\"" + escape(name, '"') + "\"";
    }

    /**
     * The way a bare atom is displayed: module names without their prefix,
     * {@code nil}, {@code true} and {@code false} as they are, anything else as a literal.
     */
    public static String inspect(String name) {
        if (name.equals("nil") || name.equals("true") || name.equals("false")) {
            return name;
        }
        if (isModuleName(name)) {
            return name.substring(ALIAS_PREFIX.length());
        }
        return literal(name);
    }

    public static String escape(String text, char quote) {
        return text.replace(String.valueOf(quote), "\\" + quote);
    }

    public static boolean isModuleName(String name) {
        if (!name.startsWith(ALIAS_PREFIX) || name.length() == ALIAS_PREFIX.length()) {
            return false;
        }
        for (var segment : name.substring(ALIAS_PREFIX.length()).split("\\.", -1)) {
            if (!isAliasSegment(segment)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Lower-case or underscore start, letters, digits and underscores, optional trailing {@code ?} or {@code !}.
     */
    public static boolean isIdentifier(String name) {
        if (name.isEmpty()) {
            return false;
        }

        var end = name.length();
        var last = name.charAt(end - 1);

        if (last == '?' || last == '!') {
            end--;
        }
        if (end == 0) {
            return false;
        }

        var first = name.codePointAt(0);

        if (first != '_' && !(Character.isLetter(first) && !Character.isUpperCase(first) && !Character.isTitleCase(first))) {
            return false;
        }

        for (int i = Character.charCount(first); i < end; ) {
            var cp = name.codePointAt(i);
            if (!isIdentifierPart(cp)) {
                return false;
            }
            i += Character.charCount(cp);
        }
        return true;
    }

    private static boolean isAliasSegment(String name) {
        if (name.isEmpty() || name.charAt(0) < 'A' || name.charAt(0) > 'Z') {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            var c = name.charAt(i);
            if (!(c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9'))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isIdentifierPart(int cp) {
        if (cp == '_' || Character.isLetterOrDigit(cp)) {
            return true;
        }
        var type = Character.getType(cp);
        return type == Character.NON_SPACING_MARK
               || type == Character.COMBINING_SPACING_MARK
               || type == Character.CONNECTOR_PUNCTUATION;
    }
}
