package org.pragmatica.exfmt.config;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Optional;

/**
 * Decorations wrapped around tokens of each category. Decorations take no room on the line,
 * so coloured and plain output break at the same places.
 */
public record SyntaxColors(Map<Category, String> colors, String reset) {
    public static final String ANSI_RESET = "\u001b[0m";
    public static final SyntaxColors NONE = new SyntaxColors(Map.of(), ANSI_RESET);

    public enum Category {
        STRING,
        NUMBER,
        ATOM,
        OPERATOR,
        CALL,
        VARIABLE,
        BOOLEAN,
        NIL,
        LIST,
        MAP,
        TUPLE
    }

    public SyntaxColors {
        colors = ImmutableMap.copyOf(colors);
    }

    public static SyntaxColors of(Map<Category, String> colors) {
        return new SyntaxColors(colors, ANSI_RESET);
    }

    public Optional<String> colorOf(Category category) {
        return Optional.ofNullable(colors.get(category));
    }

    public boolean isEnabled() {
        return !colors.isEmpty();
    }
}
