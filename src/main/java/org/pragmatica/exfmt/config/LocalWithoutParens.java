package org.pragmatica.exfmt.config;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A local call that is written without parentheses when it has the given arity.
 */
public record LocalWithoutParens(String name, int arity) {
    /**
     * Matches every arity above zero.
     */
    public static final int ANY_ARITY = -1;

    public LocalWithoutParens {
        checkNotNull(name, "name");
        checkArgument(arity >= 0 || arity == ANY_ARITY, "arity must be non-negative or ANY_ARITY, got %s", arity);
    }

    public static LocalWithoutParens of(String name, int arity) {
        return new LocalWithoutParens(name, arity);
    }

    public static LocalWithoutParens anyArity(String name) {
        return new LocalWithoutParens(name, ANY_ARITY);
    }

    public boolean matches(String fun, int callArity) {
        return name.equals(fun) && (arity == ANY_ARITY || arity == callArity);
    }

    /**
     * Whether a call of {@code fun} with {@code arity} arguments drops its parentheses.
     * Calls without arguments always keep them.
     */
    public static boolean matches(String fun, int arity, List<LocalWithoutParens> locals) {
        if (arity <= 0) {
            return false;
        }
        for (var local : locals) {
            if (local.matches(fun, arity)) {
                return true;
            }
        }
        return false;
    }

    // === Defaults ===

    public static final List<LocalWithoutParens> DEFAULTS = ImmutableList.of(
        // Special forms
        of("alias", 1), of("alias", 2), of("case", 2), of("cond", 1), anyArity("for"),
        of("import", 1), of("import", 2), of("quote", 1), of("quote", 2), of("receive", 1),
        of("require", 1), of("require", 2), of("try", 1), anyArity("with"),

        // Kernel
        of("def", 1), of("def", 2), of("defp", 1), of("defp", 2), of("defguard", 1), of("defguardp", 1),
        of("defmacro", 1), of("defmacro", 2), of("defmacrop", 1), of("defmacrop", 2), of("defmodule", 2),
        of("defdelegate", 2), of("defexception", 1), of("defoverridable", 1), of("defstruct", 1),
        of("destructure", 2), of("raise", 1), of("raise", 2), of("reraise", 2), of("reraise", 3),
        of("if", 2), of("unless", 2), of("use", 1), of("use", 2),

        // Records
        of("defrecord", 2), of("defrecord", 3), of("defrecordp", 2), of("defrecordp", 3),

        // Testing
        of("assert", 1), of("assert", 2), of("assert_in_delta", 3), of("assert_in_delta", 4),
        of("assert_raise", 2), of("assert_raise", 3), of("assert_receive", 1), of("assert_receive", 2),
        of("assert_receive", 3), of("assert_received", 1), of("assert_received", 2), of("doctest", 1),
        of("doctest", 2), of("refute", 1), of("refute", 2), of("refute_in_delta", 3), of("refute_in_delta", 4),
        of("refute_receive", 1), of("refute_receive", 2), of("refute_receive", 3), of("refute_received", 1),
        of("refute_received", 2), of("setup", 1), of("setup", 2), of("setup_all", 1), of("setup_all", 2),
        of("test", 1), of("test", 2),

        // Config
        of("config", 2), of("config", 3), of("import_config", 1)
    );
}
