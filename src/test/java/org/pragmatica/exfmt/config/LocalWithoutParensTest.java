package org.pragmatica.exfmt.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalWithoutParensTest {

    @Test
    void matches_exactArity() {
        var locals = List.of(LocalWithoutParens.of("plug", 2));

        assertTrue(LocalWithoutParens.matches("plug", 2, locals));
        assertFalse(LocalWithoutParens.matches("plug", 1, locals));
    }

    @Test
    void matches_anyArity_exceptZero() {
        var locals = List.of(LocalWithoutParens.anyArity("field"));

        assertTrue(LocalWithoutParens.matches("field", 1, locals));
        assertTrue(LocalWithoutParens.matches("field", 7, locals));
        assertFalse(LocalWithoutParens.matches("field", 0, locals));
    }

    @Test
    void defaults_coverDefinitionsAndTests() {
        assertTrue(LocalWithoutParens.matches("defmodule", 2, LocalWithoutParens.DEFAULTS));
        assertTrue(LocalWithoutParens.matches("assert", 1, LocalWithoutParens.DEFAULTS));
        assertFalse(LocalWithoutParens.matches("IO.puts", 1, LocalWithoutParens.DEFAULTS));
    }

    @Test
    void negativeArity_otherThanAny_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> LocalWithoutParens.of("x", -2));
    }
}
