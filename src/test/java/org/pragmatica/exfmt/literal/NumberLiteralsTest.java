package org.pragmatica.exfmt.literal;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class NumberLiteralsTest {

    // === Integers ===

    @Test
    void integer_hexadecimal_upperCasesDigits() {
        assertEquals("0xAF", NumberLiterals.integer("0xaf"));
        assertEquals("0xDEAD_BEEF", NumberLiterals.integer("0xdead_beef"));
    }

    @Test
    void integer_binaryOctalAndCharacter_keptAsWritten() {
        assertEquals("0b1010", NumberLiterals.integer("0b1010"));
        assertEquals("0o777", NumberLiterals.integer("0o777"));
        assertEquals("?a", NumberLiterals.integer("?a"));
    }

    @Test
    void integer_longDecimal_groupedByThousands() {
        assertEquals("1_000_000", NumberLiterals.integer("1000000"));
        assertEquals("123_456", NumberLiterals.integer("123456"));
        assertEquals("-1_234_567", NumberLiterals.integer("-1234567"));
    }

    @Test
    void integer_shortDecimal_unchanged() {
        assertEquals("12345", NumberLiterals.integer("12345"));
        assertEquals("0", NumberLiterals.integer("0"));
    }

    @Test
    void integer_existingUnderscores_kept() {
        assertEquals("10_00000", NumberLiterals.integer("10_00000"));
    }

    // === Floats ===

    @Test
    void floating_groupsIntegerPartAndLowerCasesExponent() {
        assertEquals("1_000_000.0e10", NumberLiterals.floating("1000000.0E10"));
        assertEquals("1.5", NumberLiterals.floating("1.5"));
    }
}
