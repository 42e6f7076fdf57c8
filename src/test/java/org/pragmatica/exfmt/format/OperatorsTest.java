package org.pragmatica.exfmt.format;

import org.junit.jupiter.api.Test;
import org.pragmatica.exfmt.format.Operators.Associativity;
import org.pragmatica.exfmt.format.Operators.OperatorInfo;

import static org.assertj.core.api.Assertions.assertThat;

class OperatorsTest {

    @Test
    void binary_knowsPrecedenceAndAssociativity() {
        assertThat(Operators.binary("+")).contains(new OperatorInfo(Associativity.LEFT, 210));
        assertThat(Operators.binary("++")).contains(new OperatorInfo(Associativity.RIGHT, 200));
        assertThat(Operators.binary("|>")).contains(new OperatorInfo(Associativity.LEFT, 170));
        assertThat(Operators.binary("//")).contains(new OperatorInfo(Associativity.RIGHT, 190));
        assertThat(Operators.binary("foo")).isEmpty();
    }

    @Test
    void unary_includesCaptureAndAttribute() {
        assertThat(Operators.unary("&")).map(OperatorInfo::precedence).contains(Operators.CAPTURE_PRECEDENCE);
        assertThat(Operators.unary("@")).map(OperatorInfo::precedence).contains(320);
        assertThat(Operators.isUnary("not")).isTrue();
        assertThat(Operators.isUnary("+")).isTrue();
        assertThat(Operators.isUnary("*")).isFalse();
    }

    @Test
    void families_areDisjointWhereLayoutDiffers() {
        assertThat(Operators.PIPELINE).contains("|>", "~>>", "<|>");
        assertThat(Operators.RIGHT_NEW_LINE_BEFORE).containsExactlyInAnyOrder("|", "when");
        assertThat(Operators.NO_SPACE).doesNotContainAnyElementsOf(Operators.NO_NEWLINE);
        assertThat(Operators.LOGICAL).contains("and", "or", "&&", "||");
    }
}
