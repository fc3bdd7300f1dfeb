package org.dynamis.exprtree.expressions;

import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.dynamis.exprtree.expressions.BinaryOperatorKind.*;

class BinaryOperatorKindTest {

    private static final Map<BinaryOperatorKind, BinaryOperatorKind> COMPOUND = new EnumMap<>(Map.ofEntries(
        Map.entry(ADD_ASSIGN, ADD),
        Map.entry(ADD_ASSIGN_CHECKED, ADD_CHECKED),
        Map.entry(SUBTRACT_ASSIGN, SUBTRACT),
        Map.entry(SUBTRACT_ASSIGN_CHECKED, SUBTRACT_CHECKED),
        Map.entry(MULTIPLY_ASSIGN, MULTIPLY),
        Map.entry(MULTIPLY_ASSIGN_CHECKED, MULTIPLY_CHECKED),
        Map.entry(DIVIDE_ASSIGN, DIVIDE),
        Map.entry(MODULO_ASSIGN, MODULO),
        Map.entry(POWER_ASSIGN, POWER),
        Map.entry(AND_ASSIGN, AND),
        Map.entry(OR_ASSIGN, OR),
        Map.entry(EXCLUSIVE_OR_ASSIGN, EXCLUSIVE_OR),
        Map.entry(LEFT_SHIFT_ASSIGN, LEFT_SHIFT),
        Map.entry(RIGHT_SHIFT_ASSIGN, RIGHT_SHIFT)));

    @Test
    void toNonCompound_coversEveryKind() {
        for (BinaryOperatorKind kind : values()) {
            if (COMPOUND.containsKey(kind)) {
                assertThat(kind.isCompoundAssignment()).as(kind.name()).isTrue();
                assertThat(kind.toNonCompound()).as(kind.name()).isEqualTo(COMPOUND.get(kind));
            } else {
                assertThat(kind.isCompoundAssignment()).as(kind.name()).isFalse();
                assertThatThrownBy(kind::toNonCompound)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining(kind.name());
            }
        }
    }

    @Test
    void compoundKinds_shareOperatorNameWithPlainKind() {
        assertThat(ADD_ASSIGN.getOperatorName()).isEqualTo("add");
        assertThat(MODULO_ASSIGN.getOperatorName()).isEqualTo("remainder");
        assertThat(POWER_ASSIGN.getOperatorName()).isEqualTo("pow");
        assertThat(AND_ALSO.getOperatorName()).isEqualTo(AND.getOperatorName());
        assertThat(COALESCE.getOperatorName()).isNull();
    }

    @Test
    void checkedKinds() {
        assertThat(ADD_CHECKED.isChecked()).isTrue();
        assertThat(MULTIPLY_ASSIGN_CHECKED.isChecked()).isTrue();
        assertThat(ADD.isChecked()).isFalse();
        assertThat(DIVIDE_ASSIGN.isChecked()).isFalse();
    }
}
