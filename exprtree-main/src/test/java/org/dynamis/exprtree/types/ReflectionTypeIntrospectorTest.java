package org.dynamis.exprtree.types;

import org.dynamis.exprtree.test.OperatorFixtures;
import org.dynamis.exprtree.test.OperatorFixtures.Celsius;
import org.dynamis.exprtree.test.OperatorFixtures.Flags;
import org.dynamis.exprtree.test.OperatorFixtures.Grid;
import org.dynamis.exprtree.test.OperatorFixtures.OptionalCelsius;
import org.dynamis.exprtree.test.OperatorFixtures.Tri;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReflectionTypeIntrospectorTest {

    private final TypeIntrospector types = ReflectionTypeIntrospector.instance();
    private final TypeIntrospector host = OperatorFixtures.hostTypes();

    @Test
    void primitivesAndWrappers() {
        assertThat(types.isValueType(int.class)).isTrue();
        assertThat(types.isValueType(Integer.class)).isTrue();
        assertThat(types.isValueType(String.class)).isFalse();
        assertThat(types.isValueType(void.class)).isFalse();
        assertThat(types.isNullable(Integer.class)).isTrue();
        assertThat(types.isNullable(int.class)).isFalse();
        assertThat(types.nonNullable(Integer.class)).isEqualTo(int.class);
        assertThat(types.nonNullable(String.class)).isEqualTo(String.class);
        assertThat(types.nullable(double.class)).isEqualTo(Double.class);
    }

    @Test
    void registeredValueTypes() {
        assertThat(host.isValueType(Celsius.class)).isTrue();
        assertThat(host.isValueType(OptionalCelsius.class)).isTrue();
        assertThat(host.isNullable(OptionalCelsius.class)).isTrue();
        assertThat(host.isNullable(Celsius.class)).isFalse();
        assertThat(host.nonNullable(OptionalCelsius.class)).isEqualTo(Celsius.class);
        assertThat(host.nullable(Celsius.class)).isEqualTo(OptionalCelsius.class);
        assertThat(types.isValueType(Celsius.class)).isFalse();
    }

    @Test
    void registration_rejectsPrimitivesAndSelfPairs() {
        assertThatThrownBy(() -> ReflectionTypeIntrospector.builder().valueType(int.class, Integer.class))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReflectionTypeIntrospector.builder().valueType(Celsius.class, Celsius.class))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReflectionTypeIntrospector.builder().arrayType(Grid.class, 0, int.class))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void numericCategories() {
        assertThat(types.isNumeric(char.class)).isTrue();
        assertThat(types.isArithmetic(char.class)).isFalse();
        assertThat(types.isArithmetic(Long.class)).isTrue();
        assertThat(types.isInteger(byte.class)).isTrue();
        assertThat(types.isInteger(char.class)).isFalse();
        assertThat(types.isIntegerOrBoolean(Boolean.class)).isTrue();
        assertThat(types.isEnum(Thread.State.class)).isTrue();
    }

    @Test
    void arrays() {
        assertThat(types.isArray(int[].class)).isTrue();
        assertThat(types.arrayRank(int[][].class)).isEqualTo(1);
        assertThat(types.elementType(int[][].class)).isEqualTo(int[].class);
        assertThat(host.isArray(Grid.class)).isTrue();
        assertThat(host.arrayRank(Grid.class)).isEqualTo(2);
        assertThat(host.elementType(Grid.class)).isEqualTo(double.class);
    }

    @Test
    void conversions() {
        assertThat(types.isReferenceAssignable(CharSequence.class, String.class)).isTrue();
        assertThat(types.isReferenceAssignable(Integer.class, int.class)).isFalse();
        assertThat(types.isReferenceAssignable(Number.class, Integer.class)).isFalse();
        assertThat(types.isImplicitNumericConversion(int.class, long.class)).isTrue();
        assertThat(types.isImplicitNumericConversion(long.class, int.class)).isFalse();
        assertThat(types.isImplicitlyConvertible(int.class, Number.class)).isTrue();
        assertThat(types.isImplicitlyConvertible(int.class, Long.class)).isTrue();
        assertThat(types.isImplicitlyConvertible(Integer.class, int.class)).isFalse();
        assertThat(types.isImplicitlyConvertible(String.class, int.class)).isFalse();
    }

    @Test
    void builtInEquality() {
        assertThat(types.hasBuiltInEquality(String.class, Object.class)).isTrue();
        assertThat(types.hasBuiltInEquality(List.class, String.class)).isTrue();
        assertThat(types.hasBuiltInEquality(Integer.class, Integer.class)).isTrue();
        assertThat(types.hasBuiltInEquality(Integer.class, Long.class)).isFalse();
        assertThat(types.hasBuiltInEquality(String.class, Integer.class)).isFalse();
        assertThat(host.hasBuiltInEquality(Celsius.class, Celsius.class)).isFalse();
    }

    @Test
    void findStaticMethod_exactParameterTypes() {
        assertThat(types.findStaticMethod(Celsius.class, "add", Celsius.class, Celsius.class)).isNotNull();
        assertThat(types.findStaticMethod(Celsius.class, "add", Object.class, Object.class)).isNull();
        assertThat(types.findStaticMethod(Celsius.class, "getDegrees")).isNull();
        assertThat(types.findStaticMethod(int.class, "add", int.class, int.class)).isNull();
    }

    @Test
    void findStaticMethod_prefersDeclaredOperators() {
        OperatorMethod declared = OperatorMethod.declared(Flags.class, "or")
            .parameter(Flags.class).parameter(Flags.class).returns(Flags.class)
            .build();
        TypeIntrospector withDeclared = ReflectionTypeIntrospector.builder().operators(declared).build();

        assertThat(withDeclared.findStaticMethod(Flags.class, "or", Flags.class, Flags.class)).isSameAs(declared);
        assertThat(types.findStaticMethod(Flags.class, "or", Flags.class, Flags.class)).isNull();
    }

    @Test
    void findBooleanOperator_requiresBooleanReturn() {
        assertThat(types.findBooleanOperator(Tri.class, "isTrue")).isNotNull();
        assertThat(types.findBooleanOperator(Flags.class, "isTrue")).isNull();
    }
}
