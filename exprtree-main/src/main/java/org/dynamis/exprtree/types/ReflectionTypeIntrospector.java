package org.dynamis.exprtree.types;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link TypeIntrospector} over {@link Class} tokens and {@code java.lang.reflect}. Primitives are the
 * built-in value types and their wrappers the nullable forms. A host can register further value
 * types with their nullable forms, array-like containers with a rank and element type, and operator
 * methods that exist only in its own symbol table.
 */
public final class ReflectionTypeIntrospector implements TypeIntrospector {

    private static final ReflectionTypeIntrospector DEFAULT = builder().build();

    private static final Set<Class<?>> NUMERIC = Set.of(
        char.class, byte.class, short.class, int.class, long.class, float.class, double.class);

    private static final Set<Class<?>> ARITHMETIC = Set.of(
        short.class, int.class, long.class, float.class, double.class);

    private static final Set<Class<?>> INTEGER = Set.of(
        byte.class, short.class, int.class, long.class);

    private final Map<Class<?>, Class<?>> nullableForms;
    private final Map<Class<?>, Class<?>> valueForms;
    private final Map<Class<?>, ArrayShape> containers;
    private final Map<Class<?>, List<OperatorMethod>> declaredOperators;

    private ReflectionTypeIntrospector(Builder builder) {
        this.nullableForms = Map.copyOf(builder.nullableForms);
        this.valueForms = Map.copyOf(builder.valueForms);
        this.containers = Map.copyOf(builder.containers);
        Map<Class<?>, List<OperatorMethod>> operators = new HashMap<>();
        builder.declaredOperators.forEach((type, methods) -> operators.put(type, List.copyOf(methods)));
        this.declaredOperators = Map.copyOf(operators);
    }

    /** The introspector with no host registrations. */
    public static ReflectionTypeIntrospector instance() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean isValueType(Class<?> type) {
        return (type.isPrimitive() && type != void.class)
               || Primitives.isBox(type)
               || nullableForms.containsKey(type)
               || valueForms.containsKey(type);
    }

    @Override
    public boolean isNullable(Class<?> type) {
        return Primitives.isBox(type) || valueForms.containsKey(type);
    }

    @Override
    public Class<?> nonNullable(Class<?> type) {
        Class<?> primitive = Primitives.unbox(type);
        if (primitive != null) {
            return primitive;
        }
        return valueForms.getOrDefault(type, type);
    }

    @Override
    public Class<?> nullable(Class<?> type) {
        Class<?> box = Primitives.box(type);
        if (box != null) {
            return box;
        }
        return nullableForms.getOrDefault(type, type);
    }

    @Override
    public boolean isNumeric(Class<?> type) {
        return NUMERIC.contains(nonNullable(type));
    }

    @Override
    public boolean isArithmetic(Class<?> type) {
        return ARITHMETIC.contains(nonNullable(type));
    }

    @Override
    public boolean isInteger(Class<?> type) {
        return INTEGER.contains(nonNullable(type));
    }

    @Override
    public boolean isBoolean(Class<?> type) {
        return nonNullable(type) == boolean.class;
    }

    @Override
    public boolean isEnum(Class<?> type) {
        return nonNullable(type).isEnum();
    }

    @Override
    public boolean isArray(Class<?> type) {
        return type.isArray() || containers.containsKey(type);
    }

    @Override
    public int arrayRank(Class<?> type) {
        ArrayShape shape = containers.get(type);
        return shape != null ? shape.rank() : 1;
    }

    @Override
    public Class<?> elementType(Class<?> type) {
        ArrayShape shape = containers.get(type);
        return shape != null ? shape.elementType() : type.getComponentType();
    }

    @Override
    public boolean isReferenceAssignable(Class<?> target, Class<?> source) {
        if (target == source) {
            return true;
        }
        return !isValueType(target) && !isValueType(source) && target.isAssignableFrom(source);
    }

    @Override
    public boolean isImplicitNumericConversion(Class<?> source, Class<?> target) {
        return Primitives.isWidening(source, target);
    }

    @Override
    public boolean isImplicitlyConvertible(Class<?> source, Class<?> target) {
        return source == target
               || isImplicitNumericConversion(source, target)
               || isImplicitReferenceConversion(source, target)
               || isImplicitBoxingConversion(source, target)
               || isImplicitNullableConversion(source, target);
    }

    private boolean isImplicitReferenceConversion(Class<?> source, Class<?> target) {
        return !isValueType(source) && !isValueType(target) && target.isAssignableFrom(source);
    }

    private boolean isImplicitBoxingConversion(Class<?> source, Class<?> target) {
        if (!isValueType(source) || isValueType(target)) {
            return false;
        }
        Class<?> boxed = source.isPrimitive() ? Primitives.box(source) : source;
        return target.isAssignableFrom(boxed);
    }

    private boolean isImplicitNullableConversion(Class<?> source, Class<?> target) {
        if (!isNullable(target)) {
            return false;
        }
        return isImplicitlyConvertible(nonNullable(source), nonNullable(target));
    }

    @Override
    public boolean hasBuiltInEquality(Class<?> left, Class<?> right) {
        if (left.isInterface() && !isValueType(right)) {
            return true;
        }
        if (right.isInterface() && !isValueType(left)) {
            return true;
        }
        if (hasReferenceEquality(left, right)) {
            return true;
        }
        if (left != right) {
            return false;
        }
        Class<?> type = nonNullable(left);
        return type == boolean.class || isNumeric(type) || type.isEnum();
    }

    private boolean hasReferenceEquality(Class<?> left, Class<?> right) {
        if (isValueType(left) || isValueType(right)) {
            return false;
        }
        return left.isAssignableFrom(right) || right.isAssignableFrom(left);
    }

    @Override
    public OperatorMethod findStaticMethod(Class<?> declaringType, String name, Class<?>... parameterTypes) {
        List<OperatorMethod> declared = declaredOperators.get(declaringType);
        if (declared != null) {
            for (OperatorMethod candidate : declared) {
                if (candidate.isStatic() && candidate.getName().equals(name) && matches(candidate, parameterTypes)) {
                    return candidate;
                }
            }
        }
        if (declaringType.isPrimitive()) {
            return null;
        }
        for (Method method : declaringType.getDeclaredMethods()) {
            if (method.getName().equals(name)
                && Modifier.isStatic(method.getModifiers())
                && Arrays.equals(method.getParameterTypes(), parameterTypes)) {
                return OperatorMethod.of(method);
            }
        }
        return null;
    }

    private static boolean matches(OperatorMethod method, Class<?>[] parameterTypes) {
        List<OperatorParameter> parameters = method.getParameters();
        if (parameters.size() != parameterTypes.length) {
            return false;
        }
        for (int i = 0; i < parameterTypes.length; i++) {
            if (parameters.get(i).type() != parameterTypes[i]) {
                return false;
            }
        }
        return true;
    }

    private record ArrayShape(int rank, Class<?> elementType) {
    }

    public static final class Builder {

        private final Map<Class<?>, Class<?>> nullableForms = new HashMap<>();
        private final Map<Class<?>, Class<?>> valueForms = new HashMap<>();
        private final Map<Class<?>, ArrayShape> containers = new HashMap<>();
        private final Map<Class<?>, List<OperatorMethod>> declaredOperators = new HashMap<>();

        private Builder() {
        }

        /**
         * Registers a host value type and the type that stands for its nullable form.
         */
        public Builder valueType(Class<?> valueType, Class<?> nullableForm) {
            Objects.requireNonNull(valueType, "valueType");
            Objects.requireNonNull(nullableForm, "nullableForm");
            if (valueType.isPrimitive() || Primitives.isBox(nullableForm)) {
                throw new IllegalArgumentException("Primitive value types are built in: " + valueType.getName());
            }
            if (valueType == nullableForm) {
                throw new IllegalArgumentException("A value type and its nullable form must differ: " + valueType.getName());
            }
            nullableForms.put(valueType, nullableForm);
            valueForms.put(nullableForm, valueType);
            return this;
        }

        /**
         * Registers an array-like container type indexed by {@code rank} int indexes.
         */
        public Builder arrayType(Class<?> containerType, int rank, Class<?> elementType) {
            Objects.requireNonNull(containerType, "containerType");
            Objects.requireNonNull(elementType, "elementType");
            if (rank < 1) {
                throw new IllegalArgumentException("rank must be positive: " + rank);
            }
            containers.put(containerType, new ArrayShape(rank, elementType));
            return this;
        }

        /**
         * Registers operator methods found by name on their declaring type in addition to the
         * reflective ones.
         */
        public Builder operators(OperatorMethod... methods) {
            Arrays.stream(methods).forEach(method ->
                    declaredOperators.computeIfAbsent(method.getDeclaringType(), t -> new ArrayList<>()).add(method));
            return this;
        }

        public ReflectionTypeIntrospector build() {
            return new ReflectionTypeIntrospector(this);
        }
    }
}
