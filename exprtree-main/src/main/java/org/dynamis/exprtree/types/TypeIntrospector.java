package org.dynamis.exprtree.types;

/**
 * Type facts the operator resolver and node factory depend on. A host may back this with runtime
 * reflection ({@link ReflectionTypeIntrospector}) or with symbol tables of the embedding language.
 * <p>
 * Value types are the non-nullable ones (primitives and host value types) together with their
 * nullable forms; everything else is a reference type.
 */
public interface TypeIntrospector {

    boolean isValueType(Class<?> type);

    /** True for the nullable form of a value type, such as {@code Integer} for {@code int}. */
    boolean isNullable(Class<?> type);

    /** The non-nullable form of {@code type}, or {@code type} itself when it is not nullable. */
    Class<?> nonNullable(Class<?> type);

    /** The nullable form of a non-nullable value type, or {@code type} itself otherwise. */
    Class<?> nullable(Class<?> type);

    /** {@code char}, {@code byte}, {@code short}, {@code int}, {@code long}, {@code float}, {@code double} and their nullable forms. */
    boolean isNumeric(Class<?> type);

    /** {@code short}, {@code int}, {@code long}, {@code float}, {@code double} and their nullable forms. */
    boolean isArithmetic(Class<?> type);

    /** {@code byte}, {@code short}, {@code int}, {@code long} and their nullable forms. */
    boolean isInteger(Class<?> type);

    boolean isBoolean(Class<?> type);

    boolean isEnum(Class<?> type);

    default boolean isIntegerOrBoolean(Class<?> type) {
        return isInteger(type) || isBoolean(type);
    }

    boolean isArray(Class<?> type);

    /** Number of dimensions of an array-like type; only meaningful when {@link #isArray} holds. */
    int arrayRank(Class<?> type);

    Class<?> elementType(Class<?> type);

    /** Identity, or both reference types with {@code source} assignable to {@code target}. */
    boolean isReferenceAssignable(Class<?> target, Class<?> source);

    /** Widening conversion between two non-nullable numeric types. */
    boolean isImplicitNumericConversion(Class<?> source, Class<?> target);

    boolean isImplicitlyConvertible(Class<?> source, Class<?> target);

    /** Whether {@code ==} between the two types is defined without a user operator. */
    boolean hasBuiltInEquality(Class<?> left, Class<?> right);

    /**
     * Finds a static method declared on {@code declaringType} whose parameter types are exactly
     * {@code parameterTypes}; public and non-public methods both qualify.
     *
     * @return the method, or {@code null} when there is none
     */
    OperatorMethod findStaticMethod(Class<?> declaringType, String name, Class<?>... parameterTypes);

    /**
     * Finds a boolean test operator ({@code isTrue}/{@code isFalse}) taking {@code type}, searching
     * {@code type} and then its superclasses.
     */
    default OperatorMethod findBooleanOperator(Class<?> type, String name) {
        for (Class<?> t = type; t != null; t = t.getSuperclass()) {
            OperatorMethod method = findStaticMethod(t, name, t);
            if (method != null && method.getReturnType() == boolean.class) {
                return method;
            }
        }
        return null;
    }
}
