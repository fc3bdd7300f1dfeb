package org.dynamis.exprtree.expressions;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Objects;

/**
 * An indexer given by an instance getter {@code get(i0..iN)} and an instance setter
 * {@code set(i0..iN, value)}; either may be absent but not both.
 */
public final class IndexerRef {

    public static final String GETTER_NAME = "get";
    public static final String SETTER_NAME = "set";

    private final Method getter;
    private final Method setter;
    private final Class<?> elementType;
    private final Class<?>[] indexTypes;

    private IndexerRef(Method getter, Method setter) {
        this.getter = getter;
        this.setter = setter;
        if (getter != null) {
            this.elementType = getter.getReturnType();
            this.indexTypes = getter.getParameterTypes();
        } else {
            Class<?>[] parameterTypes = setter.getParameterTypes();
            this.elementType = parameterTypes[parameterTypes.length - 1];
            this.indexTypes = Arrays.copyOf(parameterTypes, parameterTypes.length - 1);
        }
    }

    public static IndexerRef of(Method getter, Method setter) {
        if (getter == null && setter == null) {
            throw new IllegalArgumentException("An indexer needs a getter or a setter");
        }
        if (getter != null && setter != null) {
            Class<?>[] setterTypes = setter.getParameterTypes();
            Class<?>[] expected = Arrays.copyOf(getter.getParameterTypes(), getter.getParameterCount() + 1);
            expected[expected.length - 1] = getter.getReturnType();
            if (!Arrays.equals(setterTypes, expected)) {
                throw new IllegalArgumentException("Indexer setter " + setter + " does not match getter " + getter);
            }
        }
        return new IndexerRef(getter, setter);
    }

    /**
     * Finds the conventional {@code get}/{@code set} pair on {@code type} for the given index types.
     */
    public static IndexerRef of(Class<?> type, Class<?>... indexTypes) {
        Method getter = null;
        Method setter = null;
        for (Class<?> t = type; t != null && (getter == null || setter == null); t = t.getSuperclass()) {
            for (Method m : t.getDeclaredMethods()) {
                Class<?>[] parameterTypes = m.getParameterTypes();
                if (getter == null && m.getName().equals(GETTER_NAME) && Arrays.equals(parameterTypes, indexTypes)) {
                    getter = m;
                } else if (setter == null && m.getName().equals(SETTER_NAME)
                           && parameterTypes.length == indexTypes.length + 1
                           && Arrays.equals(Arrays.copyOf(parameterTypes, indexTypes.length), indexTypes)) {
                    setter = m;
                }
            }
        }
        if (getter == null && setter == null) {
            throw new IllegalArgumentException("No indexer on " + type.getName() + " for " + Arrays.toString(indexTypes));
        }
        return of(getter, setter);
    }

    public Method getGetter() {
        return getter;
    }

    public Method getSetter() {
        return setter;
    }

    public Class<?> getElementType() {
        return elementType;
    }

    public Class<?>[] getIndexTypes() {
        return indexTypes.clone();
    }

    public int getIndexCount() {
        return indexTypes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndexerRef other)) {
            return false;
        }
        return Objects.equals(getter, other.getter) && Objects.equals(setter, other.setter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getter, setter);
    }

    @Override
    public String toString() {
        Method accessor = getter != null ? getter : setter;
        return accessor.getDeclaringClass().getSimpleName() + Arrays.toString(indexTypes);
    }
}
