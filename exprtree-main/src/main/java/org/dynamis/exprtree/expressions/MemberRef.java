package org.dynamis.exprtree.expressions;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Objects;

/**
 * A field, or a property made of an optional getter and an optional setter.
 */
public final class MemberRef {

    private final Class<?> declaringType;
    private final String name;
    private final Class<?> type;
    private final Field field;
    private final Method getter;
    private final Method setter;
    private final boolean isStatic;

    private MemberRef(Class<?> declaringType, String name, Class<?> type, Field field, Method getter, Method setter, boolean isStatic) {
        this.declaringType = declaringType;
        this.name = name;
        this.type = type;
        this.field = field;
        this.getter = getter;
        this.setter = setter;
        this.isStatic = isStatic;
    }

    public static MemberRef field(Field field) {
        Objects.requireNonNull(field, "field");
        return new MemberRef(field.getDeclaringClass(), field.getName(), field.getType(), field, null, null,
                             Modifier.isStatic(field.getModifiers()));
    }

    /**
     * A property given by its accessors; either may be {@code null} but not both. The getter takes no
     * parameters and the setter takes one of the getter's return type.
     */
    public static MemberRef property(String name, Method getter, Method setter) {
        if (getter == null && setter == null) {
            throw new IllegalArgumentException("Property '" + name + "' needs a getter or a setter");
        }
        Method accessor = getter != null ? getter : setter;
        Class<?> type = getter != null ? getter.getReturnType() : setter.getParameterTypes()[0];
        if (getter != null && getter.getParameterCount() != 0) {
            throw new IllegalArgumentException("Getter of '" + name + "' must take no parameters: " + getter);
        }
        if (setter != null && (setter.getParameterCount() != 1 || setter.getParameterTypes()[0] != type)) {
            throw new IllegalArgumentException("Setter of '" + name + "' must take one " + type.getName() + ": " + setter);
        }
        return new MemberRef(accessor.getDeclaringClass(), name, type, null, getter, setter,
                             Modifier.isStatic(accessor.getModifiers()));
    }

    /**
     * Finds a property by bean naming: {@code getX}/{@code isX} and {@code setX}, public or not,
     * on {@code type} or its superclasses.
     */
    public static MemberRef property(Class<?> type, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Property name on " + type.getName() + " must not be blank");
        }
        String suffix = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        Method getter = findMethod(type, "get" + suffix);
        if (getter == null) {
            getter = findMethod(type, "is" + suffix);
        }
        Class<?> propertyType = getter != null ? getter.getReturnType() : null;
        Method setter = findSetter(type, "set" + suffix, propertyType);
        if (getter == null && setter == null) {
            throw new IllegalArgumentException("No property '" + name + "' on " + type.getName());
        }
        return property(name, getter, setter);
    }

    /** Finds a field by name on {@code type} or its superclasses. */
    public static MemberRef field(Class<?> type, String name) {
        for (Class<?> t = type; t != null; t = t.getSuperclass()) {
            for (Field f : t.getDeclaredFields()) {
                if (f.getName().equals(name)) {
                    return field(f);
                }
            }
        }
        throw new IllegalArgumentException("No field '" + name + "' on " + type.getName());
    }

    private static Method findMethod(Class<?> type, String name, Class<?>... parameterTypes) {
        for (Class<?> t = type; t != null; t = t.getSuperclass()) {
            for (Method m : t.getDeclaredMethods()) {
                if (m.getName().equals(name) && Arrays.equals(m.getParameterTypes(), parameterTypes)) {
                    return m;
                }
            }
        }
        return null;
    }

    private static Method findSetter(Class<?> type, String name, Class<?> propertyType) {
        if (propertyType != null) {
            return findMethod(type, name, propertyType);
        }
        for (Class<?> t = type; t != null; t = t.getSuperclass()) {
            for (Method m : t.getDeclaredMethods()) {
                if (m.getName().equals(name) && m.getParameterCount() == 1) {
                    return m;
                }
            }
        }
        return null;
    }

    public Class<?> getDeclaringType() {
        return declaringType;
    }

    public String getName() {
        return name;
    }

    public Class<?> getType() {
        return type;
    }

    /** The backing field, or {@code null} for a property. */
    public Field getField() {
        return field;
    }

    public Method getGetter() {
        return getter;
    }

    public Method getSetter() {
        return setter;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public boolean canRead() {
        return field != null || getter != null;
    }

    public boolean canWrite() {
        if (field != null) {
            return !Modifier.isFinal(field.getModifiers());
        }
        return setter != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MemberRef other)) {
            return false;
        }
        return declaringType == other.declaringType && name.equals(other.name)
               && Objects.equals(field, other.field)
               && Objects.equals(getter, other.getter)
               && Objects.equals(setter, other.setter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(declaringType, name);
    }

    @Override
    public String toString() {
        return declaringType.getSimpleName() + "." + name;
    }
}
