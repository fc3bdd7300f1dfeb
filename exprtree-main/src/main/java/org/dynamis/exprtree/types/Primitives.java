package org.dynamis.exprtree.types;

import java.util.Map;

/**
 * Boxing and unboxing lookups between primitive types and their wrappers.
 */
public final class Primitives {

    private Primitives() {}

    // Primitive → box
    private static final Map<Class<?>, Class<?>> BOXING_TYPES = Map.of(
        int.class, Integer.class,
        long.class, Long.class,
        double.class, Double.class,
        float.class, Float.class,
        boolean.class, Boolean.class,
        byte.class, Byte.class,
        char.class, Character.class,
        short.class, Short.class
    );

    // Box → primitive
    private static final Map<Class<?>, Class<?>> UNBOXING_TYPES = Map.of(
        Integer.class, int.class,
        Long.class, long.class,
        Double.class, double.class,
        Float.class, float.class,
        Boolean.class, boolean.class,
        Byte.class, byte.class,
        Character.class, char.class,
        Short.class, short.class
    );

    // Widening primitive conversions, JLS 5.1.2
    private static final Map<Class<?>, Class<?>[]> WIDENING = Map.of(
        byte.class, new Class<?>[] {short.class, int.class, long.class, float.class, double.class},
        short.class, new Class<?>[] {int.class, long.class, float.class, double.class},
        char.class, new Class<?>[] {int.class, long.class, float.class, double.class},
        int.class, new Class<?>[] {long.class, float.class, double.class},
        long.class, new Class<?>[] {float.class, double.class},
        float.class, new Class<?>[] {double.class}
    );

    /**
     * Returns the wrapper of a primitive type, or {@code null} when {@code type} is not a primitive
     * (or is {@code void}).
     */
    public static Class<?> box(Class<?> type) {
        return BOXING_TYPES.get(type);
    }

    /**
     * Returns the primitive of a wrapper type, or {@code null} when {@code type} is not a wrapper.
     */
    public static Class<?> unbox(Class<?> type) {
        return UNBOXING_TYPES.get(type);
    }

    public static boolean isBox(Class<?> type) {
        return UNBOXING_TYPES.containsKey(type);
    }

    public static boolean isPrimitive(Class<?> type) {
        return BOXING_TYPES.containsKey(type);
    }

    public static boolean isWidening(Class<?> source, Class<?> target) {
        Class<?>[] targets = WIDENING.get(source);
        if (targets == null) {
            return false;
        }
        for (Class<?> candidate : targets) {
            if (candidate == target) {
                return true;
            }
        }
        return false;
    }
}
