package org.dynamis.exprtree;

import java.util.Objects;
import java.util.Properties;

/**
 * Settings read from JVM system properties.
 * <ul>
 *   <li>{@code exprtree.parameterCache.capacity}: maximum number of cached parameter lists, 0 for unbounded</li>
 *   <li>{@code exprtree.reducer.tempPrefix}: prefix of temporaries introduced by compound-assignment reduction</li>
 * </ul>
 */
public final class TreeSettings {

    public static final String PARAMETER_CACHE_CAPACITY = "exprtree.parameterCache.capacity";
    public static final String TEMP_PREFIX = "exprtree.reducer.tempPrefix";

    static final int DEFAULT_PARAMETER_CACHE_CAPACITY = 0;
    static final String DEFAULT_TEMP_PREFIX = "$";

    private static final TreeSettings DEFAULTS = new TreeSettings(DEFAULT_PARAMETER_CACHE_CAPACITY, DEFAULT_TEMP_PREFIX);

    private final int parameterCacheCapacity;
    private final String tempPrefix;

    private TreeSettings(int parameterCacheCapacity, String tempPrefix) {
        this.parameterCacheCapacity = parameterCacheCapacity;
        this.tempPrefix = tempPrefix;
    }

    public static TreeSettings defaults() {
        return DEFAULTS;
    }

    public static TreeSettings fromSystemProperties() {
        return from(System.getProperties());
    }

    public static TreeSettings from(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        int capacity = parseCapacity(properties.getProperty(PARAMETER_CACHE_CAPACITY));
        String prefix = parsePrefix(properties.getProperty(TEMP_PREFIX));
        return new TreeSettings(capacity, prefix);
    }

    private static int parseCapacity(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_PARAMETER_CACHE_CAPACITY;
        }
        int capacity;
        try {
            capacity = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PARAMETER_CACHE_CAPACITY + " must be an integer, was '" + value + "'", e);
        }
        if (capacity < 0) {
            throw new IllegalArgumentException(PARAMETER_CACHE_CAPACITY + " must not be negative, was " + capacity);
        }
        return capacity;
    }

    private static String parsePrefix(String value) {
        if (value == null) {
            return DEFAULT_TEMP_PREFIX;
        }
        if (value.isEmpty() || !isIdentifierPrefix(value)) {
            throw new IllegalArgumentException(TEMP_PREFIX + " must start a valid Java identifier, was '" + value + "'");
        }
        return value;
    }

    private static boolean isIdentifierPrefix(String value) {
        if (!Character.isJavaIdentifierStart(value.charAt(0))) {
            return false;
        }
        for (int i = 1; i < value.length(); i++) {
            if (!Character.isJavaIdentifierPart(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /** 0 means unbounded. */
    public int getParameterCacheCapacity() {
        return parameterCacheCapacity;
    }

    public String getTempPrefix() {
        return tempPrefix;
    }

    @Override
    public String toString() {
        return "TreeSettings{parameterCacheCapacity=" + parameterCacheCapacity + ", tempPrefix='" + tempPrefix + "'}";
    }
}
