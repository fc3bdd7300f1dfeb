package org.dynamis.exprtree.types;

import org.dynamis.exprtree.TreeSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Process-wide cache from a reflective method to its parameter list. Lookup-or-insert runs
 * under a single lock; entries are never evicted. When a capacity is configured, new inserts
 * are refused once it is reached and the uncached list is returned instead.
 */
public final class ParameterCache {

    private static final Logger LOG = LoggerFactory.getLogger(ParameterCache.class);

    private static final ParameterCache SHARED =
            new ParameterCache(TreeSettings.fromSystemProperties().getParameterCacheCapacity());

    private final Object lock = new Object();
    private final Map<Method, List<OperatorParameter>> entries = new HashMap<>();
    private final int capacity;
    private boolean capacityReported;

    public ParameterCache(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative: " + capacity);
        }
        this.capacity = capacity;
    }

    public static ParameterCache shared() {
        return SHARED;
    }

    public List<OperatorParameter> getParameters(Method method) {
        Objects.requireNonNull(method, "method");
        synchronized (lock) {
            List<OperatorParameter> cached = entries.get(method);
            if (cached != null) {
                return cached;
            }
            List<OperatorParameter> parameters = readParameters(method);
            if (capacity == 0 || entries.size() < capacity) {
                entries.put(method, parameters);
                LOG.debug("Cached {} parameter(s) of {}", parameters.size(), method);
            } else if (!capacityReported) {
                capacityReported = true;
                LOG.warn("Parameter cache reached its capacity of {} entries; further lookups are not cached", capacity);
            }
            return parameters;
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    static List<OperatorParameter> readParameters(Method method) {
        Class<?>[] types = method.getParameterTypes();
        List<OperatorParameter> parameters = new ArrayList<>(types.length);
        for (Class<?> type : types) {
            parameters.add(OperatorParameter.of(type));
        }
        return Collections.unmodifiableList(parameters);
    }
}
