package org.dynamis.exprtree.types;

import java.util.Objects;

/**
 * A formal parameter of an operator method. For a by-reference parameter {@code type} is the
 * pointee type.
 */
public record OperatorParameter(Class<?> type, boolean byReference) {

    public OperatorParameter {
        Objects.requireNonNull(type, "type");
    }

    public static OperatorParameter of(Class<?> type) {
        return new OperatorParameter(type, false);
    }

    public static OperatorParameter byReference(Class<?> type) {
        return new OperatorParameter(type, true);
    }

    @Override
    public String toString() {
        return byReference ? "ref " + type.getSimpleName() : type.getSimpleName();
    }
}
