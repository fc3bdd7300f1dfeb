package org.dynamis.exprtree;

import org.dynamis.exprtree.expressions.BinaryOperatorKind;

public class NotAnArrayException extends NodeConstructionException {

    private final Class<?> type;

    public NotAnArrayException(Class<?> type) {
        super("Type '" + type.getName() + "' is not an array", BinaryOperatorKind.ELEMENT_ACCESS);
        this.type = type;
    }

    public Class<?> getType() {
        return type;
    }
}
