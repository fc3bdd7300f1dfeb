package org.dynamis.exprtree;

import org.dynamis.exprtree.expressions.BinaryOperatorKind;

public class InvalidCoalesceTargetException extends NodeConstructionException {

    private final Class<?> leftType;

    public InvalidCoalesceTargetException(Class<?> leftType) {
        super("Coalesce used with type '" + leftType.getName() + "' that cannot be null",
              BinaryOperatorKind.COALESCE);
        this.leftType = leftType;
    }

    public Class<?> getLeftType() {
        return leftType;
    }
}
