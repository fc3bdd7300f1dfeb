package org.dynamis.exprtree;

import org.dynamis.exprtree.expressions.BinaryOperatorKind;

public class OperatorNotDefinedException extends NodeConstructionException {

    private final Class<?> leftType;
    private final Class<?> rightType;

    public OperatorNotDefinedException(BinaryOperatorKind kind, Class<?> leftType, Class<?> rightType) {
        super("The binary operator " + kind + " is not defined for the types '"
              + leftType.getName() + "' and '" + rightType.getName() + "'", kind);
        this.leftType = leftType;
        this.rightType = rightType;
    }

    public Class<?> getLeftType() {
        return leftType;
    }

    public Class<?> getRightType() {
        return rightType;
    }
}
