package org.dynamis.exprtree;

import org.dynamis.exprtree.expressions.BinaryOperatorKind;

public class AssignmentTypeMismatchException extends NodeConstructionException {

    private final Class<?> targetType;
    private final Class<?> valueType;

    public AssignmentTypeMismatchException(Class<?> targetType, Class<?> valueType) {
        super("Expression of type '" + valueType.getName() + "' cannot be used for assignment to type '"
              + targetType.getName() + "'", BinaryOperatorKind.ASSIGN);
        this.targetType = targetType;
        this.valueType = valueType;
    }

    public Class<?> getTargetType() {
        return targetType;
    }

    public Class<?> getValueType() {
        return valueType;
    }
}
