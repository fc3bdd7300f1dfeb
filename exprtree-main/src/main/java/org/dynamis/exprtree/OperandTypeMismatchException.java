package org.dynamis.exprtree;

import org.dynamis.exprtree.expressions.BinaryOperatorKind;
import org.dynamis.exprtree.types.OperatorMethod;

public class OperandTypeMismatchException extends OperatorMethodException {

    private final int operandIndex;

    public OperandTypeMismatchException(BinaryOperatorKind kind, OperatorMethod method, int operandIndex) {
        super("The operand types for operator " + kind + " do not match the parameters of method '"
              + method.getName() + "' (operand " + operandIndex + ")", kind, method);
        this.operandIndex = operandIndex;
    }

    public int getOperandIndex() {
        return operandIndex;
    }
}
