package org.dynamis.exprtree;

import org.dynamis.exprtree.expressions.BinaryOperatorKind;
import org.dynamis.exprtree.types.OperatorMethod;

public class InvalidAssignmentReturnTypeException extends OperatorMethodException {

    public InvalidAssignmentReturnTypeException(BinaryOperatorKind kind, OperatorMethod method) {
        super("The user-defined operator method '" + method.getName() + "' for operator " + kind
              + " must return a type assignable to the assignment target", kind, method);
    }
}
