package org.dynamis.exprtree;

import org.dynamis.exprtree.expressions.BinaryOperatorKind;
import org.dynamis.exprtree.types.OperatorMethod;

public class InconsistentOperatorTypesException extends OperatorMethodException {

    public InconsistentOperatorTypesException(BinaryOperatorKind kind, OperatorMethod method) {
        super("The user-defined operator method '" + method.getName() + "' for operator " + kind
              + " must have identical parameter and return types", kind, method);
    }
}
