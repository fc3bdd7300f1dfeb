package org.dynamis.exprtree;

import org.dynamis.exprtree.expressions.BinaryOperatorKind;
import org.dynamis.exprtree.types.OperatorMethod;

public class MissingBooleanTestOperatorsException extends OperatorMethodException {

    public MissingBooleanTestOperatorsException(BinaryOperatorKind kind, OperatorMethod method) {
        super("The user-defined operator method '" + method.getName() + "' for operator " + kind
              + " requires static isTrue and isFalse methods returning boolean on '"
              + method.getDeclaringType().getName() + "'", kind, method);
    }
}
