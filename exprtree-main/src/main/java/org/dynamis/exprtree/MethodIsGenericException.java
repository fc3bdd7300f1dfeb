package org.dynamis.exprtree;

import org.dynamis.exprtree.types.OperatorMethod;

public class MethodIsGenericException extends OperatorMethodException {

    public MethodIsGenericException(OperatorMethod method) {
        super("Operator method '" + method + "' is generic or contains open type parameters", null, method);
    }
}
