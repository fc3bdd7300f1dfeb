package org.dynamis.exprtree;

import org.dynamis.exprtree.types.OperatorMethod;

public class MethodVoidReturnException extends OperatorMethodException {

    public MethodVoidReturnException(OperatorMethod method) {
        super("User-defined operator method '" + method + "' must not be void", null, method);
    }
}
