package org.dynamis.exprtree;

import org.dynamis.exprtree.types.OperatorMethod;

public class MethodNotStaticException extends OperatorMethodException {

    public MethodNotStaticException(OperatorMethod method) {
        super("User-defined operator method '" + method + "' must be static", null, method);
    }
}
