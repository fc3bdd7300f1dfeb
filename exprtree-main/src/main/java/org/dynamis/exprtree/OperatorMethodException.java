package org.dynamis.exprtree;

import org.dynamis.exprtree.expressions.BinaryOperatorKind;
import org.dynamis.exprtree.types.OperatorMethod;

/**
 * Base for failures caused by the shape of an operator method, whether supplied explicitly
 * or discovered by name.
 */
public class OperatorMethodException extends NodeConstructionException {

    private final OperatorMethod method;

    public OperatorMethodException(String message, BinaryOperatorKind kind, OperatorMethod method) {
        super(message, kind);
        this.method = method;
    }

    public OperatorMethod getMethod() {
        return method;
    }

    public String getClassName() {
        return method.getDeclaringType().getName();
    }

    public String getMethodName() {
        return method.getName();
    }
}
