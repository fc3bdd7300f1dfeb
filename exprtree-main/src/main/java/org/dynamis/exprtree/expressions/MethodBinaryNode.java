package org.dynamis.exprtree.expressions;

import org.dynamis.exprtree.types.OperatorMethod;

final class MethodBinaryNode extends SimpleBinaryNode {

    private final OperatorMethod method;

    MethodBinaryNode(BinaryOperatorKind kind, Node left, Node right, Class<?> type, OperatorMethod method) {
        super(kind, left, right, type);
        this.method = method;
    }

    @Override
    public OperatorMethod getMethod() {
        return method;
    }
}
