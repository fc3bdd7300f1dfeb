package org.dynamis.exprtree.expressions;

sealed class SimpleBinaryNode extends BinaryNode permits MethodBinaryNode {

    private final BinaryOperatorKind kind;
    private final Class<?> type;

    SimpleBinaryNode(BinaryOperatorKind kind, Node left, Node right, Class<?> type) {
        super(left, right);
        this.kind = kind;
        this.type = type;
    }

    @Override
    public final BinaryOperatorKind getKind() {
        return kind;
    }

    @Override
    public final Class<?> getType() {
        return type;
    }
}
