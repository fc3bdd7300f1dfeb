package org.dynamis.exprtree.expressions;

// && || == != < <= > >= with a plain boolean result
final class LogicalBinaryNode extends BinaryNode {

    private final BinaryOperatorKind kind;

    LogicalBinaryNode(BinaryOperatorKind kind, Node left, Node right) {
        super(left, right);
        this.kind = kind;
    }

    @Override
    public BinaryOperatorKind getKind() {
        return kind;
    }

    @Override
    public Class<?> getType() {
        return boolean.class;
    }
}
