package org.dynamis.exprtree.expressions;

final class AssignBinaryNode extends BinaryNode {

    AssignBinaryNode(Node left, Node right) {
        super(left, right);
    }

    @Override
    public BinaryOperatorKind getKind() {
        return BinaryOperatorKind.ASSIGN;
    }

    @Override
    public Class<?> getType() {
        return getLeft().getType();
    }
}
