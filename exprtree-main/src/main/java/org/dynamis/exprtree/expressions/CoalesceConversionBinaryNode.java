package org.dynamis.exprtree.expressions;

final class CoalesceConversionBinaryNode extends BinaryNode {

    private final LambdaNode conversion;

    CoalesceConversionBinaryNode(Node left, Node right, LambdaNode conversion) {
        super(left, right);
        this.conversion = conversion;
    }

    @Override
    public BinaryOperatorKind getKind() {
        return BinaryOperatorKind.COALESCE;
    }

    @Override
    public Class<?> getType() {
        return getRight().getType();
    }

    @Override
    public LambdaNode getConversion() {
        return conversion;
    }
}
