package org.dynamis.exprtree.expressions;

public interface NodeVisitor<R> {

    R visitBinary(BinaryNode node);

    R visitConstant(ConstantNode node);

    R visitVariable(VariableNode node);

    R visitMember(MemberNode node);

    R visitIndex(IndexNode node);

    R visitCall(CallNode node);

    R visitBlock(BlockNode node);

    R visitLambda(LambdaNode node);
}
