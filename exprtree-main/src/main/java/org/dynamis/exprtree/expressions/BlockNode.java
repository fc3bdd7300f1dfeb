package org.dynamis.exprtree.expressions;

import org.dynamis.exprtree.syntax.NodeRenderer;

import java.util.List;

/**
 * A sequence of expressions evaluated in order, with variables scoped to the block. The value of
 * the block is the value of its last expression.
 */
public final class BlockNode implements Node {

    private final List<VariableNode> variables;
    private final List<Node> expressions;

    BlockNode(List<VariableNode> variables, List<Node> expressions) {
        this.variables = List.copyOf(variables);
        this.expressions = List.copyOf(expressions);
    }

    public List<VariableNode> getVariables() {
        return variables;
    }

    public List<Node> getExpressions() {
        return expressions;
    }

    public Node getResult() {
        return expressions.get(expressions.size() - 1);
    }

    @Override
    public Class<?> getType() {
        return getResult().getType();
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.BLOCK;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }

    @Override
    public String toString() {
        return NodeRenderer.render(this);
    }
}
