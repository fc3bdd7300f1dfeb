package org.dynamis.exprtree.expressions;

import org.dynamis.exprtree.syntax.NodeRenderer;

import java.util.List;

/**
 * A function of its parameters. Used as the explicit null-to-value conversion of a coalesce.
 */
public final class LambdaNode implements Node {

    private final List<VariableNode> parameters;
    private final Node body;
    private final Class<?> returnType;

    LambdaNode(List<VariableNode> parameters, Node body, Class<?> returnType) {
        this.parameters = List.copyOf(parameters);
        this.body = body;
        this.returnType = returnType;
    }

    public List<VariableNode> getParameters() {
        return parameters;
    }

    public List<Class<?>> getParameterTypes() {
        return parameters.stream().<Class<?>>map(VariableNode::getType).toList();
    }

    public Node getBody() {
        return body;
    }

    public Class<?> getReturnType() {
        return returnType;
    }

    /** A lambda node evaluates to the function itself. */
    @Override
    public Class<?> getType() {
        return LambdaNode.class;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.LAMBDA;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLambda(this);
    }

    @Override
    public String toString() {
        return NodeRenderer.render(this);
    }
}
