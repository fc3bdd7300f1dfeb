package org.dynamis.exprtree.expressions;

import org.dynamis.exprtree.syntax.NodeRenderer;

import java.lang.reflect.Method;
import java.util.List;

public final class CallNode implements Node {

    private final Node target;
    private final Method method;
    private final List<Node> arguments;

    CallNode(Node target, Method method, List<Node> arguments) {
        this.target = target;
        this.method = method;
        this.arguments = List.copyOf(arguments);
    }

    /** The receiver, or {@code null} for a static method. */
    public Node getTarget() {
        return target;
    }

    public Method getMethod() {
        return method;
    }

    public List<Node> getArguments() {
        return arguments;
    }

    @Override
    public Class<?> getType() {
        return method.getReturnType();
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.CALL;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public String toString() {
        return NodeRenderer.render(this);
    }
}
