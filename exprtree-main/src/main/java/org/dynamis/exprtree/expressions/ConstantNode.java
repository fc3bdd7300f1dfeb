package org.dynamis.exprtree.expressions;

import org.dynamis.exprtree.syntax.NodeRenderer;

public final class ConstantNode implements Node {

    private final Object value;
    private final Class<?> type;

    ConstantNode(Object value, Class<?> type) {
        this.value = value;
        this.type = type;
    }

    public Object getValue() {
        return value;
    }

    /** A constant whose value is {@code null}, whatever its static type. */
    public boolean isNull() {
        return value == null;
    }

    @Override
    public Class<?> getType() {
        return type;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.CONSTANT;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public String toString() {
        return NodeRenderer.render(this);
    }
}
