package org.dynamis.exprtree.expressions;

import org.dynamis.exprtree.syntax.NodeRenderer;

/**
 * A named storage location. Two variable nodes are the same variable only if they are the same
 * instance; the name is informational.
 */
public final class VariableNode implements Node {

    private final String name;
    private final Class<?> type;

    VariableNode(String name, Class<?> type) {
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    @Override
    public Class<?> getType() {
        return type;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.VARIABLE;
    }

    @Override
    public boolean canWrite() {
        return true;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public String toString() {
        return NodeRenderer.render(this);
    }
}
