package org.dynamis.exprtree.expressions;

import org.dynamis.exprtree.syntax.NodeRenderer;

import java.util.List;

/**
 * Indexed access {@code object[a0..aN]}, through an indexer or, when the indexer is {@code null},
 * directly on a Java array.
 */
public final class IndexNode implements Node {

    private final Node object;
    private final IndexerRef indexer;
    private final List<Node> arguments;
    private final Class<?> type;

    IndexNode(Node object, IndexerRef indexer, List<Node> arguments, Class<?> type) {
        this.object = object;
        this.indexer = indexer;
        this.arguments = List.copyOf(arguments);
        this.type = type;
    }

    public Node getObject() {
        return object;
    }

    /** The indexer, or {@code null} for array access. */
    public IndexerRef getIndexer() {
        return indexer;
    }

    public List<Node> getArguments() {
        return arguments;
    }

    @Override
    public Class<?> getType() {
        return type;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.INDEX;
    }

    @Override
    public boolean canRead() {
        return indexer == null || indexer.getGetter() != null;
    }

    @Override
    public boolean canWrite() {
        return indexer == null || indexer.getSetter() != null;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIndex(this);
    }

    @Override
    public String toString() {
        return NodeRenderer.render(this);
    }
}
