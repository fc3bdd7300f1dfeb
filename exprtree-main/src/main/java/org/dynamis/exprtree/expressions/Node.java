package org.dynamis.exprtree.expressions;

/**
 * An immutable expression tree node. Nodes may be shared between trees.
 */
public interface Node {

    /** The static type of evaluating this node, fixed at construction. */
    Class<?> getType();

    NodeType getNodeType();

    /** False only for write-only placeholders such as a setter-only property. */
    default boolean canRead() {
        return true;
    }

    /** True for variables, settable members and indexer accesses. */
    default boolean canWrite() {
        return false;
    }

    <R> R accept(NodeVisitor<R> visitor);
}
