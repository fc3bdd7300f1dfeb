package org.dynamis.exprtree.reduce;

import org.dynamis.exprtree.expressions.BinaryNode;
import org.dynamis.exprtree.expressions.Node;
import org.dynamis.exprtree.expressions.NodeFactory;
import org.dynamis.exprtree.expressions.VariableNode;

/**
 * A temporary introduced by a reduction, typed from its initializer and scoped to the block the
 * reduction produces.
 */
record TempBinding(VariableNode variable, Node initializer) {

    static TempBinding bind(NodeFactory factory, String name, Node initializer) {
        return new TempBinding(factory.variable(initializer.getType(), name), initializer);
    }

    BinaryNode toAssignment(NodeFactory factory) {
        return factory.assign(variable, initializer);
    }
}
