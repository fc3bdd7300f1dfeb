package org.dynamis.exprtree.reduce;

import org.dynamis.exprtree.TreeSettings;
import org.dynamis.exprtree.expressions.BinaryNode;
import org.dynamis.exprtree.expressions.BinaryOperatorKind;
import org.dynamis.exprtree.expressions.IndexNode;
import org.dynamis.exprtree.expressions.MemberNode;
import org.dynamis.exprtree.expressions.Node;
import org.dynamis.exprtree.expressions.NodeFactory;
import org.dynamis.exprtree.expressions.VariableNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Rewrites a compound assignment {@code target op= value} into plain operations. The receiver of a
 * member target and the object and arguments of an indexer target are each evaluated exactly once,
 * in source order, before {@code value}; only a variable or static member target is read twice.
 * <pre>
 * v op= r          →  v = v op r
 * o.m op= r        →  { t1 = o; t2 = t1.m op r; t1.m = t2; t2 }
 * o[a0..aN] op= r  →  { tObj = o; tArg0 = a0; ..; tValue = tObj[tArg0..] op r; tObj[tArg0..] = tValue }
 * </pre>
 * The input is never modified. Nodes that are not compound assignments are returned unchanged.
 */
public final class CompoundAssignmentReducer {

    private static final Logger LOG = LoggerFactory.getLogger(CompoundAssignmentReducer.class);

    private final NodeFactory factory;
    private final Supplier<TempNameAllocator> allocators;

    public CompoundAssignmentReducer(NodeFactory factory) {
        this(factory, TreeSettings.fromSystemProperties());
    }

    public CompoundAssignmentReducer(NodeFactory factory, TreeSettings settings) {
        this(factory, () -> new SequentialTempNameAllocator(settings.getTempPrefix()));
    }

    /**
     * @param allocators called once per reduction for a fresh allocator
     */
    public CompoundAssignmentReducer(NodeFactory factory, Supplier<TempNameAllocator> allocators) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.allocators = Objects.requireNonNull(allocators, "allocators");
    }

    public Node reduce(BinaryNode node) {
        Objects.requireNonNull(node, "node");
        if (!node.canReduce()) {
            return node;
        }
        Node target = node.getLeft();
        return switch (target.getNodeType()) {
            case VARIABLE -> reduceVariable(node);
            case MEMBER -> reduceMember(node, (MemberNode) target);
            case INDEX -> reduceIndex(node, (IndexNode) target);
            default -> throw new IllegalStateException(
                    "Cannot reduce " + node.getKind() + " with a " + target.getNodeType() + " target");
        };
    }

    private Node reduceVariable(BinaryNode node) {
        BinaryOperatorKind operation = node.getKind().toNonCompound();
        Node target = node.getLeft();
        LOG.debug("Reducing {} on a {} target without temporaries", node.getKind(), target.getNodeType());
        return factory.assign(target, factory.makeBinary(operation, target, node.getRight(), false, node.getMethod()));
    }

    private Node reduceMember(BinaryNode node, MemberNode member) {
        if (member.getReceiver() == null) {
            return reduceVariable(node);
        }
        TempNameAllocator names = allocators.get();

        TempBinding receiver = TempBinding.bind(factory, names.allocate("receiver"), member.getReceiver());
        MemberNode access = factory.member(receiver.variable(), member.getMember());

        BinaryOperatorKind operation = node.getKind().toNonCompound();
        Node combined = factory.makeBinary(operation, access, node.getRight(), false, node.getMethod());
        TempBinding value = TempBinding.bind(factory, names.allocate("value"), combined);

        LOG.debug("Reducing {} on member {} with 2 temporaries", node.getKind(), member.getMember());
        return factory.block(List.of(receiver.variable(), value.variable()),
                             receiver.toAssignment(factory),
                             value.toAssignment(factory),
                             factory.assign(access, value.variable()),
                             value.variable());
    }

    private Node reduceIndex(BinaryNode node, IndexNode index) {
        TempNameAllocator names = allocators.get();
        List<Node> arguments = index.getArguments();
        List<VariableNode> variables = new ArrayList<>(arguments.size() + 2);
        List<Node> expressions = new ArrayList<>(arguments.size() + 3);

        TempBinding object = TempBinding.bind(factory, names.allocate("object"), index.getObject());
        variables.add(object.variable());
        expressions.add(object.toAssignment(factory));

        List<Node> tempArguments = new ArrayList<>(arguments.size());
        for (Node argument : arguments) {
            TempBinding tempArgument = TempBinding.bind(factory, names.allocate("arg"), argument);
            variables.add(tempArgument.variable());
            expressions.add(tempArgument.toAssignment(factory));
            tempArguments.add(tempArgument.variable());
        }

        IndexNode access = index.getIndexer() == null
                           ? factory.arrayAccess(object.variable(), tempArguments.toArray(new Node[0]))
                           : factory.index(object.variable(), index.getIndexer(), tempArguments);

        BinaryOperatorKind operation = node.getKind().toNonCompound();
        Node combined = factory.makeBinary(operation, access, node.getRight(), false, node.getMethod());
        TempBinding value = TempBinding.bind(factory, names.allocate("value"), combined);
        variables.add(value.variable());
        expressions.add(value.toAssignment(factory));

        // the write-back is the last expression, so the block's value is the assigned value
        expressions.add(factory.assign(access, value.variable()));

        LOG.debug("Reducing {} on an indexer with {} temporaries", node.getKind(), variables.size());
        return factory.block(variables, expressions);
    }
}
