package org.dynamis.exprtree.benchmark;

import java.util.concurrent.TimeUnit;

import org.dynamis.exprtree.TreeSettings;
import org.dynamis.exprtree.benchmark.domain.Credits;
import org.dynamis.exprtree.benchmark.domain.FactionState;
import org.dynamis.exprtree.expressions.BinaryNode;
import org.dynamis.exprtree.expressions.Node;
import org.dynamis.exprtree.expressions.NodeFactory;
import org.dynamis.exprtree.expressions.VariableNode;
import org.dynamis.exprtree.reduce.CompoundAssignmentReducer;
import org.openjdk.jmh.annotations.*;

/**
 * Measures reducing compound assignments into plain operations, one per target shape.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Fork(value = 2, jvmArgsAppend = {
        "-Dexprtree.reducer.tempPrefix=$"
})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class ReductionCostBenchmark {

    @State(Scope.Thread)
    public static class ReductionState {

        final NodeFactory factory = NodeFactory.create();
        final CompoundAssignmentReducer reducer = new CompoundAssignmentReducer(factory, TreeSettings.fromSystemProperties());
        BinaryNode variableTarget;
        BinaryNode memberTarget;
        BinaryNode indexTarget;

        @Setup(Level.Trial)
        public void init() {
            VariableNode counter = factory.variable(int.class, "counter");
            variableTarget = factory.addAssign(counter, factory.constant(1));

            VariableNode faction = factory.variable(FactionState.class, "faction");
            memberTarget = factory.addAssign(factory.property(faction, "treasury"),
                                             factory.constant(new Credits(100)));

            indexTarget = factory.addAssign(factory.index(faction, factory.constant(2)),
                                            factory.constant(new Credits(5)));
        }
    }

    @Benchmark
    public Node reduceVariable(ReductionState state) {
        return state.reducer.reduce(state.variableTarget);
    }

    @Benchmark
    public Node reduceMember(ReductionState state) {
        return state.reducer.reduce(state.memberTarget);
    }

    @Benchmark
    public Node reduceIndexer(ReductionState state) {
        return state.reducer.reduce(state.indexTarget);
    }
}
