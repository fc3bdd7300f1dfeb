package org.dynamis.exprtree.benchmark;

import java.util.concurrent.TimeUnit;

import org.dynamis.exprtree.benchmark.domain.Credits;
import org.dynamis.exprtree.benchmark.domain.FactionState;
import org.dynamis.exprtree.expressions.BinaryNode;
import org.dynamis.exprtree.expressions.NodeFactory;
import org.dynamis.exprtree.expressions.VariableNode;
import org.openjdk.jmh.annotations.*;

/**
 * Measures operator resolution and node construction: built-in, lifted and
 * user-defined operators, and a short-circuit predicate over member reads.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Fork(value = 2, jvmArgsAppend = {
        "-Dexprtree.parameterCache.capacity=0"
})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class NodeConstructionBenchmark {

    @State(Scope.Thread)
    public static class TreeState {

        final NodeFactory factory = NodeFactory.create();
        VariableNode a;
        VariableNode b;
        VariableNode maybeA;
        VariableNode maybeB;
        VariableNode left;
        VariableNode right;
        VariableNode faction;

        @Setup(Level.Trial)
        public void init() {
            a = factory.variable(int.class, "a");
            b = factory.variable(int.class, "b");
            maybeA = factory.variable(Integer.class, "maybeA");
            maybeB = factory.variable(Integer.class, "maybeB");
            left = factory.variable(Credits.class, "left");
            right = factory.variable(Credits.class, "right");
            faction = factory.variable(FactionState.class, "faction");
        }
    }

    @Benchmark
    public BinaryNode builtInAdd(TreeState state) {
        return state.factory.add(state.a, state.b);
    }

    @Benchmark
    public BinaryNode liftedAdd(TreeState state) {
        return state.factory.add(state.maybeA, state.maybeB);
    }

    @Benchmark
    public BinaryNode userDefinedAdd(TreeState state) {
        return state.factory.add(state.left, state.right);
    }

    @Benchmark
    public BinaryNode predicate(TreeState state) {
        NodeFactory f = state.factory;
        return f.andAlso(
                f.greaterThan(f.property(state.faction, "influence"), f.constant(50)),
                f.greaterThan(f.property(state.faction, "stability"), f.constant(30)));
    }
}
