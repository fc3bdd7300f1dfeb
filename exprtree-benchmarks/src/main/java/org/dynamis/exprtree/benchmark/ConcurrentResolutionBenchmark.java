package org.dynamis.exprtree.benchmark;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.dynamis.exprtree.benchmark.domain.Credits;
import org.dynamis.exprtree.expressions.BinaryOperatorKind;
import org.dynamis.exprtree.resolve.OperatorResolver;
import org.dynamis.exprtree.resolve.ResolvedOperator;
import org.dynamis.exprtree.types.ReflectionTypeIntrospector;
import org.openjdk.jmh.annotations.*;

/**
 * Two threads resolving different user-defined operators simultaneously against the
 * shared parameter cache. Gives a contention baseline for its single lock.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Fork(value = 2, jvmArgsAppend = {
        "-Dexprtree.parameterCache.capacity=0"
})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(2)
public class ConcurrentResolutionBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        final BinaryOperatorKind[] kinds = {
                BinaryOperatorKind.ADD,
                BinaryOperatorKind.LESS_THAN
        };

        final OperatorResolver resolver = new OperatorResolver(ReflectionTypeIntrospector.instance());
    }

    @State(Scope.Thread)
    public static class ThreadState {

        private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);
        int threadIndex;

        @Setup(Level.Trial)
        public void init() {
            threadIndex = THREAD_COUNTER.getAndIncrement() % 2;
        }
    }

    @Benchmark
    public ResolvedOperator concurrentResolveDifferentOperators(SharedState shared, ThreadState local) {
        return shared.resolver.resolve(shared.kinds[local.threadIndex],
                                       Credits.class, Credits.class, null, false, false);
    }
}
