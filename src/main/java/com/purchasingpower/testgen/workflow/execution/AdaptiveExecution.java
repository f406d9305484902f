package com.purchasingpower.testgen.workflow.execution;

import com.google.common.base.Preconditions;
import com.purchasingpower.testgen.model.generation.GenerationResult;
import com.purchasingpower.testgen.model.generation.GenerationTask;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.IntFunction;

/**
 * Concurrent execution whose pool size follows the backend's success rate.
 *
 * <p>Up to 5 tasks run sequentially. Larger batches run concurrently with the
 * current worker count, which is then adjusted for the next batch: one fewer
 * below 50% success, one more above 80%, bounded by {@code minWorkers} and
 * {@code maxWorkers}. The count never changes during a batch.
 */
@Slf4j
public class AdaptiveExecution implements ExecutionStrategy {

    static final int SEQUENTIAL_THRESHOLD = 5;
    static final double LOW_SUCCESS_RATE = 0.5;
    static final double HIGH_SUCCESS_RATE = 0.8;

    private final int minWorkers;
    private final int maxWorkers;
    private final SequentialExecution sequential;
    private final IntFunction<ExecutionStrategy> concurrentFactory;

    private int currentWorkers;

    public AdaptiveExecution(int minWorkers, int maxWorkers, int initialWorkers, SequentialExecution sequential) {
        this(minWorkers, maxWorkers, initialWorkers, sequential, ConcurrentExecution::new);
    }

    AdaptiveExecution(int minWorkers, int maxWorkers, int initialWorkers, SequentialExecution sequential,
                      IntFunction<ExecutionStrategy> concurrentFactory) {
        Preconditions.checkArgument(minWorkers >= 1 && minWorkers <= maxWorkers,
                "Invalid worker bounds: min=%s, max=%s", minWorkers, maxWorkers);
        this.minWorkers = minWorkers;
        this.maxWorkers = maxWorkers;
        this.currentWorkers = Math.max(minWorkers, Math.min(maxWorkers, initialWorkers));
        this.sequential = sequential;
        this.concurrentFactory = concurrentFactory;
    }

    @Override
    public List<GenerationResult> execute(List<GenerationTask> tasks, TaskProcessor processor) {
        if (tasks.size() <= SEQUENTIAL_THRESHOLD) {
            log.info("Adaptive: {} tasks, running sequentially", tasks.size());
            return sequential.execute(tasks, processor);
        }

        int workers = getCurrentWorkers();
        log.info("Adaptive: {} tasks with {} workers", tasks.size(), workers);
        List<GenerationResult> results = concurrentFactory.apply(workers).execute(tasks, processor);

        long successful = results.stream().filter(GenerationResult::isSuccess).count();
        adjustWorkers((double) successful / results.size());
        return results;
    }

    private synchronized void adjustWorkers(double successRate) {
        int previous = currentWorkers;
        if (successRate < LOW_SUCCESS_RATE) {
            currentWorkers = Math.max(minWorkers, currentWorkers - 1);
        } else if (successRate > HIGH_SUCCESS_RATE) {
            currentWorkers = Math.min(maxWorkers, currentWorkers + 1);
        }
        if (previous != currentWorkers) {
            log.info("Adaptive: success rate {}%, workers {} -> {}",
                    Math.round(successRate * 100), previous, currentWorkers);
        }
    }

    public synchronized int getCurrentWorkers() {
        return currentWorkers;
    }

    @Override
    public String getName() {
        return "adaptive";
    }
}
