package com.purchasingpower.testgen.workflow.execution;

import com.purchasingpower.testgen.model.generation.GenerationResult;
import com.purchasingpower.testgen.model.generation.GenerationTask;
import com.purchasingpower.testgen.service.resilience.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * One task at a time, pausing {@code delayBetweenRequests} between tasks (not after the last one).
 */
@Slf4j
public class SequentialExecution implements ExecutionStrategy {

    private final Duration delayBetweenRequests;
    private final Sleeper sleeper;

    public SequentialExecution(Duration delayBetweenRequests, Sleeper sleeper) {
        this.delayBetweenRequests = delayBetweenRequests;
        this.sleeper = sleeper;
    }

    @Override
    public List<GenerationResult> execute(List<GenerationTask> tasks, TaskProcessor processor) {
        log.info("Running {} tasks sequentially", tasks.size());
        List<GenerationResult> results = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            GenerationTask task = tasks.get(i);
            log.info("[{}/{}] {}", i + 1, tasks.size(), task.getFunctionName());
            results.add(ExecutionStrategy.processSafely(task, processor));

            if (i < tasks.size() - 1 && !delayBetweenRequests.isZero()) {
                pause();
            }
        }
        return results;
    }

    private void pause() {
        try {
            sleeper.sleep(delayBetweenRequests);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while pacing requests, continuing without delay");
        }
    }

    @Override
    public String getName() {
        return "sequential";
    }
}
