package com.purchasingpower.testgen.workflow.execution;

import com.google.common.base.Preconditions;
import com.purchasingpower.testgen.model.generation.GenerationResult;
import com.purchasingpower.testgen.model.generation.GenerationTask;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Runs tasks on a bounded pool of {@code maxWorkers} threads.
 *
 * <p>Results complete in any order and are sorted back by task index before
 * returning. A pool is created per call and shut down afterwards.
 */
@Slf4j
public class ConcurrentExecution implements ExecutionStrategy {

    @Getter
    private final int maxWorkers;

    public ConcurrentExecution(int maxWorkers) {
        Preconditions.checkArgument(maxWorkers >= 1, "maxWorkers must be at least 1, got %s", maxWorkers);
        this.maxWorkers = maxWorkers;
    }

    @Override
    public List<GenerationResult> execute(List<GenerationTask> tasks, TaskProcessor processor) {
        checkUniqueIndexes(tasks);
        if (tasks.isEmpty()) {
            return List.of();
        }
        log.info("Running {} tasks with {} workers", tasks.size(), maxWorkers);

        ThreadPoolTaskExecutor executor = newExecutor(Math.min(maxWorkers, tasks.size()));
        try {
            List<CompletableFuture<GenerationResult>> futures = new ArrayList<>(tasks.size());
            for (GenerationTask task : tasks) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    GenerationResult result = ExecutionStrategy.processSafely(task, processor);
                    log.info("{} {} finished", result.isSuccess() ? "✅" : "❌", task.getFunctionName());
                    return result;
                }, executor));
            }

            List<GenerationResult> results = new ArrayList<>(tasks.size());
            for (CompletableFuture<GenerationResult> future : futures) {
                results.add(future.join());
            }
            results.sort(Comparator.comparingInt(r -> r.getTask().getIndex()));
            return results;
        } finally {
            executor.shutdown();
        }
    }

    private ThreadPoolTaskExecutor newExecutor(int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("testgen-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    private static void checkUniqueIndexes(List<GenerationTask> tasks) {
        Set<Integer> seen = new HashSet<>();
        List<Integer> duplicates = tasks.stream()
                .map(GenerationTask::getIndex)
                .filter(index -> !seen.add(index))
                .collect(Collectors.toList());
        Preconditions.checkArgument(duplicates.isEmpty(), "Duplicate task indexes: %s", duplicates);
    }

    @Override
    public String getName() {
        return "concurrent";
    }
}
