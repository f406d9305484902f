package com.purchasingpower.testgen.service.context;

/**
 * A dependency with its computed score. Created per compression pass, never persisted.
 *
 * @param payload the analyzer record the score was computed from
 */
public record RankedDependency<T>(
        String name,
        DependencyKind kind,
        ImportanceLevel importance,
        double score,
        T payload
) {
}
