package com.purchasingpower.testgen.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Context compression settings.
 *
 * <p>Properties are loaded from the {@code app.compression} namespace:
 * <pre>
 * app:
 *   compression:
 *     enabled: true
 *     level: 1
 *     base-prompt-tokens: 600
 * </pre>
 *
 * <p>{@code level} picks the initial selection limits (0 keeps the most,
 * 2 the least) and is clamped to [0, 2]. The progressive trimming applied
 * when a context is over budget does not depend on it.
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "app.compression")
@Data
public class CompressionProperties {

    public static final int MIN_LEVEL = 0;
    public static final int MAX_LEVEL = 2;

    private boolean enabled = true;

    private int level = 1;

    /**
     * Tokens consumed by the fixed parts of the prompt template.
     * Subtracted from the model budget before sizing the context.
     */
    private int basePromptTokens = 600;

    public int getEffectiveLevel() {
        return Math.max(MIN_LEVEL, Math.min(MAX_LEVEL, level));
    }
}
