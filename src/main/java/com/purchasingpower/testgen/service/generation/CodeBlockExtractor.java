package com.purchasingpower.testgen.service.generation;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls source code out of a model reply.
 */
public final class CodeBlockExtractor {

    private static final Pattern FENCED_BLOCK =
            Pattern.compile("```(?:cpp|c\\+\\+|cc|c|cxx)?[ \\t]*\\r?\\n(.*?)```", Pattern.DOTALL);

    private CodeBlockExtractor() {
    }

    /**
     * Content of the first fenced block, or the trimmed text when there is none.
     */
    public static String extract(String response) {
        if (response == null) {
            return "";
        }
        Matcher matcher = FENCED_BLOCK.matcher(response);
        if (matcher.find()) {
            return matcher.group(1).strip();
        }
        return response.strip();
    }
}
