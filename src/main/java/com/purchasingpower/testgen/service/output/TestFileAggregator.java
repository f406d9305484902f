package com.purchasingpower.testgen.service.output;

import com.google.common.util.concurrent.Striped;
import com.purchasingpower.testgen.exception.TestMergeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.locks.Lock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Merges generated test fragments into one test file per source file.
 *
 * <p>A fragment is split into include directives, the {@code main} block
 * and everything else (the test bodies). Merged output is the sorted union of
 * includes, then the existing bodies followed by the new ones, then the main
 * block: the existing file's if it has one, otherwise the fragment's. Include
 * lines and {@code main} are only recognized outside comments and literals, and
 * {@code main} is delimited by brace matching.
 *
 * <p>A fragment for a file that does not exist yet is written verbatim. When
 * merging, a fragment or existing file with unbalanced braces is rejected with
 * {@link TestMergeException} and the file is left as it was. Writes to the same
 * path are serialized; different paths proceed in parallel.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class TestFileAggregator {

    private static final Pattern INCLUDE_LINE = Pattern.compile(
            "(?m)^[ \\t]*(#include\\s*[<\"][^>\"\\r\\n]*[>\"])[ \\t]*\\r?\\n?");
    private static final Pattern MAIN_HEADER = Pattern.compile("\\bint\\s+main\\s*\\([^)]*\\)\\s*\\{");

    private final Striped<Lock> pathLocks = Striped.lock(64);

    public void aggregate(Path targetPath, String newFragment) throws IOException {
        Path key = targetPath.toAbsolutePath().normalize();
        Lock lock = pathLocks.get(key);
        lock.lock();
        try {
            if (!Files.exists(key)) {
                if (key.getParent() != null) {
                    Files.createDirectories(key.getParent());
                }
                Files.writeString(key, newFragment, StandardCharsets.UTF_8);
                log.debug("Created aggregate test file {}", key);
                return;
            }

            String existing = Files.readString(key, StandardCharsets.UTF_8);
            checkBalanced(key, existing, "existing file");
            checkBalanced(key, newFragment, "generated fragment");
            Files.writeString(key, merge(key, existing, newFragment), StandardCharsets.UTF_8);
            log.debug("Merged fragment into {}", key);
        } finally {
            lock.unlock();
        }
    }

    String merge(Path targetFile, String existingContent, String newContent) {
        Parts existing = Parts.of(targetFile, existingContent);
        Parts added = Parts.of(targetFile, newContent);

        TreeSet<String> includes = new TreeSet<>(existing.includes);
        includes.addAll(added.includes);

        StringBuilder content = new StringBuilder(String.join("\n", includes)).append("\n\n");
        content.append(existing.body);
        if (!added.body.isEmpty()) {
            content.append("\n\n").append(added.body);
        }

        String main = existing.mainBlock != null ? existing.mainBlock : added.mainBlock;
        if (main != null) {
            content.append("\n\n").append(main);
        }
        return content.toString().strip() + "\n";
    }

    /**
     * Braces must balance once comments and string/char literals are removed.
     */
    static void checkBalanced(Path targetFile, String source, String what) {
        String code = stripCommentsAndLiterals(source);
        int depth = 0;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth < 0) {
                    throw new TestMergeException(targetFile,
                            "Unbalanced braces in " + what + ": unexpected '}'");
                }
            }
        }
        if (depth != 0) {
            throw new TestMergeException(targetFile,
                    "Unbalanced braces in " + what + ": " + depth + " unclosed '{'");
        }
    }

    static String stripCommentsAndLiterals(String source) {
        boolean[] code = codeMask(source);
        StringBuilder out = new StringBuilder(source.length());
        for (int i = 0; i < source.length(); i++) {
            if (code[i]) {
                out.append(source.charAt(i));
            }
        }
        return out.toString();
    }

    /**
     * Marks the characters that are code, i.e. not inside a comment or a string/char literal.
     */
    static boolean[] codeMask(String source) {
        int n = source.length();
        boolean[] code = new boolean[n];
        int i = 0;
        while (i < n) {
            char c = source.charAt(i);
            char next = i + 1 < n ? source.charAt(i + 1) : '\0';
            if (c == '/' && next == '/') {
                while (i < n && source.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '/' && next == '*') {
                int end = source.indexOf("*/", i + 2);
                i = end < 0 ? n : end + 2;
            } else if (c == '"' || c == '\'') {
                i = Math.min(skipLiteral(source, i, c), n);
            } else {
                code[i] = true;
                i++;
            }
        }
        return code;
    }

    /**
     * Start (inclusive) and end (exclusive) of the first {@code main} definition, or null when there is none.
     */
    static int[] findMain(Path targetFile, String source, boolean[] code) {
        Matcher header = MAIN_HEADER.matcher(source);
        while (header.find()) {
            if (!code[header.start()]) {
                continue;
            }
            int depth = 0;
            for (int i = header.end() - 1; i < source.length(); i++) {
                if (!code[i]) {
                    continue;
                }
                char c = source.charAt(i);
                if (c == '{') {
                    depth++;
                } else if (c == '}' && --depth == 0) {
                    return new int[] {header.start(), i + 1};
                }
            }
            throw new TestMergeException(targetFile, "Cannot find the closing brace of main()");
        }
        return null;
    }

    private static int skipLiteral(String source, int start, char quote) {
        int i = start + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote || c == '\n') {
                return i + 1;
            } else {
                i++;
            }
        }
        return i;
    }

    private static final class Parts {
        private final List<String> includes;
        private final String body;
        private final String mainBlock;

        private Parts(List<String> includes, String body, String mainBlock) {
            this.includes = includes;
            this.body = body;
            this.mainBlock = mainBlock;
        }

        static Parts of(Path targetFile, String content) {
            String mainBlock = null;
            String body = content;
            int[] main = findMain(targetFile, content, codeMask(content));
            if (main != null) {
                mainBlock = content.substring(main[0], main[1]);
                body = content.substring(0, main[0]) + content.substring(main[1]);
            }

            boolean[] code = codeMask(body);
            List<String> includes = new ArrayList<>();
            StringBuilder rest = new StringBuilder(body.length());
            int last = 0;
            Matcher includeMatcher = INCLUDE_LINE.matcher(body);
            while (includeMatcher.find()) {
                if (!code[includeMatcher.start(1)]) {
                    continue;
                }
                includes.add(includeMatcher.group(1));
                rest.append(body, last, includeMatcher.start());
                last = includeMatcher.end();
            }
            rest.append(body, last, body.length());
            return new Parts(includes, rest.toString().strip(), mainBlock);
        }
    }
}
