package com.purchasingpower.testgen.service.fixture;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scans C/C++ sources for {@code class <Suite> : public ::testing::Test { ... };}.
 *
 * <p>Files are visited in path order; the first match wins. Unreadable files are skipped.
 */
@Slf4j
@Component
public class RegexFixtureFinder implements FixtureFinder {

    private static final List<String> EXTENSIONS = List.of(".h", ".hpp", ".cpp", ".cc");

    @Override
    public Optional<String> findFixtureDefinition(String suiteName, Path searchRoot) {
        if (suiteName == null || searchRoot == null || !Files.isDirectory(searchRoot)) {
            return Optional.empty();
        }
        Pattern pattern = Pattern.compile("class\\s+" + Pattern.quote(suiteName)
                + "\\s*:\\s*public\\s+::testing::Test\\s*\\{[\\s\\S]*?};");

        for (Path file : candidateFiles(searchRoot)) {
            Optional<String> match = search(file, pattern);
            if (match.isPresent()) {
                log.info("Found fixture '{}' in {}", suiteName, file);
                return match;
            }
        }
        return Optional.empty();
    }

    private List<Path> candidateFiles(Path root) {
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile)
                    .filter(this::hasSourceExtension)
                    .sorted(Comparator.naturalOrder())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan unit test directory " + root, e);
        }
    }

    private Optional<String> search(Path file, Pattern pattern) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException | UncheckedIOException e) {
            log.debug("Skipping unreadable file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(content);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    private boolean hasSourceExtension(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(name::endsWith);
    }
}
