package com.purchasingpower.testgen.service.generation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.testgen.model.prompt.PromptTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt Library Service
 *
 * Loads prompts from {@code classpath:prompts/*.yaml} and renders them with variables.
 *
 * Usage:
 * String prompt = promptLibrary.render("test-generation", Map.of(
 *     "functionName", "add",
 *     "signature", "int add(int a, int b)"
 * ));
 */
@Slf4j
@Service
public class PromptLibraryService {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:prompts/*.yaml");

            for (Resource resource : resources) {
                PromptTemplate template = yamlMapper.readValue(resource.getInputStream(), PromptTemplate.class);
                templates.put(template.getName(), template);
                log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
            }

            log.info("Loaded {} prompt templates", templates.size());

        } catch (IOException e) {
            log.error("Failed to load prompt templates", e);
            throw new IllegalStateException("Prompt library initialization failed", e);
        }
    }

    /**
     * Renders the user prompt of a template.
     */
    public String render(String templateName, Map<String, Object> variables) {
        PromptTemplate template = getRequiredTemplate(templateName);
        Mustache mustache = compiled.computeIfAbsent(templateName,
                name -> mustacheFactory.compile(new StringReader(template.getUserPrompt()), name));

        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }

    /**
     * System prompt for a language, falling back to the template's default.
     */
    public String getSystemPrompt(String templateName, String language) {
        PromptTemplate template = getRequiredTemplate(templateName);
        String key = language == null ? "" : language.toLowerCase(Locale.ROOT);
        String prompt = template.getLanguageSystemPrompts().get(key);
        return (prompt != null ? prompt : template.getSystemPrompt()).trim();
    }

    public PromptTemplate getTemplate(String name) {
        return templates.get(name);
    }

    private PromptTemplate getRequiredTemplate(String templateName) {
        PromptTemplate template = templates.get(templateName);
        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }
        return template;
    }
}
