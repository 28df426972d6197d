package com.purchasingpower.autoreview.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.autoreview.model.prompt.PromptTemplate;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Review prompts kept as YAML under {@code prompts/}, each compiled once into a single Mustache
 * template (system part, blank line, user part) when the application starts.
 * Callers pass the decoupled diff as {@code diff}; templates insert it with {@code {{{diff}}}}
 * so quotes and angle brackets reach the model unescaped.
 */
@Slf4j
@Service
public class PromptLibraryService {

    private static final String PROMPT_LOCATION = "classpath:prompts/*.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        Resource[] resources;
        try {
            resources = new PathMatchingResourcePatternResolver().getResources(PROMPT_LOCATION);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot list prompt files at " + PROMPT_LOCATION, e);
        }
        for (Resource resource : resources) {
            PromptTemplate template = read(resource);
            templates.put(template.getName(), template);
            compiled.put(template.getName(), mustacheFactory.compile(
                    new StringReader(template.getSystemPrompt() + "\n\n" + template.getUserPrompt()),
                    template.getName()));
            log.info("Loaded prompt '{}' v{} from {}", template.getName(), template.getVersion(),
                    resource.getFilename());
        }
        log.info("✅ {} review prompt(s) ready: {}", templates.size(), templates.keySet());
    }

    private PromptTemplate read(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return yamlMapper.readValue(in, PromptTemplate.class);
        } catch (IOException e) {
            log.error("❌ Unreadable prompt file {}", resource.getFilename(), e);
            throw new IllegalStateException("Unreadable prompt file " + resource.getFilename(), e);
        }
    }

    /**
     * @throws IllegalArgumentException when no prompt has that name
     */
    public String render(String templateName, Map<String, Object> variables) {
        Mustache mustache = compiled.get(templateName);
        if (mustache == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }
        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }

    public PromptTemplate getTemplate(String name) {
        return templates.get(name);
    }

    public Set<String> getTemplateNames() {
        return templates.keySet();
    }
}
