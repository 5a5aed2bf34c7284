package com.autofix.orchestrator.agent;

import com.autofix.orchestrator.config.AutofixProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads stage prompt templates and fills in their {@code ${NAME}} placeholders.
 *
 * A template in the configured prompts directory wins; otherwise the default
 * bundled under {@code prompts/} on the classpath is used. Substitution is a
 * literal string replacement: placeholders without a value stay as they are.
 */
@Component
public class PromptTemplates {

    private static final Logger log = LoggerFactory.getLogger(PromptTemplates.class);

    private static final String CLASSPATH_DIR = "prompts/";

    private final Path overrideDir;

    @Autowired
    public PromptTemplates(AutofixProperties properties) {
        this(properties.promptsDir());
    }

    PromptTemplates(Path overrideDir) {
        this.overrideDir = overrideDir;
    }

    /** Load {@code <name>.md} and apply {@code values}. */
    public String render(String name, Map<String, String> values) {
        return substitute(load(name), values);
    }

    /** Raw template text. */
    public String load(String name) {
        String fileName = name + ".md";
        if (overrideDir != null) {
            Path override = overrideDir.resolve(fileName);
            if (Files.isRegularFile(override)) {
                try {
                    return Files.readString(override, StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new UncheckedIOException("Could not read prompt template " + override, e);
                }
            }
        }
        try (InputStream in = PromptTemplates.class.getClassLoader()
                .getResourceAsStream(CLASSPATH_DIR + fileName)) {
            if (in == null) {
                throw new IllegalArgumentException("No prompt template named '" + name + "'");
            }
            log.debug("Using bundled prompt template {}", fileName);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read bundled prompt template " + fileName, e);
        }
    }

    /** Replace every {@code ${KEY}} with its value. */
    public static String substitute(String template, Map<String, String> values) {
        String result = template;
        for (Map.Entry<String, String> e : values.entrySet()) {
            result = result.replace("${" + e.getKey() + "}", e.getValue() == null ? "" : e.getValue());
        }
        return result;
    }
}
