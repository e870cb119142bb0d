package dev.tmgrammar.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.tmgrammar.exception.TemplateException;
import dev.tmgrammar.model.Grammar;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Loads base grammar templates: JSON objects mapping rule names to rule bodies.
 */
public final class TemplateLoader {

    public static final String DEFAULT_TEMPLATE = "/templates/base-grammar.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TemplateLoader() {}

    public static Grammar loadFromFile(Path path) throws IOException {
        return parseTemplate(MAPPER.readTree(path.toFile()));
    }

    public static Grammar loadFromString(String json) throws IOException {
        return parseTemplate(MAPPER.readTree(json));
    }

    /**
     * Load the template bundled with the tool.
     */
    public static Grammar loadDefault() throws IOException {
        try (InputStream in = TemplateLoader.class.getResourceAsStream(DEFAULT_TEMPLATE)) {
            if (in == null) {
                throw new IOException("Bundled template not found: " + DEFAULT_TEMPLATE);
            }
            return parseTemplate(MAPPER.readTree(in));
        }
    }

    private static Grammar parseTemplate(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new TemplateException("template must be a JSON object");
        }
        var grammar = new Grammar();
        for (var entry : root.properties()) {
            if (!entry.getValue().isTextual()) {
                throw new TemplateException("template rule \"%s\" must be a string".formatted(entry.getKey()));
            }
            grammar.put(entry.getKey(), entry.getValue().asText());
        }
        return grammar;
    }
}
