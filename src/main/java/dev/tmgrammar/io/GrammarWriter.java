package dev.tmgrammar.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import dev.tmgrammar.model.Grammar;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes compiled grammars as tab-indented JSON, rules in grammar order.
 */
public final class GrammarWriter {

    private static final ObjectWriter WRITER = new ObjectMapper().writer(
        new DefaultPrettyPrinter().withObjectIndenter(new DefaultIndenter("\t", "\n")));

    private GrammarWriter() {}

    public static void writeToFile(Grammar grammar, Path path) throws IOException {
        WRITER.writeValue(path.toFile(), grammar.asMap());
    }

    public static String writeToString(Grammar grammar) throws JsonProcessingException {
        return WRITER.writeValueAsString(grammar.asMap());
    }
}
