package dev.tmgrammar.cli;

import dev.tmgrammar.engine.MachineCompiler;
import dev.tmgrammar.exception.TmGrammarException;
import dev.tmgrammar.io.*;
import dev.tmgrammar.model.CompileOptions;
import dev.tmgrammar.model.Grammar;
import dev.tmgrammar.model.GrammarFormat;
import dev.tmgrammar.model.MachineDescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI entry point: compile a machine description into a grammar file.
 */
@Command(
    name = "tm-grammar",
    mixinStandardHelpOptions = true,
    version = "tm-grammar 0.1.0",
    description = "Compile Turing machines to Tracery grammars."
)
public class TmGrammarCli implements Callable<Integer> {

    public static final String OUTPUT_SUFFIX = ".tracery.json";

    static final int EXIT_INVALID = 1;
    static final int EXIT_IO = 2;

    private static final Logger log = LoggerFactory.getLogger(TmGrammarCli.class);

    @Parameters(index = "0", description = "The Turing machine to compile (JSON)")
    private Path machine;

    @Option(names = {"--input", "-i"}, description = "Input tape file for the machine (default: empty tape)")
    private Path input;

    @Option(names = {"--output", "-o"}, description = "Output file (default: <machine>" + OUTPUT_SUFFIX + ")")
    private Path output;

    @Option(names = {"--template", "-t"}, description = "Base grammar template (default: bundled template)")
    private Path template;

    @Option(names = "--format", description = "Grammar format overrides (JSON)")
    private Path format;

    @Option(names = "--verbose", description = "Add step tracing text to the compiled grammar")
    private boolean verbose;

    @Option(names = "--lenient", description = "Allow transition tables that do not cover every state and symbol")
    private boolean lenient;

    @Override
    public Integer call() {
        try {
            GrammarFormat grammarFormat = format != null
                ? GrammarFormatLoader.loadFromFile(format) : GrammarFormat.defaults();
            MachineDescription description = MachineLoader.loadFromFile(machine);
            Grammar base = template != null
                ? TemplateLoader.loadFromFile(template) : TemplateLoader.loadDefault();
            String tape = input != null ? TapeLoader.loadFromFile(input) : "";

            Grammar grammar = new MachineCompiler(grammarFormat)
                .compile(description, base, tape, new CompileOptions(verbose, lenient));

            Path outFile = output != null ? output : defaultOutput(machine);
            GrammarWriter.writeToFile(grammar, outFile);
            log.info("Wrote {} rules to {}", grammar.size(), outFile);
            return 0;
        } catch (TmGrammarException e) {
            log.error("Cannot compile {}:", machine);
            e.getErrors().forEach(error -> log.error("  {}", error));
            return EXIT_INVALID;
        } catch (IOException e) {
            log.error("I/O error: {}", e.getMessage());
            return EXIT_IO;
        }
    }

    static Path defaultOutput(Path machine) {
        return Path.of(machine.toString() + OUTPUT_SUFFIX);
    }
}
