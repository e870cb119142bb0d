package dev.tmgrammar;

import dev.tmgrammar.cli.TmGrammarCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new TmGrammarCli()).execute(args);
        System.exit(exitCode);
    }
}
