package dev.tmgrammar.engine;

import dev.tmgrammar.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a whole compilation: validate the description, check the input tape,
 * assemble the grammar. Nothing is produced unless every check passes.
 */
public final class MachineCompiler {

    private static final Logger log = LoggerFactory.getLogger(MachineCompiler.class);

    private final GrammarFormat format;
    private final GrammarAssembler assembler;

    public MachineCompiler(GrammarFormat format) {
        this.format = format;
        this.assembler = new GrammarAssembler(format);
    }

    public Grammar compile(MachineDescription description, Grammar template, String input, CompileOptions options) {
        Machine machine = MachineValidator.validate(description, format, options.lenient());
        log.info("Validated machine: {} states, {} symbols, {} transitions",
            machine.states().size(), machine.symbols().size(), machine.transitions().size());

        MachineValidator.checkInput(machine, input);

        return assembler.assemble(machine, template, input, options.verbose());
    }
}
