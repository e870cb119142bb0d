package dev.tmgrammar.engine;

import dev.tmgrammar.exception.TemplateException;
import dev.tmgrammar.model.Grammar;
import dev.tmgrammar.model.GrammarFormat;
import dev.tmgrammar.model.Machine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Overlays the tape encoding, padding rules and compiled transitions onto a
 * base template, producing the complete grammar.
 */
public final class GrammarAssembler {

    private static final Logger log = LoggerFactory.getLogger(GrammarAssembler.class);

    private final GrammarFormat format;
    private final TransitionCompiler compiler;

    public GrammarAssembler(GrammarFormat format) {
        this.format = format;
        this.compiler = new TransitionCompiler(format);
    }

    /**
     * Build the grammar for {@code machine} running on {@code input}.
     * The template is not modified; its rules keep their order.
     *
     * @throws TemplateException if the template lacks the dispatcher or activation rule
     */
    public Grammar assemble(Machine machine, Grammar template, String input, boolean verbose) {
        requireRule(template, format.dispatcherKey(), "dispatcher");
        requireRule(template, format.activationKey(), "continuation activation");
        for (String name : template.names()) {
            if (isCompiledRuleName(name)) {
                throw new TemplateException(
                    "template rule \"%s\" starts with the escape marker reserved for transition rules".formatted(name));
            }
        }

        Grammar grammar = template.copy();
        grammar.put(format.initTapeKey(), initialTape(input));
        grammar.put(format.initStateKey(), format.push(format.stateKey(), machine.startState()));
        grammar.put(format.blankKey(), machine.blankSymbol());
        for (String symbol : machine.symbols()) {
            // Empty on purpose: the engine only needs to know the tape may grow here.
            grammar.put(format.leftPaddingPrefix() + symbol, "");
            grammar.put(format.rightPaddingPrefix() + symbol, "");
        }

        Grammar compiled = compiler.compile(machine);
        for (String name : compiled.names()) {
            grammar.put(name, compiled.get(name));
        }
        log.info("Compiled {} transition rules for {} live states", compiled.size(), machine.liveStates().size());

        if (verbose) {
            instrument(grammar);
        }
        return grammar;
    }

    /**
     * Pushes for the input tape, last character first, so that the first
     * character ends up under the head.
     */
    public String initialTape(String input) {
        int[] codePoints = input.codePoints().toArray();
        var sb = new StringBuilder();
        for (int i = codePoints.length - 1; i >= 0; i--) {
            sb.append(format.push(format.tapeKey(), new String(Character.toChars(codePoints[i]))));
        }
        return sb.toString();
    }

    /**
     * Add trace text: the dispatcher announces state and head symbol on every
     * step, and each traced rule echoes its own name.
     */
    void instrument(Grammar grammar) {
        grammar.prepend(format.dispatcherKey(),
            format.reference(format.stateKey()) + format.reference(format.tapeKey()) + " ");
        for (String name : grammar.names()) {
            if (isTraced(name)) {
                grammar.prepend(name, "\n" + format.escapeMarker() + name + format.escapeMarker());
            }
        }
    }

    /**
     * Tape rules and activation rules produce values other rules consume,
     * so they must expand to exactly their content.
     */
    boolean isTraced(String name) {
        if (isCompiledRuleName(name)) {
            return true;
        }
        if (name.contains(format.activationMarker()) || name.startsWith(format.tapePrefix())) {
            return false;
        }
        return !name.equals(format.initTapeKey())
            && !name.equals(format.blankKey())
            && !name.startsWith(format.leftPaddingPrefix())
            && !name.startsWith(format.rightPaddingPrefix());
    }

    private boolean isCompiledRuleName(String name) {
        return name.startsWith(format.escapeMarker());
    }

    private static void requireRule(Grammar template, String name, String role) {
        if (!template.contains(name)) {
            throw new TemplateException("template has no %s rule \"%s\"".formatted(role, name));
        }
    }
}
