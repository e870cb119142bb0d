package dev.tmgrammar.engine;

import dev.tmgrammar.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Turns the transition table of a machine into one rewrite rule per live
 * (state, symbol) pair.
 */
public final class TransitionCompiler {

    private static final Logger log = LoggerFactory.getLogger(TransitionCompiler.class);

    private final GrammarFormat format;

    public TransitionCompiler(GrammarFormat format) {
        this.format = format;
    }

    /**
     * Name of the rule handling {@code key}: marker, state, marker, symbol.
     * Validated identifiers never contain the marker, so the name is unique per key.
     */
    public String ruleName(StateSymbol key) {
        String marker = format.escapeMarker();
        return marker + key.state() + marker + key.symbol();
    }

    /**
     * Rule body for an action: set the state, replace the symbol under the head,
     * record the direction, and re-arm the step loop unless the target state halts.
     */
    public String compileAction(Action action, Machine machine) {
        var sb = new StringBuilder();
        sb.append(format.push(format.stateKey(), action.state()));
        sb.append(format.push(format.tapeKey(), format.popKeyword()));
        sb.append(format.push(format.tapeKey(), action.symbol()));
        sb.append(format.push(format.directionKey(), format.codeOf(action.direction())));
        if (!machine.isHalting(action.state())) {
            sb.append(format.push(format.continuationKey(), format.reference(format.activationKey())));
        }
        return sb.toString();
    }

    /**
     * Compile every live (state, symbol) pair, states in declaration order,
     * symbols in alphabet order. Pairs without a transition are skipped.
     */
    public Grammar compile(Machine machine) {
        var rules = new Grammar();
        for (String state : machine.liveStates()) {
            for (String symbol : machine.symbols()) {
                var key = new StateSymbol(state, symbol);
                Optional<Action> action = machine.transition(key);
                if (action.isEmpty()) {
                    log.warn("No transition for state \"{}\" on symbol \"{}\"; rule {} left undefined",
                        state, symbol, ruleName(key));
                    continue;
                }
                String body = compileAction(action.get(), machine);
                log.debug("Compiled {} -> {}", ruleName(key), body);
                rules.put(ruleName(key), body);
            }
        }
        return rules;
    }
}
