package dev.tmgrammar.engine;

import dev.tmgrammar.exception.InputTapeException;
import dev.tmgrammar.exception.MachineValidationException;
import dev.tmgrammar.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Checks a machine description before compilation and turns it into a {@link Machine}.
 */
public final class MachineValidator {

    private static final Logger log = LoggerFactory.getLogger(MachineValidator.class);

    private MachineValidator() {}

    /**
     * Validate a machine description. Returns an empty list if valid,
     * or a list of error messages if invalid.
     *
     * @param lenient when true, (state, symbol) pairs without a transition are allowed
     */
    public static List<String> check(MachineDescription description, GrammarFormat format, boolean lenient) {
        var errors = new ArrayList<String>();
        var rules = new IdentifierRules(format);

        Set<String> states = new LinkedHashSet<>();
        for (String state : description.states()) {
            if (!states.add(state)) {
                errors.add("duplicate state \"%s\"".formatted(state));
            }
            if (state.isEmpty()) {
                errors.add("state name is empty");
            } else if (!rules.isValidStateName(state)) {
                errors.add("state name \"%s\" contains reserved character".formatted(state));
            }
        }

        Set<String> symbols = new LinkedHashSet<>();
        for (String symbol : description.symbols()) {
            if (!symbols.add(symbol)) {
                errors.add("duplicate symbol \"%s\"".formatted(symbol));
            }
            if (!rules.isSingleCharacter(symbol)) {
                errors.add("symbol \"%s\" must be a single character".formatted(symbol));
            } else if (rules.containsReserved(symbol)) {
                errors.add("symbol \"%s\" is reserved".formatted(symbol));
            }
        }

        String blank = description.blankSymbol();
        if (!rules.isSingleCharacter(blank)) {
            errors.add("blank symbol \"%s\" must be a single symbol".formatted(blank));
        }
        if (!symbols.contains(blank)) {
            errors.add("blank symbol \"%s\" not in symbols".formatted(blank));
        }

        if (!states.contains(description.startState())) {
            errors.add("start state \"%s\" not in states".formatted(description.startState()));
        }
        if (!states.contains(description.acceptState())) {
            errors.add("accept state \"%s\" not in states".formatted(description.acceptState()));
        }
        if (!states.contains(description.rejectState())) {
            errors.add("reject state \"%s\" not in states".formatted(description.rejectState()));
        }

        Set<StateSymbol> seen = new HashSet<>();
        for (TransitionEntry entry : description.transitions()) {
            String where = "transition (%s, %s)".formatted(entry.state(), entry.symbol());

            if (!seen.add(entry.key())) {
                errors.add(where + " is defined more than once");
            }
            if (!states.contains(entry.state())) {
                errors.add(where + " starts in nonexistent state \"%s\"".formatted(entry.state()));
            }
            if (!symbols.contains(entry.symbol())) {
                errors.add(where + " requires nonexistent symbol \"%s\"".formatted(entry.symbol()));
            }
            if (entry.state().equals(description.acceptState())) {
                errors.add(where + " starts in accepting state \"%s\"".formatted(entry.state()));
            }
            if (entry.state().equals(description.rejectState())) {
                errors.add(where + " starts in rejecting state \"%s\"".formatted(entry.state()));
            }
            if (!states.contains(entry.targetState())) {
                errors.add(where + " goes to nonexistent state \"%s\"".formatted(entry.targetState()));
            }
            if (!symbols.contains(entry.writeSymbol())) {
                errors.add(where + " writes nonexistent symbol \"%s\"".formatted(entry.writeSymbol()));
            }
            if (format.directionOf(entry.directionCode()).isEmpty()) {
                errors.add(where + " goes in invalid direction \"%s\"".formatted(entry.directionCode()));
            }
        }

        if (!lenient) {
            for (String state : states) {
                if (state.equals(description.acceptState()) || state.equals(description.rejectState())) {
                    continue;
                }
                for (String symbol : symbols) {
                    if (!seen.contains(new StateSymbol(state, symbol))) {
                        errors.add("no transition for state \"%s\" on symbol \"%s\"".formatted(state, symbol));
                    }
                }
            }
        }

        return errors;
    }

    /**
     * Validate a machine description and build the machine.
     *
     * @throws MachineValidationException with every violation found
     */
    public static Machine validate(MachineDescription description, GrammarFormat format, boolean lenient) {
        List<String> errors = check(description, format, lenient);
        if (!errors.isEmpty()) {
            throw new MachineValidationException(errors);
        }
        if (description.acceptState().equals(description.rejectState())) {
            log.warn("Accept and reject state are the same state \"{}\"", description.acceptState());
        }

        Map<StateSymbol, Action> transitions = new LinkedHashMap<>();
        for (TransitionEntry entry : description.transitions()) {
            Direction direction = format.directionOf(entry.directionCode()).orElseThrow();
            transitions.put(entry.key(), new Action(entry.targetState(), entry.writeSymbol(), direction));
        }

        return new Machine(
            new LinkedHashSet<>(description.states()),
            new LinkedHashSet<>(description.symbols()),
            description.blankSymbol(),
            description.startState(),
            description.acceptState(),
            description.rejectState(),
            transitions
        );
    }

    /**
     * Check that every character of the input tape is one of the machine's symbols.
     *
     * @throws InputTapeException listing every offending character with its position
     */
    public static void checkInput(Machine machine, String input) {
        var errors = new ArrayList<String>();
        int position = 0;
        for (int i = 0; i < input.length(); ) {
            int codePoint = input.codePointAt(i);
            String symbol = new String(Character.toChars(codePoint));
            if (!machine.symbols().contains(symbol)) {
                errors.add("input symbol \"%s\" at position %d not in symbols".formatted(symbol, position));
            }
            i += Character.charCount(codePoint);
            position++;
        }
        if (!errors.isEmpty()) {
            throw new InputTapeException(errors);
        }
    }
}
