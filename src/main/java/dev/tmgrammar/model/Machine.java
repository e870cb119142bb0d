package dev.tmgrammar.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A validated deterministic Turing machine. Instances are produced by
 * {@code MachineValidator} and never change afterwards; sets and the transition
 * table keep the order of the description.
 */
public record Machine(
    Set<String> states,
    Set<String> symbols,
    String blankSymbol,
    String startState,
    String acceptState,
    String rejectState,
    Map<StateSymbol, Action> transitions
) {
    public Machine {
        states = Collections.unmodifiableSet(new LinkedHashSet<>(states));
        symbols = Collections.unmodifiableSet(new LinkedHashSet<>(symbols));
        transitions = Collections.unmodifiableMap(new LinkedHashMap<>(transitions));
    }

    /** True for the accept and reject states, where the machine stops. */
    public boolean isHalting(String state) {
        return state.equals(acceptState) || state.equals(rejectState);
    }

    /** States with outgoing transitions, in declaration order. */
    public List<String> liveStates() {
        var live = new ArrayList<String>();
        for (String state : states) {
            if (!isHalting(state)) {
                live.add(state);
            }
        }
        return live;
    }

    public Optional<Action> transition(StateSymbol key) {
        return Optional.ofNullable(transitions.get(key));
    }
}
