package dev.tmgrammar.model;

import java.util.List;

/**
 * A machine as read from its description, before validation.
 * Lists keep duplicates so that they can be reported.
 */
public record MachineDescription(
    List<String> states,
    List<String> symbols,
    String blankSymbol,
    String startState,
    String acceptState,
    String rejectState,
    List<TransitionEntry> transitions
) {}
