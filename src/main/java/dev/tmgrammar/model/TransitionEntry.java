package dev.tmgrammar.model;

/**
 * One unvalidated row of a machine description's transition table.
 * The direction is still the raw external code.
 */
public record TransitionEntry(
    String state,
    String symbol,
    String targetState,
    String writeSymbol,
    String directionCode
) {
    public StateSymbol key() {
        return new StateSymbol(state, symbol);
    }
}
