package dev.tmgrammar.engine;

import dev.tmgrammar.model.GrammarFormat;

/**
 * Naming rules for state and symbol identifiers, so they can be embedded in
 * rule names and rule bodies of the given grammar format.
 */
public final class IdentifierRules {

    private final GrammarFormat format;

    public IdentifierRules(GrammarFormat format) {
        this.format = format;
    }

    public boolean containsReserved(String identifier) {
        return identifier.codePoints().anyMatch(format::isReserved);
    }

    public boolean isSingleCharacter(String identifier) {
        return identifier.codePointCount(0, identifier.length()) == 1;
    }

    /** State names: non-empty, no reserved characters. */
    public boolean isValidStateName(String name) {
        return !name.isEmpty() && !containsReserved(name);
    }

    /** Symbols: exactly one character, not reserved. */
    public boolean isValidSymbol(String symbol) {
        return isSingleCharacter(symbol) && !containsReserved(symbol);
    }
}
