package dev.tmgrammar.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lexical conventions of the target grammar: reserved characters, the escape
 * marker used in compiled rule names, direction codes and the names of the
 * rules and state keys the compiled grammar talks to.
 */
public record GrammarFormat(
    String reservedCharacters,
    String escapeMarker,
    Map<Direction, String> directionCodes,
    String stateKey,
    String tapeKey,
    String tapePrefix,
    String directionKey,
    String popKeyword,
    String continuationKey,
    String activationKey,
    String activationMarker,
    String dispatcherKey,
    String initTapeKey,
    String initStateKey,
    String blankKey,
    String leftPaddingPrefix,
    String rightPaddingPrefix
) {
    // Tracery, JSON and bot-host special characters.
    public static final String DEFAULT_RESERVED_CHARACTERS = "[],{}#\"*\n \t\r";
    public static final String DEFAULT_ESCAPE_MARKER = "*";

    public GrammarFormat {
        var codes = new EnumMap<Direction, String>(Direction.class);
        codes.putAll(directionCodes);
        for (Direction direction : Direction.values()) {
            if (!codes.containsKey(direction)) {
                throw new IllegalArgumentException("No code for direction " + direction);
            }
        }
        if (codes.values().stream().distinct().count() != codes.size()) {
            throw new IllegalArgumentException("Direction codes must be distinct: " + codes);
        }
        if (escapeMarker.codePointCount(0, escapeMarker.length()) != 1) {
            throw new IllegalArgumentException("Escape marker must be a single character: \"" + escapeMarker + "\"");
        }
        directionCodes = Collections.unmodifiableMap(codes);
    }

    public static GrammarFormat defaults() {
        var codes = new EnumMap<Direction, String>(Direction.class);
        codes.put(Direction.RIGHT, ">");
        codes.put(Direction.LEFT, "<");
        codes.put(Direction.STAY, "_");
        return new GrammarFormat(
            DEFAULT_RESERVED_CHARACTERS, DEFAULT_ESCAPE_MARKER, codes,
            "state", "tape_right", "tape", "direction", "POP",
            "run_next", "activate_next", "activate", "run",
            "init_tape", "init_state", "blank",
            "padder_left", "padder_right"
        );
    }

    /**
     * True if the code point may not appear in an identifier: listed as reserved,
     * equal to the escape marker, or whitespace.
     */
    public boolean isReserved(int codePoint) {
        return reservedCharacters.indexOf(codePoint) >= 0
            || escapeMarker.codePointAt(0) == codePoint
            || Character.isWhitespace(codePoint);
    }

    public String codeOf(Direction direction) {
        return directionCodes.get(direction);
    }

    public Optional<Direction> directionOf(String code) {
        for (var entry : directionCodes.entrySet()) {
            if (entry.getValue().equals(code)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    /** Modifier that pushes {@code value} onto the engine's stack for {@code key}. */
    public String push(String key, String value) {
        return "[" + key + ":" + value + "]";
    }

    /** Expansion of the rule named {@code key}. */
    public String reference(String key) {
        return "#" + key + "#";
    }
}
