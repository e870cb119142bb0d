package dev.tmgrammar.model;

/**
 * Tape head movement. The external single-character codes are defined by
 * {@link GrammarFormat} and only used when reading descriptions and emitting rules.
 */
public enum Direction {
    RIGHT,
    LEFT,
    STAY
}
