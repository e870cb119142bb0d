package dev.tmgrammar.model;

/**
 * Lookup key of the transition function: the current state and the symbol under the head.
 */
public record StateSymbol(String state, String symbol) {}
