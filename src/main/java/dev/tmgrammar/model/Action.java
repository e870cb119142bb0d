package dev.tmgrammar.model;

/**
 * What the machine does for a given {@link StateSymbol}: move to {@code state},
 * write {@code symbol} under the head, then move the head in {@code direction}.
 */
public record Action(String state, String symbol, Direction direction) {}
