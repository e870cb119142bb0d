package dev.tmgrammar.model;

/**
 * Switches for a compilation run.
 *
 * @param verbose prefix rules with trace annotations naming the rule and the current step
 * @param lenient accept machines whose transition table does not cover every live
 *                (state, symbol) pair; the missing rules fail only inside the grammar engine
 */
public record CompileOptions(boolean verbose, boolean lenient) {

    public static CompileOptions defaults() {
        return new CompileOptions(false, false);
    }
}
