package dev.tmgrammar.exception;

import java.util.List;

/**
 * Base class for failures that abort a compilation run. Holds every problem
 * found, so callers can report them all at once.
 */
public class TmGrammarException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public TmGrammarException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public TmGrammarException(String error) {
        this(List.of(error));
    }

    public TmGrammarException(String error, Throwable cause) {
        super(error, cause);
        this.errors = List.of(error);
    }

    public List<String> getErrors() {
        return errors;
    }
}
