package dev.tmgrammar.exception;

import java.util.List;

/**
 * The input tape contains characters outside the machine's alphabet.
 */
public class InputTapeException extends TmGrammarException {

    private static final long serialVersionUID = 1L;

    public InputTapeException(List<String> errors) {
        super(errors);
    }
}
