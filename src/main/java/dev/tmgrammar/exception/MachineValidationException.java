package dev.tmgrammar.exception;

import java.util.List;

/**
 * A machine description violates one or more structural rules.
 */
public class MachineValidationException extends TmGrammarException {

    private static final long serialVersionUID = 1L;

    public MachineValidationException(List<String> errors) {
        super(errors);
    }
}
