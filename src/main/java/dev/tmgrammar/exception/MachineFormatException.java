package dev.tmgrammar.exception;

/**
 * A machine or format description does not have the expected JSON shape.
 */
public class MachineFormatException extends TmGrammarException {

    private static final long serialVersionUID = 1L;

    public MachineFormatException(String error) {
        super(error);
    }

    public MachineFormatException(String error, Throwable cause) {
        super(error, cause);
    }
}
