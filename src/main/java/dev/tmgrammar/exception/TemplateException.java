package dev.tmgrammar.exception;

/**
 * The base grammar template is malformed or misses a rule the compiled grammar relies on.
 */
public class TemplateException extends TmGrammarException {

    private static final long serialVersionUID = 1L;

    public TemplateException(String error) {
        super(error);
    }
}
