package io.bpmnconvert.signavio.json;

/**
 * The input is not a Signavio shape document at all. Fails the whole file.
 */
public class StructuralParseException extends RuntimeException {

    public StructuralParseException(String message) {
        super(message);
    }

    public StructuralParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
