package org.pragmatica.cliffs.error;

import java.util.Optional;

/**
 * Malformed command syntax specification: unbalanced delimiters, empty groups, duplicate symbols,
 * misplaced tokens or undefined parameter types.
 */
public class GrammarException extends RuntimeException {
    private final String token;
    private final int offset;

    public GrammarException(String message) {
        super(message);
        this.token = null;
        this.offset = -1;
    }

    public GrammarException(String message, String token, int offset) {
        super(message + ": '" + token + "' at " + offset);
        this.token = token;
        this.offset = offset;
    }

    public static GrammarException unexpected(String token, int offset) {
        return new GrammarException("Unexpected token", token, offset);
    }

    public static GrammarException unexpected(String token, int offset, String reason) {
        return new GrammarException("Unexpected token (" + reason + ")", token, offset);
    }

    /**
     * Text of the offending grammar token, if the error is tied to one.
     */
    public Optional<String> token() {
        return Optional.ofNullable(token);
    }

    /**
     * Offset of the offending token in the grammar text, or -1.
     */
    public int offset() {
        return offset;
    }
}
