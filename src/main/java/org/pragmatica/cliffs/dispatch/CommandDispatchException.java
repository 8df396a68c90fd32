package org.pragmatica.cliffs.dispatch;

/**
 * A call could not be dispatched to a command.
 */
public class CommandDispatchException extends RuntimeException {
    public CommandDispatchException(String message) {
        super(message);
    }
}
