package org.pragmatica.cliffs.dispatch;

/**
 * No registered command resembles the call at all.
 */
public class UnknownCommandException extends CommandDispatchException {
    private final String call;

    public UnknownCommandException(String call) {
        super("Unknown command: '" + call + "'");
        this.call = call;
    }

    public String call() {
        return call;
    }
}
