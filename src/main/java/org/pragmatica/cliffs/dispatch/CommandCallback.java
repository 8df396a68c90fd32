package org.pragmatica.cliffs.dispatch;

import org.pragmatica.cliffs.call.CallMatch;

/**
 * Action run for a call that matched a command.
 *
 * @param <R> result type shared by the commands of one dispatcher
 */
@FunctionalInterface
public interface CommandCallback<R> {
    R execute(CallMatch match);
}
