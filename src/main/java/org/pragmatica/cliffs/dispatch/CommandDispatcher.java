package org.pragmatica.cliffs.dispatch;

import org.pragmatica.cliffs.call.MatchContext;
import org.pragmatica.cliffs.error.MatchFailure;
import org.pragmatica.cliffs.grammar.CompilerConfig;
import org.pragmatica.cliffs.match.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Registry of commands that routes each call to the command matching it best.
 *
 * <p>Every registered command is tried. The highest-scoring full match is executed, the first
 * registered command winning ties. Without a full match, the failure of the command that got
 * furthest is rethrown so the caller can report it; a call no command scored on at all is an
 * {@link UnknownCommandException}.
 *
 * <p>Registration is not synchronized: register all commands before dispatching concurrently.
 *
 * @param <R> callback result type
 */
public final class CommandDispatcher<R> {
    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final List<Command<R>> commands = new ArrayList<>();
    private final CompilerConfig compilerConfig;
    private final MatchContext context;

    public CommandDispatcher() {
        this(CompilerConfig.DEFAULT, MatchContext.DEFAULT);
    }

    public CommandDispatcher(MatchContext context) {
        this(CompilerConfig.DEFAULT, context);
    }

    public CommandDispatcher(CompilerConfig compilerConfig, MatchContext context) {
        this.compilerConfig = checkNotNull(compilerConfig, "compilerConfig");
        this.context = checkNotNull(context, "context");
    }

    public Command<R> register(Command<R> command) {
        commands.add(checkNotNull(command, "command"));
        log.debug("Registered command #{}: {}", commands.size(), command.syntax());
        return command;
    }

    /**
     * Compile the syntax with this dispatcher's configuration and register a command for it.
     */
    public Command<R> command(String syntax, CommandCallback<R> callback) {
        return register(Command.compile(syntax, compilerConfig, context, Optional.empty(), callback));
    }

    public Command<R> command(String syntax, String description, CommandCallback<R> callback) {
        return register(Command.compile(syntax, compilerConfig, context, Optional.of(description), callback));
    }

    public List<Command<R>> commands() {
        return Collections.unmodifiableList(commands);
    }

    /**
     * Execute the command that matches the call best.
     *
     * @throws MatchFailure            from the best-scoring command when no command matches fully
     * @throws UnknownCommandException when no command scored anything
     */
    public R dispatch(String call) throws MatchFailure {
        Command<R> bestCommand = null;
        MatchResult.Success bestSuccess = null;
        MatchResult.Failure bestFailure = null;

        for (var command : commands) {
            var result = command.tryMatch(call);
            if (result instanceof MatchResult.Success success) {
                if (bestSuccess == null || success.score() > bestSuccess.score()) {
                    bestSuccess = success;
                    bestCommand = command;
                }
            }else if (result instanceof MatchResult.Failure failure) {
                if (bestFailure == null || failure.score() > bestFailure.score()) {
                    bestFailure = failure;
                }
            }
        }

        if (bestSuccess != null) {
            log.debug("Dispatching '{}' to {} (score {})", call, bestCommand, bestSuccess.score());
            return bestCommand.execute(bestSuccess.match());
        }
        if (bestFailure != null && bestFailure.score() > 0) {
            log.debug("No command matches '{}', best attempt scored {}: {}",
                      call,
                      bestFailure.score(),
                      bestFailure.failure()
                                 .getMessage());
            throw bestFailure.failure();
        }
        log.debug("Unknown command '{}'", call);
        throw new UnknownCommandException(call);
    }

    public List<String> usageLines() {
        return usageLines(null);
    }

    /**
     * Usage help of all commands in registration order.
     *
     * @param separator line placed between command blocks, or {@code null} for none
     */
    public List<String> usageLines(String separator) {
        return usageLines(separator, UsageFormatter.DEFAULT_MAX_WIDTH, UsageFormatter.DEFAULT_INDENT);
    }

    public List<String> usageLines(String separator, int maxWidth, int indent) {
        var lines = new ArrayList<String>();
        for (var command : commands) {
            var block = command.usageLines(maxWidth, indent);
            if (block.isEmpty()) {
                continue;
            }
            if (separator != null && !lines.isEmpty()) {
                lines.add(separator);
            }
            lines.addAll(block);
        }
        return lines;
    }
}
