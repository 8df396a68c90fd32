package org.pragmatica.cliffs.dispatch;

import org.pragmatica.cliffs.Cliffs;
import org.pragmatica.cliffs.call.CallLexer;
import org.pragmatica.cliffs.call.CallMatch;
import org.pragmatica.cliffs.call.MatchContext;
import org.pragmatica.cliffs.error.MatchFailure;
import org.pragmatica.cliffs.grammar.CompilerConfig;
import org.pragmatica.cliffs.match.MatchResult;
import org.pragmatica.cliffs.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A command: compiled syntax plus the callback to run for calls that match it.
 *
 * @param <R> callback result type
 */
public final class Command<R> {
    private final SyntaxTree syntax;
    private final CommandCallback<R> callback;
    private final MatchContext context;
    private final String quotes;
    private final Optional<String> description;

    private Command(SyntaxTree syntax,
                    CommandCallback<R> callback,
                    MatchContext context,
                    String quotes,
                    Optional<String> description) {
        this.syntax = syntax.validate(context);
        this.callback = callback;
        this.context = context;
        this.quotes = quotes;
        this.description = description;
    }

    public static <R> Command<R> of(String syntax, CommandCallback<R> callback) {
        return Command.<R>builder(Cliffs.compile(syntax)).build(callback);
    }

    public static <R> Builder<R> builder(SyntaxTree syntax) {
        return new Builder<>(syntax);
    }

    public SyntaxTree syntax() {
        return syntax;
    }

    public Optional<String> description() {
        return description;
    }

    /**
     * Match the whole call against this command.
     *
     * @throws MatchFailure if the call does not match or has tokens left over
     */
    public CallMatch match(String call) throws MatchFailure {
        var match = newMatch(call);
        matchFully(match);
        return match;
    }

    /**
     * Match the whole call, keeping the score reached by a failed attempt.
     */
    public MatchResult tryMatch(String call) {
        var match = newMatch(call);
        try{
            matchFully(match);
            return MatchResult.success(match);
        } catch (MatchFailure failure) {
            return MatchResult.failure(failure, match.score());
        }
    }

    public R execute(CallMatch match) {
        return callback.execute(match);
    }

    public List<String> usageLines() {
        return usageLines(UsageFormatter.DEFAULT_MAX_WIDTH, UsageFormatter.DEFAULT_INDENT);
    }

    /**
     * Usage help: the rendered syntax, followed by the indented description if there is one.
     */
    public List<String> usageLines(int maxWidth, int indent) {
        var lines = new ArrayList<>(UsageFormatter.wrap(syntax.render(), maxWidth, 0));
        description.ifPresent(text -> lines.addAll(UsageFormatter.wrap(text, maxWidth, indent)));
        return lines;
    }

    private CallMatch newMatch(String call) {
        return CallMatch.of(call, CallLexer.tokenize(call, quotes));
    }

    private void matchFully(CallMatch match) throws MatchFailure {
        syntax.match(match, context);
        if (match.hasTokens()) {
            throw new MatchFailure.TooManyArguments(match.remaining()
                                                         .get(0));
        }
    }

    @Override
    public String toString() {
        return "Command[" + syntax + "]";
    }

    public static final class Builder<R> {
        private final SyntaxTree syntax;
        private MatchContext context = MatchContext.DEFAULT;
        private String quotes = CallLexer.DEFAULT_QUOTES;
        private Optional<String> description = Optional.empty();

        private Builder(SyntaxTree syntax) {
            this.syntax = checkNotNull(syntax, "syntax");
        }

        public Builder<R> context(MatchContext context) {
            this.context = checkNotNull(context, "context");
            return this;
        }

        public Builder<R> quotes(String quotes) {
            this.quotes = checkNotNull(quotes, "quotes");
            return this;
        }

        public Builder<R> description(String description) {
            this.description = Optional.of(description);
            return this;
        }

        /**
         * @throws org.pragmatica.cliffs.error.GrammarException if the syntax uses a type the context lacks
         */
        public Command<R> build(CommandCallback<R> callback) {
            return new Command<>(syntax, checkNotNull(callback, "callback"), context, quotes, description);
        }
    }

    static <R> Command<R> compile(String syntax,
                                  CompilerConfig config,
                                  MatchContext context,
                                  Optional<String> description,
                                  CommandCallback<R> callback) {
        var builder = Command.<R>builder(Cliffs.compile(syntax, config))
                             .context(context);
        description.ifPresent(builder::description);
        return builder.build(callback);
    }
}
