package org.pragmatica.cliffs;

import org.pragmatica.cliffs.grammar.CompilerConfig;
import org.pragmatica.cliffs.grammar.GrammarParser;
import org.pragmatica.cliffs.grammar.SimplifyMode;
import org.pragmatica.cliffs.tree.SyntaxTree;

/**
 * Entry point for compiling command syntaxes.
 *
 * <p>Example usage:
 * <pre>{@code
 * var tree = Cliffs.compile("set [loud] alarm at <time: int> (am|pm)");
 * var match = CallMatch.of("set loud alarm at 7 am");
 *
 * tree.match(match, MatchContext.DEFAULT);
 * int time = match.param("time", Integer.class);
 * }</pre>
 */
public final class Cliffs {
    private Cliffs() {}

    /**
     * Compile a syntax specification with the default configuration.
     *
     * @throws org.pragmatica.cliffs.error.GrammarException if the syntax is malformed
     */
    public static SyntaxTree compile(String syntax) {
        return compile(syntax, CompilerConfig.DEFAULT);
    }

    public static SyntaxTree compile(String syntax, CompilerConfig config) {
        return new SyntaxTree(GrammarParser.parse(syntax, config));
    }

    /**
     * Create a builder for a non-default compiler configuration.
     */
    public static Builder builder(String syntax) {
        return new Builder(syntax);
    }

    public static final class Builder {
        private final String syntax;
        private SimplifyMode simplifyMode = CompilerConfig.DEFAULT.simplifyMode();
        private boolean allCaseInsensitive = CompilerConfig.DEFAULT.allCaseInsensitive();

        private Builder(String syntax) {
            this.syntax = syntax;
        }

        public Builder simplify(SimplifyMode mode) {
            this.simplifyMode = mode;
            return this;
        }

        public Builder caseInsensitive(boolean enabled) {
            this.allCaseInsensitive = enabled;
            return this;
        }

        public SyntaxTree build() {
            return compile(syntax, new CompilerConfig(simplifyMode, allCaseInsensitive));
        }
    }
}
