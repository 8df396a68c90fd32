package org.pragmatica.cliffs.error;

import org.pragmatica.cliffs.call.Token;
import org.pragmatica.cliffs.tree.SyntaxNode;

import java.util.Optional;

/**
 * A call did not match a (valid) command syntax.
 *
 * <p>Match failures carry no stack trace. Each one names the node that failed and, where there was one, the offending call token.
 */
public abstract sealed class MatchFailure extends Exception
        permits MatchFailure.MissingLiteral,
                MatchFailure.MismatchedLiteral,
                MatchFailure.SuggestedLiteral,
                MatchFailure.MissingParameter,
                MatchFailure.MismatchedParameterType,
                MatchFailure.MissingTail,
                MatchFailure.MissingVariant,
                MatchFailure.NoMatchedVariant,
                MatchFailure.MissingUnorderedGroup,
                MatchFailure.UnmatchedUnorderedGroup,
                MatchFailure.TooManyArguments {

    private final transient SyntaxNode node;
    private final transient Token actual;

    MatchFailure(String message, SyntaxNode node, Token actual) {
        this(message, node, actual, null);
    }

    MatchFailure(String message, SyntaxNode node, Token actual, Throwable cause) {
        super(message, cause, false, false);
        this.node = node;
        this.actual = actual;
    }

    /**
     * The node that could not be matched. Empty only for leftover-token failures.
     */
    public Optional<SyntaxNode> node() {
        return Optional.ofNullable(node);
    }

    /**
     * The call token found where something else was expected, if any.
     */
    public Optional<Token> actual() {
        return Optional.ofNullable(actual);
    }

    // === Literals ===

    public static final class MissingLiteral extends MatchFailure {
        public MissingLiteral(SyntaxNode.Literal expected) {
            super("Expected literal " + expected.describe(), expected, null);
        }
    }

    public static final class MismatchedLiteral extends MatchFailure {
        public MismatchedLiteral(SyntaxNode.Literal expected, Token actual) {
            super("Expected literal " + expected.describe() + ", got " + actual, expected, actual);
        }
    }

    /**
     * The token was close enough to the literal to be a likely typo.
     */
    public static final class SuggestedLiteral extends MatchFailure {
        private final double similarity;

        public SuggestedLiteral(SyntaxNode.Literal expected, Token actual, double similarity) {
            super("Expected literal " + expected.describe() + ", got " + actual
                  + " (did you mean " + expected.describe() + "?)", expected, actual);
            this.similarity = similarity;
        }

        public String suggestion() {
            return ((SyntaxNode.Literal) node().orElseThrow()).text();
        }

        public double similarity() {
            return similarity;
        }
    }

    // === Parameters ===

    public static final class MissingParameter extends MatchFailure {
        public MissingParameter(SyntaxNode.Parameter expected) {
            super("Expected argument for parameter " + expected.describe(), expected, null);
        }
    }

    public static final class MismatchedParameterType extends MatchFailure {
        public MismatchedParameterType(SyntaxNode.Parameter expected, Token actual, Throwable cause) {
            super("Argument " + actual + " for parameter " + expected.describe()
                  + " does not match type " + expected.typeName().orElse("str"), expected, actual, cause);
        }
    }

    public static final class MissingTail extends MatchFailure {
        public MissingTail(SyntaxNode.Tail expected) {
            super("Expected " + expected.describe(), expected, null);
        }
    }

    // === Groups ===

    public static final class MissingVariant extends MatchFailure {
        public MissingVariant(SyntaxNode.VariantGroup expected) {
            super("Expected " + expected.describe(), expected, null);
        }
    }

    public static final class NoMatchedVariant extends MatchFailure {
        public NoMatchedVariant(SyntaxNode.VariantGroup expected, Token actual) {
            super("Expected " + expected.describe() + ", got " + actual, expected, actual);
        }
    }

    public static final class MissingUnorderedGroup extends MatchFailure {
        public MissingUnorderedGroup(SyntaxNode.UnorderedGroup expected) {
            super("Expected " + expected.describe(), expected, null);
        }
    }

    public static final class UnmatchedUnorderedGroup extends MatchFailure {
        public UnmatchedUnorderedGroup(SyntaxNode.UnorderedGroup expected, Token actual) {
            super("Expected " + expected.describe() + ", got " + actual, expected, actual);
        }
    }

    // === Call level ===

    /**
     * The syntax matched but call tokens were left over.
     */
    public static final class TooManyArguments extends MatchFailure {
        public TooManyArguments(Token firstLeftover) {
            super("Too many arguments, starting with " + firstLeftover, null, firstLeftover);
        }
    }
}
