package org.pragmatica.cliffs.match;

import com.google.common.collect.Collections2;
import com.google.common.collect.ImmutableList;
import org.pragmatica.cliffs.call.CallMatch;
import org.pragmatica.cliffs.call.MatchContext;
import org.pragmatica.cliffs.call.ParameterType;
import org.pragmatica.cliffs.call.Token;
import org.pragmatica.cliffs.error.GrammarException;
import org.pragmatica.cliffs.error.MatchFailure;
import org.pragmatica.cliffs.tree.SyntaxNode;
import org.pragmatica.cliffs.tree.SyntaxNode.Literal;
import org.pragmatica.cliffs.tree.SyntaxNode.OptionalSequence;
import org.pragmatica.cliffs.tree.SyntaxNode.Parameter;
import org.pragmatica.cliffs.tree.SyntaxNode.Sequence;
import org.pragmatica.cliffs.tree.SyntaxNode.Tail;
import org.pragmatica.cliffs.tree.SyntaxNode.UnorderedGroup;
import org.pragmatica.cliffs.tree.SyntaxNode.VariantGroup;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.IntStream;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.stream.Collectors.toList;

/**
 * Matches syntax tree nodes against a call.
 *
 * <p>Each node either consumes tokens from the {@link CallMatch}, adding to its score and
 * bindings, or throws a {@link MatchFailure}. Containers explore alternatives on forks of the
 * match and commit the best-scoring one. A failing branch still contributes the score it reached,
 * so callers can tell a near miss from an unrelated call.
 */
public final class NodeMatcher {
    public static final double LITERAL_SCORE = 1.0;
    public static final double PARAMETER_SCORE = 0.5;
    public static final double TAIL_SCORE = 0.5;

    private final MatchContext context;

    public NodeMatcher(MatchContext context) {
        this.context = checkNotNull(context, "context");
    }

    /**
     * Match the node at the current position of the call match.
     *
     * @throws MatchFailure          if the node does not match; partial scores have been added
     * @throws IllegalStateException if the match was already terminated by a tail
     */
    public void match(SyntaxNode node, CallMatch match) throws MatchFailure {
        if (match.terminated()) {
            throw new IllegalStateException("Cannot match " + node.nodeName() + " after a tail");
        }
        if (node instanceof Literal literal) {
            matchLiteral(literal, match);
        }else if (node instanceof Parameter parameter) {
            matchParameter(parameter, match);
        }else if (node instanceof Tail tail) {
            matchTail(tail, match);
        }else if (node instanceof Sequence sequence) {
            matchAll(sequence.children(), match);
        }else if (node instanceof OptionalSequence optional) {
            matchOptional(optional, match);
        }else if (node instanceof VariantGroup group) {
            matchVariants(group, match);
        }else if (node instanceof UnorderedGroup group) {
            matchUnordered(group, match);
        }else {
            throw new IllegalArgumentException("Unsupported node: " + node);
        }
    }

    // === Leaves ===

    private void matchLiteral(Literal literal, CallMatch match) throws MatchFailure {
        var token = match.next()
                         .orElseThrow(() -> new MatchFailure.MissingLiteral(literal));
        var ignoreCase = !literal.caseSensitive() || !context.caseSensitive();
        var expected = ignoreCase ? literal.text().toLowerCase(Locale.ROOT) : literal.text();
        var actual = ignoreCase ? token.valueText().toLowerCase(Locale.ROOT) : token.valueText();

        if (expected.equals(actual)) {
            match.addScore(LITERAL_SCORE);
            match.take();
            return;
        }
        var similarity = context.similarity().ratio(expected, actual);
        if (similarity < context.literalThreshold()) {
            throw new MatchFailure.MismatchedLiteral(literal, token);
        }
        match.addScore(context.fuzzyScore());
        if (!literal.tolerant()) {
            throw new MatchFailure.SuggestedLiteral(literal, token, similarity);
        }
        match.take();
    }

    private void matchParameter(Parameter parameter, CallMatch match) throws MatchFailure {
        var token = match.next()
                         .orElseThrow(() -> new MatchFailure.MissingParameter(parameter));
        Object value = token.valueText();
        if (parameter.typeName().isPresent()) {
            var type = resolveType(parameter.typeName().get());
            try{
                value = type.parse(token.valueText());
            } catch (IllegalArgumentException e) {
                throw new MatchFailure.MismatchedParameterType(parameter, token, e);
            }
        }
        match.bind(parameter.name(), value);
        match.addScore(PARAMETER_SCORE);
        match.take();
    }

    private ParameterType<?> resolveType(String typeName) {
        return context.type(typeName)
                      .orElseThrow(() -> new GrammarException("Undefined parameter type '" + typeName + "'"));
    }

    private void matchTail(Tail tail, CallMatch match) throws MatchFailure {
        if (!match.hasTokens()) {
            throw new MatchFailure.MissingTail(tail);
        }
        var rest = match.remaining();
        Object value;
        if (tail.raw()) {
            var first = rest.get(0);
            var last = rest.get(rest.size() - 1);
            var text = first.span()
                            .merge(last.span())
                            .extract(match.raw());
            if (text.isEmpty()) {
                throw new MatchFailure.MissingTail(tail);
            }
            value = text;
        }else {
            var values = rest.stream()
                             .map(Token::valueText)
                             .collect(ImmutableList.toImmutableList());
            if (values.stream().allMatch(String::isEmpty)) {
                throw new MatchFailure.MissingTail(tail);
            }
            value = values;
        }
        match.takeAll();
        match.bind(tail.name(), value);
        match.addScore(TAIL_SCORE);
        match.terminate();
    }

    // === Containers ===

    private void matchAll(List<SyntaxNode> children, CallMatch match) throws MatchFailure {
        for (var child : children) {
            match(child, match);
        }
    }

    private void matchOptional(OptionalSequence optional, CallMatch match) throws MatchFailure {
        var fork = match.fork();
        try{
            matchAll(optional.children(), fork);
        } catch (MatchFailure failure) {
            if (fork.score() > 0) {
                match.addScore(fork.score());
                throw failure;
            }
            match.recordOptional(optional.identifier(), false);
            return;
        }
        match.recordOptional(optional.identifier(), true);
        match.join(fork);
    }

    private void matchVariants(VariantGroup group, CallMatch match) throws MatchFailure {
        var best = new Attempts();
        var variants = group.variants();
        for (int index = 0; index < variants.size(); index++ ) {
            var fork = match.fork();
            try{
                match(variants.get(index), fork);
                best.success(index, fork);
            } catch (MatchFailure failure) {
                best.failure(failure, fork.score());
            }
        }
        if (best.hasSuccess()) {
            match.recordVariant(group.identifier(), best.successIndex);
            match.join(best.successMatch);
            return;
        }
        throw best.failureOr(match,
                             token -> new MatchFailure.NoMatchedVariant(group, token),
                             () -> new MatchFailure.MissingVariant(group));
    }

    private void matchUnordered(UnorderedGroup group, CallMatch match) throws MatchFailure {
        switch (context.unorderedStrategy()) {
            case GREEDY -> matchUnorderedGreedy(group, match);
            case PERMUTATION -> matchUnorderedPermutations(group, match);
        }
    }

    private void matchUnorderedGreedy(UnorderedGroup group, CallMatch match) throws MatchFailure {
        var unused = new ArrayList<>(group.children());
        while (!unused.isEmpty()) {
            var best = new Attempts();
            for (int index = 0; index < unused.size(); index++ ) {
                var fork = match.fork();
                try{
                    match(unused.get(index), fork);
                    best.success(index, fork);
                } catch (MatchFailure failure) {
                    best.failure(failure, fork.score());
                }
            }
            if (!best.hasSuccess()) {
                throw best.failureOr(match,
                                     token -> new MatchFailure.UnmatchedUnorderedGroup(group, token),
                                     () -> new MatchFailure.MissingUnorderedGroup(group));
            }
            match.join(best.successMatch);
            unused.remove(best.successIndex);
        }
    }

    private void matchUnorderedPermutations(UnorderedGroup group, CallMatch match) throws MatchFailure {
        var children = group.children();
        var indices = IntStream.range(0, children.size())
                               .boxed()
                               .collect(toList());
        var best = new Attempts();
        int permutation = 0;
        for (var order : Collections2.orderedPermutations(indices)) {
            var fork = match.fork();
            try{
                for (var index : order) {
                    match(children.get(index), fork);
                }
                best.success(permutation, fork);
            } catch (MatchFailure failure) {
                best.failure(failure, fork.score());
            }
            permutation++ ;
        }
        if (!best.hasSuccess()) {
            throw best.failureOr(match,
                                 token -> new MatchFailure.UnmatchedUnorderedGroup(group, token),
                                 () -> new MatchFailure.MissingUnorderedGroup(group));
        }
        match.join(best.successMatch);
    }

    /**
     * Best success and best scoring failure among alternatives tried from the same position.
     * Earlier alternatives win ties.
     */
    private static final class Attempts {
        private int successIndex = -1;
        private CallMatch successMatch;
        private MatchFailure failure;
        private double failureScore;

        private void success(int index, CallMatch fork) {
            if (successMatch == null || fork.score() > successMatch.score()) {
                successIndex = index;
                successMatch = fork;
            }
        }

        private void failure(MatchFailure candidate, double score) {
            if (score > 0 && (failure == null || score > failureScore)) {
                failure = candidate;
                failureScore = score;
            }
        }

        private boolean hasSuccess() {
            return successMatch != null;
        }

        /**
         * The failure to report: the best scoring one, with its score added to the parent match,
         * or a generic one when no alternative got anywhere.
         */
        private MatchFailure failureOr(CallMatch match,
                                       Function<Token, MatchFailure> unmatched,
                                       Supplier<MatchFailure> missing) {
            if (failure != null) {
                match.addScore(failureScore);
                return failure;
            }
            return match.next()
                        .map(unmatched)
                        .orElseGet(missing);
        }
    }
}
