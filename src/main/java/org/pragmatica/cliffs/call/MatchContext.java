package org.pragmatica.cliffs.call;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Configuration for matching calls against syntax trees: registered parameter types and the
 * comparison policy for literals. Immutable once built, so one context may serve any number of
 * concurrent matches.
 *
 * <p>Pre-registered types: {@code str} (the token text), {@code int}, {@code float} and
 * {@code bool} (see {@link LooseBoolean}).
 */
public final class MatchContext {
    public static final double DEFAULT_LITERAL_THRESHOLD = 0.75;
    public static final double DEFAULT_FUZZY_SCORE = 0.25;

    public static final MatchContext DEFAULT = builder().build();

    private final Map<String, ParameterType<?>> types;
    private final double literalThreshold;
    private final double fuzzyScore;
    private final boolean caseSensitive;
    private final UnorderedStrategy unorderedStrategy;
    private final Similarity similarity;

    private MatchContext(Builder builder) {
        this.types = ImmutableMap.copyOf(builder.types);
        this.literalThreshold = builder.literalThreshold;
        this.fuzzyScore = builder.fuzzyScore;
        this.caseSensitive = builder.caseSensitive;
        this.unorderedStrategy = builder.unorderedStrategy;
        this.similarity = builder.similarity;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start a builder from this context's settings.
     */
    public Builder toBuilder() {
        var builder = new Builder();
        builder.types.clear();
        builder.types.putAll(types);
        return builder.literalThreshold(literalThreshold)
                      .fuzzyScore(fuzzyScore)
                      .caseSensitive(caseSensitive)
                      .unorderedStrategy(unorderedStrategy)
                      .similarity(similarity);
    }

    public Optional<ParameterType<?>> type(String name) {
        return Optional.ofNullable(types.get(name));
    }

    public boolean hasType(String name) {
        return types.containsKey(name);
    }

    public Set<String> typeNames() {
        return types.keySet();
    }

    /**
     * Minimum similarity for a mistyped token to count as a near miss of a literal.
     */
    public double literalThreshold() {
        return literalThreshold;
    }

    /**
     * Partial score awarded for a near miss of a literal.
     */
    public double fuzzyScore() {
        return fuzzyScore;
    }

    public boolean caseSensitive() {
        return caseSensitive;
    }

    public UnorderedStrategy unorderedStrategy() {
        return unorderedStrategy;
    }

    public Similarity similarity() {
        return similarity;
    }

    public static final class Builder {
        private final Map<String, ParameterType<?>> types = new LinkedHashMap<>();
        private double literalThreshold = DEFAULT_LITERAL_THRESHOLD;
        private double fuzzyScore = DEFAULT_FUZZY_SCORE;
        private boolean caseSensitive = true;
        private UnorderedStrategy unorderedStrategy = UnorderedStrategy.GREEDY;
        private Similarity similarity = Similarity.jaroWinkler();

        private Builder() {
            types.put("str", text -> text);
            types.put("int", text -> Integer.valueOf(text.strip()));
            types.put("float", text -> Double.valueOf(text.strip()));
            types.put("bool", LooseBoolean::parse);
        }

        public Builder type(String name, ParameterType<?> type) {
            checkNotNull(name, "name");
            checkNotNull(type, "type");
            types.put(name, type);
            return this;
        }

        public Builder literalThreshold(double literalThreshold) {
            checkArgument(literalThreshold > 0.0 && literalThreshold <= 1.0,
                          "Literal threshold must be in (0, 1]: %s", literalThreshold);
            this.literalThreshold = literalThreshold;
            return this;
        }

        public Builder fuzzyScore(double fuzzyScore) {
            checkArgument(fuzzyScore > 0.0 && fuzzyScore < 1.0, "Fuzzy score must be in (0, 1): %s", fuzzyScore);
            this.fuzzyScore = fuzzyScore;
            return this;
        }

        public Builder caseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
            return this;
        }

        public Builder unorderedStrategy(UnorderedStrategy unorderedStrategy) {
            this.unorderedStrategy = checkNotNull(unorderedStrategy, "unorderedStrategy");
            return this;
        }

        public Builder similarity(Similarity similarity) {
            this.similarity = checkNotNull(similarity, "similarity");
            return this;
        }

        public MatchContext build() {
            return new MatchContext(this);
        }
    }
}
