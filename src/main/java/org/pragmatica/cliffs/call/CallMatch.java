package org.pragmatica.cliffs.call;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Accumulator for one attempt to match a call against a syntax tree.
 *
 * <p>Holds the call tokens, the read position, the score so far and the bindings made by
 * matched nodes: parameter values, presence of optional sequences and the chosen variant of each
 * variant group. Optional sequences and variant groups without an identifier are recorded
 * positionally, in the order they are entered.
 *
 * <p>Speculative matching works on {@link #fork() forks}. A fork starts at the parent's position
 * with zero score and no bindings; {@link #join(CallMatch)} commits it.
 */
public final class CallMatch {
    private final String raw;
    private final List<Token> tokens;
    private int position;
    private double score;
    private boolean terminated;

    private final Map<String, Object> params = new LinkedHashMap<>();
    private final List<Boolean> optionals = new ArrayList<>();
    private final Map<String, Boolean> namedOptionals = new LinkedHashMap<>();
    private final List<Integer> variants = new ArrayList<>();
    private final Map<String, Integer> namedVariants = new LinkedHashMap<>();

    private CallMatch(String raw, List<Token> tokens, int position, boolean terminated) {
        this.raw = raw;
        this.tokens = tokens;
        this.position = position;
        this.terminated = terminated;
    }

    /**
     * Match state for the given call, tokenized with the default quotes.
     */
    public static CallMatch of(String call) {
        return of(call, CallLexer.tokenize(call));
    }

    public static CallMatch of(String call, List<Token> tokens) {
        checkNotNull(call, "call");
        return new CallMatch(call, ImmutableList.copyOf(tokens), 0, false);
    }

    // === Speculation ===

    public CallMatch fork() {
        return new CallMatch(raw, tokens, position, terminated);
    }

    /**
     * Commit a fork of this match: adopt its position and add its score and bindings.
     */
    public void join(CallMatch fork) {
        checkArgument(fork.tokens == tokens, "Can only join a fork of the same call");
        checkState(fork.position >= position, "Fork is behind its parent");
        position = fork.position;
        score += fork.score;
        terminated |= fork.terminated;
        params.putAll(fork.params);
        optionals.addAll(fork.optionals);
        namedOptionals.putAll(fork.namedOptionals);
        variants.addAll(fork.variants);
        namedVariants.putAll(fork.namedVariants);
    }

    // === Tokens ===

    public String raw() {
        return raw;
    }

    public List<Token> tokens() {
        return tokens;
    }

    public int position() {
        return position;
    }

    public boolean hasTokens() {
        return position < tokens.size();
    }

    /**
     * Tokens not consumed yet.
     */
    public List<Token> remaining() {
        return tokens.subList(position, tokens.size());
    }

    /**
     * Next unconsumed token, if any.
     */
    public Optional<Token> next() {
        return hasTokens()
               ? Optional.of(tokens.get(position))
               : Optional.empty();
    }

    public Token take() {
        if (!hasTokens()) {
            throw new NoSuchElementException("No tokens left in call '" + raw + "'");
        }
        return tokens.get(position++ );
    }

    public List<Token> takeAll() {
        var rest = remaining();
        position = tokens.size();
        return rest;
    }

    // === Score and termination ===

    public double score() {
        return score;
    }

    public void addScore(double delta) {
        score += delta;
    }

    public boolean terminated() {
        return terminated;
    }

    /**
     * Mark the match as complete: nothing may be matched after a tail.
     */
    public void terminate() {
        terminated = true;
    }

    // === Bindings ===

    public void bind(String name, Object value) {
        params.put(name, value);
    }

    public void recordOptional(Optional<String> identifier, boolean present) {
        if (identifier.isPresent()) {
            namedOptionals.put(identifier.get(), present);
        }else {
            optionals.add(present);
        }
    }

    public void recordVariant(Optional<String> identifier, int index) {
        if (identifier.isPresent()) {
            namedVariants.put(identifier.get(), index);
        }else {
            variants.add(index);
        }
    }

    // === Accessors ===

    public boolean hasParam(String name) {
        return params.containsKey(name);
    }

    public Object param(String name) {
        if (!params.containsKey(name)) {
            throw new NoSuchElementException("No parameter '" + name + "' in match");
        }
        return params.get(name);
    }

    public <T> T param(String name, Class<T> type) {
        return type.cast(param(name));
    }

    public Optional<Object> findParam(String name) {
        return Optional.ofNullable(params.get(name));
    }

    public Map<String, Object> params() {
        return Collections.unmodifiableMap(params);
    }

    /**
     * Presence of the n-th unnamed optional sequence.
     */
    public boolean optional(int index) {
        checkIndex(index, optionals.size(), "optional sequence");
        return optionals.get(index);
    }

    public boolean optional(String identifier) {
        var present = namedOptionals.get(identifier);
        if (present == null) {
            throw new NoSuchElementException("No optional sequence identified as '" + identifier + "'");
        }
        return present;
    }

    /**
     * Index of the matched variant in the n-th unnamed variant group.
     */
    public int variant(int index) {
        checkIndex(index, variants.size(), "variant group");
        return variants.get(index);
    }

    public int variant(String identifier) {
        var index = namedVariants.get(identifier);
        if (index == null) {
            throw new NoSuchElementException("No variant group identified as '" + identifier + "'");
        }
        return index;
    }

    public List<Boolean> optionals() {
        return Collections.unmodifiableList(optionals);
    }

    public List<Integer> variants() {
        return Collections.unmodifiableList(variants);
    }

    private static void checkIndex(int index, int size, String what) {
        if (index < 0 || index >= size) {
            throw new NoSuchElementException("No " + what + " #" + index + ", matched " + size);
        }
    }

    @Override
    public String toString() {
        return "CallMatch[score=" + score + ", params=" + params + ", optionals=" + optionals + namedOptionals
               + ", variants=" + variants + namedVariants + "]";
    }
}
