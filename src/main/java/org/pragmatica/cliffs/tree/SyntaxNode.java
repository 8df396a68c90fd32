package org.pragmatica.cliffs.tree;

import com.google.common.collect.ImmutableList;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Syntax tree node types - the building blocks of a compiled command syntax.
 *
 * <p>Nodes are immutable. Containers hold their children in immutable lists, so a compiled
 * tree may be shared between threads and matched concurrently.
 */
public sealed interface SyntaxNode {

    /**
     * Name used in error messages and nesting paths.
     */
    String nodeName();

    /**
     * Human-readable description of what this node expects to see next in a call.
     */
    String describe();

    /**
     * Direct children of this node, empty for leaves.
     */
    default List<SyntaxNode> children() {
        return List.of();
    }

    // === Leaves ===

    /**
     * Literal command word: {@code set}, {@code help^}, {@code exit~}.
     */
    record Literal(String text, boolean caseSensitive, boolean tolerant) implements SyntaxNode {
        public Literal {
            checkNotNull(text, "text");
            checkArgument(!text.isEmpty(), "Literal text must not be empty");
        }

        public static Literal of(String text) {
            return new Literal(text, true, false);
        }

        public Literal withCaseSensitive(boolean caseSensitive) {
            return new Literal(text, caseSensitive, tolerant);
        }

        public Literal withTolerant(boolean tolerant) {
            return new Literal(text, caseSensitive, tolerant);
        }

        @Override
        public String nodeName() {
            return "literal";
        }

        @Override
        public String describe() {
            return "'" + text + "'";
        }
    }

    /**
     * Parameter: {@code <name>} or {@code <name: type>}.
     */
    record Parameter(String name, Optional<String> typeName) implements SyntaxNode {
        public Parameter {
            checkNotNull(name, "name");
            checkNotNull(typeName, "typeName");
        }

        public static Parameter of(String name) {
            return new Parameter(name, Optional.empty());
        }

        public static Parameter of(String name, String typeName) {
            return new Parameter(name, Optional.of(typeName));
        }

        @Override
        public String nodeName() {
            return "parameter";
        }

        @Override
        public String describe() {
            return typeName.map(type -> "<" + name + ": " + type + ">")
                           .orElse("<" + name + ">");
        }
    }

    /**
     * Tail: {@code <name...>} collects the remaining token values,
     * {@code <name...*>} keeps the remaining call text as typed.
     */
    record Tail(String name, boolean raw) implements SyntaxNode {
        public Tail {
            checkNotNull(name, "name");
        }

        @Override
        public String nodeName() {
            return "tail";
        }

        @Override
        public String describe() {
            return "<" + name + "...>";
        }
    }

    // === Containers ===

    /**
     * Sequence: all children in order. Also the shape of every variant in a {@link VariantGroup}.
     */
    record Sequence(List<SyntaxNode> children) implements SyntaxNode {
        public Sequence {
            children = ImmutableList.copyOf(children);
        }

        public static Sequence of(SyntaxNode... children) {
            return new Sequence(List.of(children));
        }

        @Override
        public String nodeName() {
            return "sequence";
        }

        @Override
        public String describe() {
            return children.isEmpty()
                   ? "nothing"
                   : children.get(0).describe();
        }
    }

    /**
     * Optional sequence: {@code [...]}, optionally identified as {@code [...]:id}.
     */
    record OptionalSequence(List<SyntaxNode> children, Optional<String> identifier) implements SyntaxNode {
        public OptionalSequence {
            children = ImmutableList.copyOf(children);
            checkNotNull(identifier, "identifier");
        }

        public static OptionalSequence of(SyntaxNode... children) {
            return new OptionalSequence(List.of(children), Optional.empty());
        }

        public OptionalSequence withIdentifier(String identifier) {
            return new OptionalSequence(children, Optional.of(identifier));
        }

        @Override
        public String nodeName() {
            return "optional_sequence";
        }

        @Override
        public String describe() {
            return children.isEmpty()
                   ? "nothing"
                   : children.get(0).describe();
        }
    }

    /**
     * Variant group: {@code (a|b|c)}, optionally identified as {@code (a|b):id}.
     *
     * <p>{@code inheritedIdentifier} marks an identifier written on the enclosing optional
     * sequence ({@code [a|b]:id}). {@code parenthesized} only affects rendering.
     */
    record VariantGroup(List<Sequence> variants,
                        Optional<String> identifier,
                        boolean inheritedIdentifier,
                        boolean parenthesized) implements SyntaxNode {
        public VariantGroup {
            variants = ImmutableList.copyOf(variants);
            checkArgument(!variants.isEmpty(), "Variant group must have at least one variant");
            checkNotNull(identifier, "identifier");
        }

        public static VariantGroup of(Sequence... variants) {
            return new VariantGroup(List.of(variants), Optional.empty(), false, true);
        }

        public VariantGroup withIdentifier(String identifier, boolean inherited) {
            return new VariantGroup(variants, Optional.of(identifier), inherited, parenthesized);
        }

        public VariantGroup withParenthesized(boolean parenthesized) {
            return new VariantGroup(variants, identifier, inheritedIdentifier, parenthesized);
        }

        /**
         * Whether the group carries an identifier of its own, written directly after it.
         */
        public boolean hasOwnIdentifier() {
            return identifier.isPresent() && !inheritedIdentifier;
        }

        @Override
        public List<SyntaxNode> children() {
            return ImmutableList.copyOf(variants);
        }

        @Override
        public String nodeName() {
            return "variant_group";
        }

        @Override
        public String describe() {
            return describeAlternatives(variants);
        }
    }

    /**
     * Unordered group: {@code {a b c}} matches its children in any order.
     */
    record UnorderedGroup(List<SyntaxNode> children) implements SyntaxNode {
        public UnorderedGroup {
            children = ImmutableList.copyOf(children);
        }

        public static UnorderedGroup of(SyntaxNode... children) {
            return new UnorderedGroup(List.of(children));
        }

        @Override
        public String nodeName() {
            return "unordered_group";
        }

        @Override
        public String describe() {
            return describeAlternatives(children);
        }
    }

    private static String describeAlternatives(List<? extends SyntaxNode> nodes) {
        var descriptions = new LinkedHashSet<String>();
        for (var node : nodes) {
            descriptions.add(node.describe());
        }
        return String.join(" or ", descriptions);
    }
}
