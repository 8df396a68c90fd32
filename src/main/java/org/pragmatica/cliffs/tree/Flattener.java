package org.pragmatica.cliffs.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree normalization run once after a grammar is parsed.
 *
 * <p>Rewrites:
 * <ul>
 *   <li>sequences and unordered groups with a single child collapse into that child;</li>
 *   <li>nested sequences are spliced into sequence-shaped parents (sequences, variants, optional sequences);</li>
 *   <li>a variant group with a single variant becomes that variant's sequence;</li>
 *   <li>a variant consisting only of an unidentified variant group is replaced by that group's variants;</li>
 *   <li>a variant group is parenthesized when it has its own identifier, is not the sole child of its parent,
 *   or is the sole child of an identified optional sequence.</li>
 * </ul>
 * Flattening is idempotent and does not change whether or how well a call matches.
 */
public final class Flattener {
    private Flattener() {}

    public static SyntaxNode flatten(SyntaxNode root) {
        return arrange(flattenNode(root), true);
    }

    private static SyntaxNode flattenNode(SyntaxNode node) {
        if (node instanceof SyntaxNode.Sequence sequence) {
            var children = spliced(sequence.children());
            return children.size() == 1
                   ? children.get(0)
                   : new SyntaxNode.Sequence(arranged(children));
        }
        if (node instanceof SyntaxNode.OptionalSequence optional) {
            var children = arranged(spliced(optional.children()));
            // [(a|b)]:id must not render as [a|b]:id, which identifies the group instead
            if (optional.identifier().isPresent()
                && children.size() == 1
                && children.get(0) instanceof SyntaxNode.VariantGroup group
                && group.identifier().isEmpty()) {
                children = List.of(group.withParenthesized(true));
            }
            return new SyntaxNode.OptionalSequence(children, optional.identifier());
        }
        if (node instanceof SyntaxNode.UnorderedGroup unordered) {
            var children = new ArrayList<SyntaxNode>();
            for (var child : unordered.children()) {
                children.add(flattenNode(child));
            }
            return children.size() == 1
                   ? children.get(0)
                   : new SyntaxNode.UnorderedGroup(arranged(children));
        }
        if (node instanceof SyntaxNode.VariantGroup group) {
            return flattenGroup(group);
        }
        return node;
    }

    private static SyntaxNode flattenGroup(SyntaxNode.VariantGroup group) {
        if (group.variants().size() == 1) {
            return flattenNode(group.variants().get(0));
        }
        var variants = new ArrayList<SyntaxNode.Sequence>();
        for (var variant : group.variants()) {
            var children = spliced(variant.children());
            if (children.size() == 1
                && children.get(0) instanceof SyntaxNode.VariantGroup nested
                && nested.identifier().isEmpty()) {
                variants.addAll(nested.variants());
            } else {
                variants.add(new SyntaxNode.Sequence(arranged(children)));
            }
        }
        return new SyntaxNode.VariantGroup(variants,
                                           group.identifier(),
                                           group.inheritedIdentifier(),
                                           group.parenthesized());
    }

    private static List<SyntaxNode> spliced(List<SyntaxNode> children) {
        var result = new ArrayList<SyntaxNode>();
        for (var child : children) {
            var flat = flattenNode(child);
            if (flat instanceof SyntaxNode.Sequence nested) {
                result.addAll(nested.children());
            } else {
                result.add(flat);
            }
        }
        return result;
    }

    private static List<SyntaxNode> arranged(List<SyntaxNode> children) {
        var soleChild = children.size() == 1;
        var result = new ArrayList<SyntaxNode>(children.size());
        for (var child : children) {
            result.add(arrange(child, soleChild));
        }
        return result;
    }

    private static SyntaxNode arrange(SyntaxNode node, boolean soleChild) {
        if (node instanceof SyntaxNode.VariantGroup group) {
            return group.withParenthesized(!soleChild || group.hasOwnIdentifier());
        }
        return node;
    }
}
