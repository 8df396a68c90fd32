package org.pragmatica.cliffs.tree;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders syntax trees back into grammar text.
 *
 * <p>Flattened trees render to their canonical form, which compiles back into an equal tree.
 */
public final class SyntaxRenderer {
    private SyntaxRenderer() {}

    public static String render(SyntaxNode root) {
        return render(root, true);
    }

    private static String render(SyntaxNode node, boolean root) {
        if (node instanceof SyntaxNode.Literal literal) {
            return literal.text()
                   + (literal.caseSensitive() ? "" : "^")
                   + (literal.tolerant() ? "~" : "");
        }
        if (node instanceof SyntaxNode.Parameter parameter) {
            return parameter.describe();
        }
        if (node instanceof SyntaxNode.Tail tail) {
            return "<" + tail.name() + (tail.raw() ? "...*" : "...") + ">";
        }
        if (node instanceof SyntaxNode.Sequence sequence) {
            var body = renderAll(sequence.children());
            return root ? body : "(" + body + ")";
        }
        if (node instanceof SyntaxNode.OptionalSequence optional) {
            return "[" + renderAll(optional.children()) + "]" + optionalSuffix(optional);
        }
        if (node instanceof SyntaxNode.VariantGroup group) {
            var body = group.variants()
                            .stream()
                            .map(variant -> renderAll(variant.children()))
                            .collect(Collectors.joining("|"));
            if (group.hasOwnIdentifier()) {
                return "(" + body + "):" + group.identifier().orElseThrow();
            }
            return group.parenthesized() ? "(" + body + ")" : body;
        }
        if (node instanceof SyntaxNode.UnorderedGroup unordered) {
            return "{" + renderAll(unordered.children()) + "}";
        }
        throw new IllegalArgumentException("Unknown node type: " + node.getClass().getName());
    }

    private static String renderAll(List<SyntaxNode> nodes) {
        return nodes.stream()
                    .map(child -> render(child, false))
                    .collect(Collectors.joining(" "));
    }

    // An identifier inherited by the only variant group inside is written after the brackets
    private static String optionalSuffix(SyntaxNode.OptionalSequence optional) {
        if (optional.identifier().isPresent()) {
            return ":" + optional.identifier().get();
        }
        if (optional.children().size() == 1
            && optional.children().get(0) instanceof SyntaxNode.VariantGroup group
            && group.inheritedIdentifier()) {
            return ":" + group.identifier().orElseThrow();
        }
        return "";
    }
}
