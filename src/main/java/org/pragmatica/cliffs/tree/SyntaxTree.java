package org.pragmatica.cliffs.tree;

import org.pragmatica.cliffs.call.CallMatch;
import org.pragmatica.cliffs.call.MatchContext;
import org.pragmatica.cliffs.error.GrammarException;
import org.pragmatica.cliffs.error.MatchFailure;
import org.pragmatica.cliffs.match.NodeMatcher;

import java.util.LinkedHashSet;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A compiled command syntax.
 */
public record SyntaxTree(SyntaxNode root) {
    public SyntaxTree {
        checkNotNull(root, "root");
    }

    /**
     * Match the call from the current position of {@code match}. Tokens left over after a
     * successful match are not an error here; check {@link CallMatch#hasTokens()}.
     */
    public void match(CallMatch match, MatchContext context) throws MatchFailure {
        new NodeMatcher(context).match(root, match);
    }

    /**
     * Check that every parameter type used in the tree is registered in the context.
     *
     * @throws GrammarException naming the first undefined type
     */
    public SyntaxTree validate(MatchContext context) {
        for (var typeName : parameterTypes()) {
            if (!context.hasType(typeName)) {
                throw new GrammarException("Undefined parameter type '" + typeName + "' in syntax " + render());
            }
        }
        return this;
    }

    /**
     * Names of all parameter types referenced by the tree, in order of appearance.
     */
    public Set<String> parameterTypes() {
        var types = new LinkedHashSet<String>();
        collectTypes(root, types);
        return types;
    }

    private static void collectTypes(SyntaxNode node, Set<String> types) {
        if (node instanceof SyntaxNode.Parameter parameter) {
            parameter.typeName()
                     .ifPresent(types::add);
        }
        for (var child : node.children()) {
            collectTypes(child, types);
        }
    }

    public String render() {
        return SyntaxRenderer.render(root);
    }

    @Override
    public String toString() {
        return render();
    }
}
