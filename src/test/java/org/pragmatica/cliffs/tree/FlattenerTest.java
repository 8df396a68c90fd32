package org.pragmatica.cliffs.tree;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.pragmatica.cliffs.call.CallMatch;
import org.pragmatica.cliffs.call.MatchContext;
import org.pragmatica.cliffs.error.MatchFailure;
import org.pragmatica.cliffs.grammar.CompilerConfig;
import org.pragmatica.cliffs.grammar.GrammarParser;
import org.pragmatica.cliffs.grammar.SimplifyMode;
import org.pragmatica.cliffs.match.NodeMatcher;
import org.pragmatica.cliffs.tree.SyntaxNode.Literal;
import org.pragmatica.cliffs.tree.SyntaxNode.OptionalSequence;
import org.pragmatica.cliffs.tree.SyntaxNode.Sequence;
import org.pragmatica.cliffs.tree.SyntaxNode.UnorderedGroup;
import org.pragmatica.cliffs.tree.SyntaxNode.VariantGroup;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FlattenerTest {
    private static final CompilerConfig RAW = CompilerConfig.DEFAULT.withSimplifyMode(SimplifyMode.NO);
    private static final NodeMatcher MATCHER = new NodeMatcher(MatchContext.DEFAULT);

    private static final Literal A = Literal.of("a");
    private static final Literal B = Literal.of("b");
    private static final Literal C = Literal.of("c");

    @Test
    void flatten_nestedSequences_areSpliced() {
        var tree = Sequence.of(A, Sequence.of(B, Sequence.of(C)));

        assertEquals(Sequence.of(A, B, C), Flattener.flatten(tree));
    }

    @Test
    void flatten_singleChildSequence_collapses() {
        assertEquals(A, Flattener.flatten(Sequence.of(Sequence.of(A))));
    }

    @Test
    void flatten_singleChildUnorderedGroup_collapses() {
        assertEquals(Sequence.of(A, B), Flattener.flatten(Sequence.of(A, UnorderedGroup.of(B))));
    }

    @Test
    void flatten_sequenceInsideOptional_isSpliced() {
        var tree = Sequence.of(A, OptionalSequence.of(Sequence.of(B, C)));

        assertEquals(Sequence.of(A, OptionalSequence.of(B, C)), Flattener.flatten(tree));
    }

    @Test
    void flatten_sequenceInsideUnorderedGroup_isKept() {
        var tree = UnorderedGroup.of(A, Sequence.of(B, C));

        assertEquals(tree, Flattener.flatten(tree));
    }

    @Test
    void flatten_singleVariantGroup_becomesItsSequence() {
        var tree = Sequence.of(A, VariantGroup.of(Sequence.of(B, C)));

        assertEquals(Sequence.of(A, B, C), Flattener.flatten(tree));
    }

    @Test
    void flatten_variantOfBareGroup_isUnpacked() {
        var inner = VariantGroup.of(Sequence.of(A), Sequence.of(B)).withParenthesized(false);
        var tree = VariantGroup.of(Sequence.of(inner), Sequence.of(C));

        var expected = new VariantGroup(List.of(Sequence.of(A), Sequence.of(B), Sequence.of(C)),
                                        Optional.empty(),
                                        false,
                                        false);
        assertEquals(expected, Flattener.flatten(tree));
    }

    @Test
    void flatten_variantOfIdentifiedGroup_isKept() {
        var inner = VariantGroup.of(Sequence.of(A), Sequence.of(B)).withIdentifier("inner", false);
        var tree = VariantGroup.of(Sequence.of(inner), Sequence.of(C));

        var flat = assertInstanceOf(VariantGroup.class, Flattener.flatten(tree));

        assertEquals(2, flat.variants().size());
        assertEquals(inner, flat.variants().get(0).children().get(0));
    }

    @Test
    void flatten_groupParentheses_dependOnSiblingsAndIdentifier() {
        var sole = Flattener.flatten(VariantGroup.of(Sequence.of(A), Sequence.of(B)));
        var withSibling = Flattener.flatten(Sequence.of(C, VariantGroup.of(Sequence.of(A), Sequence.of(B))
                                                                      .withParenthesized(false)));
        var identified = Flattener.flatten(VariantGroup.of(Sequence.of(A), Sequence.of(B))
                                                       .withIdentifier("id", false));

        assertFalse(((VariantGroup) sole).parenthesized());
        assertTrue(((VariantGroup) withSibling.children().get(1)).parenthesized());
        assertTrue(((VariantGroup) identified).parenthesized());
    }

    @Test
    void flatten_inheritedIdentifier_staysUnparenthesized() {
        var group = VariantGroup.of(Sequence.of(A), Sequence.of(B)).withIdentifier("which", true);
        var tree = new OptionalSequence(List.of(group), Optional.empty());

        var flat = (OptionalSequence) Flattener.flatten(tree);

        assertFalse(((VariantGroup) flat.children().get(0)).parenthesized());
    }

    @Test
    void flatten_soleGroupOfIdentifiedOptional_keepsParentheses() {
        var group = VariantGroup.of(Sequence.of(A, B), Sequence.of(C));
        var tree = new OptionalSequence(List.of(group), Optional.of("which"));

        var flat = (OptionalSequence) Flattener.flatten(tree);

        assertEquals(Optional.of("which"), flat.identifier());
        assertTrue(((VariantGroup) flat.children().get(0)).parenthesized());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '=', value = {
        "set [loud] alarm at <time: int> (am|pm) = set loud alarm at 7 pm",
        "set [loud] alarm at <time: int> (am|pm) = set alarm at 7 xm",
        "a (b (c d)) [e (f)] = a b c d e f",
        "a (b (c d)) [e (f)] = a b c d e",
        "((a|b)|(c|d)) e = d e",
        "[(a b|c d)]:which = c d",
        "[(a b|c d)]:which = c x",
        "{(a b) [c] (d|e)} = e a b c",
        "{(a b) [c] (d|e)} = a b",
        "(x (y|z)|w) <rest...> = x z 1 2",
        "(a|b):id ((c)) = b c d",
        "go (north|south) [quickly|slowly] = go nort"
    })
    void flatten_keepsMatchOutcomeAndScore(String grammar, String call) {
        var raw = GrammarParser.parse(grammar, RAW);

        assertEquals(outcome(raw, call), outcome(Flattener.flatten(raw), call));
    }

    private static String outcome(SyntaxNode root, String call) {
        var match = CallMatch.of(call);
        try{
            MATCHER.match(root, match);
            return "matched " + match.score() + " leaving " + match.remaining().size();
        } catch (MatchFailure failure) {
            return failure.getClass().getSimpleName() + " " + match.score();
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "set [loud] alarm at <time: int> (am|pm)",
        "a (b (c d)) [e (f)]",
        "((a|b)|(c|d)) e",
        "[(a b|c d)]:which",
        "{(a b) [c] (d|e)}",
        "(x (y|z)|w) <rest...>",
        "(a|b):id ((c))"
    })
    void flatten_isIdempotent(String grammar) {
        var raw = GrammarParser.parse(grammar, RAW);
        var once = Flattener.flatten(raw);

        assertEquals(once, Flattener.flatten(once));
    }
}
