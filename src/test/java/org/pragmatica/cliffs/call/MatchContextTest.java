package org.pragmatica.cliffs.call;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class MatchContextTest {

    @Test
    void defaults_matchDocumentedPolicy() {
        var context = MatchContext.DEFAULT;

        assertThat(context.typeNames()).containsExactly("str", "int", "float", "bool");
        assertEquals(0.75, context.literalThreshold());
        assertEquals(0.25, context.fuzzyScore());
        assertTrue(context.caseSensitive());
        assertEquals(UnorderedStrategy.GREEDY, context.unorderedStrategy());
    }

    @Test
    void builtInTypes_convertText() {
        var context = MatchContext.DEFAULT;

        assertEquals("x y", context.type("str").orElseThrow().parse("x y"));
        assertEquals(42, context.type("int").orElseThrow().parse(" 42 "));
        assertEquals(2.5, context.type("float").orElseThrow().parse("2.5"));
        assertEquals(Boolean.TRUE, context.type("bool").orElseThrow().parse("yes"));
    }

    @Test
    void intType_rejectsNonNumbers() {
        var type = MatchContext.DEFAULT.type("int").orElseThrow();

        assertThrows(NumberFormatException.class, () -> type.parse("seven"));
        assertThrows(NumberFormatException.class, () -> type.parse("7.5"));
    }

    @Test
    void registeredType_isAvailable() {
        var context = MatchContext.builder()
                                  .type("upper", text -> text.toUpperCase())
                                  .build();

        assertTrue(context.hasType("upper"));
        assertEquals("ABC", context.type("upper").orElseThrow().parse("abc"));
        assertFalse(MatchContext.DEFAULT.hasType("upper"));
        assertEquals(Optional.empty(), MatchContext.DEFAULT.type("upper"));
    }

    @Test
    void toBuilder_keepsSettingsAndTypes() {
        var context = MatchContext.builder()
                                  .type("upper", text -> text.toUpperCase())
                                  .caseSensitive(false)
                                  .literalThreshold(0.9)
                                  .unorderedStrategy(UnorderedStrategy.PERMUTATION)
                                  .build();

        var copy = context.toBuilder().fuzzyScore(0.1).build();

        assertTrue(copy.hasType("upper"));
        assertFalse(copy.caseSensitive());
        assertEquals(0.9, copy.literalThreshold());
        assertEquals(0.1, copy.fuzzyScore());
        assertEquals(UnorderedStrategy.PERMUTATION, copy.unorderedStrategy());
        assertEquals(0.25, context.fuzzyScore());
    }

    @Test
    void builder_rejectsOutOfRangeScores() {
        var builder = MatchContext.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.literalThreshold(0.0));
        assertThrows(IllegalArgumentException.class, () -> builder.literalThreshold(1.5));
        assertThrows(IllegalArgumentException.class, () -> builder.fuzzyScore(1.0));
        assertThrows(NullPointerException.class, () -> builder.type("x", null));
    }
}
