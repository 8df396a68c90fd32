package org.pragmatica.cliffs.tree;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.pragmatica.cliffs.Cliffs;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxRendererTest {

    @ParameterizedTest
    @CsvSource(delimiter = '=', value = {
        "set [loud] alarm at <time: int> (am|pm) = set [loud] alarm at <time: int> (am|pm)",
        "(exit|quit)                             = exit|quit",
        "a (b c) d                               = a b c d",
        "[a|b]:which                             = [a|b]:which",
        "(a|b):choice c                          = (a|b):choice c",
        "say <words*>                            = say <words...>",
        "say <text...*>                          = say <text...*>",
        "help^ exit~                             = help^ exit~",
        "{tell time}                             = {tell time}",
        "[loud]:volume alarm                     = [loud]:volume alarm",
        "((a|b)|c)                               = a|b|c"
    })
    void render_compiledSyntax_givesCanonicalForm(String grammar, String canonical) {
        assertEquals(canonical, Cliffs.compile(grammar).render());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "set [loud] alarm at <time: int> (am|pm)",
        "i [don't] like bread",
        "<n: int> times say <what>",
        "[a b|c d]:which e",
        "[(a b|c d)]:which",
        "go (north|south|east|west) [quickly|slowly]",
        "{(a b) [c] (d|e)}",
        "(x (y|z)|w) <rest...*>",
        "(a|b):id [c]:opt"
    })
    void render_thenCompile_givesEqualTree(String grammar) {
        var tree = Cliffs.compile(grammar);

        assertEquals(tree, Cliffs.compile(tree.render()));
    }

    @Test
    void toString_rendersTree() {
        var tree = Cliffs.compile("a [b]");

        assertEquals("a [b]", tree.toString());
    }
}
