package org.pragmatica.cliffs.grammar;

import org.pragmatica.cliffs.tree.SourceSpan;

/**
 * Token types for the grammar lexer.
 */
public sealed interface GrammarToken {
    SourceSpan span();

    /**
     * Text of the token as written in the grammar.
     */
    String text();

    // Words: literals, parameter names, type names, identifiers
    record Symbol(SourceSpan span, String text) implements GrammarToken {}

    // Parameters
    record LAngle(SourceSpan span) implements GrammarToken {
        public String text() { return "<"; }
    }

    record RAngle(SourceSpan span) implements GrammarToken {
        public String text() { return ">"; }
    }

    record Colon(SourceSpan span) implements GrammarToken {
        public String text() { return ":"; }
    }

    record Ellipsis(SourceSpan span) implements GrammarToken {
        public String text() { return "..."; }
    }

    record Star(SourceSpan span) implements GrammarToken {
        public String text() { return "*"; }
    }

    // Groups
    record Pipe(SourceSpan span) implements GrammarToken {
        public String text() { return "|"; }
    }

    record LParen(SourceSpan span) implements GrammarToken {
        public String text() { return "("; }
    }

    record RParen(SourceSpan span) implements GrammarToken {
        public String text() { return ")"; }
    }

    record LBracket(SourceSpan span) implements GrammarToken {
        public String text() { return "["; }
    }

    record RBracket(SourceSpan span) implements GrammarToken {
        public String text() { return "]"; }
    }

    record LBrace(SourceSpan span) implements GrammarToken {
        public String text() { return "{"; }
    }

    record RBrace(SourceSpan span) implements GrammarToken {
        public String text() { return "}"; }
    }

    // Literal modifiers
    record Caret(SourceSpan span) implements GrammarToken {
        public String text() { return "^"; }
    }

    record Tilde(SourceSpan span) implements GrammarToken {
        public String text() { return "~"; }
    }

    record Eof(SourceSpan span) implements GrammarToken {
        public String text() { return "end of input"; }
    }
}
