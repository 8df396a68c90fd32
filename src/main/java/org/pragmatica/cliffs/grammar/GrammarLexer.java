package org.pragmatica.cliffs.grammar;

import org.pragmatica.cliffs.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for command syntax specifications.
 *
 * <p>Produces symbols (runs of non-punctuation, non-whitespace characters) and punctuation tokens.
 * Whitespace only separates symbols. There is no escaping, and lexing never fails: the parser
 * decides what is legal.
 */
public final class GrammarLexer {
    private static final int MAX_INPUT_SIZE = 100_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 16;
    private static final String ELLIPSIS = "...";

    private final String input;
    private final List<GrammarToken> tokens;
    private final StringBuilder symbol;
    private int symbolStart;
    private int pos;

    private GrammarLexer(String input) {
        this.input = input;
        this.tokens = new ArrayList<>();
        this.symbol = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        this.symbolStart = 0;
        this.pos = 0;
    }

    public static List<GrammarToken> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Grammar input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new GrammarLexer(input).tokenizeAll();
    }

    private List<GrammarToken> tokenizeAll() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                flushSymbol();
                pos++ ;
            }else if (input.startsWith(ELLIPSIS, pos)) {
                flushSymbol();
                tokens.add(new GrammarToken.Ellipsis(SourceSpan.of(pos, pos + ELLIPSIS.length())));
                pos += ELLIPSIS.length();
            }else if (isPunctuation(c)) {
                flushSymbol();
                tokens.add(scanPunctuation(c, SourceSpan.of(pos, pos + 1)));
                pos++ ;
            }else {
                if (symbol.length() == 0) {
                    symbolStart = pos;
                }
                symbol.append(c);
                pos++ ;
            }
        }
        flushSymbol();
        tokens.add(new GrammarToken.Eof(SourceSpan.at(pos)));
        return tokens;
    }

    private void flushSymbol() {
        if (symbol.length() > 0) {
            tokens.add(new GrammarToken.Symbol(SourceSpan.of(symbolStart, pos), symbol.toString()));
            symbol.setLength(0);
        }
    }

    private static boolean isPunctuation(char c) {
        return "<>:|()[]{}*^~".indexOf(c) >= 0;
    }

    private static GrammarToken scanPunctuation(char c, SourceSpan span) {
        return switch (c) {
            case'<' -> new GrammarToken.LAngle(span);
            case'>' -> new GrammarToken.RAngle(span);
            case':' -> new GrammarToken.Colon(span);
            case'|' -> new GrammarToken.Pipe(span);
            case'(' -> new GrammarToken.LParen(span);
            case')' -> new GrammarToken.RParen(span);
            case'[' -> new GrammarToken.LBracket(span);
            case']' -> new GrammarToken.RBracket(span);
            case'{' -> new GrammarToken.LBrace(span);
            case'}' -> new GrammarToken.RBrace(span);
            case'*' -> new GrammarToken.Star(span);
            case'^' -> new GrammarToken.Caret(span);
            case'~' -> new GrammarToken.Tilde(span);
            default -> throw new IllegalArgumentException("Not a punctuation character: " + c);
        };
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }
}
