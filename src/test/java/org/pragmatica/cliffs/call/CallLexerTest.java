package org.pragmatica.cliffs.call;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CallLexerTest {

    private record Lexeme(String value, int start, int end) {}

    private static void assertTokens(String call, Lexeme... expected) {
        var actual = CallLexer.tokenize(call)
                              .stream()
                              .map(token -> new Lexeme(token.valueText(), token.span().start(), token.span().end()))
                              .toList();
        assertEquals(List.of(expected), actual);
    }

    @Test
    void tokenize_emptyCall_producesNothing() {
        assertTokens("");
        assertTokens("   ");
    }

    @Test
    void tokenize_plainWords_splitOnWhitespace() {
        assertTokens("foo", new Lexeme("foo", 0, 3));
        assertTokens("  foo  ", new Lexeme("foo", 2, 5));
        assertTokens("foo bar baz", new Lexeme("foo", 0, 3), new Lexeme("bar", 4, 7), new Lexeme("baz", 8, 11));
        assertTokens("  foo  bar\tbaz  ", new Lexeme("foo", 2, 5), new Lexeme("bar", 7, 10), new Lexeme("baz", 11, 14));
    }

    @Test
    void tokenize_quotedToken_keepsWhitespace() {
        assertTokens("\"foo\"", new Lexeme("foo", 0, 5));
        assertTokens("\"  foo  \"", new Lexeme("  foo  ", 0, 9));
        assertTokens("  '  foo  '  ", new Lexeme("  foo  ", 2, 11));
    }

    @Test
    void tokenize_quotedToken_textKeepsQuotes() {
        var token = CallLexer.tokenize("say \"hello world\"").get(1);

        assertEquals("\"hello world\"", token.text());
        assertEquals("hello world", token.value());
    }

    @Test
    void tokenize_adjacentQuotedTokens_areSeparate() {
        assertTokens("\"foo\" \"bar\"\"baz\"",
                     new Lexeme("foo", 0, 5),
                     new Lexeme("bar", 6, 11),
                     new Lexeme("baz", 11, 16));
    }

    @Test
    void tokenize_quoteAfterPlainRun_startsNewToken() {
        assertTokens("foo\"bar baz\"", new Lexeme("foo", 0, 3), new Lexeme("bar baz", 3, 12));
    }

    @Test
    void tokenize_otherQuoteInsideQuotedToken_isContent() {
        assertTokens("\"it's\"", new Lexeme("it's", 0, 6));
    }

    @Test
    void tokenize_escapedQuoteOutsideQuotes_keepsBackslash() {
        assertTokens("\\\"", new Lexeme("\\\"", 0, 2));
        assertTokens("  \\\"  ", new Lexeme("\\\"", 2, 4));
    }

    @Test
    void tokenize_escapedQuoteInsideQuotes_dropsBackslash() {
        assertTokens("\"\\\"\"", new Lexeme("\"", 0, 4));
        assertTokens("\"foo \\\"bar\\\"\"", new Lexeme("foo \"bar\"", 0, 13));
    }

    @Test
    void tokenize_escapedBackslash_keepsOne() {
        assertTokens("a\\\\b", new Lexeme("a\\b", 0, 4));
    }

    @Test
    void tokenize_unterminatedQuote_keepsOpeningQuote() {
        assertTokens("\"", new Lexeme("\"", 0, 1));
        assertTokens("foo \"", new Lexeme("foo", 0, 3), new Lexeme("\"", 4, 5));
        assertTokens("\"foo", new Lexeme("\"foo", 0, 4));
        assertTokens("foo \"bar", new Lexeme("foo", 0, 3), new Lexeme("\"bar", 4, 8));
    }

    @Test
    void tokenize_danglingBackslash_isKept() {
        assertTokens("\\", new Lexeme("\\", 0, 1));
        assertTokens("foo\\", new Lexeme("foo\\", 0, 4));
        assertTokens("foo \\", new Lexeme("foo", 0, 3), new Lexeme("\\", 4, 5));
    }

    @Test
    void tokenize_unsupportedEscape_keepsBackslash() {
        assertTokens("\\a", new Lexeme("\\a", 0, 2));
    }

    @Test
    void tokenize_customQuotes_onlyThoseDelimit() {
        var tokens = CallLexer.tokenize("'a b' `c d`", "`");

        assertEquals(List.of("'a", "b'", "c d"), tokens.stream().map(Token::valueText).toList());
    }
}
