package org.pragmatica.cliffs.call;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Lexer for command calls.
 *
 * <p>Whitespace separates tokens. Quote characters delimit compound tokens that may contain
 * whitespace: the token text keeps the quotes, the value does not. A backslash escapes a quote or
 * another backslash and is kept literally before any other character. Escaped quotes outside a
 * quoted token keep their backslash. An unterminated quoted token keeps its opening quote in the
 * value.
 */
public final class CallLexer {
    public static final String DEFAULT_QUOTES = "\"'";

    private static final char BACKSLASH = '\\';

    private final String input;
    private final String quotes;
    private final List<Token> tokens;
    private final StringBuilder current;
    private int currentStart;
    private char quote;
    private boolean quoted;
    private boolean escape;

    private CallLexer(String input, String quotes) {
        this.input = input;
        this.quotes = quotes;
        this.tokens = new ArrayList<>();
        this.current = new StringBuilder();
        this.currentStart = 0;
    }

    public static List<Token> tokenize(String call) {
        return tokenize(call, DEFAULT_QUOTES);
    }

    public static List<Token> tokenize(String call, String quotes) {
        checkNotNull(call, "call");
        checkNotNull(quotes, "quotes");
        return new CallLexer(call, quotes).tokenizeAll();
    }

    private List<Token> tokenizeAll() {
        for (int pos = 0; pos < input.length(); pos++ ) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c) && !quoted) {
                escapeDangling();
                flushPlain(pos);
                currentStart = pos + 1;
            }else if (quotes.indexOf(c) >= 0) {
                onQuote(c, pos);
            }else if (c == BACKSLASH) {
                if (escape) {
                    current.append(c);
                    escape = false;
                }else {
                    escape = true;
                }
            }else {
                escapeDangling();
                current.append(c);
            }
        }
        escapeDangling();
        if (quoted) {
            var text = quote + current.toString();
            tokens.add(Token.quoted(text, currentStart, input.length(), text));
        }else {
            flushPlain(input.length());
        }
        return tokens;
    }

    private void onQuote(char c, int pos) {
        if (escape) {
            if (!quoted) {
                current.append(BACKSLASH);
            }
            current.append(c);
            escape = false;
        }else if (!quoted) {
            flushPlain(pos);
            currentStart = pos;
            quote = c;
            quoted = true;
        }else if (quote == c) {
            var value = current.toString();
            tokens.add(Token.quoted(quote + value + quote, currentStart, pos + 1, value));
            current.setLength(0);
            currentStart = pos + 1;
            quoted = false;
        }else {
            // a different quote character inside a quoted token is plain content
            current.append(c);
        }
    }

    // Backslash before a character it cannot escape stays as typed
    private void escapeDangling() {
        if (escape) {
            current.append(BACKSLASH);
            escape = false;
        }
    }

    private void flushPlain(int end) {
        if (current.length() > 0) {
            tokens.add(Token.plain(current.toString(), currentStart, end));
            current.setLength(0);
        }
    }
}
