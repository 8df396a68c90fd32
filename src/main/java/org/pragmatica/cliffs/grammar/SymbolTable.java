package org.pragmatica.cliffs.grammar;

import org.pragmatica.cliffs.error.GrammarException;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Symbols (parameter names, tail names, group identifiers) used in one syntax specification.
 */
public final class SymbolTable {
    private final Set<String> symbols = new LinkedHashSet<>();

    /**
     * Register a symbol and return the identifier to use for it.
     *
     * @throws GrammarException when the symbol is already taken
     */
    public String register(GrammarToken.Symbol symbol) {
        if (!symbols.add(symbol.text())) {
            throw new GrammarException("Symbol used more than once", symbol.text(), symbol.span().start());
        }
        return symbol.text();
    }
}
