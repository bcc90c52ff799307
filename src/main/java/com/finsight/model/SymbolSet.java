package com.finsight.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, de-duplicated set of normalized symbols. First occurrence wins.
 */
public final class SymbolSet implements Iterable<Symbol> {
    private final List<Symbol> symbols;

    private SymbolSet(List<Symbol> symbols) {
        this.symbols = Collections.unmodifiableList(symbols);
    }

    public static SymbolSet of(Collection<String> raw) {
        Set<Symbol> seen = new LinkedHashSet<>();
        if (raw != null) {
            for (String token : raw) {
                if (token == null || token.trim().isEmpty()) {
                    continue;
                }
                seen.add(Symbol.of(token));
            }
        }
        return new SymbolSet(new ArrayList<>(seen));
    }

    public static SymbolSet of(String... raw) {
        return of(raw == null ? List.of() : List.of(raw));
    }

    public static SymbolSet ofSymbols(Collection<Symbol> symbols) {
        Set<Symbol> seen = new LinkedHashSet<>();
        if (symbols != null) {
            for (Symbol symbol : symbols) {
                if (symbol != null) {
                    seen.add(symbol);
                }
            }
        }
        return new SymbolSet(new ArrayList<>(seen));
    }

    public List<Symbol> asList() {
        return symbols;
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    public boolean contains(Symbol symbol) {
        return symbols.contains(symbol);
    }

    @Override
    public Iterator<Symbol> iterator() {
        return symbols.iterator();
    }

    @Override
    public String toString() {
        List<String> out = new ArrayList<>(symbols.size());
        for (Symbol symbol : symbols) {
            out.add(symbol.value);
        }
        return String.join(",", out);
    }
}
