package me.christianrobert.ilcodegen.codegen.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single scope level of the {@link SymbolEnvironment}.
 *
 * <p>Scopes are organized in a stack: class → method → nested block. Each scope has its own
 * symbol table; names are case-sensitive as in the IL.</p>
 */
public class Scope {

    public enum Kind {
        FUNCTION,
        CLASS,
        BLOCK
    }

    private final Kind kind;
    private final String name;
    private final Map<String, SymbolInfo> symbols = new LinkedHashMap<>();

    public Scope(Kind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    public void declare(SymbolInfo symbol) {
        symbols.put(symbol.getName(), symbol);
    }

    public SymbolInfo lookupLocal(String symbolName) {
        return symbols.get(symbolName);
    }

    public boolean isDeclared(String symbolName) {
        return symbols.containsKey(symbolName);
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public Map<String, SymbolInfo> getSymbols() {
        return Collections.unmodifiableMap(symbols);
    }

    @Override
    public String toString() {
        return "Scope{" +
                "kind=" + kind +
                ", name='" + name + '\'' +
                ", symbols=" + symbols.size() +
                '}';
    }
}
