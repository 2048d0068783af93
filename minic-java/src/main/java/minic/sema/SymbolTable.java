package minic.sema;

import minic.types.PrimitiveType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Variable name to type tag. A single flat scope: the language has no nested declarations.
 */
public final class SymbolTable {
    private final Map<String, String> symbols = new LinkedHashMap<>();

    /** Starts from a copy of {@code predeclared}; the argument is never modified. */
    public SymbolTable(Map<String, String> predeclared) {
        symbols.putAll(predeclared);
    }

    /** Binds or rebinds {@code name}. */
    public void define(String name, PrimitiveType type) {
        symbols.put(name, type.tag());
    }

    public boolean isDefined(String name) {
        return symbols.containsKey(name);
    }

    public Map<String, String> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
    }
}
