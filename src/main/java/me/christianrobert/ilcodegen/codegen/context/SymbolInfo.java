package me.christianrobert.ilcodegen.codegen.context;

import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;

/**
 * Metadata about one declared name.
 *
 * <p>{@code emittedName} is the identifier the target uses for the symbol (after casing
 * conventions and keyword escaping), so later references render consistently with the
 * declaration. For functions, {@code type} is the return type.</p>
 */
public class SymbolInfo {

    private final String name;
    private final String emittedName;
    private final TypeDescriptor type;
    private final SymbolRole role;
    private final boolean isStatic;

    public SymbolInfo(String name, String emittedName, TypeDescriptor type, SymbolRole role, boolean isStatic) {
        this.name = name;
        this.emittedName = emittedName != null ? emittedName : name;
        this.type = type;
        this.role = role;
        this.isStatic = isStatic;
    }

    public SymbolInfo(String name, String emittedName, TypeDescriptor type, SymbolRole role) {
        this(name, emittedName, type, role, false);
    }

    public String getName() {
        return name;
    }

    public String getEmittedName() {
        return emittedName;
    }

    public TypeDescriptor getType() {
        return type;
    }

    public SymbolRole getRole() {
        return role;
    }

    public boolean isStatic() {
        return isStatic;
    }

    @Override
    public String toString() {
        return "SymbolInfo{" +
                "name='" + name + '\'' +
                ", emittedName='" + emittedName + '\'' +
                ", type=" + type +
                ", role=" + role +
                '}';
    }
}
