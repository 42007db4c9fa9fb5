package me.christianrobert.ilcodegen.target.cpp.ast;

import me.christianrobert.ilcodegen.target.cpp.CppType;

/**
 * A local or namespace-level variable.
 *
 * <pre>
 * uint32_t x = 0;
 * constexpr uint32_t ROUNDS = 10;
 * std::vector&lt;uint8_t&gt; out{};   (value-initialized, no initializer)
 * </pre>
 */
public final class CppVariableDeclaration extends CppNode {

    private final CppType type;
    private final String name;
    private final CppNode initializer;
    private final boolean isConst;
    private final boolean isConstexpr;
    private final boolean valueInitialized;

    public CppVariableDeclaration(CppType type, String name, CppNode initializer, boolean isConst,
                                  boolean isConstexpr, boolean valueInitialized) {
        this.type = type;
        this.name = name;
        this.initializer = initializer;
        this.isConst = isConst;
        this.isConstexpr = isConstexpr;
        this.valueInitialized = valueInitialized;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.VARIABLE_DECLARATION;
    }

    public CppType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public CppNode getInitializer() {
        return initializer;
    }

    public boolean isConst() {
        return isConst;
    }

    public boolean isConstexpr() {
        return isConstexpr;
    }

    /**
     * Renders {@code T x{};} when there is no initializer.
     */
    public boolean isValueInitialized() {
        return valueInitialized;
    }
}
