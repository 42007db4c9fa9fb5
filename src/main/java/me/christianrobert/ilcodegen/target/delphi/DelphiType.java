package me.christianrobert.ilcodegen.target.delphi;

import java.util.Objects;

/**
 * A Delphi type reference. Dynamic arrays remember their element type, so array-aware
 * lowerings ({@code Length}, {@code for..in}, element defaults) can see through
 * {@code TBytes} and {@code TArray<T>}.
 */
public final class DelphiType {

    public static final DelphiType BYTE = of("Byte");
    public static final DelphiType WORD = of("Word");
    public static final DelphiType CARDINAL = of("Cardinal");
    public static final DelphiType UINT64 = of("UInt64");
    public static final DelphiType INTEGER = of("Integer");
    public static final DelphiType INT64 = of("Int64");
    public static final DelphiType DOUBLE = of("Double");
    public static final DelphiType BOOLEAN = of("Boolean");
    public static final DelphiType STRING = of("string");
    public static final DelphiType CHAR = of("Char");
    public static final DelphiType VARIANT = of("Variant");
    public static final DelphiType EXCEPTION = of("Exception");

    /**
     * Return type of a procedure.
     */
    public static final DelphiType VOID = of("");

    private final String name;
    private final DelphiType elementType;

    private DelphiType(String name, DelphiType elementType) {
        this.name = Objects.requireNonNull(name, "name");
        this.elementType = elementType;
    }

    public static DelphiType of(String name) {
        return new DelphiType(name, null);
    }

    /**
     * {@code TBytes} for byte elements, {@code TArray<T>} otherwise.
     */
    public static DelphiType arrayOf(DelphiType element) {
        if (BYTE.equals(element)) {
            return new DelphiType("TBytes", element);
        }
        return new DelphiType("TArray<" + element.getName() + ">", element);
    }

    public String getName() {
        return name;
    }

    public DelphiType getElementType() {
        return elementType;
    }

    public boolean isArray() {
        return elementType != null;
    }

    public boolean isVoid() {
        return name.isEmpty();
    }

    public boolean isString() {
        return name.equals("string");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DelphiType)) {
            return false;
        }
        DelphiType other = (DelphiType) o;
        return name.equals(other.name) && Objects.equals(elementType, other.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, elementType);
    }

    @Override
    public String toString() {
        return name;
    }
}
