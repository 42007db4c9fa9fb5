package me.christianrobert.ilcodegen.target.cpp;

import java.util.List;
import java.util.Objects;

/**
 * A C++ type reference: a (possibly qualified) name with template arguments and the
 * const / reference / pointer qualifiers.
 *
 * <pre>
 * new CppType("std::vector", List.of(CppType.of("uint8_t"))).asConstReference()
 *     → const std::vector&lt;uint8_t&gt;&amp;
 * </pre>
 */
public final class CppType {

    public static final CppType VOID = of("void");
    public static final CppType AUTO = of("auto");
    public static final CppType BOOL = of("bool");
    public static final CppType SIZE_T = of("size_t");
    public static final CppType INT32 = of("int32_t");
    public static final CppType UINT8 = of("uint8_t");
    public static final CppType UINT32 = of("uint32_t");
    public static final CppType STRING = of("std::string");

    private final String name;
    private final List<CppType> typeArguments;
    private final boolean isConst;
    private final boolean reference;
    private final boolean pointer;

    public CppType(String name, List<CppType> typeArguments) {
        this(name, typeArguments, false, false, false);
    }

    private CppType(String name, List<CppType> typeArguments, boolean isConst, boolean reference, boolean pointer) {
        this.name = Objects.requireNonNull(name, "name");
        this.typeArguments = typeArguments == null ? List.of() : List.copyOf(typeArguments);
        this.isConst = isConst;
        this.reference = reference;
        this.pointer = pointer;
    }

    public static CppType of(String name) {
        return new CppType(name, List.of());
    }

    public static CppType vectorOf(CppType element) {
        return new CppType("std::vector", List.of(element.unqualified()));
    }

    public CppType asConst() {
        return new CppType(name, typeArguments, true, reference, pointer);
    }

    public CppType asReference() {
        return new CppType(name, typeArguments, isConst, true, pointer);
    }

    public CppType asConstReference() {
        return new CppType(name, typeArguments, true, true, pointer);
    }

    public CppType asPointer() {
        return new CppType(name, typeArguments, isConst, reference, true);
    }

    /**
     * The same type without const, reference and pointer qualifiers.
     */
    public CppType unqualified() {
        if (!isConst && !reference && !pointer) {
            return this;
        }
        return new CppType(name, typeArguments, false, false, false);
    }

    public String getName() {
        return name;
    }

    public List<CppType> getTypeArguments() {
        return typeArguments;
    }

    public boolean isConst() {
        return isConst;
    }

    public boolean isReference() {
        return reference;
    }

    public boolean isPointer() {
        return pointer;
    }

    public boolean isVector() {
        return name.equals("std::vector") && typeArguments.size() == 1;
    }

    public boolean isString() {
        return name.equals("std::string");
    }

    public boolean isVoid() {
        return name.equals("void") && !pointer;
    }

    /**
     * Element type of a vector, or null.
     */
    public CppType getElementType() {
        return isVector() ? typeArguments.get(0) : null;
    }

    /**
     * Class types are passed as arguments by (const) reference.
     */
    public boolean isPassedByReference() {
        return isVector() || isString() || name.startsWith("std::map") || name.startsWith("std::set")
                || (!name.contains("::") && !name.endsWith("_t") && Character.isUpperCase(name.charAt(0)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CppType)) {
            return false;
        }
        CppType other = (CppType) o;
        return isConst == other.isConst
                && reference == other.reference
                && pointer == other.pointer
                && name.equals(other.name)
                && typeArguments.equals(other.typeArguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeArguments, isConst, reference, pointer);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (isConst) {
            sb.append("const ");
        }
        sb.append(name);
        if (!typeArguments.isEmpty()) {
            sb.append('<');
            for (int i = 0; i < typeArguments.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(typeArguments.get(i));
            }
            sb.append('>');
        }
        if (pointer) {
            sb.append('*');
        }
        if (reference) {
            sb.append('&');
        }
        return sb.toString();
    }
}
