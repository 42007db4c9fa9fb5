package me.christianrobert.ilcodegen.codegen.type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, target-neutral description of an IL type.
 *
 * <p>A descriptor is either a primitive ({@link PrimitiveKind}), a user-defined type reference
 * (kind {@link PrimitiveKind#USER}, optionally with generic arguments) or an array, which always
 * carries its element type. Width and signedness come from the kind and cannot disagree.</p>
 *
 * <p>Annotation strings are parsed with {@link #parse(String)}:</p>
 * <pre>
 * uint32              → uint32
 * uint8[]             → array of uint8
 * Uint32Array         → array of uint32
 * Array&lt;uint16&gt;       → array of uint16
 * Map&lt;string,uint32&gt;  → user type Map with two arguments
 * uint32?             → nullable uint32
 * </pre>
 */
public final class TypeDescriptor {

    public static final TypeDescriptor UINT8 = primitive(PrimitiveKind.UINT8);
    public static final TypeDescriptor UINT16 = primitive(PrimitiveKind.UINT16);
    public static final TypeDescriptor UINT32 = primitive(PrimitiveKind.UINT32);
    public static final TypeDescriptor UINT64 = primitive(PrimitiveKind.UINT64);
    public static final TypeDescriptor INT32 = primitive(PrimitiveKind.INT32);
    public static final TypeDescriptor INT64 = primitive(PrimitiveKind.INT64);
    public static final TypeDescriptor FLOAT64 = primitive(PrimitiveKind.FLOAT64);
    public static final TypeDescriptor BOOL = primitive(PrimitiveKind.BOOL);
    public static final TypeDescriptor STRING = primitive(PrimitiveKind.STRING);
    public static final TypeDescriptor VOID = primitive(PrimitiveKind.VOID);
    public static final TypeDescriptor ANY = primitive(PrimitiveKind.ANY);
    public static final TypeDescriptor BYTE_ARRAY = arrayOf(UINT8);

    private static final Map<String, PrimitiveKind> TYPED_ARRAYS = Map.of(
            "Uint8Array", PrimitiveKind.UINT8,
            "Uint8ClampedArray", PrimitiveKind.UINT8,
            "Uint16Array", PrimitiveKind.UINT16,
            "Uint32Array", PrimitiveKind.UINT32,
            "Int8Array", PrimitiveKind.INT8,
            "Int16Array", PrimitiveKind.INT16,
            "Int32Array", PrimitiveKind.INT32,
            "Float32Array", PrimitiveKind.FLOAT32,
            "Float64Array", PrimitiveKind.FLOAT64,
            "BigUint64Array", PrimitiveKind.UINT64);

    private final PrimitiveKind kind;
    private final String name;
    private final TypeDescriptor elementType;
    private final boolean array;
    private final boolean nullable;
    private final List<TypeDescriptor> typeArguments;

    private TypeDescriptor(PrimitiveKind kind, String name, boolean array, TypeDescriptor elementType,
                           boolean nullable, List<TypeDescriptor> typeArguments) {
        if (array && elementType == null) {
            throw new IllegalArgumentException("Array type descriptor requires an element type");
        }
        if (!array && elementType != null) {
            throw new IllegalArgumentException("Only array type descriptors carry an element type");
        }
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = name;
        this.array = array;
        this.elementType = elementType;
        this.nullable = nullable;
        this.typeArguments = typeArguments == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(typeArguments));
    }

    public static TypeDescriptor primitive(PrimitiveKind kind) {
        if (kind == PrimitiveKind.USER) {
            throw new IllegalArgumentException("User types need a name, use TypeDescriptor.user(name)");
        }
        return new TypeDescriptor(kind, kind.getCanonicalName(), false, null, false, null);
    }

    public static TypeDescriptor user(String name) {
        return user(name, Collections.emptyList());
    }

    public static TypeDescriptor user(String name, List<TypeDescriptor> typeArguments) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("User type name cannot be null or empty");
        }
        return new TypeDescriptor(PrimitiveKind.USER, name, false, null, false, typeArguments);
    }

    /**
     * Array of the given element type.
     *
     * @throws IllegalArgumentException if {@code elementType} is null
     */
    public static TypeDescriptor arrayOf(TypeDescriptor elementType) {
        return new TypeDescriptor(PrimitiveKind.USER, null, true, elementType, false, null);
    }

    /**
     * Unsigned integer descriptor of the given width; 32 bits for unsupported widths.
     */
    public static TypeDescriptor unsignedOfWidth(int bits) {
        return primitive(PrimitiveKind.unsignedOfWidth(bits));
    }

    /**
     * Parses a type annotation.
     *
     * @param annotation annotation text, may be null
     * @return descriptor, or null for null/blank input
     */
    public static TypeDescriptor parse(String annotation) {
        if (annotation == null || annotation.trim().isEmpty()) {
            return null;
        }
        String text = annotation.trim();

        int union = indexOfTopLevel(text, '|');
        if (union >= 0) {
            return parseUnion(text);
        }
        if (text.endsWith("?")) {
            TypeDescriptor inner = parse(text.substring(0, text.length() - 1));
            return inner == null ? null : inner.withNullable(true);
        }
        if (text.endsWith("[]")) {
            TypeDescriptor element = parse(text.substring(0, text.length() - 2));
            return element == null ? null : arrayOf(element);
        }

        PrimitiveKind typedArray = TYPED_ARRAYS.get(text);
        if (typedArray != null) {
            return arrayOf(primitive(typedArray));
        }

        int open = text.indexOf('<');
        if (open > 0 && text.endsWith(">")) {
            String base = text.substring(0, open).trim();
            List<TypeDescriptor> args = new ArrayList<>();
            for (String part : splitTopLevel(text.substring(open + 1, text.length() - 1))) {
                TypeDescriptor arg = parse(part);
                if (arg != null) {
                    args.add(arg);
                }
            }
            if ((base.equals("Array") || base.equals("ReadonlyArray")) && args.size() == 1) {
                return arrayOf(args.get(0));
            }
            return user(base, args);
        }

        PrimitiveKind kind = PrimitiveKind.fromName(text);
        if (kind != null) {
            return primitive(kind);
        }
        return user(text);
    }

    // "uint8[] | null" → nullable uint8[]; other unions collapse to their first member
    private static TypeDescriptor parseUnion(String text) {
        boolean nullable = false;
        TypeDescriptor first = null;
        for (String part : splitTopLevel(text, '|')) {
            String trimmed = part.trim();
            if (trimmed.equals("null") || trimmed.equals("undefined")) {
                nullable = true;
            } else if (first == null) {
                first = parse(trimmed);
            }
        }
        if (first == null) {
            return ANY;
        }
        return nullable ? first.withNullable(true) : first;
    }

    private static int indexOfTopLevel(String text, char separator) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
            } else if (c == separator && depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private static List<String> splitTopLevel(String text) {
        return splitTopLevel(text, ',');
    }

    private static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    public TypeDescriptor withNullable(boolean value) {
        if (value == nullable) {
            return this;
        }
        return new TypeDescriptor(kind, name, array, elementType, value, typeArguments);
    }

    public PrimitiveKind getKind() {
        return kind;
    }

    /**
     * Canonical primitive name or user type name; null for arrays.
     */
    public String getName() {
        return name;
    }

    public boolean isArray() {
        return array;
    }

    public TypeDescriptor getElementType() {
        return elementType;
    }

    public boolean isNullable() {
        return nullable;
    }

    public List<TypeDescriptor> getTypeArguments() {
        return typeArguments;
    }

    public boolean isUser() {
        return !array && kind == PrimitiveKind.USER;
    }

    public boolean isIntegral() {
        return !array && kind.isIntegral();
    }

    public boolean isFloating() {
        return !array && kind.isFloating();
    }

    public boolean isNumeric() {
        return !array && kind.isNumeric();
    }

    public boolean isBool() {
        return !array && kind == PrimitiveKind.BOOL;
    }

    public boolean isString() {
        return !array && kind == PrimitiveKind.STRING;
    }

    public boolean isVoid() {
        return !array && kind == PrimitiveKind.VOID;
    }

    public boolean isByteArray() {
        return array && elementType.kind == PrimitiveKind.UINT8 && !elementType.array;
    }

    public int getBits() {
        return array ? 0 : kind.getBits();
    }

    public boolean isSigned() {
        return !array && kind.isSigned();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TypeDescriptor that = (TypeDescriptor) o;
        return array == that.array
                && nullable == that.nullable
                && kind == that.kind
                && Objects.equals(name, that.name)
                && Objects.equals(elementType, that.elementType)
                && typeArguments.equals(that.typeArguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, array, elementType, nullable, typeArguments);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (array) {
            sb.append(elementType).append("[]");
        } else {
            sb.append(name);
            if (!typeArguments.isEmpty()) {
                sb.append('<');
                for (int i = 0; i < typeArguments.size(); i++) {
                    if (i > 0) {
                        sb.append(',');
                    }
                    sb.append(typeArguments.get(i));
                }
                sb.append('>');
            }
        }
        if (nullable) {
            sb.append('?');
        }
        return sb.toString();
    }
}
