package me.christianrobert.ilcodegen.codegen.type;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Primitive kinds of the IL type system. Width and signedness are fixed per constant.
 */
public enum PrimitiveKind {

    UINT8("uint8", 8, false, Family.INTEGRAL),
    UINT16("uint16", 16, false, Family.INTEGRAL),
    UINT32("uint32", 32, false, Family.INTEGRAL),
    UINT64("uint64", 64, false, Family.INTEGRAL),
    INT8("int8", 8, true, Family.INTEGRAL),
    INT16("int16", 16, true, Family.INTEGRAL),
    INT32("int32", 32, true, Family.INTEGRAL),
    INT64("int64", 64, true, Family.INTEGRAL),
    FLOAT32("float32", 32, true, Family.FLOATING),
    FLOAT64("float64", 64, true, Family.FLOATING),
    BOOL("bool", 0, false, Family.OTHER),
    STRING("string", 0, false, Family.OTHER),
    VOID("void", 0, false, Family.OTHER),
    ANY("any", 0, false, Family.OTHER),
    USER("", 0, false, Family.OTHER);

    private enum Family {
        INTEGRAL,
        FLOATING,
        OTHER
    }

    private static final Map<String, PrimitiveKind> BY_NAME = new HashMap<>();

    static {
        for (PrimitiveKind kind : values()) {
            if (kind != USER) {
                BY_NAME.put(kind.canonicalName, kind);
            }
        }
        // aliases used by the upstream type pass and by JSDoc-style annotations
        BY_NAME.put("byte", UINT8);
        BY_NAME.put("ushort", UINT16);
        BY_NAME.put("word", UINT16);
        BY_NAME.put("uint", UINT32);
        BY_NAME.put("dword", UINT32);
        BY_NAME.put("number", UINT32);
        BY_NAME.put("ulong", UINT64);
        BY_NAME.put("qword", UINT64);
        BY_NAME.put("sbyte", INT8);
        BY_NAME.put("short", INT16);
        BY_NAME.put("int", INT32);
        BY_NAME.put("long", INT64);
        BY_NAME.put("float", FLOAT32);
        BY_NAME.put("double", FLOAT64);
        BY_NAME.put("boolean", BOOL);
        BY_NAME.put("object", ANY);
        BY_NAME.put("undefined", VOID);
    }

    private final String canonicalName;
    private final int bits;
    private final boolean signed;
    private final Family family;

    PrimitiveKind(String canonicalName, int bits, boolean signed, Family family) {
        this.canonicalName = canonicalName;
        this.bits = bits;
        this.signed = signed;
        this.family = family;
    }

    /**
     * Looks up a canonical name or alias, case-insensitively.
     *
     * @return the kind, or null when the name denotes a user-defined type
     */
    public static PrimitiveKind fromName(String name) {
        if (name == null) {
            return null;
        }
        PrimitiveKind kind = BY_NAME.get(name);
        if (kind == null) {
            kind = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        }
        return kind;
    }

    /**
     * Unsigned integer kind of the given width (8/16/32/64), UINT32 for anything else.
     */
    public static PrimitiveKind unsignedOfWidth(int bits) {
        return switch (bits) {
            case 8 -> UINT8;
            case 16 -> UINT16;
            case 64 -> UINT64;
            default -> UINT32;
        };
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public int getBits() {
        return bits;
    }

    public boolean isSigned() {
        return signed;
    }

    public boolean isIntegral() {
        return family == Family.INTEGRAL;
    }

    public boolean isFloating() {
        return family == Family.FLOATING;
    }

    public boolean isNumeric() {
        return family != Family.OTHER;
    }
}
