package me.christianrobert.ilcodegen.target.delphi;

import me.christianrobert.ilcodegen.codegen.type.PrimitiveKind;
import me.christianrobert.ilcodegen.codegen.type.TargetTypeTable;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * IL → Delphi type mapping. Byte arrays become {@code TBytes}, other arrays
 * {@code TArray<T>}; {@code void} is the procedure marker {@link DelphiType#VOID}.
 */
public class DelphiTypeTable extends TargetTypeTable<DelphiType> {

    private static final Map<PrimitiveKind, DelphiType> PRIMITIVES = new EnumMap<>(PrimitiveKind.class);

    static {
        PRIMITIVES.put(PrimitiveKind.UINT8, DelphiType.BYTE);
        PRIMITIVES.put(PrimitiveKind.UINT16, DelphiType.WORD);
        PRIMITIVES.put(PrimitiveKind.UINT32, DelphiType.CARDINAL);
        PRIMITIVES.put(PrimitiveKind.UINT64, DelphiType.UINT64);
        PRIMITIVES.put(PrimitiveKind.INT8, DelphiType.of("ShortInt"));
        PRIMITIVES.put(PrimitiveKind.INT16, DelphiType.of("SmallInt"));
        PRIMITIVES.put(PrimitiveKind.INT32, DelphiType.INTEGER);
        PRIMITIVES.put(PrimitiveKind.INT64, DelphiType.INT64);
        PRIMITIVES.put(PrimitiveKind.FLOAT32, DelphiType.of("Single"));
        PRIMITIVES.put(PrimitiveKind.FLOAT64, DelphiType.DOUBLE);
        PRIMITIVES.put(PrimitiveKind.BOOL, DelphiType.BOOLEAN);
        PRIMITIVES.put(PrimitiveKind.STRING, DelphiType.STRING);
        PRIMITIVES.put(PrimitiveKind.VOID, DelphiType.VOID);
        PRIMITIVES.put(PrimitiveKind.ANY, DelphiType.VARIANT);
    }

    private static final Set<String> ORDINALS = Set.of(
            "Byte", "Word", "Cardinal", "UInt64", "ShortInt", "SmallInt", "Integer", "Int64", "Boolean", "Char");

    @Override
    protected DelphiType primitive(PrimitiveKind kind) {
        DelphiType type = PRIMITIVES.get(kind);
        return type != null ? type : DelphiType.CARDINAL;
    }

    @Override
    protected DelphiType userType(String name, List<DelphiType> typeArguments) {
        switch (name) {
            case "Map" -> {
                if (typeArguments.size() == 2) {
                    return DelphiType.of("TDictionary<" + typeArguments.get(0) + ", " + typeArguments.get(1) + ">");
                }
                return DelphiType.of("TDictionary<Variant, Variant>");
            }
            case "Error" -> {
                return DelphiType.EXCEPTION;
            }
            default -> {
                if (typeArguments.isEmpty()) {
                    return DelphiType.of(DelphiNames.type(name));
                }
                StringBuilder sb = new StringBuilder(DelphiNames.type(name)).append('<');
                for (int i = 0; i < typeArguments.size(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    sb.append(typeArguments.get(i));
                }
                return DelphiType.of(sb.append('>').toString());
            }
        }
    }

    @Override
    protected DelphiType arrayOf(DelphiType element, TypeDescriptor elementType) {
        return DelphiType.arrayOf(element);
    }

    /**
     * Units a type reference needs in the uses clause.
     */
    public static Set<String> unitsFor(DelphiType type) {
        Set<String> units = new TreeSet<>();
        String name = type.getName();
        if (name.equals("TBytes") || name.equals("Exception")) {
            units.add("SysUtils");
        } else if (name.startsWith("TDictionary<")) {
            units.add("Generics.Collections");
        }
        if (type.getElementType() != null) {
            units.addAll(unitsFor(type.getElementType()));
        }
        return units;
    }

    /**
     * Whether values of the type may label a {@code case} arm and drive a {@code for} loop.
     */
    public static boolean isOrdinal(DelphiType type) {
        return type != null && ORDINALS.contains(type.getName());
    }
}
