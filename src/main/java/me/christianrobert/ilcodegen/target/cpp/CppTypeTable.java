package me.christianrobert.ilcodegen.target.cpp;

import me.christianrobert.ilcodegen.codegen.type.PrimitiveKind;
import me.christianrobert.ilcodegen.codegen.type.TargetTypeTable;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * IL → C++ type mapping. Fixed-width integers come from {@code <cstdint>}, arrays become
 * {@code std::vector<T>}.
 */
public class CppTypeTable extends TargetTypeTable<CppType> {

    private static final Map<PrimitiveKind, String> PRIMITIVES = new EnumMap<>(PrimitiveKind.class);

    static {
        PRIMITIVES.put(PrimitiveKind.UINT8, "uint8_t");
        PRIMITIVES.put(PrimitiveKind.UINT16, "uint16_t");
        PRIMITIVES.put(PrimitiveKind.UINT32, "uint32_t");
        PRIMITIVES.put(PrimitiveKind.UINT64, "uint64_t");
        PRIMITIVES.put(PrimitiveKind.INT8, "int8_t");
        PRIMITIVES.put(PrimitiveKind.INT16, "int16_t");
        PRIMITIVES.put(PrimitiveKind.INT32, "int32_t");
        PRIMITIVES.put(PrimitiveKind.INT64, "int64_t");
        PRIMITIVES.put(PrimitiveKind.FLOAT32, "float");
        PRIMITIVES.put(PrimitiveKind.FLOAT64, "double");
        PRIMITIVES.put(PrimitiveKind.BOOL, "bool");
        PRIMITIVES.put(PrimitiveKind.STRING, "std::string");
        PRIMITIVES.put(PrimitiveKind.VOID, "void");
        PRIMITIVES.put(PrimitiveKind.ANY, "auto");
    }

    private static final Map<String, String> CONTAINERS = Map.of(
            "Map", "std::map",
            "Set", "std::set",
            "Function", "std::function");

    @Override
    protected CppType primitive(PrimitiveKind kind) {
        String name = PRIMITIVES.get(kind);
        return CppType.of(name != null ? name : "uint32_t");
    }

    @Override
    protected CppType userType(String name, List<CppType> typeArguments) {
        String container = CONTAINERS.get(name);
        if (container != null) {
            return new CppType(container, typeArguments);
        }
        return new CppType(CppNames.type(name), typeArguments);
    }

    @Override
    protected CppType arrayOf(CppType element, TypeDescriptor elementType) {
        return CppType.vectorOf(element);
    }

    /**
     * Standard headers a type reference needs, recursively over template arguments.
     */
    public static Set<String> includesFor(CppType type) {
        Set<String> includes = new TreeSet<>();
        collectIncludes(type, includes);
        return includes;
    }

    private static void collectIncludes(CppType type, Set<String> includes) {
        String name = type.getName();
        if (name.endsWith("_t") && !name.equals("size_t")) {
            includes.add("cstdint");
        } else if (name.equals("size_t")) {
            includes.add("cstddef");
        } else if (name.equals("std::vector")) {
            includes.add("vector");
        } else if (name.equals("std::string")) {
            includes.add("string");
        } else if (name.equals("std::map")) {
            includes.add("map");
        } else if (name.equals("std::set")) {
            includes.add("set");
        } else if (name.equals("std::function")) {
            includes.add("functional");
        }
        for (CppType argument : type.getTypeArguments()) {
            collectIncludes(argument, includes);
        }
    }

    /**
     * Native name of an unsigned integer of the given width ({@code uint32_t}).
     */
    public CppType unsigned(int bits) {
        return map(TypeDescriptor.unsignedOfWidth(bits));
    }
}
