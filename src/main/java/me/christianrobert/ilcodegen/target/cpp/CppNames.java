package me.christianrobert.ilcodegen.target.cpp;

import me.christianrobert.ilcodegen.codegen.naming.NamingConventions;
import me.christianrobert.ilcodegen.codegen.naming.ReservedWords;

import java.util.List;

/**
 * C++ naming: snake_case for functions, methods, variables and fields, PascalCase for types,
 * SCREAMING_CASE for constants. Keyword collisions get a trailing underscore.
 *
 * <p>Fields named with a leading underscore are private and use the trailing-underscore
 * member form ({@code _state} → {@code state_}).</p>
 */
public final class CppNames {

    public static final ReservedWords RESERVED = ReservedWords.caseSensitive(List.of(
            "alignas", "alignof", "and", "and_eq", "asm", "auto", "bitand", "bitor", "bool", "break",
            "case", "catch", "char", "char8_t", "char16_t", "char32_t", "class", "compl", "concept",
            "const", "consteval", "constexpr", "constinit", "const_cast", "continue", "co_await",
            "co_return", "co_yield", "decltype", "default", "delete", "do", "double", "dynamic_cast",
            "else", "enum", "explicit", "export", "extern", "false", "float", "for", "friend", "goto",
            "if", "inline", "int", "long", "mutable", "namespace", "new", "noexcept", "not", "not_eq",
            "nullptr", "operator", "or", "or_eq", "private", "protected", "public", "register",
            "reinterpret_cast", "requires", "return", "short", "signed", "sizeof", "static",
            "static_assert", "static_cast", "struct", "switch", "template", "this", "thread_local",
            "throw", "true", "try", "typedef", "typeid", "typename", "union", "unsigned", "using",
            "virtual", "void", "volatile", "wchar_t", "while", "xor", "xor_eq",
            "final", "override", "main", "std", "size_t", "uint8_t", "uint16_t", "uint32_t", "uint64_t",
            "int8_t", "int16_t", "int32_t", "int64_t"));

    private CppNames() {
    }

    public static String function(String name) {
        return RESERVED.escape(NamingConventions.toSnakeCase(name));
    }

    public static String variable(String name) {
        return RESERVED.escape(NamingConventions.toSnakeCase(name));
    }

    public static String field(String name) {
        if (isPrivateField(name)) {
            return NamingConventions.toSnakeCase(name.substring(1)) + "_";
        }
        return RESERVED.escape(NamingConventions.toSnakeCase(name));
    }

    public static boolean isPrivateField(String name) {
        return name != null && name.length() > 1 && name.charAt(0) == '_';
    }

    public static String type(String name) {
        return RESERVED.escape(NamingConventions.toPascalCase(name));
    }

    public static String constant(String name) {
        return RESERVED.escape(NamingConventions.toScreamingCase(name));
    }

    public static String getter(String property) {
        return "get_" + NamingConventions.toSnakeCase(property);
    }

    public static String setter(String property) {
        return "set_" + NamingConventions.toSnakeCase(property);
    }

    /**
     * Text that can sit inside a block comment: every {@code *}{@code /} is split apart.
     */
    public static String blockCommentText(String text) {
        return text == null ? "" : text.replace("*/", "* /");
    }
}
