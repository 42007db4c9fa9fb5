package me.christianrobert.ilcodegen.target.delphi;

import me.christianrobert.ilcodegen.codegen.naming.NamingConventions;
import me.christianrobert.ilcodegen.codegen.naming.ReservedWords;

import java.util.List;

/**
 * Delphi naming: PascalCase routines and types, leading-uppercase variables and members,
 * SCREAMING_CASE constants. Keyword matching is case insensitive, collisions get a trailing
 * underscore.
 *
 * <pre>
 * rotl32     → Rotl32        (routine)
 * keySize    → KeySize       (variable, property)
 * _state     → FState        (private field)
 * cipher     → TCipher       (class)
 * maxRounds  → MAX_ROUNDS    (constant)
 * </pre>
 */
public final class DelphiNames {

    public static final ReservedWords RESERVED = ReservedWords.caseInsensitive(List.of(
            "and", "array", "as", "asm", "begin", "case", "class", "const", "constructor", "destructor",
            "dispinterface", "div", "do", "downto", "else", "end", "except", "exports", "file",
            "finalization", "finally", "for", "function", "goto", "if", "implementation", "in", "inherited",
            "initialization", "inline", "interface", "is", "label", "library", "mod", "nil", "not", "object",
            "of", "or", "out", "packed", "procedure", "program", "property", "raise", "record", "repeat",
            "resourcestring", "set", "shl", "shr", "string", "then", "threadvar", "to", "try", "type", "unit",
            "until", "uses", "var", "while", "with", "xor",
            "result", "self", "exit", "break", "continue", "create", "free", "length", "high", "low", "inc",
            "dec", "ord", "chr", "copy", "true", "false", "byte", "word", "cardinal", "integer", "boolean",
            "char", "variant"));

    private DelphiNames() {
    }

    public static String routine(String name) {
        return RESERVED.escape(NamingConventions.toPascalCase(name));
    }

    public static String variable(String name) {
        return RESERVED.escape(NamingConventions.toCamelCase(name));
    }

    /**
     * Public member (property, public field) name.
     */
    public static String property(String name) {
        return RESERVED.escape(NamingConventions.toCamelCase(name));
    }

    /**
     * Backing field name with the {@code F} prefix.
     */
    public static String field(String name) {
        return "F" + NamingConventions.toCamelCase(name);
    }

    public static boolean isPrivateMember(String name) {
        return name != null && name.length() > 1 && name.charAt(0) == '_';
    }

    public static String type(String name) {
        String pascal = NamingConventions.toPascalCase(name);
        if (pascal.length() > 1 && pascal.charAt(0) == 'T' && Character.isUpperCase(pascal.charAt(1))) {
            return pascal;
        }
        return "T" + pascal;
    }

    public static String constant(String name) {
        return RESERVED.escape(NamingConventions.toScreamingCase(name));
    }

    public static String getter(String property) {
        return "Get" + NamingConventions.toCamelCase(property);
    }

    /**
     * Text that can sit inside a brace comment. A closing brace would end the comment early.
     */
    public static String braceCommentText(String text) {
        return text == null ? "" : text.replace("}", ")");
    }

    public static String setter(String property) {
        return "Set" + NamingConventions.toCamelCase(property);
    }
}
