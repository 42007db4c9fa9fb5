package me.christianrobert.ilcodegen.codegen.naming;

/**
 * Identifier casing conversions shared by all targets.
 *
 * <p>All functions are pure and total: {@code null} and empty input are returned unchanged.</p>
 */
public final class NamingConventions {

    private NamingConventions() {
    }

    /**
     * Type-name convention. Unchanged if the first character is already uppercase,
     * otherwise the first character is uppercased and the rest kept.
     *
     * <pre>
     * rotl32      → Rotl32
     * BlockCipher → BlockCipher
     * </pre>
     */
    public static String toPascalCase(String s) {
        if (s == null || s.isEmpty()) {
            return s;
        }
        char first = s.charAt(0);
        if (Character.isUpperCase(first)) {
            return s;
        }
        return Character.toUpperCase(first) + s.substring(1);
    }

    /**
     * Member convention of targets with leading-uppercase members: strips one leading
     * underscore, then uppercases the first character.
     *
     * <pre>
     * _rounds → Rounds
     * keySize → KeySize
     * </pre>
     */
    public static String toCamelCase(String s) {
        if (s == null || s.isEmpty()) {
            return s;
        }
        String stripped = s.startsWith("_") ? s.substring(1) : s;
        if (stripped.isEmpty()) {
            return stripped;
        }
        return Character.toUpperCase(stripped.charAt(0)) + stripped.substring(1);
    }

    /**
     * Constant convention: {@code _} before every uppercase letter, whole string uppercased,
     * a produced leading {@code _} stripped. Input without lowercase letters is already in
     * this form and is returned unchanged.
     *
     * <pre>
     * myConstant  → MY_CONSTANT
     * MY_CONSTANT → MY_CONSTANT
     * </pre>
     */
    public static String toScreamingCase(String s) {
        if (s == null || s.isEmpty()) {
            return s;
        }
        if (!containsLowercase(s)) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isUpperCase(c)) {
                sb.append('_');
            }
            sb.append(Character.toUpperCase(c));
        }
        if (sb.length() > 0 && sb.charAt(0) == '_' && s.charAt(0) != '_') {
            sb.deleteCharAt(0);
        }
        return sb.toString();
    }

    /**
     * Member convention of snake-case targets. An underscore goes before an uppercase letter
     * that follows a lowercase letter or digit, or that starts a new word after an acronym;
     * the result is lowercased. Input without lowercase letters is returned unchanged.
     *
     * <pre>
     * keySize     → key_size
     * parseXMLDoc → parse_xml_doc
     * SBOX        → SBOX
     * </pre>
     */
    public static String toSnakeCase(String s) {
        if (s == null || s.isEmpty()) {
            return s;
        }
        if (!containsLowercase(s)) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isUpperCase(c) && i > 0) {
                char previous = s.charAt(i - 1);
                boolean afterWord = Character.isLowerCase(previous) || Character.isDigit(previous);
                boolean endOfAcronym = Character.isUpperCase(previous)
                        && i + 1 < s.length() && Character.isLowerCase(s.charAt(i + 1));
                if (afterWord || endOfAcronym) {
                    sb.append('_');
                }
            }
            sb.append(Character.toLowerCase(c));
        }
        return sb.toString();
    }

    private static boolean containsLowercase(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isLowerCase(s.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
