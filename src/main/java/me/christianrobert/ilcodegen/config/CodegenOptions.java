package me.christianrobert.ilcodegen.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-run generation options for one target.
 *
 * <p>Built from a plain {@code Map<String, Object>} on top of per-target defaults. The key set
 * is closed: keys that are not recognized for the target are ignored (logged at debug level),
 * and values of the wrong type fall back to the default. Instances are immutable.</p>
 *
 * <table>
 *   <tr><th>Key</th><th>Targets</th><th>Default</th></tr>
 *   <tr><td>indent</td><td>all</td><td>4 spaces (cpp), 2 spaces (delphi)</td></tr>
 *   <tr><td>lineEnding / newline</td><td>all</td><td>\n</td></tr>
 *   <tr><td>addComments</td><td>all</td><td>true</td></tr>
 *   <tr><td>namespace</td><td>cpp</td><td>generated</td></tr>
 *   <tr><td>cppStandard</td><td>cpp</td><td>20</td></tr>
 *   <tr><td>useConstexpr</td><td>cpp</td><td>true</td></tr>
 *   <tr><td>runtimeHeader</td><td>cpp</td><td>cipher_runtime.h</td></tr>
 *   <tr><td>unitName</td><td>delphi</td><td>Generated</td></tr>
 *   <tr><td>emitProperties</td><td>delphi</td><td>false</td></tr>
 *   <tr><td>runtimeUnit</td><td>delphi</td><td>CipherRuntime</td></tr>
 * </table>
 */
public final class CodegenOptions {

    private static final Logger log = LoggerFactory.getLogger(CodegenOptions.class);

    public static final String TARGET_CPP = "cpp";
    public static final String TARGET_DELPHI = "delphi";

    public static final String INDENT = "indent";
    public static final String LINE_ENDING = "lineEnding";
    public static final String NEWLINE_ALIAS = "newline";
    public static final String ADD_COMMENTS = "addComments";
    public static final String NAMESPACE = "namespace";
    public static final String CPP_STANDARD = "cppStandard";
    public static final String USE_CONSTEXPR = "useConstexpr";
    public static final String RUNTIME_HEADER = "runtimeHeader";
    public static final String UNIT_NAME = "unitName";
    public static final String EMIT_PROPERTIES = "emitProperties";
    public static final String RUNTIME_UNIT = "runtimeUnit";

    private final String targetId;
    private final Map<String, Object> values;

    private CodegenOptions(String targetId, Map<String, Object> values) {
        this.targetId = targetId;
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Defaults of the given target without overrides.
     */
    public static CodegenOptions defaults(String targetId) {
        return forTarget(targetId, Collections.emptyMap());
    }

    /**
     * Builds the options of a target from user-supplied overrides.
     *
     * @param targetId target identifier ({@code cpp}, {@code delphi}); unknown ids get the common keys only
     * @param overrides user options, may be null
     */
    public static CodegenOptions forTarget(String targetId, Map<String, ?> overrides) {
        Map<String, Object> values = new HashMap<>();
        initializeDefaults(targetId, values);

        if (overrides != null) {
            overrides.forEach((key, value) -> {
                String normalizedKey = NEWLINE_ALIAS.equals(key) ? LINE_ENDING : key;
                if (!values.containsKey(normalizedKey)) {
                    log.debug("Ignoring unrecognized option '{}' for target {}", key, targetId);
                    return;
                }
                if (value == null) {
                    return;
                }
                Object converted = convert(normalizedKey, value, values.get(normalizedKey));
                if (converted == null) {
                    log.debug("Ignoring option {} = {} (expected {})", key, value,
                            values.get(normalizedKey).getClass().getSimpleName());
                    return;
                }
                values.put(normalizedKey, converted);
            });
        }

        return new CodegenOptions(targetId, values);
    }

    private static void initializeDefaults(String targetId, Map<String, Object> values) {
        boolean delphi = TARGET_DELPHI.equals(targetId);
        values.put(INDENT, delphi ? "  " : "    ");
        values.put(LINE_ENDING, "\n");
        values.put(ADD_COMMENTS, true);

        if (TARGET_CPP.equals(targetId)) {
            values.put(NAMESPACE, "generated");
            values.put(CPP_STANDARD, 20);
            values.put(USE_CONSTEXPR, true);
            values.put(RUNTIME_HEADER, "cipher_runtime.h");
        } else if (delphi) {
            values.put(UNIT_NAME, "Generated");
            values.put(EMIT_PROPERTIES, false);
            values.put(RUNTIME_UNIT, "CipherRuntime");
        }
    }

    // Returns null when the value cannot be converted to the default's type
    private static Object convert(String key, Object value, Object defaultValue) {
        if (INDENT.equals(key) && value instanceof Number) {
            int width = ((Number) value).intValue();
            return width >= 0 ? " ".repeat(width) : null;
        }
        if (defaultValue instanceof Boolean) {
            if (value instanceof Boolean) {
                return value;
            }
            if (value instanceof String) {
                String s = ((String) value).trim();
                if (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false")) {
                    return Boolean.parseBoolean(s);
                }
            }
            return null;
        }
        if (defaultValue instanceof Integer) {
            if (value instanceof Number) {
                return ((Number) value).intValue();
            }
            if (value instanceof String) {
                try {
                    return Integer.parseInt(((String) value).trim());
                } catch (NumberFormatException e) {
                    return null;
                }
            }
            return null;
        }
        return value instanceof String ? value : null;
    }

    public static Set<String> recognizedKeys(String targetId) {
        Map<String, Object> values = new HashMap<>();
        initializeDefaults(targetId, values);
        return Collections.unmodifiableSet(values.keySet());
    }

    public String getTargetId() {
        return targetId;
    }

    public Map<String, Object> getAllOptions() {
        return new HashMap<>(values);
    }

    public String getString(String key) {
        Object value = values.get(key);
        return value != null ? value.toString() : null;
    }

    public boolean getBoolean(String key) {
        Object value = values.get(key);
        return value instanceof Boolean && (Boolean) value;
    }

    public int getInt(String key) {
        Object value = values.get(key);
        return value instanceof Integer ? (Integer) value : 0;
    }

    public String getIndent() {
        return getString(INDENT);
    }

    public String getLineEnding() {
        return getString(LINE_ENDING);
    }

    public boolean isAddComments() {
        return getBoolean(ADD_COMMENTS);
    }

    @Override
    public String toString() {
        return "CodegenOptions{target=" + targetId + ", values=" + values + "}";
    }
}
