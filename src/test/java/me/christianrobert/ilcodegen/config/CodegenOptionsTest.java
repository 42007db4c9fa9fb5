package me.christianrobert.ilcodegen.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CodegenOptionsTest {

    @Test
    void cppDefaults() {
        CodegenOptions options = CodegenOptions.defaults(CodegenOptions.TARGET_CPP);

        assertEquals("    ", options.getIndent());
        assertEquals("\n", options.getLineEnding());
        assertTrue(options.isAddComments());
        assertEquals("generated", options.getString(CodegenOptions.NAMESPACE));
        assertEquals(20, options.getInt(CodegenOptions.CPP_STANDARD));
        assertTrue(options.getBoolean(CodegenOptions.USE_CONSTEXPR));
        assertEquals("cipher_runtime.h", options.getString(CodegenOptions.RUNTIME_HEADER));
        assertNull(options.getString(CodegenOptions.UNIT_NAME));
    }

    @Test
    void delphiDefaults() {
        CodegenOptions options = CodegenOptions.defaults(CodegenOptions.TARGET_DELPHI);

        assertEquals("  ", options.getIndent());
        assertEquals("Generated", options.getString(CodegenOptions.UNIT_NAME));
        assertFalse(options.getBoolean(CodegenOptions.EMIT_PROPERTIES));
        assertEquals("CipherRuntime", options.getString(CodegenOptions.RUNTIME_UNIT));
        assertNull(options.getString(CodegenOptions.NAMESPACE));
    }

    @Test
    void overridesAreConvertedToTheDefaultType() {
        CodegenOptions options = CodegenOptions.forTarget(CodegenOptions.TARGET_CPP, Map.of(
                "indent", 2,
                "cppStandard", "17",
                "useConstexpr", "false",
                "namespace", "ciphers"));

        assertEquals("  ", options.getIndent());
        assertEquals(17, options.getInt(CodegenOptions.CPP_STANDARD));
        assertFalse(options.getBoolean(CodegenOptions.USE_CONSTEXPR));
        assertEquals("ciphers", options.getString(CodegenOptions.NAMESPACE));
    }

    @Test
    void newlineIsAnAliasOfLineEnding() {
        CodegenOptions options = CodegenOptions.forTarget(CodegenOptions.TARGET_DELPHI, Map.of("newline", "\r\n"));

        assertEquals("\r\n", options.getLineEnding());
    }

    @Test
    void unknownKeysAndBadValuesAreIgnored() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("colour", "blue");
        overrides.put("unitName", null);
        overrides.put("emitProperties", 42);
        overrides.put("namespace", "ignoredForDelphi");

        CodegenOptions options = CodegenOptions.forTarget(CodegenOptions.TARGET_DELPHI, overrides);

        assertFalse(options.getAllOptions().containsKey("colour"));
        assertFalse(options.getAllOptions().containsKey("namespace"));
        assertEquals("Generated", options.getString(CodegenOptions.UNIT_NAME));
        assertFalse(options.getBoolean(CodegenOptions.EMIT_PROPERTIES));
    }

    @Test
    void nullOverridesGiveDefaults() {
        CodegenOptions options = CodegenOptions.forTarget(CodegenOptions.TARGET_CPP, null);

        assertEquals(CodegenOptions.defaults(CodegenOptions.TARGET_CPP).getAllOptions(), options.getAllOptions());
    }

    @Test
    void recognizedKeysDependOnTarget() {
        assertTrue(CodegenOptions.recognizedKeys("cpp").contains("runtimeHeader"));
        assertFalse(CodegenOptions.recognizedKeys("cpp").contains("unitName"));
        assertTrue(CodegenOptions.recognizedKeys("delphi").contains("unitName"));
        assertEquals(3, CodegenOptions.recognizedKeys("rust").size());
    }
}
