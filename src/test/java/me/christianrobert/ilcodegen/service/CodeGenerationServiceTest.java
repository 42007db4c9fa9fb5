package me.christianrobert.ilcodegen.service;

import me.christianrobert.ilcodegen.il.IlFormatException;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.il.IlTreeReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static me.christianrobert.ilcodegen.il.IlFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CodeGenerationService.
 * Covers target dispatch, option passing and the failure paths.
 */
class CodeGenerationServiceTest {

    private static final String ONE_JSON = """
            {
              "kind": "Program",
              "body": [
                {
                  "kind": "FunctionDeclaration",
                  "id": { "kind": "Identifier", "name": "one" },
                  "params": [],
                  "returnType": "uint32",
                  "body": {
                    "kind": "BlockStatement",
                    "body": [
                      { "kind": "ReturnStatement", "argument": { "kind": "Literal", "value": 1, "raw": "1" } }
                    ]
                  }
                }
              ]
            }
            """;

    private CodeGenerationService service;

    @BeforeEach
    void setUp() {
        service = new CodeGenerationService();
        service.reader = new IlTreeReader();
    }

    @Test
    void supportedTargetsInRegistrationOrder() {
        assertEquals(List.of("cpp", "delphi"), List.copyOf(service.getSupportedTargets()));
        assertTrue(service.supportsTarget("delphi"));
        assertFalse(service.supportsTarget(null));
    }

    @Test
    void generatesCppFromJson() {
        GenerationResult result = service.generate(ONE_JSON, "cpp", null);

        assertTrue(result.isSuccess(), result.getErrorMessage());
        assertEquals("cpp", result.getTargetId());
        assertTrue(result.getCode().contains("uint32_t one()"), result.getCode());
        assertFalse(result.hasWarnings());
        assertFalse(result.hasIlTree());
    }

    @Test
    void generatesDelphiWithOptions() {
        GenerationResult result = service.generate(ONE_JSON, "delphi", Map.of("unitName", "Numbers"));

        assertTrue(result.isSuccess(), result.getErrorMessage());
        assertTrue(result.getCode().contains("unit Numbers;"));
        assertTrue(result.getCode().contains("function One: Cardinal;"), result.getCode());
    }

    @Test
    void unknownTargetFails() {
        GenerationResult result = service.generate(ONE_JSON, "rust", null);

        assertTrue(result.isFailure());
        assertEquals("Unsupported target: rust", result.getErrorMessage());
        assertNull(result.getCode());
    }

    @Test
    void invalidJsonFailsWithPath() {
        GenerationResult result = service.generate("{\"kind\": ", "cpp", null);

        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().startsWith("IL document is not valid JSON"), result.getErrorMessage());
    }

    @Test
    void readerFailureIsReportedWithDetailedMessage() {
        IlTreeReader reader = mock(IlTreeReader.class);
        when(reader.read(anyString())).thenThrow(new IlFormatException("IL node has no string 'kind' property",
                "$.body[0]"));
        service.reader = reader;

        GenerationResult result = service.generate("{}", "delphi", null);

        assertTrue(result.isFailure());
        assertEquals("IL node has no string 'kind' property (at $.body[0])", result.getErrorMessage());
    }

    @Test
    void nullTreeFails() {
        GenerationResult result = service.generate((IlNode) null, "cpp", null);

        assertTrue(result.isFailure());
        assertEquals("IL tree cannot be null", result.getErrorMessage());
    }

    @Test
    void unsupportedConstructsAreWarningsNotFailures() {
        IlNode program = program(function("has", "bool", params(id("key"), id("table")),
                ret(binary("in", id("key"), id("table")))));

        GenerationResult result = service.generate(program, "cpp", null);

        assertTrue(result.isSuccess());
        assertTrue(result.hasWarnings());
    }

    @Test
    void ilTreeDumpOnRequest() {
        GenerationResult result = service.generate(ONE_JSON, "cpp", null, true);

        assertTrue(result.hasIlTree());
        assertTrue(result.getIlTree().startsWith("Program\n"));
        assertTrue(result.getIlTree().contains("Identifier [name=\"one\"]"));
    }
}
