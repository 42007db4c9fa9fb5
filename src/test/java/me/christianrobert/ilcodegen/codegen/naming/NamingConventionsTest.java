package me.christianrobert.ilcodegen.codegen.naming;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NamingConventionsTest {

    // ========== PASCAL CASE ==========

    @Test
    void pascalCaseUppercasesFirstCharacter() {
        assertEquals("Rotl32", NamingConventions.toPascalCase("rotl32"));
        assertEquals("BlockCipher", NamingConventions.toPascalCase("blockCipher"));
    }

    @Test
    void pascalCaseKeepsAlreadyUppercaseNames() {
        assertEquals("BlockCipher", NamingConventions.toPascalCase("BlockCipher"));
        assertEquals("SBOX", NamingConventions.toPascalCase("SBOX"));
    }

    @Test
    void pascalCaseIsIdempotent() {
        for (String name : List.of("rotl32", "keySize", "_state", "x")) {
            String once = NamingConventions.toPascalCase(name);
            assertEquals(once, NamingConventions.toPascalCase(once), name);
        }
    }

    // ========== CAMEL CASE (leading-uppercase members) ==========

    @Test
    void camelCaseStripsOneLeadingUnderscore() {
        assertEquals("Rounds", NamingConventions.toCamelCase("_rounds"));
        assertEquals("KeySize", NamingConventions.toCamelCase("keySize"));
        assertEquals("", NamingConventions.toCamelCase("_"));
    }

    // ========== SCREAMING CASE ==========

    @Test
    void screamingCaseSplitsWordsOnUppercase() {
        assertEquals("MY_CONSTANT", NamingConventions.toScreamingCase("myConstant"));
        assertEquals("BLOCK_SIZE", NamingConventions.toScreamingCase("BlockSize"));
        assertEquals("ROUNDS", NamingConventions.toScreamingCase("rounds"));
    }

    @Test
    void screamingCaseIsIdempotent() {
        assertEquals("MY_CONSTANT", NamingConventions.toScreamingCase("MY_CONSTANT"));
        String once = NamingConventions.toScreamingCase("keyScheduleSize");
        assertEquals(once, NamingConventions.toScreamingCase(once));
    }

    // ========== SNAKE CASE ==========

    @Test
    void snakeCaseSeparatesWordsAndAcronyms() {
        assertEquals("key_size", NamingConventions.toSnakeCase("keySize"));
        assertEquals("parse_xml_doc", NamingConventions.toSnakeCase("parseXMLDoc"));
        assertEquals("rotl32", NamingConventions.toSnakeCase("rotl32"));
        assertEquals("SBOX", NamingConventions.toSnakeCase("SBOX"));
    }

    // ========== EDGE CASES ==========

    @Test
    void nullAndEmptyAreReturnedUnchanged() {
        assertNull(NamingConventions.toPascalCase(null));
        assertNull(NamingConventions.toCamelCase(null));
        assertNull(NamingConventions.toScreamingCase(null));
        assertNull(NamingConventions.toSnakeCase(null));
        assertEquals("", NamingConventions.toPascalCase(""));
        assertEquals("", NamingConventions.toScreamingCase(""));
    }
}
