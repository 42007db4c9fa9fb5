package me.christianrobert.ilcodegen.codegen.type;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TypeDescriptorTest {

    // ========== PARSING ==========

    @Test
    void parsesCanonicalNamesAndAliases() {
        assertEquals(TypeDescriptor.UINT32, TypeDescriptor.parse("uint32"));
        assertEquals(TypeDescriptor.UINT8, TypeDescriptor.parse("byte"));
        assertEquals(TypeDescriptor.INT32, TypeDescriptor.parse("int"));
        assertEquals(TypeDescriptor.FLOAT64, TypeDescriptor.parse("double"));
        assertEquals(TypeDescriptor.BOOL, TypeDescriptor.parse("boolean"));
    }

    @Test
    void parsesArraysAndTypedArrays() {
        TypeDescriptor words = TypeDescriptor.parse("uint32[]");
        assertTrue(words.isArray());
        assertEquals(TypeDescriptor.UINT32, words.getElementType());

        assertEquals(TypeDescriptor.BYTE_ARRAY, TypeDescriptor.parse("Uint8Array"));
        assertTrue(TypeDescriptor.parse("Uint8Array").isByteArray());
        assertEquals(TypeDescriptor.arrayOf(TypeDescriptor.INT32), TypeDescriptor.parse("Array<int32>"));
    }

    @Test
    void parsesNullableUnions() {
        TypeDescriptor type = TypeDescriptor.parse("uint8[] | null");

        assertTrue(type.isArray());
        assertTrue(type.isNullable());
        assertEquals(TypeDescriptor.UINT8, type.getElementType());
    }

    @Test
    void unknownNamesBecomeUserTypes() {
        TypeDescriptor type = TypeDescriptor.parse("BlockCipher");

        assertTrue(type.isUser());
        assertEquals("BlockCipher", type.getName());
        assertFalse(type.isNumeric());
    }

    @Test
    void blankAnnotationsParseToNull() {
        assertNull(TypeDescriptor.parse(null));
        assertNull(TypeDescriptor.parse("  "));
    }

    // ========== PREDICATES ==========

    @Test
    void widthAndSignedness() {
        assertEquals(32, TypeDescriptor.UINT32.getBits());
        assertFalse(TypeDescriptor.UINT32.isSigned());
        assertTrue(TypeDescriptor.INT64.isSigned());
        assertTrue(TypeDescriptor.FLOAT64.isFloating());
        assertFalse(TypeDescriptor.FLOAT64.isIntegral());
        assertEquals(0, TypeDescriptor.BYTE_ARRAY.getBits());
    }

    @Test
    void unsignedOfWidthFallsBackTo32Bits() {
        assertEquals(TypeDescriptor.UINT64, TypeDescriptor.unsignedOfWidth(64));
        assertEquals(TypeDescriptor.UINT8, TypeDescriptor.unsignedOfWidth(8));
        assertEquals(TypeDescriptor.UINT32, TypeDescriptor.unsignedOfWidth(12));
    }

    @Test
    void arrayWithoutElementTypeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TypeDescriptor.arrayOf(null));
        assertThrows(IllegalArgumentException.class, () -> TypeDescriptor.user(""));
    }

    @Test
    void toStringRoundTripsThroughParse() {
        TypeDescriptor type = TypeDescriptor.arrayOf(TypeDescriptor.UINT16);

        assertEquals("uint16[]", type.toString());
        assertEquals(type, TypeDescriptor.parse(type.toString()));
    }
}
