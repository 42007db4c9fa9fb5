package me.christianrobert.ilcodegen.codegen.runtime;

import me.christianrobert.ilcodegen.codegen.naming.NamingConventions;

/**
 * Routines of the companion runtime module that generated code calls when a target has no
 * native construct for a virtual instruction.
 *
 * <p>Names are fixed and stable across generations. {@link #getName()} is the canonical
 * (C-family) spelling; Pascal-family targets use {@link #getPascalName()}.</p>
 */
public enum RuntimeHelper {

    PACK16_BE("pack16BE"),
    PACK16_LE("pack16LE"),
    PACK32_BE("pack32BE"),
    PACK32_LE("pack32LE"),
    PACK64_BE("pack64BE"),
    PACK64_LE("pack64LE"),
    UNPACK16_BE("unpack16BE"),
    UNPACK16_LE("unpack16LE"),
    UNPACK32_BE("unpack32BE"),
    UNPACK32_LE("unpack32LE"),
    UNPACK64_BE("unpack64BE"),
    UNPACK64_LE("unpack64LE"),
    ROTATE_LEFT8("rotateLeft8"),
    ROTATE_LEFT16("rotateLeft16"),
    ROTATE_LEFT32("rotateLeft32"),
    ROTATE_LEFT64("rotateLeft64"),
    ROTATE_RIGHT8("rotateRight8"),
    ROTATE_RIGHT16("rotateRight16"),
    ROTATE_RIGHT32("rotateRight32"),
    ROTATE_RIGHT64("rotateRight64"),
    XOR_ARRAYS("xorArrays"),
    ARRAY_SPLICE("arraySplice"),
    ARRAY_CONCAT("arrayConcat"),
    ARRAY_INDEX_OF("arrayIndexOf"),
    CLEAR_ARRAY("clearArray"),
    HEX_TO_BYTES("hexToBytes"),
    BYTES_TO_HEX("bytesToHex"),
    STRING_TO_BYTES("stringToBytes"),
    BYTES_TO_STRING("bytesToString");

    private final String name;

    RuntimeHelper(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public String getPascalName() {
        return NamingConventions.toPascalCase(name);
    }

    /**
     * Pack helper for a word width (16/32/64) and byte order; other widths use 32 bits.
     */
    public static RuntimeHelper pack(int bits, boolean bigEndian) {
        return switch (bits) {
            case 16 -> bigEndian ? PACK16_BE : PACK16_LE;
            case 64 -> bigEndian ? PACK64_BE : PACK64_LE;
            default -> bigEndian ? PACK32_BE : PACK32_LE;
        };
    }

    public static RuntimeHelper unpack(int bits, boolean bigEndian) {
        return switch (bits) {
            case 16 -> bigEndian ? UNPACK16_BE : UNPACK16_LE;
            case 64 -> bigEndian ? UNPACK64_BE : UNPACK64_LE;
            default -> bigEndian ? UNPACK32_BE : UNPACK32_LE;
        };
    }

    public static RuntimeHelper rotate(int bits, boolean left) {
        return switch (bits) {
            case 8 -> left ? ROTATE_LEFT8 : ROTATE_RIGHT8;
            case 16 -> left ? ROTATE_LEFT16 : ROTATE_RIGHT16;
            case 64 -> left ? ROTATE_LEFT64 : ROTATE_RIGHT64;
            default -> left ? ROTATE_LEFT32 : ROTATE_RIGHT32;
        };
    }
}
