package me.christianrobert.ilcodegen.codegen.runtime;

import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites calls into the upstream helper library ({@code OpCodesCall} nodes) into the
 * equivalent virtual instruction, so targets lower them through one path.
 *
 * <pre>
 * OpCodes.RotL32(x, 7)        → RotateLeft{bits: 32}
 * OpCodes.Pack32BE(a, b, c, d) → PackBytes{bits: 32, endian: big}
 * OpCodes.Unpack16LE(w)       → UnpackBytes{bits: 16, endian: little}
 * OpCodes.Hex8ToBytes(s)      → HexDecode
 * OpCodes.ToUint32(x)         → Cast{targetType: uint32}
 * </pre>
 */
public final class OpCodesNormalizer {

    private static final Pattern ROTATE = Pattern.compile("Rot([LR])(8|16|32|64)");
    private static final Pattern PACK = Pattern.compile("(Un)?[Pp]ack(16|32|64)(BE|LE)");

    private static final Map<String, String> CASTS = Map.of(
            "ToByte", "uint8",
            "UintToByte", "uint8",
            "ToSByte", "int8",
            "ToWord", "uint16",
            "ToShort", "int16",
            "ToDWord", "uint32",
            "ToUint32", "uint32",
            "ToInt", "int32",
            "ToQWord", "uint64",
            "ToLong", "int64");

    private OpCodesNormalizer() {
    }

    /**
     * @return the equivalent instruction node, or null when the helper has no instruction form
     */
    public static IlNode normalize(IlNode call) {
        if (call == null || !call.is(IlKind.OPCODES_CALL)) {
            return null;
        }
        String method = call.text("method", "");
        List<IlNode> args = call.nodes("arguments");

        Matcher rotate = ROTATE.matcher(method);
        if (rotate.matches() && args.size() == 2) {
            IlKind kind = rotate.group(1).equals("L") ? IlKind.ROTATE_LEFT : IlKind.ROTATE_RIGHT;
            return derive(call, kind)
                    .node("value", args.get(0))
                    .node("amount", args.get(1))
                    .number("bits", Long.parseLong(rotate.group(2)))
                    .build();
        }

        Matcher pack = PACK.matcher(method);
        if (pack.matches()) {
            String endian = pack.group(3).equals("BE") ? "big" : "little";
            long bits = Long.parseLong(pack.group(2));
            if (pack.group(1) != null) {
                if (args.size() != 1) {
                    return null;
                }
                return derive(call, IlKind.UNPACK_BYTES)
                        .node("value", args.get(0)).number("bits", bits).text("endian", endian).build();
            }
            return derive(call, IlKind.PACK_BYTES)
                    .nodes("arguments", args).number("bits", bits).text("endian", endian).build();
        }

        String castType = CASTS.get(method);
        if (castType != null && args.size() == 1) {
            return derive(call, IlKind.CAST).node("value", args.get(0)).text("targetType", castType).build();
        }

        return switch (method) {
            case "XorArrays", "FastXorArrays" -> derive(call, IlKind.XOR_ARRAYS).nodes("arguments", args).build();
            case "ClearArray" -> single(call, IlKind.ARRAY_CLEAR, "array", args);
            case "CopyArray" -> single(call, IlKind.ARRAY_SLICE, "array", args);
            case "Hex8ToBytes", "HexToBytes" -> single(call, IlKind.HEX_DECODE, "value", args);
            case "BytesToHex8", "BytesToHex" -> single(call, IlKind.HEX_ENCODE, "value", args);
            case "AnsiToBytes", "AsciiToBytes", "StringToBytes" -> single(call, IlKind.STRING_TO_BYTES, "value", args);
            case "BytesToAnsi", "BytesToString" -> single(call, IlKind.BYTES_TO_STRING, "value", args);
            case "ConcatArrays" -> args.isEmpty() ? null : derive(call, IlKind.ARRAY_CONCAT)
                    .node("array", args.get(0)).nodes("arguments", args.subList(1, args.size())).build();
            default -> null;
        };
    }

    private static IlNode single(IlNode call, IlKind kind, String field, List<IlNode> args) {
        if (args.size() != 1) {
            return null;
        }
        return derive(call, kind).node(field, args.get(0)).build();
    }

    private static IlNode.Builder derive(IlNode call, IlKind kind) {
        return IlNode.builder(kind).resultType(call.getResultType()).location(call.getLocation());
    }
}
