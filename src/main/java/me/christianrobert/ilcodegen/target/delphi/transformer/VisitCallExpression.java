package me.christianrobert.ilcodegen.target.delphi.transformer;

import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.context.SymbolRole;
import me.christianrobert.ilcodegen.codegen.context.TransformationContext;
import me.christianrobert.ilcodegen.codegen.runtime.RuntimeHelper;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.delphi.DelphiNames;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiArrayLiteral;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiBinary;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiCall;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiIdentifier;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiLiteral;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiMemberAccess;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNode;

import java.util.List;

/**
 * Static helper for calls and object creation.
 *
 * <h3>Calls:</h3>
 * <pre>
 * rotl32(x, 7)          →   Rotl32(X, 7)
 * this.expandKey(k)     →   ExpandKey(K)
 * super.reset()         →   inherited Reset
 * Cipher.create()       →   TCipher.Create
 * out.push(b)           →   Out := Out + [B]
 * s.indexOf("x")        →   Pos('x', S) - 1
 * s.toUpperCase()       →   UpperCase(S)
 * </pre>
 *
 * <p>Calls of well-known library members are rewritten to the equivalent virtual instruction
 * and lowered by {@link VisitInstruction}, so both spellings produce the same Pascal.</p>
 *
 * <h3>Object creation:</h3>
 * <pre>
 * x = new Uint8Array(16)      →   SetLength(X, 16)     (statement position only)
 * new Uint8Array([1, 2])      →   [1, 2]
 * new Uint32Array(words)      →   Copy(Words)
 * new Error("bad key")        →   Exception.Create('bad key')
 * new Cipher(key)             →   TCipher.Create(Key)
 * </pre>
 */
public class VisitCallExpression {

    public static DelphiNode call(IlNode node, DelphiCodeBuilder b) {
        IlNode callee = node.node("callee");
        List<IlNode> arguments = node.nodes("arguments");
        if (callee == null) {
            b.getContext().unsupported(node);
            return b.placeholder("call");
        }

        if (callee.is(IlKind.IDENTIFIER)) {
            return functionCall(node, callee.name(), arguments, b);
        }
        if (callee.is(IlKind.SUPER)) {
            return inheritedConstructor(arguments, b);
        }
        if (callee.is(IlKind.THIS_PROPERTY_ACCESS)) {
            return thisCall(callee.text("property"), arguments, b);
        }
        if (callee.is(IlKind.MEMBER_EXPRESSION) && !callee.flag("computed")) {
            IlNode property = callee.node("property");
            String method = property != null ? property.name() : null;
            if (method != null) {
                return methodCall(node, callee.node("object"), method, arguments, b);
            }
        }
        return new DelphiCall(b.visitExpression(callee), b.visitExpressions(arguments));
    }

    private static DelphiNode functionCall(IlNode node, String name, List<IlNode> arguments, DelphiCodeBuilder b) {
        if (name.equals("String") && arguments.size() == 1) {
            return VisitLiteralExpression.stringified(arguments.get(0), b);
        }
        SymbolInfo symbol = b.lookup(name);
        String emitted = symbol != null ? symbol.getEmittedName() : DelphiNames.routine(name);
        if (symbol == null) {
            b.getContext().warn(node, "Call to undeclared function '" + name + "'");
        }
        return new DelphiCall(new DelphiIdentifier(emitted), b.visitExpressions(arguments));
    }

    private static DelphiNode methodCall(IlNode node, IlNode object, String method, List<IlNode> arguments,
                                         DelphiCodeBuilder b) {
        // STEP 1: Members of the current or the parent class
        if (object.is(IlKind.THIS_EXPRESSION)) {
            return thisCall(method, arguments, b);
        }
        if (object.is(IlKind.SUPER)) {
            return parentCall(node, method, arguments, b);
        }

        // STEP 2: Library namespaces
        if (object.isIdentifier("Math")) {
            return b.visitExpression(derive(node, IlKind.MATH_CALL).text("method", method)
                    .nodes("arguments", arguments).build());
        }
        if (object.isIdentifier("OpCodes")) {
            return b.visitExpression(derive(node, IlKind.OPCODES_CALL).text("method", method)
                    .nodes("arguments", arguments).build());
        }
        if (object.isIdentifier("String") && method.equals("fromCharCode")) {
            return b.visitExpression(derive(node, IlKind.STRING_FROM_CHAR_CODE).nodes("arguments", arguments).build());
        }
        if (object.isIdentifier("Array") && method.equals("isArray") && arguments.size() == 1) {
            return b.visitExpression(derive(node, IlKind.IS_ARRAY_CHECK).node("value", arguments.get(0)).build());
        }
        if (object.isIdentifier("Object") && method.equals("freeze") && arguments.size() == 1) {
            return b.visitExpression(arguments.get(0));
        }
        if (object.isIdentifier("console")) {
            b.getContext().warn(node, "console." + method + " dropped");
            return b.placeholder("console." + method);
        }

        // STEP 3: Static members of a declared class
        if (object.is(IlKind.IDENTIFIER)) {
            SymbolInfo symbol = b.lookup(object.name());
            if (symbol != null && symbol.getRole() == SymbolRole.TYPE) {
                String member = b.staticMember(object.name(), method);
                return new DelphiCall(new DelphiMemberAccess(new DelphiIdentifier(symbol.getEmittedName()),
                        member != null ? member : DelphiNames.routine(method)), b.visitExpressions(arguments));
            }
        }

        // STEP 4: Array and string methods
        TypeDescriptor type = b.typeOf(object);
        boolean string = type != null && type.isString();
        switch (method) {
            case "slice", "substring" -> {
                return b.visitExpression(derive(node, IlKind.ARRAY_SLICE).node("array", object)
                        .node("start", argument(arguments, 0)).node("end", argument(arguments, 1)).build());
            }
            case "splice" -> {
                return b.visitExpression(derive(node, IlKind.ARRAY_SPLICE).node("array", object)
                        .node("start", argument(arguments, 0)).node("deleteCount", argument(arguments, 1))
                        .nodes("items", arguments.size() > 2 ? arguments.subList(2, arguments.size()) : List.of())
                        .build());
            }
            case "concat" -> {
                if (string) {
                    DelphiNode result = b.visitExpression(object);
                    for (IlNode argument : arguments) {
                        result = new DelphiBinary("+", result, VisitLiteralExpression.stringified(argument, b));
                    }
                    return result;
                }
                return b.visitExpression(derive(node, IlKind.ARRAY_CONCAT).node("array", object)
                        .nodes("arguments", arguments).build());
            }
            case "indexOf" -> {
                if (arguments.size() == 1) {
                    if (string) {
                        DelphiNode position = DelphiCall.of("Pos",
                                b.visitExpression(arguments.get(0)), b.visitExpression(object));
                        return new DelphiBinary("-", position, DelphiLiteral.ONE);
                    }
                    return b.helperCallWith(RuntimeHelper.ARRAY_INDEX_OF,
                            List.of(b.visitExpression(object), b.visitExpression(arguments.get(0))));
                }
            }
            case "charCodeAt" -> {
                return b.visitExpression(derive(node, IlKind.STRING_CHAR_CODE_AT).node("value", object)
                        .node("index", argument(arguments, 0)).build());
            }
            case "toUpperCase", "toLowerCase" -> {
                if (string && arguments.isEmpty()) {
                    return b.unitCall("SysUtils", method.equals("toUpperCase") ? "UpperCase" : "LowerCase",
                            b.visitExpression(object));
                }
            }
            case "push", "fill" -> {
                IlNode instruction = statementInstruction(node);
                if (instruction != null) {
                    return VisitInstruction.statementOnly(instruction, b);
                }
            }
            case "pop" -> {
                b.getContext().warn(node, "Array pop has no Delphi equivalent");
                return b.placeholder("pop");
            }
            case "toString" -> {
                if (arguments.isEmpty()) {
                    return VisitLiteralExpression.stringified(object, b);
                }
            }
            default -> {
            }
        }

        // STEP 5: Method of a value
        return new DelphiCall(new DelphiMemberAccess(b.visitExpression(object), DelphiNames.routine(method)),
                b.visitExpressions(arguments));
    }

    /**
     * Calls that only exist as statements in Pascal, rewritten to their virtual instruction:
     * {@code a.push(x)} and {@code a.fill(v)}. Null for anything else.
     */
    static IlNode statementInstruction(IlNode expression) {
        if (expression == null || !expression.is(IlKind.CALL_EXPRESSION)) {
            return null;
        }
        IlNode callee = expression.node("callee");
        if (callee == null || !callee.is(IlKind.MEMBER_EXPRESSION) || callee.flag("computed")) {
            return null;
        }
        IlNode object = callee.node("object");
        IlNode property = callee.node("property");
        String method = property != null ? property.name() : null;
        if (object == null || method == null || object.is(IlKind.THIS_EXPRESSION) || object.is(IlKind.SUPER)) {
            return null;
        }
        List<IlNode> arguments = expression.nodes("arguments");
        if (method.equals("push") && !arguments.isEmpty()) {
            return derive(expression, IlKind.ARRAY_PUSH).node("array", object).nodes("arguments", arguments).build();
        }
        if (method.equals("fill") && arguments.size() == 1) {
            return derive(expression, IlKind.ARRAY_FILL).node("array", object).node("value", arguments.get(0)).build();
        }
        return null;
    }

    public static DelphiNode thisMethodCall(IlNode node, DelphiCodeBuilder b) {
        return thisCall(node.text("method"), node.nodes("arguments"), b);
    }

    private static DelphiNode thisCall(String method, List<IlNode> arguments, DelphiCodeBuilder b) {
        SymbolInfo symbol = b.getContext().getSymbols().lookupMember(method);
        String emitted = symbol != null ? symbol.getEmittedName() : DelphiNames.routine(method);
        DelphiNode callee;
        if (symbol != null && symbol.isStatic()) {
            callee = new DelphiMemberAccess(new DelphiIdentifier(VisitMemberExpression.currentClassName(b)), emitted);
        } else {
            callee = new DelphiIdentifier(emitted);
        }
        return new DelphiCall(callee, b.visitExpressions(arguments));
    }

    public static DelphiNode parentMethodCall(IlNode node, DelphiCodeBuilder b) {
        return parentCall(node, node.text("method"), node.nodes("arguments"), b);
    }

    private static DelphiNode parentCall(IlNode node, String method, List<IlNode> arguments, DelphiCodeBuilder b) {
        TransformationContext.ClassFrame frame = b.getContext().currentClass();
        if (frame == null || !frame.hasSuperClass()) {
            b.getContext().warn(node, "Parent method call outside a derived class");
            return b.placeholder("super." + method);
        }
        return new DelphiCall(new DelphiIdentifier("inherited " + DelphiNames.routine(method)),
                b.visitExpressions(arguments));
    }

    public static DelphiNode parentConstructorCall(IlNode node, DelphiCodeBuilder b) {
        return inheritedConstructor(node.nodes("arguments"), b);
    }

    private static DelphiNode inheritedConstructor(List<IlNode> arguments, DelphiCodeBuilder b) {
        return new DelphiCall(new DelphiIdentifier("inherited Create"), b.visitExpressions(arguments));
    }

    public static DelphiNode newExpression(IlNode node, DelphiCodeBuilder b) {
        IlNode callee = node.node("callee");
        String name = callee != null ? callee.name() : null;
        List<IlNode> arguments = node.nodes("arguments");
        if (name == null) {
            b.getContext().unsupported(node);
            return b.placeholder("new");
        }

        if (name.endsWith("Error")) {
            return VisitTryStatement.errorCreation(name, argument(arguments, 0), b);
        }

        TypeDescriptor type = arrayType(name);
        if (type != null) {
            return newArray(node, type, arguments, b);
        }

        SymbolInfo symbol = b.lookup(name);
        String typeName = symbol != null && symbol.getRole() == SymbolRole.TYPE
                ? symbol.getEmittedName()
                : DelphiNames.type(name);
        return new DelphiCall(new DelphiMemberAccess(new DelphiIdentifier(typeName), "Create"),
                b.visitExpressions(arguments));
    }

    private static DelphiNode newArray(IlNode node, TypeDescriptor type, List<IlNode> arguments,
                                       DelphiCodeBuilder b) {
        b.mapType(type);
        if (arguments.isEmpty()) {
            return DelphiLiteral.NIL;
        }
        IlNode first = arguments.get(0);
        if (arguments.size() > 1) {
            return new DelphiArrayLiteral(b.visitExpressions(arguments));
        }
        if (first != null && first.is(IlKind.ARRAY_EXPRESSION)) {
            return VisitLiteralExpression.array(first, b);
        }
        TypeDescriptor argumentType = b.typeOf(first);
        if (argumentType != null && argumentType.isArray()) {
            return DelphiCall.of("Copy", b.visitExpression(first));
        }
        IlNode creation = asArrayCreation(node, b);
        return VisitInstruction.statementOnly(creation != null ? creation : node, b);
    }

    /**
     * {@code new Uint8Array(size)} as an {@code ArrayCreation} instruction, or null when the
     * expression creates no sized array.
     */
    static IlNode asArrayCreation(IlNode value, DelphiCodeBuilder b) {
        if (value == null || !value.is(IlKind.NEW_EXPRESSION)) {
            return null;
        }
        IlNode callee = value.node("callee");
        TypeDescriptor type = callee != null && callee.name() != null ? arrayType(callee.name()) : null;
        List<IlNode> arguments = value.nodes("arguments");
        if (type == null || arguments.size() != 1) {
            return null;
        }
        IlNode size = arguments.get(0);
        if (size == null || size.is(IlKind.ARRAY_EXPRESSION)) {
            return null;
        }
        TypeDescriptor sizeType = b.typeOf(size);
        if (sizeType != null && !sizeType.isNumeric()) {
            return null;
        }
        return derive(value, IlKind.ARRAY_CREATION)
                .text("elementType", type.getElementType().toString())
                .node("size", size)
                .build();
    }

    private static TypeDescriptor arrayType(String name) {
        if (name.equals("Array")) {
            return TypeDescriptor.arrayOf(TypeDescriptor.UINT32);
        }
        TypeDescriptor type = TypeDescriptor.parse(name);
        return type != null && type.isArray() ? type : null;
    }

    private static IlNode argument(List<IlNode> arguments, int index) {
        return index < arguments.size() ? arguments.get(index) : null;
    }

    private static IlNode.Builder derive(IlNode node, IlKind kind) {
        return IlNode.builder(kind).resultType(node.getResultType()).location(node.getLocation());
    }
}
