package me.christianrobert.ilcodegen.target.cpp.transformer;

import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.context.SymbolRole;
import me.christianrobert.ilcodegen.codegen.context.TransformationContext;
import me.christianrobert.ilcodegen.codegen.runtime.RuntimeHelper;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.cpp.CppNames;
import me.christianrobert.ilcodegen.target.cpp.CppType;
import me.christianrobert.ilcodegen.target.cpp.ast.CppCall;
import me.christianrobert.ilcodegen.target.cpp.ast.CppIdentifier;
import me.christianrobert.ilcodegen.target.cpp.ast.CppInitializerList;
import me.christianrobert.ilcodegen.target.cpp.ast.CppMemberAccess;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNode;
import me.christianrobert.ilcodegen.target.cpp.ast.CppObjectCreation;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for calls and object creation.
 *
 * <h3>Calls:</h3>
 * <pre>
 * rotl32(x, 7)          →   rotl32(x, 7)
 * this.expandKey(k)     →   this-&gt;expand_key(k)
 * super.reset()         →   Base::reset()
 * Cipher.create()       →   Cipher::create()
 * out.push(b)           →   out.push_back(b)
 * Math.floor(x / 2)     →   static_cast&lt;int32_t&gt;(std::floor(x / 2))
 * String.fromCharCode(c) →  std::string(1, static_cast&lt;char&gt;(c))
 * </pre>
 *
 * <p>Calls of well-known library members are rewritten to the equivalent virtual instruction
 * and lowered by {@link VisitInstruction}, so both spellings produce the same C++.</p>
 *
 * <h3>Object creation:</h3>
 * <pre>
 * new Uint8Array(16)      →   std::vector&lt;uint8_t&gt;(16)
 * new Uint8Array([1, 2])  →   std::vector&lt;uint8_t&gt;{1, 2}
 * new Uint32Array(words)  →   std::vector&lt;uint32_t&gt;(words.begin(), words.end())
 * new Error("bad key")    →   std::runtime_error("bad key")
 * new Cipher(key)         →   Cipher(key)
 * </pre>
 */
public class VisitCallExpression {

    public static CppNode call(IlNode node, CppCodeBuilder b) {
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
            return parentConstructorCall(node, b);
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
        return new CppCall(b.visitExpression(callee), b.visitExpressions(arguments));
    }

    private static CppNode functionCall(IlNode node, String name, List<IlNode> arguments, CppCodeBuilder b) {
        if (name.equals("String") && arguments.size() == 1) {
            return VisitLiteralExpression.stringified(arguments.get(0), b);
        }
        SymbolInfo symbol = b.lookup(name);
        String emitted = symbol != null ? symbol.getEmittedName() : CppNames.function(name);
        if (symbol == null) {
            b.getContext().warn(node, "Call to undeclared function '" + name + "'");
        }
        return new CppCall(new CppIdentifier(emitted), b.visitExpressions(arguments));
    }

    private static CppNode methodCall(IlNode node, IlNode object, String method, List<IlNode> arguments,
                                      CppCodeBuilder b) {
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
                return new CppCall(new CppMemberAccess(new CppIdentifier(symbol.getEmittedName()),
                        CppNames.function(method), CppMemberAccess.Operator.SCOPE), b.visitExpressions(arguments));
            }
        }

        // STEP 4: Array and string methods
        TypeDescriptor type = b.typeOf(object);
        boolean string = type != null && type.isString();
        switch (method) {
            case "push" -> {
                return VisitInstruction.push(object, arguments, b);
            }
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
                if (!string) {
                    return b.visitExpression(derive(node, IlKind.ARRAY_CONCAT).node("array", object)
                            .nodes("arguments", arguments).build());
                }
            }
            case "fill" -> {
                if (arguments.size() == 1) {
                    return VisitInstruction.fill(object, b.visitExpression(arguments.get(0)), b);
                }
            }
            case "indexOf" -> {
                if (!string && arguments.size() == 1) {
                    List<CppNode> helperArguments = List.of(b.visitExpression(object),
                            b.visitExpression(arguments.get(0)));
                    return b.helperCallWith(RuntimeHelper.ARRAY_INDEX_OF, helperArguments);
                }
            }
            case "charCodeAt" -> {
                return b.visitExpression(derive(node, IlKind.STRING_CHAR_CODE_AT).node("value", object)
                        .node("index", argument(arguments, 0)).build());
            }
            case "pop" -> {
                b.getContext().warn(node, "Array pop lowered to pop_back; the removed value is lost");
                return b.methodCall(b.visitExpression(object), "pop_back", List.of());
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
        return b.methodCall(b.visitExpression(object), CppNames.function(method), b.visitExpressions(arguments));
    }

    public static CppNode thisMethodCall(IlNode node, CppCodeBuilder b) {
        return thisCall(node.text("method"), node.nodes("arguments"), b);
    }

    private static CppNode thisCall(String method, List<IlNode> arguments, CppCodeBuilder b) {
        SymbolInfo symbol = b.getContext().getSymbols().lookupMember(method);
        String emitted = symbol != null ? symbol.getEmittedName() : CppNames.function(method);
        CppNode callee;
        if (symbol != null && symbol.isStatic()) {
            callee = new CppMemberAccess(new CppIdentifier(VisitMemberExpression.currentClassName(b)), emitted,
                    CppMemberAccess.Operator.SCOPE);
        } else {
            callee = CppMemberAccess.thisMember(emitted);
        }
        return new CppCall(callee, b.visitExpressions(arguments));
    }

    public static CppNode parentMethodCall(IlNode node, CppCodeBuilder b) {
        return parentCall(node, node.text("method"), node.nodes("arguments"), b);
    }

    private static CppNode parentCall(IlNode node, String method, List<IlNode> arguments, CppCodeBuilder b) {
        TransformationContext.ClassFrame frame = b.getContext().currentClass();
        if (frame == null || !frame.hasSuperClass()) {
            b.getContext().warn(node, "Parent method call outside a derived class");
            return b.placeholder("super." + method);
        }
        CppNode callee = new CppMemberAccess(new CppIdentifier(CppNames.type(frame.getSuperClassName())),
                CppNames.function(method), CppMemberAccess.Operator.SCOPE);
        return new CppCall(callee, b.visitExpressions(arguments));
    }

    /**
     * Parent constructor calls become member initializers of the constructor; one left in the
     * body cannot be expressed.
     */
    public static CppNode parentConstructorCall(IlNode node, CppCodeBuilder b) {
        b.getContext().warn(node, "Parent constructor call outside the constructor prologue");
        return b.placeholder("super(...)");
    }

    public static CppNode newExpression(IlNode node, CppCodeBuilder b) {
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

        TypeDescriptor type = name.equals("Array")
                ? TypeDescriptor.arrayOf(TypeDescriptor.UINT32)
                : TypeDescriptor.parse(name);
        if (type.isArray()) {
            return newArray(type, arguments, b);
        }

        SymbolInfo symbol = b.lookup(name);
        CppType cppType = symbol != null && symbol.getRole() == SymbolRole.TYPE
                ? CppType.of(symbol.getEmittedName())
                : b.mapType(type);
        return new CppObjectCreation(cppType, b.visitExpressions(arguments), false);
    }

    private static CppNode newArray(TypeDescriptor type, List<IlNode> arguments, CppCodeBuilder b) {
        CppType vector = b.mapType(type);
        if (arguments.isEmpty()) {
            return new CppInitializerList(vector, List.of());
        }
        IlNode first = arguments.get(0);
        if (arguments.size() > 1) {
            return new CppInitializerList(vector, b.visitExpressions(arguments));
        }
        if (first != null && first.is(IlKind.ARRAY_EXPRESSION)) {
            List<CppNode> elements = new ArrayList<>();
            for (IlNode element : first.nodes("elements")) {
                elements.add(b.visitExpression(element));
            }
            return new CppInitializerList(vector, elements);
        }
        TypeDescriptor argumentType = b.typeOf(first);
        if (argumentType != null && argumentType.isArray()) {
            CppNode source = b.visitExpression(first);
            return new CppObjectCreation(vector, List.of(b.methodCall(source, "begin", List.of()),
                    b.methodCall(source, "end", List.of())), false);
        }
        return new CppObjectCreation(vector, List.of(b.visitExpression(first)), false);
    }

    private static IlNode argument(List<IlNode> arguments, int index) {
        return index < arguments.size() ? arguments.get(index) : null;
    }

    private static IlNode.Builder derive(IlNode node, IlKind kind) {
        return IlNode.builder(kind).resultType(node.getResultType()).location(node.getLocation());
    }
}
