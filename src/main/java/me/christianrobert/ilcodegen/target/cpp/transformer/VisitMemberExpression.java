package me.christianrobert.ilcodegen.target.cpp.transformer;

import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.context.SymbolRole;
import me.christianrobert.ilcodegen.codegen.context.TransformationContext;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.cpp.CppNames;
import me.christianrobert.ilcodegen.target.cpp.ast.CppCall;
import me.christianrobert.ilcodegen.target.cpp.ast.CppElementAccess;
import me.christianrobert.ilcodegen.target.cpp.ast.CppIdentifier;
import me.christianrobert.ilcodegen.target.cpp.ast.CppLiteral;
import me.christianrobert.ilcodegen.target.cpp.ast.CppMemberAccess;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNode;
import me.christianrobert.ilcodegen.target.cpp.ast.CppThis;

import java.util.List;

/**
 * Static helper for names and member access.
 *
 * <h3>Mapping:</h3>
 * <pre>
 * key           →   key              (declared name, reserved words escaped)
 * ROUNDS        →   ROUNDS           (module constant)
 * this._state   →   this-&gt;state_
 * this.size     →   this-&gt;get_size()  (getter)
 * Cipher.BLOCK  →   Cipher::BLOCK    (static member)
 * data.length   →   data.size()
 * data[i]       →   data[i]
 * e.message     →   e.what()
 * </pre>
 */
public class VisitMemberExpression {

    public static CppNode identifier(IlNode node, CppCodeBuilder b) {
        String name = node.name();
        if (name == null) {
            return b.placeholder("identifier");
        }
        if (name.equals("undefined")) {
            return new CppLiteral("{}");
        }
        SymbolInfo symbol = b.lookup(name);
        if (symbol != null) {
            return new CppIdentifier(symbol.getEmittedName());
        }
        return new CppIdentifier(CppNames.variable(name));
    }

    public static CppNode thisProperty(IlNode node, CppCodeBuilder b) {
        return thisMember(node.text("property"), b);
    }

    /**
     * Read access to a member of the current class.
     */
    static CppNode thisMember(String name, CppCodeBuilder b) {
        SymbolInfo symbol = b.getContext().getSymbols().lookupMember(name);
        if (symbol == null) {
            b.getContext().warn(null, "Unknown member '" + name + "' of the current class");
            return CppMemberAccess.thisMember(CppNames.field(name));
        }
        if (isGetter(symbol)) {
            return new CppCall(CppMemberAccess.thisMember(symbol.getEmittedName()), List.of());
        }
        return memberOfThis(symbol, b);
    }

    private static CppNode memberOfThis(SymbolInfo symbol, CppCodeBuilder b) {
        if (symbol.isStatic()) {
            return new CppMemberAccess(new CppIdentifier(currentClassName(b)), symbol.getEmittedName(),
                    CppMemberAccess.Operator.SCOPE);
        }
        return CppMemberAccess.thisMember(symbol.getEmittedName());
    }

    /**
     * Accessor-backed properties are class members whose emitted name is the getter name.
     */
    static boolean isGetter(SymbolInfo symbol) {
        return symbol.getRole() == SymbolRole.FUNCTION
                && symbol.getEmittedName().equals(CppNames.getter(symbol.getName()));
    }

    static String currentClassName(CppCodeBuilder b) {
        TransformationContext.ClassFrame frame = b.getContext().currentClass();
        return frame != null ? CppNames.type(frame.getName()) : "";
    }

    public static CppNode member(IlNode node, CppCodeBuilder b) {
        IlNode object = node.node("object");
        IlNode property = node.node("property");

        // STEP 1: Element access
        if (node.flag("computed")) {
            return new CppElementAccess(b.visitExpression(object), b.visitExpression(property));
        }

        String name = property != null ? property.name() : null;
        if (object == null || name == null) {
            b.getContext().unsupported(node);
            return b.placeholder("member");
        }

        // STEP 2: this.x and super.x
        if (object.is(IlKind.THIS_EXPRESSION)) {
            return thisMember(name, b);
        }
        if (object.is(IlKind.SUPER)) {
            return new CppMemberAccess(superExpression(object, b), CppNames.field(name),
                    CppMemberAccess.Operator.SCOPE);
        }

        // STEP 3: Well-known globals and class-level access
        if (object.isIdentifier("Math")) {
            return mathConstant(node, name, b);
        }
        if (name.equals("length")) {
            return b.methodCall(b.visitExpression(object), "size", List.of());
        }
        if (object.is(IlKind.IDENTIFIER)) {
            SymbolInfo symbol = b.lookup(object.name());
            if (symbol != null && symbol.getRole() == SymbolRole.TYPE) {
                return new CppMemberAccess(new CppIdentifier(symbol.getEmittedName()), CppNames.field(name),
                        CppMemberAccess.Operator.SCOPE);
            }
        }

        // STEP 4: Plain member of a value
        TypeDescriptor objectType = b.typeOf(object);
        if (name.equals("message") && objectType != null && objectType.isUser()
                && objectType.getName().endsWith("Error")) {
            return b.methodCall(b.visitExpression(object), "what", List.of());
        }
        return new CppMemberAccess(b.visitExpression(object), CppNames.field(name), CppMemberAccess.Operator.DOT);
    }

    private static CppNode mathConstant(IlNode node, String name, CppCodeBuilder b) {
        return switch (name) {
            case "PI" -> new CppLiteral("3.141592653589793");
            case "E" -> new CppLiteral("2.718281828459045");
            case "LN2" -> new CppLiteral("0.6931471805599453");
            case "SQRT2" -> new CppLiteral("1.4142135623730951");
            default -> {
                b.getContext().warn(node, "Unsupported Math member '" + name + "'");
                yield b.placeholder("Math." + name);
            }
        };
    }

    public static CppNode thisExpression(IlNode node, CppCodeBuilder b) {
        return CppThis.INSTANCE;
    }

    /**
     * {@code super} outside a call names the base class.
     */
    public static CppNode superExpression(IlNode node, CppCodeBuilder b) {
        TransformationContext.ClassFrame frame = b.getContext().currentClass();
        if (frame == null || !frame.hasSuperClass()) {
            b.getContext().warn(node, "'super' outside a derived class");
            return b.placeholder("super");
        }
        return new CppIdentifier(CppNames.type(frame.getSuperClassName()));
    }
}
