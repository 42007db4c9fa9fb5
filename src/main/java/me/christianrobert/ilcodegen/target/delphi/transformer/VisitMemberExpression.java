package me.christianrobert.ilcodegen.target.delphi.transformer;

import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.context.SymbolRole;
import me.christianrobert.ilcodegen.codegen.context.TransformationContext;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.delphi.DelphiNames;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiBinary;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiCall;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiIdentifier;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiIndex;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiLiteral;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiMemberAccess;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNode;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Static helper for names and member access.
 *
 * <h3>Mapping:</h3>
 * <pre>
 * key           →   Key               (declared name, reserved words escaped)
 * ROUNDS        →   ROUNDS            (unit constant)
 * this._state   →   FState            (private field)
 * this.size     →   Self.Size         (public field or property)
 * Cipher.BLOCK  →   TCipher.BLOCK     (class constant or class var)
 * data.length   →   Length(Data)
 * data[i]       →   Data[I]
 * text[i]       →   Text[I + 1]       (strings are 1-based)
 * e.message     →   E.Message
 * </pre>
 */
public class VisitMemberExpression {

    public static DelphiNode identifier(IlNode node, DelphiCodeBuilder b) {
        String name = node.name();
        if (name == null) {
            return b.placeholder("identifier");
        }
        if (name.equals("undefined")) {
            return DelphiLiteral.NIL;
        }
        SymbolInfo symbol = b.lookup(name);
        if (symbol != null) {
            return new DelphiIdentifier(symbol.getEmittedName());
        }
        return new DelphiIdentifier(DelphiNames.variable(name));
    }

    public static DelphiNode thisProperty(IlNode node, DelphiCodeBuilder b) {
        return thisMember(node.text("property"), b);
    }

    /**
     * Access to a member of the current class, readable and assignable.
     */
    static DelphiNode thisMember(String name, DelphiCodeBuilder b) {
        SymbolInfo symbol = b.getContext().getSymbols().lookupMember(name);
        if (symbol == null) {
            b.getContext().warn(null, "Unknown member '" + name + "' of the current class");
            return new DelphiMemberAccess(DelphiIdentifier.SELF, DelphiNames.property(name));
        }
        String emitted = symbol.getEmittedName();
        if (symbol.getRole() == SymbolRole.CONSTANT) {
            return new DelphiIdentifier(emitted);
        }
        if (symbol.isStatic()) {
            return new DelphiMemberAccess(new DelphiIdentifier(currentClassName(b)), emitted);
        }
        if (symbol.getRole() == SymbolRole.FIELD && emitted.equals(DelphiNames.field(name))) {
            return new DelphiIdentifier(emitted);
        }
        if (symbol.getRole() == SymbolRole.FUNCTION && !isProperty(name, b)) {
            return new DelphiIdentifier(emitted);
        }
        return new DelphiMemberAccess(DelphiIdentifier.SELF, emitted);
    }

    static boolean isProperty(String name, DelphiCodeBuilder b) {
        TransformationContext.ClassFrame frame = b.getContext().currentClass();
        return frame != null && b.isProperty(frame.getName(), name);
    }

    static String currentClassName(DelphiCodeBuilder b) {
        TransformationContext.ClassFrame frame = b.getContext().currentClass();
        return frame != null ? DelphiNames.type(frame.getName()) : "";
    }

    public static DelphiNode member(IlNode node, DelphiCodeBuilder b) {
        IlNode object = node.node("object");
        IlNode property = node.node("property");

        // STEP 1: Element access
        if (node.flag("computed")) {
            TypeDescriptor objectType = b.typeOf(object);
            if (objectType != null && objectType.isString()) {
                return new DelphiIndex(b.visitExpression(object), oneBased(property, b));
            }
            return new DelphiIndex(b.visitExpression(object), b.visitExpression(property));
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
            return superExpression(object, b);
        }

        // STEP 3: Well-known globals and class-level access
        if (object.isIdentifier("Math")) {
            return mathConstant(node, name, b);
        }
        if (name.equals("length")) {
            return DelphiCall.of("Length", b.visitExpression(object));
        }
        if (object.is(IlKind.IDENTIFIER)) {
            SymbolInfo symbol = b.lookup(object.name());
            if (symbol != null && symbol.getRole() == SymbolRole.TYPE) {
                String member = b.staticMember(object.name(), name);
                return new DelphiMemberAccess(new DelphiIdentifier(symbol.getEmittedName()),
                        member != null ? member : DelphiNames.property(name));
            }
        }

        // STEP 4: Plain member of a value
        TypeDescriptor objectType = b.typeOf(object);
        if (name.equals("message") && objectType != null && objectType.isUser()
                && objectType.getName().endsWith("Error")) {
            return new DelphiMemberAccess(b.visitExpression(object), "Message");
        }
        String member = DelphiNames.isPrivateMember(name) ? DelphiNames.field(name) : DelphiNames.property(name);
        return new DelphiMemberAccess(b.visitExpression(object), member);
    }

    /**
     * A zero-based string position as a one-based index, folded for literals.
     */
    static DelphiNode oneBased(IlNode index, DelphiCodeBuilder b) {
        if (index != null && index.isNumericLiteral() && index.value("value") instanceof BigDecimal) {
            BigDecimal value = (BigDecimal) index.value("value");
            if (value.stripTrailingZeros().scale() <= 0) {
                return new DelphiLiteral(value.toBigIntegerExact().add(BigInteger.ONE).toString());
            }
        }
        return new DelphiBinary("+", b.visitExpression(index), DelphiLiteral.ONE);
    }

    private static DelphiNode mathConstant(IlNode node, String name, DelphiCodeBuilder b) {
        return switch (name) {
            case "PI" -> new DelphiIdentifier("Pi");
            case "E" -> DelphiCall.of("Exp", DelphiLiteral.ONE);
            case "LN2" -> DelphiCall.of("Ln", new DelphiLiteral("2"));
            case "LN10" -> DelphiCall.of("Ln", new DelphiLiteral("10"));
            case "SQRT2" -> DelphiCall.of("Sqrt", new DelphiLiteral("2"));
            default -> {
                b.getContext().warn(node, "Unsupported Math member '" + name + "'");
                yield b.placeholder("Math." + name);
            }
        };
    }

    /**
     * {@code super} is only meaningful as a call target.
     */
    public static DelphiNode superExpression(IlNode node, DelphiCodeBuilder b) {
        b.getContext().warn(node, "'super' outside a call not supported");
        return b.placeholder("super");
    }
}
