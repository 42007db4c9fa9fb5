package me.christianrobert.ilcodegen.target.delphi.transformer;

import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.context.SymbolRole;
import me.christianrobert.ilcodegen.codegen.context.TransformationContext;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.codegen.type.TypeInferrer;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.delphi.DelphiNames;
import me.christianrobert.ilcodegen.target.delphi.DelphiType;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiConstant;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiIdentifier;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNode;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiVariable;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for variable declarations.
 *
 * <h3>Inside routines</h3>
 * Every local is hoisted into the routine's {@code var} section; the declaration site keeps the
 * initializing assignment.
 * <pre>
 * let x = 0;                  →   X := 0;                     (var X: Cardinal;)
 * let block = new Uint8Array(16);  →   SetLength(Block, 16);  (var Block: TBytes;)
 * const f = (a) =&gt; a + 1;    →   nested routine F
 * </pre>
 *
 * <h3>At unit level</h3>
 * <pre>
 * const rounds = 10;          →   const ROUNDS = 10;
 * const sbox = [0x63, 0x7c];  →   const SBOX: TBytes = [$63, $7C];
 * let counter = 0;            →   var Counter: Cardinal = 0;
 * let table = makeTable();    →   var Table: TArray&lt;Cardinal&gt;;  ...  initialization Table := MakeTable;
 * </pre>
 */
public class VisitVariableDeclaration {

    public static List<DelphiNode> local(IlNode declaration, DelphiCodeBuilder b) {
        TransformationContext context = b.getContext();
        List<DelphiNode> result = new ArrayList<>();

        for (IlNode declarator : declaration.nodes("declarations")) {
            String name = declarator.name();
            if (name == null) {
                context.warn(declarator, "Destructuring declaration not supported");
                continue;
            }
            IlNode init = declarator.node("init");
            if (init != null && init.getKind().isFunctionLike()) {
                result.addAll(VisitFunctionExpression.localRoutine(declaration, name, init, b));
                continue;
            }

            TypeDescriptor type = declaredType(name, declarator, b);
            String emitted = DelphiNames.variable(name);
            context.getSymbols().declare(new SymbolInfo(name, emitted, type, SymbolRole.LOCAL));
            b.declareLocal(declarator, emitted, b.mapType(type));

            if (hasValue(init)) {
                // a declaration inside a loop starts from a fresh array on every iteration
                result.addAll(VisitOperatorExpression.assign(declarator, new DelphiIdentifier(emitted), init,
                        context.isInLoop(), b));
            }
        }
        return result;
    }

    public static List<DelphiNode> moduleLevel(IlNode declaration, DelphiCodeBuilder b) {
        TransformationContext context = b.getContext();
        List<DelphiNode> result = new ArrayList<>();

        for (IlNode declarator : declaration.nodes("declarations")) {
            String name = declarator.name();
            if (name == null) {
                context.warn(declarator, "Destructuring declaration not supported");
                continue;
            }
            IlNode init = declarator.node("init");
            if (init != null && init.getKind().isFunctionLike()) {
                result.add(VisitFunctionDeclaration.v(init, name, b));
                continue;
            }

            SymbolInfo symbol = declareModuleSymbol(declaration, declarator, b);
            DelphiType type = b.mapType(symbol.getType());

            // STEP 1: Constant expressions are true constants
            if (symbol.getRole() == SymbolRole.CONSTANT) {
                boolean scalar = !init.is(IlKind.ARRAY_EXPRESSION);
                result.add(new DelphiConstant(symbol.getEmittedName(), scalar ? null : type, b.visitExpression(init)));
                continue;
            }

            // STEP 2: Literal initializers stay inline, others run in the initialization section
            if (!hasValue(init)) {
                result.add(new DelphiVariable(symbol.getEmittedName(), type, null));
            } else if (isScalarLiteral(init)) {
                result.add(new DelphiVariable(symbol.getEmittedName(), type, b.visitExpression(init)));
            } else {
                result.add(new DelphiVariable(symbol.getEmittedName(), type, null));
                List<DelphiNode> statements = VisitOperatorExpression.assign(declarator,
                        new DelphiIdentifier(symbol.getEmittedName()), init, false, b);
                List<DelphiNode> initialization = new ArrayList<>(b.drainPreEffects());
                initialization.addAll(statements);
                initialization.addAll(b.drainPostEffects());
                b.addInitialization(initialization);
            }
        }
        return result;
    }

    /**
     * Declares the unit-level symbol of a declarator and returns it. A {@code const} with a
     * constant initializer is a Delphi constant; everything else is a unit variable. Called in
     * the program pre-pass and again when the declaration itself is transformed.
     */
    public static SymbolInfo declareModuleSymbol(IlNode declaration, IlNode declarator, DelphiCodeBuilder b) {
        String name = declarator.name();
        TypeDescriptor type = declaredType(name, declarator, b);
        boolean constant = "const".equals(declaration.text("declarationKind"))
                && isConstantExpression(declarator.node("init"), b);
        SymbolInfo symbol = constant
                ? new SymbolInfo(name, DelphiNames.constant(name), type, SymbolRole.CONSTANT)
                : new SymbolInfo(name, DelphiNames.variable(name), type, SymbolRole.LOCAL);
        b.getContext().getSymbols().declareGlobal(symbol);
        return symbol;
    }

    static TypeDescriptor declaredType(String name, IlNode declarator, DelphiCodeBuilder b) {
        IlNode init = declarator.node("init");
        TypeDescriptor type = TypeInferrer.inferDeclaration(name, declarator.text("typeAnnotation"), init,
                b.getContext().getSymbols());
        if (init != null && init.is(IlKind.ARRAY_EXPRESSION) && !type.isArray()) {
            type = TypeDescriptor.arrayOf(type.isNumeric() ? type : TypeDescriptor.UINT32);
        }
        return type;
    }

    private static boolean hasValue(IlNode init) {
        if (init == null || init.isIdentifier("undefined")) {
            return false;
        }
        return !(init.is(IlKind.LITERAL) && init.value("value") == null);
    }

    private static boolean isScalarLiteral(IlNode init) {
        return init.is(IlKind.LITERAL) && init.value("value") != null;
    }

    private static boolean isConstantExpression(IlNode node, DelphiCodeBuilder b) {
        if (node == null) {
            return false;
        }
        return switch (node.getKind()) {
            case LITERAL -> node.value("value") != null;
            case UNARY_EXPRESSION -> isConstantExpression(node.node("argument"), b);
            case BINARY_EXPRESSION -> isConstantExpression(node.node("left"), b)
                    && isConstantExpression(node.node("right"), b);
            case ARRAY_EXPRESSION -> {
                if (node.nodes("elements").isEmpty()) {
                    yield false;
                }
                for (IlNode element : node.nodes("elements")) {
                    if (element == null || !element.is(IlKind.LITERAL) && !element.is(IlKind.UNARY_EXPRESSION)
                            || !isConstantExpression(element, b)) {
                        yield false;
                    }
                }
                yield true;
            }
            case IDENTIFIER -> {
                SymbolInfo symbol = b.lookup(node.name());
                yield symbol != null && symbol.getRole() == SymbolRole.CONSTANT
                        && symbol.getType() != null && !symbol.getType().isArray();
            }
            default -> false;
        };
    }
}
