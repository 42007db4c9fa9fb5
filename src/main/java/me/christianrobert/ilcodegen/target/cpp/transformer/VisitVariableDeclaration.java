package me.christianrobert.ilcodegen.target.cpp.transformer;

import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.context.SymbolRole;
import me.christianrobert.ilcodegen.codegen.context.TransformationContext;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.codegen.type.TypeInferrer;
import me.christianrobert.ilcodegen.config.CodegenOptions;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.cpp.CppNames;
import me.christianrobert.ilcodegen.target.cpp.CppType;
import me.christianrobert.ilcodegen.target.cpp.ast.CppInitializerList;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNode;
import me.christianrobert.ilcodegen.target.cpp.ast.CppVariableDeclaration;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for variable declarations.
 *
 * <h3>Inside routines:</h3>
 * <pre>
 * let x = 0;              →   uint32_t x = 0;
 * const n = data.length;  →   const int32_t n = data.size();
 * let out = [];           →   std::vector&lt;uint32_t&gt; out = {};
 * let block;              →   std::vector&lt;uint8_t&gt; block{};
 * </pre>
 *
 * <h3>At namespace level:</h3>
 * <pre>
 * const rounds = 10;              →   constexpr uint32_t ROUNDS = 10;
 * const sbox = [0x63, 0x7c];      →   const std::vector&lt;uint32_t&gt; SBOX = {0x63, 0x7c};
 * const f = (x) =&gt; x + 1;        →   uint32_t f(uint32_t x) { ... }
 * </pre>
 */
public class VisitVariableDeclaration {

    public static List<CppNode> local(IlNode declaration, CppCodeBuilder b) {
        TransformationContext context = b.getContext();
        boolean isConst = "const".equals(declaration.text("declarationKind"));
        List<CppNode> result = new ArrayList<>();

        for (IlNode declarator : declaration.nodes("declarations")) {
            String name = declarator.name();
            if (name == null) {
                context.warn(declarator, "Destructuring declaration not supported");
                continue;
            }
            IlNode init = declarator.node("init");
            if (init != null && init.getKind().isFunctionLike()) {
                String emitted = CppNames.variable(name);
                context.getSymbols().declare(new SymbolInfo(name, emitted,
                        TypeDescriptor.parse(init.text("returnType")), SymbolRole.FUNCTION));
                result.add(new CppVariableDeclaration(CppType.AUTO, emitted,
                        VisitFunctionExpression.lambda(init, b), false, false, false));
                continue;
            }

            TypeDescriptor type = declaredType(name, declarator, b);
            CppNode value = initializer(init, b);
            String emitted = CppNames.variable(name);
            context.getSymbols().declare(new SymbolInfo(name, emitted, type, SymbolRole.LOCAL));

            boolean constant = isConst && !type.isArray() && !type.isUser() && value != null;
            result.add(new CppVariableDeclaration(b.mapType(type), emitted, value, constant, false, value == null));
        }
        return result;
    }

    public static List<CppNode> moduleLevel(IlNode declaration, CppCodeBuilder b) {
        TransformationContext context = b.getContext();
        List<CppNode> result = new ArrayList<>();

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
            CppNode value = initializer(init, b);
            CppType type;
            if (init != null && init.is(IlKind.OBJECT_EXPRESSION)) {
                type = CppType.AUTO;
            } else {
                type = b.mapType(symbol.getType());
            }

            if (symbol.getRole() == SymbolRole.CONSTANT) {
                boolean constexpr = b.getOptions().getBoolean(CodegenOptions.USE_CONSTEXPR)
                        && isConstexprCandidate(symbol.getType(), init, b);
                result.add(new CppVariableDeclaration(type, symbol.getEmittedName(), value,
                        !constexpr, constexpr, value == null));
            } else {
                result.add(new CppVariableDeclaration(type, symbol.getEmittedName(), value,
                        false, false, value == null));
            }
        }
        return result;
    }

    /**
     * Declares the module-level symbol of a declarator and returns it. Called once in the
     * program pre-pass (so routines see constants declared later) and again when the
     * declaration itself is transformed.
     */
    public static SymbolInfo declareModuleSymbol(IlNode declaration, IlNode declarator, CppCodeBuilder b) {
        String name = declarator.name();
        TypeDescriptor type = declaredType(name, declarator, b);
        boolean constant = "const".equals(declaration.text("declarationKind"));
        SymbolInfo symbol = constant
                ? new SymbolInfo(name, CppNames.constant(name), type, SymbolRole.CONSTANT)
                : new SymbolInfo(name, CppNames.variable(name), type, SymbolRole.LOCAL);
        b.getContext().getSymbols().declareGlobal(symbol);
        return symbol;
    }

    static TypeDescriptor declaredType(String name, IlNode declarator, CppCodeBuilder b) {
        IlNode init = declarator.node("init");
        TypeDescriptor type = TypeInferrer.inferDeclaration(name, declarator.text("typeAnnotation"), init,
                b.getContext().getSymbols());
        if (init != null && init.is(IlKind.ARRAY_EXPRESSION) && !type.isArray()) {
            type = TypeDescriptor.arrayOf(type.isNumeric() ? type : TypeDescriptor.UINT32);
        }
        return type;
    }

    /**
     * Initializer of a declaration whose type is spelled out: array literals drop their type
     * prefix, {@code null} means value-initialization.
     */
    static CppNode initializer(IlNode init, CppCodeBuilder b) {
        if (init == null || (init.is(IlKind.LITERAL) && init.value("value") == null)) {
            return null;
        }
        if (init.isIdentifier("undefined")) {
            return null;
        }
        CppNode value = b.visitExpression(init);
        if (value instanceof CppInitializerList) {
            return new CppInitializerList(null, ((CppInitializerList) value).getElements());
        }
        return value;
    }

    private static boolean isConstexprCandidate(TypeDescriptor type, IlNode init, CppCodeBuilder b) {
        if (init == null || type.isArray() || type.isString() || type.isUser()) {
            return false;
        }
        return isConstantExpression(init, b);
    }

    private static boolean isConstantExpression(IlNode node, CppCodeBuilder b) {
        if (node == null) {
            return false;
        }
        return switch (node.getKind()) {
            case LITERAL -> node.value("value") != null && !(node.value("value") instanceof String);
            case UNARY_EXPRESSION -> isConstantExpression(node.node("argument"), b);
            case BINARY_EXPRESSION -> isConstantExpression(node.node("left"), b)
                    && isConstantExpression(node.node("right"), b);
            case IDENTIFIER -> {
                SymbolInfo symbol = b.lookup(node.name());
                yield symbol != null && symbol.getRole() == SymbolRole.CONSTANT;
            }
            default -> false;
        };
    }
}
