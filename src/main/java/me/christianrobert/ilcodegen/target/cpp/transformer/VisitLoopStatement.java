package me.christianrobert.ilcodegen.target.cpp.transformer;

import me.christianrobert.ilcodegen.codegen.analysis.CountedLoop;
import me.christianrobert.ilcodegen.codegen.analysis.LoopCanonicalizer;
import me.christianrobert.ilcodegen.codegen.context.Scope;
import me.christianrobert.ilcodegen.codegen.context.SymbolEnvironment;
import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.context.SymbolRole;
import me.christianrobert.ilcodegen.codegen.context.TransformationContext;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.cpp.CppNames;
import me.christianrobert.ilcodegen.target.cpp.CppType;
import me.christianrobert.ilcodegen.target.cpp.ast.CppBinary;
import me.christianrobert.ilcodegen.target.cpp.ast.CppBlock;
import me.christianrobert.ilcodegen.target.cpp.ast.CppDoWhile;
import me.christianrobert.ilcodegen.target.cpp.ast.CppExpressionStatement;
import me.christianrobert.ilcodegen.target.cpp.ast.CppFor;
import me.christianrobert.ilcodegen.target.cpp.ast.CppIdentifier;
import me.christianrobert.ilcodegen.target.cpp.ast.CppLiteral;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNode;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNodeKind;
import me.christianrobert.ilcodegen.target.cpp.ast.CppRangeFor;
import me.christianrobert.ilcodegen.target.cpp.ast.CppUnary;
import me.christianrobert.ilcodegen.target.cpp.ast.CppVariableDeclaration;
import me.christianrobert.ilcodegen.target.cpp.ast.CppWhile;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for loops.
 *
 * <h3>C-style for loops</h3>
 * <p>Loops recognized by {@link LoopCanonicalizer} become canonical counted loops with an
 * explicit index type:</p>
 * <pre>
 * for (let i = 0; i &lt; 16; i++)       →   for (int32_t i = 0; i &lt; 16; i++)
 * for (let i = n - 1; i &gt;= 0; --i)    →   for (int32_t i = n - 1; i &gt;= 0; i--)
 * </pre>
 * <p>Anything else becomes a while loop with the initializer hoisted in front and the update
 * appended to the body (and run before every {@code continue}):</p>
 * <pre>
 * for (let i = 0; i &lt; n; i += 2) {...}   →   {
 *                                                 int32_t i = 0;
 *                                                 while (i &lt; n)
 *                                                 {
 *                                                     ...
 *                                                     i += 2;
 *                                                 }
 *                                             }
 * </pre>
 *
 * <h3>Other loops</h3>
 * <ul>
 *   <li>for-of → range-based for</li>
 *   <li>for-in → {@code size_t} index loop over the container</li>
 *   <li>while / do-while → same form</li>
 * </ul>
 */
public class VisitLoopStatement {

    public static List<CppNode> forStatement(IlNode node, CppCodeBuilder b) {
        CountedLoop loop = LoopCanonicalizer.match(node);
        if (loop != null) {
            return List.of(countedLoop(loop, b));
        }
        return whileFallback(node, b);
    }

    private static CppNode countedLoop(CountedLoop loop, CppCodeBuilder b) {
        TransformationContext context = b.getContext();
        SymbolEnvironment symbols = context.getSymbols();

        TypeDescriptor indexType = TypeDescriptor.parse(loop.getTypeAnnotation());
        if (indexType == null) {
            indexType = TypeDescriptor.INT32;
        }
        String variable = CppNames.variable(loop.getVariable());

        symbols.push(Scope.Kind.BLOCK, "<for>");
        try {
            CppNode start = b.visitExpression(loop.getStart());
            symbols.declare(new SymbolInfo(loop.getVariable(), variable, indexType, SymbolRole.LOCAL));
            CppNode bound = b.visitExpression(loop.getBound());

            String comparison = loop.isAscending()
                    ? (loop.isInclusive() ? "<=" : "<")
                    : (loop.isInclusive() ? ">=" : ">");
            CppNode init = new CppVariableDeclaration(b.mapType(indexType), variable, start, false, false, false);
            CppNode condition = new CppBinary(comparison, new CppIdentifier(variable), bound);
            CppNode update = new CppUnary(loop.isAscending() ? "++" : "--", new CppIdentifier(variable), false);

            context.enterLoop(null);
            try {
                return new CppFor(init, condition, update, b.visitBody(loop.getBody()));
            } finally {
                context.exitLoop();
            }
        } finally {
            symbols.pop();
        }
    }

    private static List<CppNode> whileFallback(IlNode node, CppCodeBuilder b) {
        TransformationContext context = b.getContext();
        SymbolEnvironment symbols = context.getSymbols();

        symbols.push(Scope.Kind.BLOCK, "<for>");
        try {
            // STEP 1: Hoisted initializer
            List<CppNode> statements = new ArrayList<>();
            IlNode init = node.node("init");
            if (init != null) {
                statements.addAll(init.is(IlKind.VARIABLE_DECLARATION)
                        ? VisitVariableDeclaration.local(init, b)
                        : List.of(new CppExpressionStatement(b.visitExpression(init))));
            }

            // STEP 2: Condition, true when absent
            IlNode test = node.node("test");
            CppNode condition = test != null ? b.visitExpression(test) : new CppLiteral("true");

            // STEP 3: Body with the update appended
            IlNode update = node.node("update");
            context.enterLoop(update);
            CppBlock body;
            try {
                body = b.visitBody(node.node("body"));
            } finally {
                context.exitLoop();
            }
            List<CppNode> bodyStatements = new ArrayList<>(body.getStatements());
            if (update != null) {
                bodyStatements.add(new CppExpressionStatement(b.visitExpression(update)));
            }
            statements.add(new CppWhile(condition, new CppBlock(bodyStatements)));

            boolean declaresVariables = statements.stream()
                    .anyMatch(s -> s.getKind() == CppNodeKind.VARIABLE_DECLARATION);
            return declaresVariables ? List.of(new CppBlock(statements)) : statements;
        } finally {
            symbols.pop();
        }
    }

    public static CppNode forOf(IlNode node, CppCodeBuilder b) {
        TransformationContext context = b.getContext();
        SymbolEnvironment symbols = context.getSymbols();

        String name = LoopCanonicalizer.boundName(node.node("left"));
        if (name == null) {
            context.warn(node, "Unsupported for-of target");
            name = "item";
        }
        IlNode right = node.node("right");
        TypeDescriptor iterable = b.typeOf(right);
        TypeDescriptor element = iterable != null && iterable.isArray() ? iterable.getElementType() : null;

        CppType variableType;
        if (element != null && (element.isNumeric() || element.isBool())) {
            variableType = b.mapType(element);
        } else {
            variableType = CppType.AUTO.asConstReference();
        }

        CppNode range = b.visitExpression(right);
        String emitted = CppNames.variable(name);
        symbols.push(Scope.Kind.BLOCK, "<for-of>");
        try {
            symbols.declare(new SymbolInfo(name, emitted, element, SymbolRole.LOCAL));
            context.enterLoop(null);
            try {
                return new CppRangeFor(variableType, emitted, range, b.visitBody(node.node("body")));
            } finally {
                context.exitLoop();
            }
        } finally {
            symbols.pop();
        }
    }

    public static CppNode forIn(IlNode node, CppCodeBuilder b) {
        TransformationContext context = b.getContext();
        SymbolEnvironment symbols = context.getSymbols();

        String name = LoopCanonicalizer.boundName(node.node("left"));
        if (name == null) {
            context.warn(node, "Unsupported for-in target");
            name = "key";
        }
        String emitted = CppNames.variable(name);
        CppNode container = b.visitExpression(node.node("right"));
        b.include("cstddef");

        symbols.push(Scope.Kind.BLOCK, "<for-in>");
        try {
            symbols.declare(new SymbolInfo(name, emitted, TypeDescriptor.INT32, SymbolRole.LOCAL));
            CppNode init = new CppVariableDeclaration(CppType.SIZE_T, emitted, new CppLiteral("0"),
                    false, false, false);
            CppNode condition = new CppBinary("<", new CppIdentifier(emitted),
                    b.methodCall(container, "size", List.of()));
            CppNode update = new CppUnary("++", new CppIdentifier(emitted), false);
            context.enterLoop(null);
            try {
                return new CppFor(init, condition, update, b.visitBody(node.node("body")));
            } finally {
                context.exitLoop();
            }
        } finally {
            symbols.pop();
        }
    }

    public static CppNode whileStatement(IlNode node, CppCodeBuilder b) {
        CppNode condition = b.visitExpression(node.node("test"));
        b.getContext().enterLoop(null);
        try {
            return new CppWhile(condition, b.visitBody(node.node("body")));
        } finally {
            b.getContext().exitLoop();
        }
    }

    public static CppNode doWhile(IlNode node, CppCodeBuilder b) {
        b.getContext().enterLoop(null);
        CppBlock body;
        try {
            body = b.visitBody(node.node("body"));
        } finally {
            b.getContext().exitLoop();
        }
        return new CppDoWhile(body, b.visitExpression(node.node("test")));
    }
}
