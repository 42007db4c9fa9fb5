package me.christianrobert.ilcodegen.target.delphi.transformer;

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
import me.christianrobert.ilcodegen.target.delphi.DelphiNames;
import me.christianrobert.ilcodegen.target.delphi.DelphiType;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiBinary;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiBlock;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiCall;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiFor;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiForIn;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiLiteral;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNode;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiRepeat;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiUnary;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiWhile;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for loops.
 *
 * <h3>C-style for loops</h3>
 * <p>Loops recognized by {@link LoopCanonicalizer} become Pascal {@code for} loops. The bound of
 * an exclusive loop is adjusted by one, folded when it is a literal:</p>
 * <pre>
 * for (let i = 0; i &lt; 16; i++)        →   for I := 0 to 15 do
 * for (let i = 0; i &lt; n; i++)         →   for I := 0 to N - 1 do
 * for (let i = n - 1; i &gt;= 0; i--)    →   for I := N - 1 downto 0 do
 * </pre>
 * <p>Anything else becomes a while loop with the initializer in front and the update appended
 * to the body (and run before every {@code Continue}).</p>
 *
 * <h3>Other loops</h3>
 * <ul>
 *   <li>for-of → {@code for X in C do}</li>
 *   <li>for-in → {@code for K := 0 to High(C) do}</li>
 *   <li>do-while → {@code repeat ... until not (C)}</li>
 * </ul>
 */
public class VisitLoopStatement {

    public static List<DelphiNode> forStatement(IlNode node, DelphiCodeBuilder b) {
        CountedLoop loop = LoopCanonicalizer.match(node);
        if (loop != null) {
            return List.of(countedLoop(node, loop, b));
        }
        return whileFallback(node, b);
    }

    private static DelphiNode countedLoop(IlNode node, CountedLoop loop, DelphiCodeBuilder b) {
        TransformationContext context = b.getContext();
        SymbolEnvironment symbols = context.getSymbols();

        // Pascal loop counters are ordinal locals; unsigned counters would wrap on downto 0
        TypeDescriptor indexType = TypeDescriptor.parse(loop.getTypeAnnotation());
        if (indexType == null || !indexType.isIntegral() || !indexType.isSigned()) {
            indexType = TypeDescriptor.INT32;
        }
        String variable = DelphiNames.variable(loop.getVariable());

        symbols.push(Scope.Kind.BLOCK, "<for>");
        try {
            DelphiNode start = b.visitExpression(loop.getStart());
            symbols.declare(new SymbolInfo(loop.getVariable(), variable, indexType, SymbolRole.LOCAL));
            b.declareLocal(node, variable, b.mapType(indexType));

            DelphiNode end;
            if (loop.isInclusive()) {
                end = b.visitExpression(loop.getBound());
            } else {
                end = offset(loop.getBound(), loop.isAscending() ? -1 : 1, b);
            }

            context.enterLoop(null);
            try {
                return new DelphiFor(variable, start, end, !loop.isAscending(), b.visitBody(loop.getBody()));
            } finally {
                context.exitLoop();
            }
        } finally {
            symbols.pop();
        }
    }

    /**
     * {@code bound + delta}, folded for integer literals.
     */
    private static DelphiNode offset(IlNode bound, int delta, DelphiCodeBuilder b) {
        if (bound.isNumericLiteral() && bound.value("value") instanceof Number) {
            double value = ((Number) bound.value("value")).doubleValue();
            if (value == Math.rint(value)) {
                return new DelphiLiteral(Long.toString((long) value + delta));
            }
        }
        return new DelphiBinary(delta < 0 ? "-" : "+", b.visitExpression(bound),
                new DelphiLiteral(Integer.toString(Math.abs(delta))));
    }

    private static List<DelphiNode> whileFallback(IlNode node, DelphiCodeBuilder b) {
        TransformationContext context = b.getContext();
        SymbolEnvironment symbols = context.getSymbols();

        symbols.push(Scope.Kind.BLOCK, "<for>");
        try {
            // STEP 1: Initializer in front of the loop
            List<DelphiNode> statements = new ArrayList<>();
            IlNode init = node.node("init");
            if (init != null) {
                statements.addAll(init.is(IlKind.VARIABLE_DECLARATION)
                        ? b.visitStatement(init)
                        : b.visitStatement(VisitJumpStatement.expressionStatement(init)));
            }

            // STEP 2: Condition, True when absent
            IlNode test = node.node("test");
            DelphiNode condition = test != null ? VisitOperatorExpression.condition(test, b) : DelphiLiteral.TRUE;

            // STEP 3: Body with the update appended
            IlNode update = node.node("update");
            context.enterLoop(update);
            DelphiBlock body;
            try {
                body = b.visitBody(node.node("body"));
            } finally {
                context.exitLoop();
            }
            List<DelphiNode> bodyStatements = new ArrayList<>(body.getStatements());
            if (update != null) {
                bodyStatements.addAll(b.visitStatement(VisitJumpStatement.expressionStatement(update)));
            }
            statements.add(new DelphiWhile(condition, new DelphiBlock(bodyStatements)));
            return statements;
        } finally {
            symbols.pop();
        }
    }

    public static DelphiNode forOf(IlNode node, DelphiCodeBuilder b) {
        TransformationContext context = b.getContext();
        SymbolEnvironment symbols = context.getSymbols();

        String name = LoopCanonicalizer.boundName(node.node("left"));
        if (name == null) {
            context.warn(node, "Unsupported for-of target");
            name = "item";
        }
        IlNode right = node.node("right");
        TypeDescriptor iterable = b.typeOf(right);

        TypeDescriptor element;
        DelphiType variableType;
        if (iterable != null && iterable.isString()) {
            element = TypeDescriptor.STRING;
            variableType = DelphiType.CHAR;
        } else if (iterable != null && iterable.isArray()) {
            element = iterable.getElementType();
            variableType = b.mapType(element);
        } else {
            element = TypeDescriptor.UINT32;
            variableType = DelphiType.CARDINAL;
        }

        DelphiNode collection = b.visitExpression(right);
        String emitted = DelphiNames.variable(name);
        symbols.push(Scope.Kind.BLOCK, "<for-of>");
        try {
            symbols.declare(new SymbolInfo(name, emitted, element, SymbolRole.LOCAL));
            b.declareLocal(node, emitted, variableType);
            context.enterLoop(null);
            try {
                return new DelphiForIn(emitted, collection, b.visitBody(node.node("body")));
            } finally {
                context.exitLoop();
            }
        } finally {
            symbols.pop();
        }
    }

    public static DelphiNode forIn(IlNode node, DelphiCodeBuilder b) {
        TransformationContext context = b.getContext();
        SymbolEnvironment symbols = context.getSymbols();

        String name = LoopCanonicalizer.boundName(node.node("left"));
        if (name == null) {
            context.warn(node, "Unsupported for-in target");
            name = "key";
        }
        String emitted = DelphiNames.variable(name);
        DelphiNode container = b.visitExpression(node.node("right"));

        symbols.push(Scope.Kind.BLOCK, "<for-in>");
        try {
            symbols.declare(new SymbolInfo(name, emitted, TypeDescriptor.INT32, SymbolRole.LOCAL));
            b.declareLocal(node, emitted, DelphiType.INTEGER);
            context.enterLoop(null);
            try {
                return new DelphiFor(emitted, DelphiLiteral.ZERO, DelphiCall.of("High", container), false,
                        b.visitBody(node.node("body")));
            } finally {
                context.exitLoop();
            }
        } finally {
            symbols.pop();
        }
    }

    public static DelphiNode whileStatement(IlNode node, DelphiCodeBuilder b) {
        DelphiNode condition = VisitOperatorExpression.condition(node.node("test"), b);
        b.getContext().enterLoop(null);
        try {
            return new DelphiWhile(condition, b.visitBody(node.node("body")));
        } finally {
            b.getContext().exitLoop();
        }
    }

    public static DelphiNode doWhile(IlNode node, DelphiCodeBuilder b) {
        b.getContext().enterLoop(null);
        DelphiBlock body;
        try {
            body = b.visitBody(node.node("body"));
        } finally {
            b.getContext().exitLoop();
        }
        DelphiNode condition = VisitOperatorExpression.condition(node.node("test"), b);
        return new DelphiRepeat(body, new DelphiUnary("not", condition));
    }
}
