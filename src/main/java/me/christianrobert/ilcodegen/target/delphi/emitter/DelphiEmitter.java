package me.christianrobert.ilcodegen.target.delphi.emitter;

import me.christianrobert.ilcodegen.codegen.EmitResult;
import me.christianrobert.ilcodegen.codegen.Emitter;
import me.christianrobert.ilcodegen.codegen.emit.EmitContext;
import me.christianrobert.ilcodegen.codegen.emit.ListLayout;
import me.christianrobert.ilcodegen.config.CodegenOptions;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiAssignment;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiBlock;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiCase;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiCaseArm;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiClass;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiComment;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiConstant;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiExit;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiExpressionStatement;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiField;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiFor;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiForIn;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiIf;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNode;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNodeKind;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiParameter;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiProperty;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiRaise;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiRepeat;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiRoutine;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiTryExcept;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiTryFinally;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiUnit;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiVariable;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiVisibility;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiWhile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Pretty-prints a Delphi unit.
 *
 * <p>The unit is split into the interface part (uses, constants, class declarations, routine
 * headings and global variables) and the implementation part (method and routine bodies in
 * declaration order), followed by an optional {@code initialization} section. Every control
 * statement body is a {@code begin}/{@code end} block; the {@code end} in front of an
 * {@code else} carries no semicolon.</p>
 */
public class DelphiEmitter implements Emitter<DelphiUnit> {

    private static final Logger log = LoggerFactory.getLogger(DelphiEmitter.class);

    @Override
    public EmitResult emit(DelphiUnit unit, CodegenOptions options) {
        CodegenOptions effective = options != null ? options : CodegenOptions.defaults(CodegenOptions.TARGET_DELPHI);
        EmitContext ctx = EmitContext.root(effective);

        String text;
        if (unit == null) {
            text = statement(null, ctx);
        } else {
            text = unit(unit, ctx);
        }
        log.debug("Emitted {} characters of Delphi with {} warnings", text.length(), ctx.getWarnings().size());
        return new EmitResult(text, ctx.getWarnings());
    }

    // ========== Unit layout ==========

    private String unit(DelphiUnit unit, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        String nl = ctx.newline();
        EmitContext inner = ctx.indented();

        if (unit.getHeaderComment() != null) {
            for (String line : unit.getHeaderComment().split("\n", -1)) {
                sb.append(line.isEmpty() ? "//" : "// " + line).append(nl);
            }
            sb.append(nl);
        }
        sb.append("unit ").append(unit.getName()).append(';').append(nl).append(nl);
        sb.append("interface").append(nl).append(nl);

        if (!unit.getUses().isEmpty()) {
            sb.append("uses").append(nl);
            sb.append(inner.line(String.join(", ", unit.getUses()) + ";")).append(nl);
        }

        List<DelphiConstant> constants = new ArrayList<>();
        List<DelphiClass> classes = new ArrayList<>();
        List<DelphiRoutine> routines = new ArrayList<>();
        List<DelphiVariable> variables = new ArrayList<>();
        for (DelphiNode declaration : unit.getDeclarations()) {
            if (declaration == null) {
                continue;
            }
            switch (declaration.getKind()) {
                case CONSTANT -> constants.add((DelphiConstant) declaration);
                case CLASS -> classes.add((DelphiClass) declaration);
                case ROUTINE -> routines.add((DelphiRoutine) declaration);
                case VARIABLE -> variables.add((DelphiVariable) declaration);
                default -> {
                    // rendered in the implementation part
                }
            }
        }

        if (!constants.isEmpty()) {
            sb.append("const").append(nl);
            for (DelphiConstant constant : constants) {
                sb.append(inner.line(constant(constant, inner)));
            }
            sb.append(nl);
        }
        if (!classes.isEmpty()) {
            sb.append("type").append(nl);
            for (int i = 0; i < classes.size(); i++) {
                if (i > 0) {
                    sb.append(nl);
                }
                sb.append(classDeclaration(classes.get(i), inner));
            }
            sb.append(nl);
        }
        if (!routines.isEmpty()) {
            for (DelphiRoutine routine : routines) {
                sb.append(ctx.line(heading(routine, false, ctx)));
            }
            sb.append(nl);
        }
        if (!variables.isEmpty()) {
            sb.append("var").append(nl);
            for (DelphiVariable variable : variables) {
                String text = variable.getName() + ": " + variable.getType();
                if (variable.getInitializer() != null) {
                    text += " = " + DelphiExpressionEmitter.emit(variable.getInitializer(), inner);
                }
                sb.append(inner.line(text + ";"));
            }
            sb.append(nl);
        }

        sb.append("implementation").append(nl).append(nl);
        for (DelphiNode declaration : unit.getDeclarations()) {
            String body = implementation(declaration, ctx);
            if (!body.isEmpty()) {
                sb.append(body).append(nl);
            }
        }

        if (!unit.getInitialization().isEmpty()) {
            sb.append("initialization").append(nl);
            for (DelphiNode statement : unit.getInitialization()) {
                sb.append(statement(statement, inner));
            }
            sb.append(nl);
        }
        sb.append("end.").append(nl);
        return sb.toString();
    }

    private String implementation(DelphiNode declaration, EmitContext ctx) {
        if (declaration == null) {
            return statement(null, ctx);
        }
        return switch (declaration.getKind()) {
            case CLASS -> {
                StringBuilder sb = new StringBuilder();
                for (DelphiNode member : ((DelphiClass) declaration).getMembers()) {
                    if (member != null && member.getKind() == DelphiNodeKind.ROUTINE
                            && ((DelphiRoutine) member).getBody() != null) {
                        if (sb.length() > 0) {
                            sb.append(ctx.newline());
                        }
                        sb.append(routine((DelphiRoutine) member, true, ctx));
                    }
                }
                yield sb.toString();
            }
            case ROUTINE -> ((DelphiRoutine) declaration).getBody() == null
                    ? ""
                    : routine((DelphiRoutine) declaration, true, ctx);
            case COMMENT -> comment((DelphiComment) declaration, ctx);
            case CONSTANT, VARIABLE -> "";
            case UNIT, FIELD, PROPERTY, PARAMETER, BLOCK, ASSIGNMENT, EXPRESSION_STATEMENT, IF, FOR, FOR_IN, WHILE,
                 REPEAT, CASE, CASE_ARM, BREAK, CONTINUE, EXIT, RAISE, TRY_EXCEPT, TRY_FINALLY, LITERAL, IDENTIFIER,
                 BINARY, UNARY, MEMBER_ACCESS, INDEX, CALL, ARRAY_LITERAL, ANONYMOUS_METHOD ->
                    placeholderLine(declaration.getKind().name(), ctx);
        };
    }

    private static String constant(DelphiConstant constant, EmitContext ctx) {
        String typePart = constant.getType() != null && !constant.getType().isVoid()
                ? ": " + constant.getType()
                : "";
        return constant.getName() + typePart + " = " + DelphiExpressionEmitter.emit(constant.getValue(), ctx) + ";";
    }

    // ========== Classes ==========

    private String classDeclaration(DelphiClass cls, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        if (cls.getDocComment() != null) {
            sb.append(comment(cls.getDocComment(), ctx));
        }
        String parent = cls.getParent() != null ? cls.getParent() : "TObject";
        sb.append(ctx.line(cls.getName() + " = class(" + parent + ")"));

        EmitContext inner = ctx.indented();
        for (DelphiVisibility visibility : DelphiVisibility.values()) {
            List<DelphiNode> section = new ArrayList<>();
            for (DelphiNode member : cls.getMembers()) {
                if (visibilityOf(member) == visibility) {
                    section.add(member);
                }
            }
            if (section.isEmpty()) {
                continue;
            }
            section.sort((a, b) -> Integer.compare(memberOrder(a), memberOrder(b)));
            sb.append(ctx.line(visibility.keyword()));
            for (DelphiNode member : section) {
                sb.append(member(member, inner));
            }
        }
        sb.append(ctx.line("end;"));
        return sb.toString();
    }

    private static DelphiVisibility visibilityOf(DelphiNode member) {
        DelphiVisibility visibility = null;
        if (member != null) {
            visibility = switch (member.getKind()) {
                case FIELD -> ((DelphiField) member).getVisibility();
                case PROPERTY -> ((DelphiProperty) member).getVisibility();
                case ROUTINE -> ((DelphiRoutine) member).getVisibility();
                default -> null;
            };
        }
        return visibility != null ? visibility : DelphiVisibility.PUBLIC;
    }

    /**
     * Instance fields first, then class vars, constants, methods and properties. A class var
     * section would otherwise absorb the instance fields that follow it.
     */
    private static int memberOrder(DelphiNode member) {
        if (member == null) {
            return 5;
        }
        return switch (member.getKind()) {
            case FIELD -> {
                DelphiField field = (DelphiField) member;
                if (field.getConstantValue() != null) {
                    yield 2;
                }
                yield field.isStatic() ? 1 : 0;
            }
            case ROUTINE -> 3;
            case PROPERTY -> 4;
            default -> 5;
        };
    }

    private String member(DelphiNode member, EmitContext ctx) {
        if (member == null) {
            return statement(null, ctx);
        }
        return switch (member.getKind()) {
            case FIELD -> field((DelphiField) member, ctx);
            case PROPERTY -> property((DelphiProperty) member, ctx);
            case ROUTINE -> {
                DelphiRoutine routine = (DelphiRoutine) member;
                StringBuilder sb = new StringBuilder();
                if (routine.getDocComment() != null) {
                    sb.append(comment(routine.getDocComment(), ctx));
                }
                String heading = heading(routine, false, ctx);
                if (routine.isStatic()) {
                    heading += " static;";
                }
                if (routine.getDirective() != null) {
                    heading += " " + routine.getDirective() + ";";
                }
                yield sb.append(ctx.line(heading)).toString();
            }
            case COMMENT -> comment((DelphiComment) member, ctx);
            default -> placeholderLine(member.getKind().name(), ctx);
        };
    }

    private static String field(DelphiField field, EmitContext ctx) {
        if (field.getConstantValue() != null) {
            return ctx.line("const " + field.getName() + " = "
                    + DelphiExpressionEmitter.emit(field.getConstantValue(), ctx) + ";");
        }
        String prefix = field.isStatic() ? "class var " : "";
        return ctx.line(prefix + field.getName() + ": " + field.getType() + ";");
    }

    private static String property(DelphiProperty property, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append("property ").append(property.getName()).append(": ").append(property.getType());
        if (property.getReader() != null) {
            sb.append(" read ").append(property.getReader());
        }
        if (property.getWriter() != null) {
            sb.append(" write ").append(property.getWriter());
        }
        return ctx.line(sb.append(';').toString());
    }

    // ========== Routines ==========

    /**
     * Routine heading terminated by a semicolon, without directives.
     */
    static String heading(DelphiRoutine routine, boolean qualified, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        if (routine.isStatic()) {
            sb.append("class ");
        }
        sb.append(routine.getRoutineKind().keyword()).append(' ');
        if (qualified && routine.getClassName() != null) {
            sb.append(routine.getClassName()).append('.');
        }
        sb.append(routine.getName());
        sb.append(parameterList(routine.getParameters(), ctx));
        if (routine.getRoutineKind() == DelphiRoutine.Kind.FUNCTION && routine.getReturnType() != null) {
            sb.append(": ").append(routine.getReturnType());
        }
        return sb.append(';').toString();
    }

    private static String routine(DelphiRoutine routine, boolean qualified, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        if (routine.getDocComment() != null && routine.getClassName() == null) {
            sb.append(comment(routine.getDocComment(), ctx));
        }
        sb.append(ctx.line(heading(routine, qualified, ctx)));
        sb.append(varSection(routine.getLocals(), ctx));
        EmitContext nestedCtx = ctx.indented();
        for (DelphiRoutine nested : routine.getNestedRoutines()) {
            sb.append(ctx.newline());
            sb.append(routine(nested, false, nestedCtx));
        }
        if (!routine.getNestedRoutines().isEmpty()) {
            sb.append(ctx.newline());
        }
        sb.append(block(routine.getBody(), ctx, ";"));
        return sb.toString();
    }

    static String parameterList(List<DelphiParameter> parameters, EmitContext ctx) {
        if (parameters.isEmpty()) {
            return "";
        }
        return ListLayout.layout("", "(", c -> {
            List<String> rendered = new ArrayList<>();
            for (DelphiParameter parameter : parameters) {
                String text = parameter.getName() + ": " + parameter.getType();
                if (parameter.getModifier() != null) {
                    text = parameter.getModifier() + " " + text;
                }
                if (parameter.getDefaultValue() != null) {
                    text += " = " + DelphiExpressionEmitter.emit(parameter.getDefaultValue(), c);
                }
                rendered.add(text);
            }
            return rendered;
        }, ";", ")", ctx, false);
    }

    static String varSection(List<DelphiVariable> locals, EmitContext ctx) {
        if (locals.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(ctx.line("var"));
        EmitContext inner = ctx.indented();
        for (DelphiVariable local : locals) {
            sb.append(inner.line(local.getName() + ": " + local.getType() + ";"));
        }
        return sb.toString();
    }

    // ========== Statements ==========

    /**
     * Renders {@code begin ... end} at the given indent with the statements one level deeper.
     * {@code terminator} follows the {@code end}: a semicolon, or nothing in front of an
     * {@code else}.
     */
    static String block(DelphiBlock block, EmitContext ctx, String terminator) {
        StringBuilder sb = new StringBuilder();
        sb.append(ctx.line("begin"));
        if (block != null) {
            EmitContext inner = ctx.indented();
            for (DelphiNode statement : block.getStatements()) {
                sb.append(statement(statement, inner));
            }
        }
        sb.append(ctx.line("end" + terminator));
        return sb.toString();
    }

    static String statement(DelphiNode node, EmitContext ctx) {
        if (node == null) {
            return placeholderLine("null", ctx);
        }
        return switch (node.getKind()) {
            case BLOCK -> block((DelphiBlock) node, ctx, ";");
            case ASSIGNMENT -> ctx.line(DelphiExpressionEmitter.emit(((DelphiAssignment) node).getTarget(), ctx)
                    + " := " + DelphiExpressionEmitter.emit(((DelphiAssignment) node).getValue(), ctx) + ";");
            case EXPRESSION_STATEMENT -> ctx.line(
                    DelphiExpressionEmitter.emit(((DelphiExpressionStatement) node).getExpression(), ctx) + ";");
            case IF -> ifStatement((DelphiIf) node, ctx);
            case FOR -> forStatement((DelphiFor) node, ctx);
            case FOR_IN -> ctx.line("for " + ((DelphiForIn) node).getVariable() + " in "
                    + DelphiExpressionEmitter.emit(((DelphiForIn) node).getCollection(), ctx) + " do")
                    + block(((DelphiForIn) node).getBody(), ctx, ";");
            case WHILE -> ctx.line("while " + DelphiExpressionEmitter.emit(((DelphiWhile) node).getCondition(), ctx)
                    + " do") + block(((DelphiWhile) node).getBody(), ctx, ";");
            case REPEAT -> repeatStatement((DelphiRepeat) node, ctx);
            case CASE -> caseStatement((DelphiCase) node, ctx);
            case BREAK -> ctx.line("Break;");
            case CONTINUE -> ctx.line("Continue;");
            case EXIT -> ((DelphiExit) node).getValue() == null
                    ? ctx.line("Exit;")
                    : ctx.line("Exit(" + DelphiExpressionEmitter.emit(((DelphiExit) node).getValue(), ctx) + ");");
            case RAISE -> ((DelphiRaise) node).getExpression() == null
                    ? ctx.line("raise;")
                    : ctx.line("raise "
                            + DelphiExpressionEmitter.emit(((DelphiRaise) node).getExpression(), ctx) + ";");
            case TRY_EXCEPT -> tryExcept((DelphiTryExcept) node, ctx);
            case TRY_FINALLY -> tryFinally((DelphiTryFinally) node, ctx);
            case COMMENT -> comment((DelphiComment) node, ctx);
            case UNIT, CLASS, FIELD, PROPERTY, ROUTINE, PARAMETER, CONSTANT, VARIABLE, CASE_ARM, LITERAL, IDENTIFIER,
                 BINARY, UNARY, MEMBER_ACCESS, INDEX, CALL, ARRAY_LITERAL, ANONYMOUS_METHOD ->
                    placeholderLine(node.getKind().name(), ctx);
        };
    }

    private static String ifStatement(DelphiIf node, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append(ctx.line("if " + DelphiExpressionEmitter.emit(node.getCondition(), ctx) + " then"));
        sb.append(block(node.getThenBranch(), ctx, node.getElseBranch() == null ? ";" : ""));

        DelphiNode elseBranch = node.getElseBranch();
        while (elseBranch != null) {
            if (elseBranch.getKind() == DelphiNodeKind.IF) {
                DelphiIf elseIf = (DelphiIf) elseBranch;
                sb.append(ctx.line("else if " + DelphiExpressionEmitter.emit(elseIf.getCondition(), ctx) + " then"));
                sb.append(block(elseIf.getThenBranch(), ctx, elseIf.getElseBranch() == null ? ";" : ""));
                elseBranch = elseIf.getElseBranch();
            } else {
                sb.append(ctx.line("else"));
                DelphiBlock elseBlock = elseBranch.getKind() == DelphiNodeKind.BLOCK
                        ? (DelphiBlock) elseBranch
                        : new DelphiBlock(List.of(elseBranch));
                sb.append(block(elseBlock, ctx, ";"));
                elseBranch = null;
            }
        }
        return sb.toString();
    }

    private static String forStatement(DelphiFor node, EmitContext ctx) {
        return ctx.line("for " + node.getVariable() + " := " + DelphiExpressionEmitter.emit(node.getStart(), ctx)
                + (node.isDownto() ? " downto " : " to ") + DelphiExpressionEmitter.emit(node.getEnd(), ctx) + " do")
                + block(node.getBody(), ctx, ";");
    }

    private static String repeatStatement(DelphiRepeat node, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append(ctx.line("repeat"));
        if (node.getBody() != null) {
            EmitContext inner = ctx.indented();
            for (DelphiNode statement : node.getBody().getStatements()) {
                sb.append(statement(statement, inner));
            }
        }
        sb.append(ctx.line("until " + DelphiExpressionEmitter.emit(node.getUntilCondition(), ctx) + ";"));
        return sb.toString();
    }

    private static String caseStatement(DelphiCase node, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append(ctx.line("case " + DelphiExpressionEmitter.emit(node.getSelector(), ctx) + " of"));
        EmitContext armCtx = ctx.indented();
        for (DelphiCaseArm arm : node.getArms()) {
            sb.append(armCtx.line(String.join(", ", DelphiExpressionEmitter.emitAll(arm.getLabels(), armCtx)) + ":"));
            sb.append(block(new DelphiBlock(arm.getStatements()), armCtx.indented(), ";"));
        }
        if (node.getElseStatements() != null) {
            sb.append(ctx.line("else"));
            for (DelphiNode statement : node.getElseStatements()) {
                sb.append(statement(statement, armCtx));
            }
        }
        sb.append(ctx.line("end;"));
        return sb.toString();
    }

    private static String tryExcept(DelphiTryExcept node, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        EmitContext inner = ctx.indented();
        sb.append(ctx.line("try"));
        appendStatements(sb, node.getBody(), inner);
        sb.append(ctx.line("except"));
        if (node.getExceptionType() != null) {
            String name = node.getExceptionName() != null ? node.getExceptionName() + ": " : "";
            sb.append(inner.line("on " + name + node.getExceptionType() + " do"));
            sb.append(block(node.getHandler(), inner, ";"));
        } else {
            appendStatements(sb, node.getHandler(), inner);
        }
        sb.append(ctx.line("end;"));
        return sb.toString();
    }

    private static String tryFinally(DelphiTryFinally node, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        EmitContext inner = ctx.indented();
        sb.append(ctx.line("try"));
        appendStatements(sb, node.getBody(), inner);
        sb.append(ctx.line("finally"));
        appendStatements(sb, node.getFinallyBlock(), inner);
        sb.append(ctx.line("end;"));
        return sb.toString();
    }

    private static void appendStatements(StringBuilder sb, DelphiBlock block, EmitContext ctx) {
        if (block == null) {
            return;
        }
        for (DelphiNode statement : block.getStatements()) {
            sb.append(statement(statement, ctx));
        }
    }

    private static String comment(DelphiComment comment, EmitContext ctx) {
        String prefix = comment.isDoc() ? "///" : "//";
        StringBuilder sb = new StringBuilder();
        for (String line : comment.getText().split("\n", -1)) {
            sb.append(ctx.line(line.isEmpty() ? prefix : prefix + " " + line));
        }
        return sb.toString();
    }

    private static String placeholderLine(String kind, EmitContext ctx) {
        ctx.warn(kind, "Node kind '" + kind + "' cannot be rendered in this position");
        return ctx.line("{ Unknown node: " + kind + " }");
    }
}
