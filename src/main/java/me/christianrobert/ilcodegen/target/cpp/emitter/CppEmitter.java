package me.christianrobert.ilcodegen.target.cpp.emitter;

import me.christianrobert.ilcodegen.codegen.EmitResult;
import me.christianrobert.ilcodegen.codegen.Emitter;
import me.christianrobert.ilcodegen.codegen.emit.EmitContext;
import me.christianrobert.ilcodegen.codegen.emit.ListLayout;
import me.christianrobert.ilcodegen.config.CodegenOptions;
import me.christianrobert.ilcodegen.target.cpp.CppNames;
import me.christianrobert.ilcodegen.target.cpp.ast.CppBlock;
import me.christianrobert.ilcodegen.target.cpp.ast.CppCatchClause;
import me.christianrobert.ilcodegen.target.cpp.ast.CppClass;
import me.christianrobert.ilcodegen.target.cpp.ast.CppComment;
import me.christianrobert.ilcodegen.target.cpp.ast.CppCompilationUnit;
import me.christianrobert.ilcodegen.target.cpp.ast.CppConstructor;
import me.christianrobert.ilcodegen.target.cpp.ast.CppDoWhile;
import me.christianrobert.ilcodegen.target.cpp.ast.CppExpressionStatement;
import me.christianrobert.ilcodegen.target.cpp.ast.CppField;
import me.christianrobert.ilcodegen.target.cpp.ast.CppFor;
import me.christianrobert.ilcodegen.target.cpp.ast.CppFunction;
import me.christianrobert.ilcodegen.target.cpp.ast.CppIf;
import me.christianrobert.ilcodegen.target.cpp.ast.CppInclude;
import me.christianrobert.ilcodegen.target.cpp.ast.CppMemberInitializer;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNode;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNodeKind;
import me.christianrobert.ilcodegen.target.cpp.ast.CppParameter;
import me.christianrobert.ilcodegen.target.cpp.ast.CppRangeFor;
import me.christianrobert.ilcodegen.target.cpp.ast.CppReturn;
import me.christianrobert.ilcodegen.target.cpp.ast.CppSwitch;
import me.christianrobert.ilcodegen.target.cpp.ast.CppSwitchCase;
import me.christianrobert.ilcodegen.target.cpp.ast.CppThrow;
import me.christianrobert.ilcodegen.target.cpp.ast.CppTryCatch;
import me.christianrobert.ilcodegen.target.cpp.ast.CppVariableDeclaration;
import me.christianrobert.ilcodegen.target.cpp.ast.CppVisibility;
import me.christianrobert.ilcodegen.target.cpp.ast.CppWhile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Pretty-prints a C++ target tree.
 *
 * <p>Layout follows Allman style: opening braces of classes, functions and control statements
 * go on their own line at the enclosing indent. Declarations inside the namespace are not
 * indented. Expressions are delegated to {@link CppExpressionEmitter}.</p>
 *
 * <p>The emitter holds no state; indentation travels in the {@link EmitContext} passed to every
 * call.</p>
 */
public class CppEmitter implements Emitter<CppCompilationUnit> {

    private static final Logger log = LoggerFactory.getLogger(CppEmitter.class);

    @Override
    public EmitResult emit(CppCompilationUnit unit, CodegenOptions options) {
        CodegenOptions effective = options != null ? options : CodegenOptions.defaults(CodegenOptions.TARGET_CPP);
        EmitContext ctx = EmitContext.root(effective);

        String text;
        if (unit == null) {
            text = statement(null, ctx);
        } else {
            text = compilationUnit(unit, ctx);
        }
        log.debug("Emitted {} characters of C++ with {} warnings", text.length(), ctx.getWarnings().size());
        return new EmitResult(text, ctx.getWarnings());
    }

    // ========== Top level ==========

    private String compilationUnit(CppCompilationUnit unit, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        String nl = ctx.newline();

        if (unit.getHeaderComment() != null) {
            for (String line : unit.getHeaderComment().split("\n", -1)) {
                sb.append(line.isEmpty() ? "//" : "// " + line).append(nl);
            }
            sb.append(nl);
        }

        if (!unit.getIncludes().isEmpty()) {
            for (CppInclude include : unit.getIncludes()) {
                sb.append(include(include)).append(nl);
            }
            sb.append(nl);
        }

        boolean namespaced = unit.getNamespaceName() != null && !unit.getNamespaceName().isEmpty();
        if (namespaced) {
            sb.append("namespace ").append(unit.getNamespaceName()).append(" {").append(nl).append(nl);
        }

        CppNode previous = null;
        for (CppNode declaration : unit.getDeclarations()) {
            if (previous != null && !groupsWith(previous, declaration)) {
                sb.append(nl);
            }
            sb.append(declaration(declaration, ctx));
            previous = declaration;
        }

        if (namespaced) {
            if (previous != null) {
                sb.append(nl);
            }
            sb.append("}  // namespace ").append(unit.getNamespaceName()).append(nl);
        }
        return sb.toString();
    }

    private static String include(CppInclude include) {
        return include.isSystem()
                ? "#include <" + include.getPath() + ">"
                : "#include \"" + include.getPath() + "\"";
    }

    /**
     * Consecutive variables and consecutive prototypes stay together without a blank line.
     */
    private static boolean groupsWith(CppNode previous, CppNode next) {
        if (previous.getKind() != next.getKind()) {
            return false;
        }
        if (next.getKind() == CppNodeKind.VARIABLE_DECLARATION) {
            return true;
        }
        return next.getKind() == CppNodeKind.FUNCTION
                && ((CppFunction) previous).getBody() == null
                && ((CppFunction) next).getBody() == null;
    }

    private String declaration(CppNode node, EmitContext ctx) {
        if (node == null) {
            return statement(null, ctx);
        }
        return switch (node.getKind()) {
            case CLASS -> classDeclaration((CppClass) node, ctx);
            case FUNCTION -> function((CppFunction) node, ctx);
            case VARIABLE_DECLARATION, COMMENT -> statement(node, ctx);
            case COMPILATION_UNIT, INCLUDE, FIELD, CONSTRUCTOR, PARAMETER, MEMBER_INITIALIZER, BLOCK,
                 EXPRESSION_STATEMENT, RETURN, IF, FOR, RANGE_FOR, WHILE, DO_WHILE, SWITCH, SWITCH_CASE, BREAK,
                 CONTINUE, THROW, TRY_CATCH, CATCH_CLAUSE, LITERAL, IDENTIFIER, BINARY, UNARY, ASSIGNMENT,
                 MEMBER_ACCESS, ELEMENT_ACCESS, CALL, OBJECT_CREATION, INITIALIZER_LIST, CAST, CONDITIONAL,
                 LAMBDA, THIS -> placeholderLine(node.getKind().name(), ctx);
        };
    }

    // ========== Classes ==========

    private String classDeclaration(CppClass cls, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        if (cls.getDocComment() != null) {
            sb.append(comment(cls.getDocComment(), ctx));
        }
        String header = "class " + cls.getName();
        if (cls.getBaseClass() != null) {
            header += " : public " + cls.getBaseClass();
        }
        sb.append(ctx.line(header));
        sb.append(ctx.line("{"));

        EmitContext inner = ctx.indented();
        CppVisibility current = null;
        boolean first = true;
        for (CppNode member : cls.getMembers()) {
            CppVisibility visibility = visibilityOf(member);
            if (visibility != current) {
                if (!first) {
                    sb.append(ctx.newline());
                }
                sb.append(ctx.line(visibility.label()));
                current = visibility;
            } else if (!first && spacedMember(member)) {
                sb.append(ctx.newline());
            }
            sb.append(member(member, cls.getName(), inner));
            first = false;
        }
        sb.append(ctx.line("};"));
        return sb.toString();
    }

    private static CppVisibility visibilityOf(CppNode member) {
        if (member == null) {
            return CppVisibility.PUBLIC;
        }
        return switch (member.getKind()) {
            case FIELD -> ((CppField) member).getVisibility();
            case FUNCTION -> ((CppFunction) member).getVisibility();
            default -> CppVisibility.PUBLIC;
        };
    }

    private static boolean spacedMember(CppNode member) {
        return member != null && member.getKind() != CppNodeKind.FIELD;
    }

    private String member(CppNode member, String className, EmitContext ctx) {
        if (member == null) {
            return statement(null, ctx);
        }
        return switch (member.getKind()) {
            case FIELD -> field((CppField) member, ctx);
            case FUNCTION -> function((CppFunction) member, ctx);
            case CONSTRUCTOR -> constructor((CppConstructor) member, className, ctx);
            case COMMENT -> statement(member, ctx);
            default -> placeholderLine(member.getKind().name(), ctx);
        };
    }

    private String field(CppField field, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        if (field.isStatic()) {
            sb.append(field.isConstexpr() ? "static constexpr " : "static inline ");
        }
        sb.append(field.getType()).append(' ').append(field.getName());
        if (field.getInitializer() != null) {
            sb.append(" = ").append(CppExpressionEmitter.emit(field.getInitializer(), ctx));
        } else {
            sb.append("{}");
        }
        sb.append(';');
        return ctx.line(sb.toString());
    }

    private String constructor(CppConstructor constructor, String className, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        if (constructor.getDocComment() != null) {
            sb.append(comment(constructor.getDocComment(), ctx));
        }
        String prefix = constructor.getParameters().size() == 1 ? "explicit " : "";
        sb.append(ctx.indent()).append(prefix).append(className)
                .append(parameterList(constructor.getParameters(), ctx)).append(ctx.newline());

        if (!constructor.getInitializers().isEmpty()) {
            List<String> entries = new ArrayList<>();
            for (CppMemberInitializer initializer : constructor.getInitializers()) {
                entries.add(initializer.getName() + "("
                        + String.join(", ", CppExpressionEmitter.emitAll(initializer.getArguments(), ctx)) + ")");
            }
            sb.append(ctx.indented().line(": " + String.join(", ", entries)));
        }
        sb.append(block(constructor.getBody(), ctx));
        return sb.toString();
    }

    // ========== Functions ==========

    private String function(CppFunction function, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        if (function.getDocComment() != null) {
            sb.append(comment(function.getDocComment(), ctx));
        }
        StringBuilder signature = new StringBuilder();
        if (function.isStatic()) {
            signature.append("static ");
        }
        signature.append(function.getReturnType()).append(' ').append(function.getName())
                .append(parameterList(function.getParameters(), ctx));
        if (function.isConstMethod()) {
            signature.append(" const");
        }
        if (function.getBody() == null) {
            return sb.append(ctx.line(signature + ";")).toString();
        }
        sb.append(ctx.line(signature.toString()));
        sb.append(block(function.getBody(), ctx));
        return sb.toString();
    }

    static String parameterList(List<CppParameter> parameters, EmitContext ctx) {
        return ListLayout.layout("", "(", c -> {
            List<String> rendered = new ArrayList<>();
            for (CppParameter parameter : parameters) {
                String text = parameter.getType() + " " + parameter.getName();
                if (parameter.getDefaultValue() != null) {
                    text += " = " + CppExpressionEmitter.emit(parameter.getDefaultValue(), c);
                }
                rendered.add(text);
            }
            return rendered;
        }, ",", ")", ctx, false);
    }

    // ========== Statements ==========

    /**
     * Renders a braced block at the given indent; the statements go one level deeper.
     */
    static String block(CppBlock block, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append(ctx.line("{"));
        if (block != null) {
            EmitContext inner = ctx.indented();
            for (CppNode statement : block.getStatements()) {
                sb.append(statement(statement, inner));
            }
        }
        sb.append(ctx.line("}"));
        return sb.toString();
    }

    static String statement(CppNode node, EmitContext ctx) {
        if (node == null) {
            return placeholderLine("null", ctx);
        }
        return switch (node.getKind()) {
            case BLOCK -> block((CppBlock) node, ctx);
            case VARIABLE_DECLARATION -> ctx.line(variableDeclaration((CppVariableDeclaration) node, ctx) + ";");
            case EXPRESSION_STATEMENT ->
                    ctx.line(CppExpressionEmitter.emit(((CppExpressionStatement) node).getExpression(), ctx) + ";");
            case RETURN -> returnStatement((CppReturn) node, ctx);
            case IF -> ifStatement((CppIf) node, ctx);
            case FOR -> forStatement((CppFor) node, ctx);
            case RANGE_FOR -> rangeFor((CppRangeFor) node, ctx);
            case WHILE -> ctx.line("while (" + CppExpressionEmitter.emit(((CppWhile) node).getCondition(), ctx) + ")")
                    + block(((CppWhile) node).getBody(), ctx);
            case DO_WHILE -> doWhile((CppDoWhile) node, ctx);
            case SWITCH -> switchStatement((CppSwitch) node, ctx);
            case BREAK -> ctx.line("break;");
            case CONTINUE -> ctx.line("continue;");
            case THROW -> ((CppThrow) node).getExpression() == null
                    ? ctx.line("throw;")
                    : ctx.line("throw " + CppExpressionEmitter.emit(((CppThrow) node).getExpression(), ctx) + ";");
            case TRY_CATCH -> tryCatch((CppTryCatch) node, ctx);
            case COMMENT -> comment((CppComment) node, ctx);
            case COMPILATION_UNIT, INCLUDE, CLASS, FIELD, FUNCTION, CONSTRUCTOR, PARAMETER, MEMBER_INITIALIZER,
                 SWITCH_CASE, CATCH_CLAUSE, LITERAL, IDENTIFIER, BINARY, UNARY, ASSIGNMENT, MEMBER_ACCESS,
                 ELEMENT_ACCESS, CALL, OBJECT_CREATION, INITIALIZER_LIST, CAST, CONDITIONAL, LAMBDA, THIS ->
                    placeholderLine(node.getKind().name(), ctx);
        };
    }

    private static String variableDeclaration(CppVariableDeclaration declaration, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        if (declaration.isConstexpr()) {
            sb.append("constexpr ");
        } else if (declaration.isConst()) {
            sb.append("const ");
        }
        sb.append(declaration.getType()).append(' ').append(declaration.getName());
        if (declaration.getInitializer() != null) {
            sb.append(" = ").append(CppExpressionEmitter.emit(declaration.getInitializer(), ctx));
        } else if (declaration.isValueInitialized()) {
            sb.append("{}");
        }
        return sb.toString();
    }

    private static String returnStatement(CppReturn node, EmitContext ctx) {
        if (node.getExpression() == null) {
            return ctx.line("return;");
        }
        return ctx.line("return " + CppExpressionEmitter.emit(node.getExpression(), ctx) + ";");
    }

    private static String ifStatement(CppIf node, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append(ctx.line("if (" + CppExpressionEmitter.emit(node.getCondition(), ctx) + ")"));
        sb.append(block(node.getThenBranch(), ctx));

        CppNode elseBranch = node.getElseBranch();
        while (elseBranch != null) {
            if (elseBranch.getKind() == CppNodeKind.IF) {
                CppIf elseIf = (CppIf) elseBranch;
                sb.append(ctx.line("else if (" + CppExpressionEmitter.emit(elseIf.getCondition(), ctx) + ")"));
                sb.append(block(elseIf.getThenBranch(), ctx));
                elseBranch = elseIf.getElseBranch();
            } else {
                sb.append(ctx.line("else"));
                if (elseBranch.getKind() == CppNodeKind.BLOCK) {
                    sb.append(block((CppBlock) elseBranch, ctx));
                } else {
                    sb.append(ctx.line("{"));
                    sb.append(statement(elseBranch, ctx.indented()));
                    sb.append(ctx.line("}"));
                }
                elseBranch = null;
            }
        }
        return sb.toString();
    }

    private static String forStatement(CppFor node, EmitContext ctx) {
        String init = "";
        CppNode initializer = node.getInitializer();
        if (initializer != null) {
            init = initializer.getKind() == CppNodeKind.VARIABLE_DECLARATION
                    ? variableDeclaration((CppVariableDeclaration) initializer, ctx)
                    : CppExpressionEmitter.emit(initializer, ctx);
        }
        String condition = node.getCondition() != null ? " " + CppExpressionEmitter.emit(node.getCondition(), ctx) : "";
        String update = node.getUpdate() != null ? " " + CppExpressionEmitter.emit(node.getUpdate(), ctx) : "";
        return ctx.line("for (" + init + ";" + condition + ";" + update + ")") + block(node.getBody(), ctx);
    }

    private static String rangeFor(CppRangeFor node, EmitContext ctx) {
        return ctx.line("for (" + node.getType() + " " + node.getName() + " : "
                + CppExpressionEmitter.emit(node.getRange(), ctx) + ")")
                + block(node.getBody(), ctx);
    }

    private static String doWhile(CppDoWhile node, EmitContext ctx) {
        String body = block(node.getBody(), ctx);
        // Closing brace and condition share the last line
        String withoutLastLine = body.substring(0, body.length() - ctx.line("}").length());
        return ctx.line("do") + withoutLastLine
                + ctx.line("} while (" + CppExpressionEmitter.emit(node.getCondition(), ctx) + ");");
    }

    private static String switchStatement(CppSwitch node, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append(ctx.line("switch (" + CppExpressionEmitter.emit(node.getExpression(), ctx) + ")"));
        sb.append(ctx.line("{"));
        EmitContext caseCtx = ctx.indented();
        for (CppSwitchCase switchCase : node.getCases()) {
            for (CppNode label : switchCase.getLabels()) {
                sb.append(caseCtx.line("case " + CppExpressionEmitter.emit(label, caseCtx) + ":"));
            }
            if (switchCase.isDefault()) {
                sb.append(caseCtx.line("default:"));
            }
            boolean scoped = switchCase.getStatements().stream()
                    .anyMatch(s -> s != null && s.getKind() == CppNodeKind.VARIABLE_DECLARATION);
            if (scoped) {
                sb.append(block(new CppBlock(switchCase.getStatements()), caseCtx));
            } else {
                for (CppNode statement : switchCase.getStatements()) {
                    sb.append(statement(statement, caseCtx.indented()));
                }
            }
        }
        sb.append(ctx.line("}"));
        return sb.toString();
    }

    private static String tryCatch(CppTryCatch node, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append(ctx.line("try"));
        sb.append(block(node.getTryBlock(), ctx));
        for (CppCatchClause clause : node.getCatches()) {
            String parameter = clause.getExceptionType() == null
                    ? "..."
                    : clause.getExceptionType() + (clause.getName() != null ? " " + clause.getName() : "");
            sb.append(ctx.line("catch (" + parameter + ")"));
            sb.append(block(clause.getBody(), ctx));
        }
        return sb.toString();
    }

    private static String comment(CppComment comment, EmitContext ctx) {
        String[] lines = comment.getText().split("\n", -1);
        StringBuilder sb = new StringBuilder();
        if (comment.isDoc()) {
            sb.append(ctx.line("/**"));
            for (String line : lines) {
                sb.append(ctx.line(line.isEmpty() ? " *" : " * " + CppNames.blockCommentText(line)));
            }
            sb.append(ctx.line(" */"));
        } else {
            for (String line : lines) {
                sb.append(ctx.line(line.isEmpty() ? "//" : "// " + line));
            }
        }
        return sb.toString();
    }

    private static String placeholderLine(String kind, EmitContext ctx) {
        ctx.warn(kind, "Node kind '" + kind + "' cannot be rendered in this position");
        return ctx.line("/* Unknown node: " + kind + " */");
    }
}
