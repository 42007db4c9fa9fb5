package me.christianrobert.ilcodegen.target.delphi.transformer;

import me.christianrobert.ilcodegen.codegen.analysis.ModuleWrappers;
import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.context.SymbolRole;
import me.christianrobert.ilcodegen.codegen.context.TransformationContext;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.config.CodegenOptions;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.delphi.DelphiNames;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNode;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiUnit;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for the program root.
 *
 * <h3>Steps:</h3>
 * <ol>
 *   <li>Module wrappers are flattened into top-level statements.</li>
 *   <li>A pre-pass declares every routine, class and constant of the module and registers the
 *       class hierarchy, so later declarations can be referenced and methods get their
 *       {@code virtual}/{@code override} directives.</li>
 *   <li>Top-level statements are transformed in source order. Statements that are not
 *       declarations are dropped with a warning.</li>
 *   <li>The uses clause lists the standard units referenced by types and library calls, plus
 *       the runtime unit when a helper is used.</li>
 * </ol>
 *
 * <p>Routine headings go to the interface part, so free routines may call each other in any
 * order without forward declarations.</p>
 */
public class VisitProgram {

    public static DelphiUnit v(IlNode program, DelphiCodeBuilder b) {
        TransformationContext context = b.getContext();
        CodegenOptions options = b.getOptions();
        List<IlNode> statements = ModuleWrappers.flatten(program.nodes("body"));

        // STEP 1: Pre-pass
        for (IlNode statement : statements) {
            declare(statement, b);
        }

        // STEP 2: Declarations in source order
        List<DelphiNode> declarations = new ArrayList<>();
        for (IlNode statement : statements) {
            switch (statement.getKind()) {
                case FUNCTION_DECLARATION ->
                        declarations.add(VisitFunctionDeclaration.v(statement, statement.name(), b));
                case CLASS_DECLARATION -> declarations.add(VisitClassDeclaration.v(statement, b));
                case VARIABLE_DECLARATION -> declarations.addAll(VisitVariableDeclaration.moduleLevel(statement, b));
                case EMPTY_STATEMENT -> {
                }
                case EXPRESSION_STATEMENT -> context.warn(statement, "Top-level statement dropped");
                default -> context.unsupported(statement);
            }
        }

        // STEP 3: Uses clause
        List<String> uses = new ArrayList<>(context.getImports());
        if (context.usesHelpers()) {
            uses.add(options.getString(CodegenOptions.RUNTIME_UNIT));
        }

        String header = options.isAddComments()
                ? "Generated by ilcodegen (Delphi target)\nDo not edit by hand."
                : null;
        return new DelphiUnit(header, options.getString(CodegenOptions.UNIT_NAME), uses, declarations,
                b.getInitialization());
    }

    private static void declare(IlNode statement, DelphiCodeBuilder b) {
        switch (statement.getKind()) {
            case FUNCTION_DECLARATION -> declareRoutine(statement.name(), statement, b);
            case CLASS_DECLARATION -> VisitClassDeclaration.declareType(statement, b);
            case VARIABLE_DECLARATION -> {
                for (IlNode declarator : statement.nodes("declarations")) {
                    if (declarator.name() == null) {
                        continue;
                    }
                    IlNode init = declarator.node("init");
                    if (init != null && init.getKind().isFunctionLike()) {
                        declareRoutine(declarator.name(), init, b);
                    } else {
                        VisitVariableDeclaration.declareModuleSymbol(statement, declarator, b);
                    }
                }
            }
            default -> {
            }
        }
    }

    private static void declareRoutine(String name, IlNode function, DelphiCodeBuilder b) {
        if (name == null) {
            return;
        }
        b.getContext().getSymbols().declareGlobal(new SymbolInfo(name, DelphiNames.routine(name),
                TypeDescriptor.parse(function.text("returnType")), SymbolRole.FUNCTION));
    }
}
