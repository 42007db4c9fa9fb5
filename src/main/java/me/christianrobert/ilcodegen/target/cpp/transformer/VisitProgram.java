package me.christianrobert.ilcodegen.target.cpp.transformer;

import me.christianrobert.ilcodegen.codegen.analysis.ModuleWrappers;
import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.context.SymbolRole;
import me.christianrobert.ilcodegen.codegen.context.TransformationContext;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.config.CodegenOptions;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.cpp.CppNames;
import me.christianrobert.ilcodegen.target.cpp.ast.CppCompilationUnit;
import me.christianrobert.ilcodegen.target.cpp.ast.CppFunction;
import me.christianrobert.ilcodegen.target.cpp.ast.CppInclude;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNode;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for the program root.
 *
 * <h3>Steps:</h3>
 * <ol>
 *   <li>Module wrappers are flattened into top-level statements.</li>
 *   <li>A pre-pass declares every function, class and constant of the module.</li>
 *   <li>Top-level statements are transformed in source order. Statements that are not
 *       declarations are dropped with a warning.</li>
 *   <li>With two or more free functions, prototypes are placed before the first one, so the
 *       functions may call each other in any order.</li>
 *   <li>Includes are collected from the types and library calls used, plus the runtime
 *       header when a helper is referenced.</li>
 * </ol>
 */
public class VisitProgram {

    public static CppCompilationUnit v(IlNode program, CppCodeBuilder b) {
        TransformationContext context = b.getContext();
        CodegenOptions options = b.getOptions();
        List<IlNode> statements = ModuleWrappers.flatten(program.nodes("body"));

        // STEP 1: Pre-pass
        for (IlNode statement : statements) {
            declare(statement, b);
        }

        // STEP 2: Declarations in source order
        List<CppNode> declarations = new ArrayList<>();
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

        // STEP 3: Prototypes
        List<CppNode> withPrototypes = withPrototypes(declarations);

        // STEP 4: Includes
        List<CppInclude> includes = new ArrayList<>();
        for (String header : context.getImports()) {
            includes.add(new CppInclude(header, true));
        }
        if (context.usesHelpers()) {
            includes.add(new CppInclude(options.getString(CodegenOptions.RUNTIME_HEADER), false));
        }

        String header = options.isAddComments()
                ? "Generated by ilcodegen (C++ target)\nDo not edit by hand."
                : null;
        return new CppCompilationUnit(header, includes, options.getString(CodegenOptions.NAMESPACE), withPrototypes);
    }

    private static void declare(IlNode statement, CppCodeBuilder b) {
        switch (statement.getKind()) {
            case FUNCTION_DECLARATION -> declareFunction(statement.name(), statement, b);
            case CLASS_DECLARATION -> VisitClassDeclaration.declareType(statement, b);
            case VARIABLE_DECLARATION -> {
                for (IlNode declarator : statement.nodes("declarations")) {
                    if (declarator.name() == null) {
                        continue;
                    }
                    IlNode init = declarator.node("init");
                    if (init != null && init.getKind().isFunctionLike()) {
                        declareFunction(declarator.name(), init, b);
                    } else {
                        VisitVariableDeclaration.declareModuleSymbol(statement, declarator, b);
                    }
                }
            }
            default -> {
            }
        }
    }

    private static void declareFunction(String name, IlNode function, CppCodeBuilder b) {
        if (name == null) {
            return;
        }
        b.getContext().getSymbols().declareGlobal(new SymbolInfo(name, CppNames.function(name),
                TypeDescriptor.parse(function.text("returnType")), SymbolRole.FUNCTION));
    }

    private static List<CppNode> withPrototypes(List<CppNode> declarations) {
        List<CppFunction> functions = new ArrayList<>();
        int first = -1;
        for (int i = 0; i < declarations.size(); i++) {
            if (declarations.get(i).getKind() == CppNodeKind.FUNCTION) {
                functions.add((CppFunction) declarations.get(i));
                if (first < 0) {
                    first = i;
                }
            }
        }
        if (functions.size() < 2) {
            return declarations;
        }
        List<CppNode> result = new ArrayList<>(declarations.subList(0, first));
        for (CppFunction function : functions) {
            result.add(VisitFunctionDeclaration.prototype(function));
        }
        result.addAll(declarations.subList(first, declarations.size()));
        return result;
    }
}
