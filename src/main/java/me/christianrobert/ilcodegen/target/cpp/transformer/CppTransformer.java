package me.christianrobert.ilcodegen.target.cpp.transformer;

import me.christianrobert.ilcodegen.codegen.TransformResult;
import me.christianrobert.ilcodegen.codegen.Transformer;
import me.christianrobert.ilcodegen.codegen.context.TransformationContext;
import me.christianrobert.ilcodegen.config.CodegenOptions;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.cpp.ast.CppCompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * IL to C++ transformation entry point.
 *
 * <p>Stateless: each call creates its own {@link TransformationContext} and
 * {@link CppCodeBuilder}.</p>
 */
public class CppTransformer implements Transformer<CppCompilationUnit> {

    private static final Logger log = LoggerFactory.getLogger(CppTransformer.class);

    @Override
    public String getTargetId() {
        return CodegenOptions.TARGET_CPP;
    }

    @Override
    public TransformResult<CppCompilationUnit> transform(IlNode program, CodegenOptions options) {
        CodegenOptions effective = options != null ? options : CodegenOptions.defaults(CodegenOptions.TARGET_CPP);
        TransformationContext context = new TransformationContext(CodegenOptions.TARGET_CPP, effective);
        CppCodeBuilder builder = new CppCodeBuilder(context);

        IlNode root = program;
        if (root == null || !root.is(IlKind.PROGRAM)) {
            // a lone declaration is treated as a one-statement program
            context.warn(root, "Root is not a Program node");
            root = IlNode.builder(IlKind.PROGRAM).nodes("body", root != null ? List.of(root) : List.of()).build();
        }

        CppCompilationUnit unit = VisitProgram.v(root, builder);
        log.debug("Transformed program into {} C++ declarations ({} warnings, {} helpers)",
                unit.getDeclarations().size(), context.getWarnings().size(), context.getHelpers().size());
        return new TransformResult<>(unit, context.getWarnings(), context.getHelpers());
    }
}
