package me.christianrobert.ilcodegen.target.delphi.transformer;

import me.christianrobert.ilcodegen.codegen.TransformResult;
import me.christianrobert.ilcodegen.codegen.Transformer;
import me.christianrobert.ilcodegen.codegen.context.TransformationContext;
import me.christianrobert.ilcodegen.config.CodegenOptions;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * IL to Delphi transformation entry point. Stateless, like the C++ transformer.
 */
public class DelphiTransformer implements Transformer<DelphiUnit> {

    private static final Logger log = LoggerFactory.getLogger(DelphiTransformer.class);

    @Override
    public String getTargetId() {
        return CodegenOptions.TARGET_DELPHI;
    }

    @Override
    public TransformResult<DelphiUnit> transform(IlNode program, CodegenOptions options) {
        CodegenOptions effective = options != null ? options : CodegenOptions.defaults(CodegenOptions.TARGET_DELPHI);
        TransformationContext context = new TransformationContext(CodegenOptions.TARGET_DELPHI, effective);
        DelphiCodeBuilder builder = new DelphiCodeBuilder(context);

        IlNode root = program;
        if (root == null || !root.is(IlKind.PROGRAM)) {
            context.warn(root, "Root is not a Program node");
            root = IlNode.builder(IlKind.PROGRAM).nodes("body", root != null ? List.of(root) : List.of()).build();
        }

        DelphiUnit unit = VisitProgram.v(root, builder);
        log.debug("Transformed program into unit {} with {} declarations ({} warnings, {} helpers)",
                unit.getName(), unit.getDeclarations().size(), context.getWarnings().size(),
                context.getHelpers().size());
        return new TransformResult<>(unit, context.getWarnings(), context.getHelpers());
    }
}
