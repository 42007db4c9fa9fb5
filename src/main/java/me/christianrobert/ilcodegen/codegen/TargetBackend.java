package me.christianrobert.ilcodegen.codegen;

import me.christianrobert.ilcodegen.codegen.context.CodegenWarning;
import me.christianrobert.ilcodegen.config.CodegenOptions;
import me.christianrobert.ilcodegen.il.IlNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Pairs the transformer and emitter of one target.
 *
 * @param <U> root node type of the target AST
 */
public class TargetBackend<U> {

    private final Transformer<U> transformer;
    private final Emitter<U> emitter;

    public TargetBackend(Transformer<U> transformer, Emitter<U> emitter) {
        this.transformer = transformer;
        this.emitter = emitter;
    }

    public String getTargetId() {
        return transformer.getTargetId();
    }

    /**
     * Runs transform then emit. Warnings of both phases are returned in order.
     */
    public GeneratedCode generate(IlNode program, CodegenOptions options) {
        TransformResult<U> transformed = transformer.transform(program, options);
        EmitResult emitted = emitter.emit(transformed.getUnit(), options);

        List<CodegenWarning> warnings = new ArrayList<>(transformed.getWarnings());
        warnings.addAll(emitted.getWarnings());
        return new GeneratedCode(emitted.getText(), warnings, transformed.getHelpers());
    }

    public Transformer<U> getTransformer() {
        return transformer;
    }

    public Emitter<U> getEmitter() {
        return emitter;
    }
}
