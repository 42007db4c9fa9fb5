package me.christianrobert.ilcodegen.codegen;

import me.christianrobert.ilcodegen.config.CodegenOptions;
import me.christianrobert.ilcodegen.il.IlNode;

/**
 * Rewrites an IL tree into the AST of one target grammar.
 *
 * <p>Implementations hold no mutable state: all per-run state lives in a context created
 * inside {@link #transform}, so one instance can be reused and independent instances can run
 * concurrently. Unsupported IL kinds never throw; they are reported as warnings.</p>
 *
 * @param <U> root node type of the target AST
 */
public interface Transformer<U> {

    String getTargetId();

    TransformResult<U> transform(IlNode program, CodegenOptions options);
}
