package me.christianrobert.ilcodegen.codegen;

import me.christianrobert.ilcodegen.config.CodegenOptions;

/**
 * Pretty-prints a target AST into source text.
 *
 * <p>Like {@link Transformer}, implementations are stateless; indentation and warnings live
 * in an {@link me.christianrobert.ilcodegen.codegen.emit.EmitContext} created per call.
 * Nodes that cannot be rendered produce an inline placeholder comment, never an exception.</p>
 *
 * @param <U> root node type of the target AST
 */
public interface Emitter<U> {

    EmitResult emit(U unit, CodegenOptions options);
}
