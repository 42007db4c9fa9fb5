package me.christianrobert.ilcodegen.codegen.emit;

import me.christianrobert.ilcodegen.codegen.context.CodegenWarning;
import me.christianrobert.ilcodegen.config.CodegenOptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Formatting state of one emit run.
 *
 * <p>The indent depth is immutable per instance; {@link #indented()} returns a context one
 * level deeper that shares the same options and warning list. Emitters pass the deeper
 * context into every block body.</p>
 */
public final class EmitContext {

    private final CodegenOptions options;
    private final String indentUnit;
    private final String lineEnding;
    private final int depth;
    private final List<CodegenWarning> warnings;

    private EmitContext(CodegenOptions options, int depth, List<CodegenWarning> warnings) {
        this.options = options;
        this.indentUnit = options.getIndent();
        this.lineEnding = options.getLineEnding();
        this.depth = depth;
        this.warnings = warnings;
    }

    /**
     * Fresh context at depth zero with an empty warning list.
     */
    public static EmitContext root(CodegenOptions options) {
        return new EmitContext(options, 0, new ArrayList<>());
    }

    public EmitContext indented() {
        return new EmitContext(options, depth + 1, warnings);
    }

    /**
     * Indentation string of this depth.
     */
    public String indent() {
        return indentUnit.repeat(depth);
    }

    public String newline() {
        return lineEnding;
    }

    /**
     * Indented line terminated by the line ending.
     */
    public String line(String text) {
        return indent() + text + lineEnding;
    }

    public int getDepth() {
        return depth;
    }

    public String getIndentUnit() {
        return indentUnit;
    }

    public CodegenOptions getOptions() {
        return options;
    }

    public void warn(String nodeKind, String message) {
        warnings.add(new CodegenWarning(CodegenWarning.Phase.EMIT, nodeKind, message, null));
    }

    public List<CodegenWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
