package me.christianrobert.ilcodegen.codegen;

import me.christianrobert.ilcodegen.codegen.context.CodegenWarning;

import java.util.List;

/**
 * Emitted source text and the warnings raised while printing it.
 */
public final class EmitResult {

    private final String text;
    private final List<CodegenWarning> warnings;

    public EmitResult(String text, List<CodegenWarning> warnings) {
        this.text = text;
        this.warnings = List.copyOf(warnings);
    }

    public String getText() {
        return text;
    }

    public List<CodegenWarning> getWarnings() {
        return warnings;
    }
}
