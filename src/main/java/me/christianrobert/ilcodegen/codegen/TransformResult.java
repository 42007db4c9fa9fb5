package me.christianrobert.ilcodegen.codegen;

import me.christianrobert.ilcodegen.codegen.context.CodegenWarning;
import me.christianrobert.ilcodegen.codegen.runtime.RuntimeHelper;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Target AST produced by a transformer plus the diagnostics of the run.
 */
public final class TransformResult<U> {

    private final U unit;
    private final List<CodegenWarning> warnings;
    private final Set<RuntimeHelper> helpers;

    public TransformResult(U unit, List<CodegenWarning> warnings, Set<RuntimeHelper> helpers) {
        this.unit = unit;
        this.warnings = List.copyOf(warnings);
        EnumSet<RuntimeHelper> copy = EnumSet.noneOf(RuntimeHelper.class);
        copy.addAll(helpers);
        this.helpers = Collections.unmodifiableSet(copy);
    }

    public U getUnit() {
        return unit;
    }

    public List<CodegenWarning> getWarnings() {
        return warnings;
    }

    /**
     * Runtime helpers referenced by the generated code.
     */
    public Set<RuntimeHelper> getHelpers() {
        return helpers;
    }
}
