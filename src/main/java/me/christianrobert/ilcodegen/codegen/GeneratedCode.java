package me.christianrobert.ilcodegen.codegen;

import me.christianrobert.ilcodegen.codegen.context.CodegenWarning;
import me.christianrobert.ilcodegen.codegen.runtime.RuntimeHelper;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Output of a full transform-and-emit run of one target.
 */
public final class GeneratedCode {

    private final String text;
    private final List<CodegenWarning> warnings;
    private final Set<RuntimeHelper> helpers;

    public GeneratedCode(String text, List<CodegenWarning> warnings, Set<RuntimeHelper> helpers) {
        this.text = text;
        this.warnings = List.copyOf(warnings);
        EnumSet<RuntimeHelper> copy = EnumSet.noneOf(RuntimeHelper.class);
        copy.addAll(helpers);
        this.helpers = Collections.unmodifiableSet(copy);
    }

    public String getText() {
        return text;
    }

    public List<CodegenWarning> getWarnings() {
        return warnings;
    }

    public Set<RuntimeHelper> getHelpers() {
        return helpers;
    }
}
