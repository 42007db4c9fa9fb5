package me.christianrobert.ilcodegen.service;

import me.christianrobert.ilcodegen.codegen.GeneratedCode;
import me.christianrobert.ilcodegen.codegen.context.CodegenException;
import me.christianrobert.ilcodegen.codegen.context.CodegenWarning;
import me.christianrobert.ilcodegen.codegen.runtime.RuntimeHelper;

import java.util.List;
import java.util.Set;

/**
 * Result of a generation run.
 * Contains either the emitted source text with its warnings or an error message.
 * Optionally includes the IL tree dump for debugging.
 */
public class GenerationResult {

    private final boolean success;
    private final String targetId;
    private final String code;
    private final List<CodegenWarning> warnings;
    private final Set<RuntimeHelper> helpers;
    private final String errorMessage;
    private final String ilTree;  // Optional IL tree dump (null by default)

    private GenerationResult(boolean success, String targetId, String code, List<CodegenWarning> warnings,
                             Set<RuntimeHelper> helpers, String errorMessage, String ilTree) {
        this.success = success;
        this.targetId = targetId;
        this.code = code;
        this.warnings = warnings;
        this.helpers = helpers;
        this.errorMessage = errorMessage;
        this.ilTree = ilTree;
    }

    /**
     * Creates a successful result.
     */
    public static GenerationResult success(String targetId, GeneratedCode generated) {
        return successWithIlTree(targetId, generated, null);
    }

    /**
     * Creates a successful result with the IL tree dump.
     */
    public static GenerationResult successWithIlTree(String targetId, GeneratedCode generated, String ilTree) {
        return new GenerationResult(true, targetId, generated.getText(), generated.getWarnings(),
                generated.getHelpers(), null, ilTree);
    }

    /**
     * Creates a failed result.
     */
    public static GenerationResult failure(String targetId, String errorMessage) {
        return new GenerationResult(false, targetId, null, List.of(), Set.of(), errorMessage, null);
    }

    /**
     * Creates a failed result from an exception.
     */
    public static GenerationResult failure(String targetId, CodegenException exception) {
        return failure(targetId, exception.getDetailedMessage());
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getCode() {
        return code;
    }

    public List<CodegenWarning> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public Set<RuntimeHelper> getHelpers() {
        return helpers;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getIlTree() {
        return ilTree;
    }

    public boolean hasIlTree() {
        return ilTree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "GenerationResult{success=true, target=" + targetId + ", warnings=" + warnings.size()
                    + (ilTree != null ? ", hasIlTree=true" : "") + "}";
        }
        return "GenerationResult{success=false, target=" + targetId + ", error='" + errorMessage + "'}";
    }
}
