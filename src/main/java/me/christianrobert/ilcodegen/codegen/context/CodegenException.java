package me.christianrobert.ilcodegen.codegen.context;

/**
 * Exception thrown when a generation run cannot produce output at all
 * (unsupported target, internal failure of a transformer or emitter).
 *
 * <p>Unsupported constructs inside a tree never raise this; they are reported as
 * {@link CodegenWarning}s.</p>
 */
public class CodegenException extends RuntimeException {

    private final String targetId;
    private final String context;

    public CodegenException(String message) {
        super(message);
        this.targetId = null;
        this.context = null;
    }

    public CodegenException(String message, String targetId, String context) {
        super(message);
        this.targetId = targetId;
        this.context = context;
    }

    public CodegenException(String message, String targetId, String context, Throwable cause) {
        super(message, cause);
        this.targetId = targetId;
        this.context = context;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getContext() {
        return context;
    }

    /**
     * Gets a detailed error message including target and context.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (targetId != null) {
            sb.append("\nTarget: ").append(targetId);
        }
        if (context != null) {
            sb.append("\nContext: ").append(context);
        }
        return sb.toString();
    }
}
