package me.christianrobert.ilcodegen.codegen.context;

import me.christianrobert.ilcodegen.il.SourceLocation;

/**
 * A non-fatal diagnostic raised while transforming or emitting.
 *
 * <p>{@code nodeKind} names the IL kind (transformer) or target node kind (emitter)
 * that triggered the warning.</p>
 */
public class CodegenWarning {

    public enum Phase {
        TRANSFORM,
        EMIT
    }

    private final Phase phase;
    private final String nodeKind;
    private final String message;
    private final SourceLocation location;

    public CodegenWarning(Phase phase, String nodeKind, String message, SourceLocation location) {
        this.phase = phase;
        this.nodeKind = nodeKind;
        this.message = message;
        this.location = location;
    }

    public Phase getPhase() {
        return phase;
    }

    public String getNodeKind() {
        return nodeKind;
    }

    public String getMessage() {
        return message;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(phase).append(" [").append(nodeKind).append("] ").append(message);
        if (location != null) {
            sb.append(" at ").append(location);
        }
        return sb.toString();
    }
}
