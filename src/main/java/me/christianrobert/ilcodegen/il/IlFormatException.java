package me.christianrobert.ilcodegen.il;

/**
 * Thrown by the boundary reader when the IL document is not a well-formed tree.
 *
 * <p>This is the only hard failure of the pipeline; everything past the boundary soft-fails.</p>
 */
public class IlFormatException extends RuntimeException {

    private final String path;

    public IlFormatException(String message, String path) {
        super(message);
        this.path = path;
    }

    public IlFormatException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /**
     * JSON path of the offending element (e.g. {@code $.body[2].test}).
     */
    public String getPath() {
        return path;
    }

    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (path != null) {
            sb.append(" (at ").append(path).append(")");
        }
        return sb.toString();
    }
}
