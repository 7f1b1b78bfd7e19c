package de.bsommerfeld.recall.core.error;

/**
 * Thrown by every memory operation that cannot produce its documented result.
 * The {@link ErrorKind} tells the caller whether the failure is its own fault,
 * a missing record or a transient store condition.
 */
public class MemoryException extends RuntimeException {

    private final ErrorKind kind;

    public MemoryException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MemoryException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static MemoryException notFound(String message) {
        return new MemoryException(ErrorKind.NOT_FOUND, message);
    }

    public static MemoryException invalidArgument(String message) {
        return new MemoryException(ErrorKind.INVALID_ARGUMENT, message);
    }

    public static MemoryException alreadyExists(String message) {
        return new MemoryException(ErrorKind.ALREADY_EXISTS, message);
    }
}
