package io.coordhub.error;

/**
 * Typed failure raised by the coordination core. A call that fails with this exception has not mutated state.
 */
public class CoordinationException extends RuntimeException {
    private final ErrorKind kind;

    public CoordinationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static CoordinationException validation(String message) {
        return new CoordinationException(ErrorKind.VALIDATION, message);
    }

    public static CoordinationException notFound(String message) {
        return new CoordinationException(ErrorKind.NOT_FOUND, message);
    }

    public static CoordinationException conflict(String message) {
        return new CoordinationException(ErrorKind.CONFLICT, message);
    }

    public static CoordinationException unknownMethod(String method) {
        return new CoordinationException(ErrorKind.UNKNOWN_METHOD, "Unknown method: " + method);
    }
}
