package io.github.cyfko.boolexpr.core.exception;

/**
 * Raised when a variable assignment given as text cannot be turned into a pass mask.
 *
 * @since 1.0
 */
public class AssignmentFormatException extends IllegalArgumentException {

    /**
     * @param message description of the rejected input
     */
    public AssignmentFormatException(String message) {
        super(message);
    }

    /**
     * @param message description of the rejected input
     * @param cause   underlying number format error
     */
    public AssignmentFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
