package ai.codesniff.lint.language;

/**
 * Raised when a language policy table is inconsistent or names an unknown token kind.
 */
public class InvalidPolicyException extends IllegalArgumentException {

    public InvalidPolicyException(String message) {
        super(message);
    }

    public InvalidPolicyException(String message, Throwable cause) {
        super(message, cause);
    }
}
