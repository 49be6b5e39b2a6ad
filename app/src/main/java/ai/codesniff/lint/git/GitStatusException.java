package ai.codesniff.lint.git;

/**
 * Runtime exception for failures reading the git working tree status.
 */
public class GitStatusException extends RuntimeException {

    public GitStatusException(String message) {
        super(message);
    }

    public GitStatusException(String message, Throwable cause) {
        super(message, cause);
    }
}
