package ai.codesniff.lint.language;

/**
 * Decides which scope-opener a closing token records as its own condition when several scopes end on it.
 */
public enum ClosingOwnerPolicy {
    /** The first scope resolved on the token, i.e. the innermost one. */
    INNERMOST,
    /** The last scope resolved on the token, i.e. the outermost one. */
    OUTERMOST;

    public static ClosingOwnerPolicy from(String raw) {
        if (raw == null || raw.isBlank()) {
            return INNERMOST;
        }
        for (ClosingOwnerPolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(raw.trim())) {
                return policy;
            }
        }
        throw new InvalidPolicyException("Unsupported closing owner policy: " + raw);
    }
}
