package io.agentkernel.admission;

/**
 * Gate 0 outcome. {@code pattern} names the rule that fired, null when the input passed.
 */
public record SecurityVerdict(boolean blocked, String reason, String pattern) {
    private static final SecurityVerdict CLEAN = new SecurityVerdict(false, "security check passed", null);

    public static SecurityVerdict clean() {
        return CLEAN;
    }

    public static SecurityVerdict block(String pattern, String reason) {
        return new SecurityVerdict(true, reason, pattern);
    }
}
