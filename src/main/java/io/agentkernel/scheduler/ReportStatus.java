package io.agentkernel.scheduler;

import java.util.Locale;

/**
 * Outcome an agent reports for a claimed task.
 */
public enum ReportStatus {
    COMPLETED,
    FAILED;

    public static ReportStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("report status is required");
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);
        if ("SUCCESS".equals(value) || "OK".equals(value)) {
            return COMPLETED;
        }
        return ReportStatus.valueOf(value);
    }
}
