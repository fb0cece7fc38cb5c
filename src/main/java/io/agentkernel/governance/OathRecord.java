package io.agentkernel.governance;

import java.time.Instant;

/**
 * One sworn oath. Rows are never rewritten except for {@code valid}, which flips to false once the
 * policy it was sworn to is superseded.
 */
public record OathRecord(
        long oathId,
        String agentId,
        String policyHash,
        String signature,
        Instant swornAt,
        boolean valid,
        long ledgerSequence
) {
}
