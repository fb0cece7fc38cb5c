package io.agentkernel.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentkernel.util.Jsons;

/**
 * One link of the chain. {@code payload} is the canonical JSON text exactly as it was hashed.
 */
public record LedgerEvent(
        long sequenceNumber,
        String prevHash,
        String hash,
        LedgerEventType eventType,
        String payload,
        String timestamp,
        String actor
) {
    public JsonNode payloadJson() {
        try {
            return Jsons.mapper().readTree(payload);
        } catch (Exception e) {
            throw new IllegalStateException("Ledger payload is not JSON at sequence " + sequenceNumber, e);
        }
    }
}
