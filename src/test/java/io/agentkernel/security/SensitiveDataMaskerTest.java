package io.agentkernel.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class SensitiveDataMaskerTest {

    @Test
    void sensitiveKeysAreMaskedAtAnyDepth() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("Authorization", "Bearer abc");
        nested.put("note", "plain words stay");
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("password", "hunter2");
        input.put("headers", nested);
        input.put("items", List.of(Map.of("client_secret", "s3cr3t")));

        Map<String, Object> masked = SensitiveDataMasker.maskedMap(input);

        Assertions.assertEquals(SensitiveDataMasker.MASK, masked.get("password"));
        Map<?, ?> headers = (Map<?, ?>) masked.get("headers");
        Assertions.assertEquals(SensitiveDataMasker.MASK, headers.get("Authorization"));
        Assertions.assertEquals("plain words stay", headers.get("note"));
        Map<?, ?> item = (Map<?, ?>) ((List<?>) masked.get("items")).get(0);
        Assertions.assertEquals(SensitiveDataMasker.MASK, item.get("client_secret"));
    }

    @Test
    void opaqueValuesAreMaskedUnlessKeyedAsIdentifiers() {
        String hash = "9f86d081884c7d659a2feaa0c55ad015a3bf4f1b2b0b822cd15d6c15b0f00a08";
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("policy_hash", hash);
        input.put("task_id", "3f2b8c1e-7d4a-4c8e-9b1f-2a6d5e0c7f31");
        input.put("decided_at", "2026-01-01T00:00:00.000000Z");
        input.put("public_key_sha256", hash);
        input.put("hash", hash);
        input.put("blob", "QUJDREVGR0hJSktMTU5PUFFSU1RVVldYWVo=");
        input.put("reason", "oath signature does not verify");

        Map<String, Object> masked = SensitiveDataMasker.maskedMap(input);

        Assertions.assertEquals(hash, masked.get("policy_hash"));
        Assertions.assertEquals("3f2b8c1e-7d4a-4c8e-9b1f-2a6d5e0c7f31", masked.get("task_id"));
        Assertions.assertEquals("2026-01-01T00:00:00.000000Z", masked.get("decided_at"));
        Assertions.assertEquals(hash, masked.get("public_key_sha256"));
        Assertions.assertEquals(hash, masked.get("hash"));
        Assertions.assertEquals(SensitiveDataMasker.MASK, masked.get("blob"));
        Assertions.assertEquals("oath signature does not verify", masked.get("reason"));
    }

    @Test
    void keyHintsAreCaseInsensitive() {
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("X_Api_Key"));
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("PRIVATE_KEY"));
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("refreshToken"));
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey("agent_id"));
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey(null));
        Assertions.assertTrue(SensitiveDataMasker.maskedMap(null).isEmpty());
    }
}
