package io.agentkernel.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentkernel.util.Jsons;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scrubs secrets out of anything headed for the ledger. Kernel identifiers (ids and hashes) look
 * like opaque tokens but are kept verbatim since the chain is useless without them.
 */
public final class SensitiveDataMasker {
    public static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key",
            "private_key", "privatekey", "credential"
    );
    private static final Set<String> IDENTIFIER_SUFFIXES = Set.of("_id", "_hash", "_at", "_key_sha256");

    private SensitiveDataMasker() {
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> maskedMap(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        return Jsons.mapper().convertValue(masked(node), LinkedHashMap.class);
    }

    public static JsonNode masked(JsonNode input) {
        return masked(input, false);
    }

    private static JsonNode masked(JsonNode input, boolean identifier) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String key = entry.getKey();
                if (isSensitiveKey(key)) {
                    out.put(key, MASK);
                } else {
                    out.set(key, masked(entry.getValue(), isIdentifierKey(key)));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value, identifier));
            }
            return out;
        }
        if (!identifier && input.isTextual() && likelySecretValue(input.asText(""))) {
            return Jsons.mapper().valueToTree(MASK);
        }
        return input;
    }

    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isIdentifierKey(String rawKey) {
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String suffix : IDENTIFIER_SUFFIXES) {
            if (key.endsWith(suffix)) {
                return true;
            }
        }
        return key.equals("hash") || key.equals("id");
    }

    private static boolean likelySecretValue(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        if (v.length() < 24) {
            return false;
        }
        // Long opaque strings without spaces are treated as credentials.
        return v.matches("^[A-Za-z0-9+/=_\\-:.]{24,}$");
    }
}
