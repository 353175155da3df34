package io.schemaledger.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemaledger.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks credentials before settings or audit details leave the process. JDBC URLs keep their host
 * and database but lose inline {@code password=} parameters.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "credential", "apikey", "api_key"
    );
    private static final Pattern URL_PASSWORD = Pattern.compile("(?i)(password|passwd|pwd)=([^&;]*)");
    private static final Pattern URL_USERINFO = Pattern.compile("(//[^/:@]+):([^/@]+)@");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                JsonNode value = entry.getValue();
                if (isSensitiveKey(entry.getKey()) && !value.isNull()) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(value));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual()) {
            return Jsons.mapper().getNodeFactory().textNode(maskText(input.asText("")));
        }
        return input;
    }

    public static String maskText(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        String out = URL_PASSWORD.matcher(value).replaceAll("$1=" + MASK);
        return URL_USERINFO.matcher(out).replaceAll("$1:" + MASK + "@");
    }

    private static boolean isSensitiveKey(String rawKey) {
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
}
