package io.promptrelay.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.promptrelay.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrubs secrets from audit details and step output before they leave the process.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential"
    );
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("^[A-Za-z0-9+/=_\\-:.]{24,}$");
    private static final Pattern GENERATED_ID = Pattern.compile("^[a-z]{2,8}_[0-9a-f]{8}(-[0-9a-f]{4}){3}-[0-9a-f]{12}$");
    private static final Pattern BEARER = Pattern.compile("(?i)(bearer\\s+)[A-Za-z0-9+/=_\\-.]+");
    private static final Pattern URL_CREDENTIALS = Pattern.compile("(://[^/:@\\s]+:)[^@\\s]+(@)");
    private static final Pattern ASSIGNMENT = Pattern.compile(
            "(?i)\\b(password|passwd|secret|token|api[_-]?key)(\\s*[=:]\\s*)(\"[^\"]*\"|'[^']*'|\\S+)");

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
                if (isSensitiveKey(entry.getKey())) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(entry.getValue()));
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
            String text = input.asText("");
            if (likelySecretValue(text)) {
                return Jsons.mapper().getNodeFactory().textNode(MASK);
            }
            String scrubbed = maskText(text);
            return scrubbed.equals(text) ? input : Jsons.mapper().getNodeFactory().textNode(scrubbed);
        }
        return input;
    }

    /**
     * Masks inline credentials in free text: bearer tokens, {@code user:pass@} in URLs and
     * {@code password=...} style assignments.
     */
    public static String maskText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String out = BEARER.matcher(text).replaceAll("$1" + MASK);
        out = URL_CREDENTIALS.matcher(out).replaceAll("$1" + MASK + "$2");
        Matcher m = ASSIGNMENT.matcher(out);
        return m.replaceAll("$1$2" + Matcher.quoteReplacement(MASK));
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

    private static boolean likelySecretValue(String value) {
        String v = value.trim();
        if (v.length() < 24 || v.contains(" ")) {
            return false;
        }
        // Long opaque strings without separators are treated as tokens; paths and URLs are kept.
        if (v.contains("/") && (v.startsWith("/") || v.contains("://"))) {
            return false;
        }
        if (GENERATED_ID.matcher(v).matches()) {
            return false;
        }
        return OPAQUE_TOKEN.matcher(v).matches();
    }
}
