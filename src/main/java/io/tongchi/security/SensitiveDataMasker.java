package io.tongchi.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.tongchi.util.Jsons;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class SensitiveDataMasker {
    public static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential", "accessor"
    );
    private static final Pattern OPAQUE_VALUE = Pattern.compile("^[A-Za-z0-9+/=_\\-:.]{24,}$");
    private static final Pattern VAULT_TOKEN = Pattern.compile("\\bhv[sbr]\\.[A-Za-z0-9_\\-]{16,}");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null) {
            return Jsons.mapper().nullNode();
        }
        JsonNode copy = input.deepCopy();
        return maskInPlace(copy);
    }

    private static JsonNode maskInPlace(JsonNode node) {
        switch (node.getNodeType()) {
            case OBJECT:
                ObjectNode object = (ObjectNode) node;
                List<String> names = new ArrayList<>();
                object.fieldNames().forEachRemaining(names::add);
                for (String name : names) {
                    object.set(name, isSensitiveKey(name)
                            ? TextNode.valueOf(MASK)
                            : maskInPlace(object.get(name)));
                }
                return object;
            case ARRAY:
                ArrayNode array = (ArrayNode) node;
                for (int i = 0; i < array.size(); i++) {
                    array.set(i, maskInPlace(array.get(i)));
                }
                return array;
            case STRING:
                String text = node.textValue();
                if (likelySecretValue(text)) {
                    return TextNode.valueOf(MASK);
                }
                String scrubbed = scrubText(text);
                return scrubbed.equals(text) ? node : TextNode.valueOf(scrubbed);
            default:
                return node;
        }
    }

    public static String scrubText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return VAULT_TOKEN.matcher(text).replaceAll(MASK);
    }

    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        return SENSITIVE_HINTS.stream().anyMatch(key::contains);
    }

    private static boolean likelySecretValue(String value) {
        String candidate = value == null ? "" : value.trim();
        return !candidate.contains("/") && OPAQUE_VALUE.matcher(candidate).matches();
    }
}
