package io.coordhub.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scrubs credentials out of caller-supplied metadata before it reaches the audit trail. Workers routinely pass
 * source-hosting tokens through instance and task metadata.
 */
public final class SensitiveDataMasker {
    public static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential", "private_key"
    );
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("^(gh[pousr]_[A-Za-z0-9]{20,}|[A-Za-z0-9+/=_\\-]{40,})$");

    private SensitiveDataMasker() {
    }

    public static Map<String, Object> masked(Map<String, ?> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        input.forEach((key, value) -> out.put(key, isSensitiveKey(key) ? MASK : maskedValue(value)));
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Object maskedValue(Object value) {
        if (value instanceof Map) {
            return masked((Map<String, ?>) value);
        }
        if (value instanceof Collection) {
            Collection<?> items = (Collection<?>) value;
            List<Object> out = new ArrayList<>(items.size());
            for (Object item : items) {
                out.add(maskedValue(item));
            }
            return out;
        }
        if (value instanceof String && likelySecretValue((String) value)) {
            return MASK;
        }
        return value;
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

    static boolean likelySecretValue(String value) {
        return value != null && OPAQUE_TOKEN.matcher(value.trim()).matches();
    }
}
