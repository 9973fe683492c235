package io.pagecomposer.fragment.source;

import java.util.Map;
import java.util.StringJoiner;

/**
 * Replaces {@code :name} placeholders inside slash separated paths with request parameters.
 * <p>
 * Each section may hold one placeholder after a literal prefix: {@code a}, {@code /:a}, {@code :a/:b},
 * {@code :a/foo} and {@code /:a/foo:b} are all supported. Unknown parameters resolve to an empty string.
 */
public final class PathParameters {

    private PathParameters() {
    }

    public static String apply(String template, Map<String, String> params) {
        if (template == null || template.isEmpty()) {
            return template;
        }
        Map<String, String> safeParams = params == null ? Map.of() : params;
        StringJoiner joined = new StringJoiner("/");
        for (String section : template.split("/", -1)) {
            String[] pieces = section.split(":", -1);
            String key = pieces.length > 1 ? pieces[1] : null;
            String replacement = key == null || key.isEmpty() ? "" : safeParams.getOrDefault(key, "");
            joined.add(pieces[0] + replacement);
        }
        return joined.toString();
    }
}
