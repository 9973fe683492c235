package io.pagecomposer.fragment.render;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code <fragment-inject>} markers and parses their attributes.
 * <p>
 * Markers do not nest: the content between the tags is raw text that is only rescanned once it has
 * been extracted and rendered as a template of its own.
 */
public final class InjectionTagParser {

    private static final Pattern INJECT_TAG = Pattern.compile(
        "<fragment-inject\\s([^>]+)>([\\s\\S]*?)</fragment-inject>",
        Pattern.CASE_INSENSITIVE);

    static final String ATTR_NAME = "fragment-name";
    static final String ATTR_TEMPLATE = "template";
    static final String ATTR_REQUIRED = "required";
    static final String ATTR_REPEAT = "fragment-repeat";
    static final String ATTR_MODELS = "models";

    private InjectionTagParser() {
    }

    /**
     * Scans {@code body} left to right for non overlapping markers.
     */
    public static List<InjectionTag> scan(String body) {
        List<InjectionTag> tags = new ArrayList<>();
        Matcher matcher = INJECT_TAG.matcher(body);
        while (matcher.find()) {
            String rawAttributes = matcher.group(1);
            tags.add(new InjectionTag(
                matcher.start(),
                matcher.end(),
                rawAttributes,
                matcher.group(2),
                parseAttributes(rawAttributes)));
        }
        return tags;
    }

    /**
     * Parses the attribute text of an opening tag. Names are case-insensitive; values may be single
     * or double quoted, or bare. Attributes without a value are flags.
     */
    public static InjectionTag.Attributes parseAttributes(String rawAttributes) {
        Map<String, String> attributes = tokenize(rawAttributes == null ? "" : rawAttributes);
        String modelsValue = attributes.get(ATTR_MODELS);
        List<String> models = new ArrayList<>();
        if (modelsValue != null) {
            LinkedHashSet<String> unique = new LinkedHashSet<>();
            for (String name : modelsValue.split(",")) {
                String trimmed = name.trim();
                if (!trimmed.isEmpty()) {
                    unique.add(trimmed);
                }
            }
            models.addAll(unique);
        }
        return new InjectionTag.Attributes(
            attributes.containsKey(ATTR_TEMPLATE),
            blankToNull(attributes.get(ATTR_NAME)),
            blankToNull(attributes.get(ATTR_REPEAT)),
            attributes.containsKey(ATTR_REQUIRED),
            models,
            modelsValue != null);
    }

    private static Map<String, String> tokenize(String text) {
        Map<String, String> attributes = new LinkedHashMap<>();
        int i = 0;
        int length = text.length();
        while (i < length) {
            while (i < length && Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            int nameStart = i;
            while (i < length && !Character.isWhitespace(text.charAt(i)) && text.charAt(i) != '=') {
                i++;
            }
            if (nameStart == i) {
                // stray '=' without a name
                i++;
                continue;
            }
            String name = text.substring(nameStart, i).toLowerCase(Locale.ROOT);
            int afterName = i;
            while (i < length && Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            if (i < length && text.charAt(i) == '=') {
                i++;
                while (i < length && Character.isWhitespace(text.charAt(i))) {
                    i++;
                }
                String value;
                if (i < length && (text.charAt(i) == '"' || text.charAt(i) == '\'')) {
                    char quote = text.charAt(i);
                    int close = text.indexOf(quote, i + 1);
                    int valueEnd = close < 0 ? length : close;
                    value = text.substring(i + 1, valueEnd);
                    i = close < 0 ? length : close + 1;
                } else {
                    int valueStart = i;
                    while (i < length && !Character.isWhitespace(text.charAt(i))) {
                        i++;
                    }
                    value = text.substring(valueStart, i);
                }
                attributes.putIfAbsent(name, value.trim());
            } else {
                i = afterName;
                attributes.putIfAbsent(name, null);
            }
        }
        return attributes;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
