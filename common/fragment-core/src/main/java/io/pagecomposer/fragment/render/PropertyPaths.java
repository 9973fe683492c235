package io.pagecomposer.fragment.render;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Dotted path lookups into fetched fragment data ({@code basket.items}, {@code list.0.name},
 * {@code list[0].name}).
 */
final class PropertyPaths {

    private PropertyPaths() {
    }

    /**
     * @return the first segment of {@code path}
     */
    static String root(String path) {
        int dot = path.indexOf('.');
        int bracket = path.indexOf('[');
        int end = path.length();
        if (dot >= 0) {
            end = dot;
        }
        if (bracket >= 0 && bracket < end) {
            end = bracket;
        }
        return path.substring(0, end).trim();
    }

    /**
     * Resolves {@code path} against {@code root}; any missing step yields {@code null}.
     */
    static Object get(Object root, String path) {
        Object current = root;
        for (String segment : segments(path)) {
            if (current == null) {
                return null;
            }
            current = step(current, segment);
        }
        return current;
    }

    /**
     * Views {@code value} as an ordered sequence. Anything that is not a collection or an array is
     * treated as absent and yields an empty list.
     */
    static List<Object> sequence(Object value) {
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(value, i));
            }
            return items;
        }
        return List.of();
    }

    private static List<String> segments(String path) {
        List<String> segments = new ArrayList<>();
        for (String part : path.replace("[", ".").replace("]", "").split("\\.")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                segments.add(trimmed);
            }
        }
        return segments;
    }

    private static Object step(Object current, String segment) {
        if (current instanceof Map<?, ?> map) {
            return map.get(segment);
        }
        Integer index = index(segment);
        if (index == null) {
            return null;
        }
        if (current instanceof List<?> list) {
            return index < list.size() ? list.get(index) : null;
        }
        if (current.getClass().isArray()) {
            return index < Array.getLength(current) ? Array.get(current, index) : null;
        }
        return null;
    }

    private static Integer index(String segment) {
        try {
            int value = Integer.parseInt(segment);
            return value < 0 ? null : value;
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
