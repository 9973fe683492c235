package io.pagecomposer.fragment.render;

import java.util.List;

/**
 * One {@code <fragment-inject>} marker found in a body.
 *
 * @param start            offset of the opening {@code <}
 * @param end              offset just past the closing tag
 * @param rawAttributes    attribute text of the opening tag, as written
 * @param embeddedTemplate text between the opening and closing tags
 * @param attributes       parsed attributes
 */
public record InjectionTag(
    int start,
    int end,
    String rawAttributes,
    String embeddedTemplate,
    Attributes attributes
) {

    /**
     * @param template      {@code template} flag: the embedded text is the template to render
     * @param fragmentName  {@code fragment-name}, takes precedence over {@code template}
     * @param repeatPath    {@code fragment-repeat}, dotted path into the dependency data
     * @param required      {@code required} flag
     * @param models        {@code models}, dependency names in declaration order
     * @param modelsDeclared whether a {@code models} attribute was present at all
     */
    public record Attributes(
        boolean template,
        String fragmentName,
        String repeatPath,
        boolean required,
        List<String> models,
        boolean modelsDeclared
    ) {

        public Attributes {
            models = models == null ? List.of() : List.copyOf(models);
        }
    }
}
