package io.pagecomposer.fragment.error;

/**
 * An injection tag carries neither a {@code fragment-name} nor the {@code template} flag.
 */
public final class MissingTemplateSpecificationException extends FragmentException {

    public MissingTemplateSpecificationException(String tagAttributes) {
        super("A fragment inject found with no name or embed (attributes: " + tagAttributes + ")");
    }
}
