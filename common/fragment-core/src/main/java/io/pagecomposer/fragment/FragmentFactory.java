package io.pagecomposer.fragment;

import java.util.Objects;

/**
 * Produces fresh {@link Fragment} instances for one render and keeps the configuration they were
 * declared with for diagnostics.
 *
 * <pre>{@code
 * FragmentFactory header = FragmentFactory.html(FragmentOptions.builder()
 *     .source(SourceLocator.remote("http://header-service", "/header/:lang"))
 *     .build());
 * }</pre>
 */
public record FragmentFactory(FragmentType type, FragmentOptions configuration) {

    public FragmentFactory {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(configuration, "configuration");
    }

    /**
     * The base fragment of a route. Always required; keeps the configured body type, HTML by default.
     */
    public static FragmentFactory base(FragmentOptions options) {
        return new FragmentFactory(FragmentType.BASE, options);
    }

    public static FragmentFactory html(FragmentOptions options) {
        return new FragmentFactory(FragmentType.HTML, options);
    }

    public static FragmentFactory json(FragmentOptions options) {
        return new FragmentFactory(FragmentType.JSON, options);
    }

    public Fragment create() {
        FragmentOptions options = switch (type) {
            case BASE -> configuration.withRequired(true);
            case HTML -> configuration.withBodyType(BodyType.HTML);
            case JSON -> configuration.withBodyType(BodyType.JSON);
        };
        return new Fragment(type, options);
    }

    @Override
    public String toString() {
        FragmentOptions c = configuration;
        StringBuilder out = new StringBuilder(type.name()).append('{');
        out.append("source=").append(c.source() == null ? "-" : c.source());
        if (c.inlineDataPresent()) {
            out.append(", data=").append(c.inlineData());
        }
        if (!c.requiredData().isEmpty()) {
            out.append(", requiredData=").append(c.requiredData());
        }
        if (c.required()) {
            out.append(", required=true");
        }
        return out.append('}').toString();
    }
}
