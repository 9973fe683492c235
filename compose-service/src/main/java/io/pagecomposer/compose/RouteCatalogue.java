package io.pagecomposer.compose;

import io.pagecomposer.fragment.BodyType;
import io.pagecomposer.fragment.FragmentFactory;
import io.pagecomposer.fragment.FragmentOptions;
import io.pagecomposer.fragment.Route;
import io.pagecomposer.fragment.source.LocalFilePath;
import io.pagecomposer.fragment.source.RemoteUrl;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.server.PathContainer;
import org.springframework.web.util.pattern.PathPattern;
import org.springframework.web.util.pattern.PathPatternParser;

/**
 * The configured routes, matched by method and path.
 */
public class RouteCatalogue {
    private static final Logger log = LoggerFactory.getLogger(RouteCatalogue.class);
    private static final Pattern PATH_PARAMETER = Pattern.compile(":([A-Za-z0-9_]+)");

    private final List<Entry> entries;

    public RouteCatalogue(List<Route> routes) {
        List<Entry> parsed = new ArrayList<>(routes.size());
        for (Route route : routes) {
            PathPattern pattern = PathPatternParser.defaultInstance.parse(toPathPattern(route.path()));
            parsed.add(new Entry(pattern, route));
            log.info("Registered route {}", route);
        }
        this.entries = List.copyOf(parsed);
    }

    public static RouteCatalogue fromProperties(ComposeServiceProperties properties) {
        List<Route> routes = new ArrayList<>();
        for (ComposeServiceProperties.RouteDefinition definition : properties.getRoutes()) {
            routes.add(toRoute(definition));
        }
        return new RouteCatalogue(routes);
    }

    /**
     * Finds the first route registered for {@code method} whose path matches {@code path}.
     */
    public Optional<RouteMatch> match(String method, String path) {
        PathContainer container = PathContainer.parsePath(path);
        for (Entry entry : entries) {
            if (!entry.route().method().equalsIgnoreCase(method)) {
                continue;
            }
            PathPattern.PathMatchInfo info = entry.pattern().matchAndExtract(container);
            if (info != null) {
                return Optional.of(new RouteMatch(entry.route(), info.getUriVariables()));
            }
        }
        return Optional.empty();
    }

    public List<Route> routes() {
        return entries.stream().map(Entry::route).toList();
    }

    static String toPathPattern(String path) {
        return PATH_PARAMETER.matcher(path).replaceAll("{$1}");
    }

    static Route toRoute(ComposeServiceProperties.RouteDefinition definition) {
        Route.Builder builder = Route.builder()
            .path(definition.getPath())
            .method(definition.getMethod())
            .cacheMaxAge(definition.getCacheMaxAge())
            .redirect(definition.getRedirect());
        definition.getResponseHeaders().forEach(builder::responseHeader);
        if (definition.getBase() != null) {
            builder.baseFragment(FragmentFactory.base(toOptions(definition.getBase())));
        }
        definition.getFragments().forEach((name, fragment) -> builder.fragment(name, toFactory(fragment)));
        return builder.build();
    }

    private static FragmentFactory toFactory(ComposeServiceProperties.FragmentDefinition definition) {
        FragmentOptions options = toOptions(definition);
        return isJson(definition) ? FragmentFactory.json(options) : FragmentFactory.html(options);
    }

    private static FragmentOptions toOptions(ComposeServiceProperties.FragmentDefinition definition) {
        FragmentOptions.Builder options = FragmentOptions.builder()
            .method(definition.getMethod())
            .query(definition.getQuery())
            .headers(definition.getHeaders())
            .passQueryParams(definition.isPassQueryParams())
            .required(definition.isRequired())
            .requiredData(definition.getRequiredData())
            .bodyType(isJson(definition) ? BodyType.JSON : BodyType.HTML);
        if (definition.getUrl() != null && !definition.getUrl().isBlank()) {
            options.source(new RemoteUrl(definition.getUrl(), definition.getPath(), definition.getAuthorization()));
        } else if (!definition.getFile().isEmpty()) {
            options.source(LocalFilePath.of(definition.getFile().toArray(new String[0])));
        } else if (definition.getData() != null) {
            options.data(definition.getData());
        }
        if (definition.getContentMissingMessage() != null) {
            options.contentMissingMessage(definition.getContentMissingMessage());
        }
        if (definition.getRenderErrorMessage() != null) {
            options.renderErrorMessage(definition.getRenderErrorMessage());
        }
        return options.build();
    }

    private static boolean isJson(ComposeServiceProperties.FragmentDefinition definition) {
        return "json".equals(definition.getType() == null ? "" : definition.getType().toLowerCase(Locale.ROOT));
    }

    /**
     * A matched route and the path parameters extracted for it.
     */
    public record RouteMatch(Route route, Map<String, String> params) {
    }

    private record Entry(PathPattern pattern, Route route) {
    }
}
