package io.pagecomposer.compose;

import io.pagecomposer.fragment.FragmentBody;
import io.pagecomposer.fragment.FragmentFetcher;
import io.pagecomposer.fragment.RenderContext;
import io.pagecomposer.fragment.Route;
import io.pagecomposer.fragment.render.FragmentComposer;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Serves every configured route: redirects, or renders the route's base fragment and answers with
 * the composed body.
 */
@RestController
public class ComposeController {
    private static final Logger log = LoggerFactory.getLogger(ComposeController.class);

    private final RouteCatalogue routes;
    private final FragmentComposer composer;
    private final FragmentFetcher fetcher;

    public ComposeController(RouteCatalogue routes, FragmentComposer composer, FragmentFetcher fetcher) {
        this.routes = routes;
        this.composer = composer;
        this.fetcher = fetcher;
    }

    @RequestMapping("/**")
    public CompletableFuture<ResponseEntity<Object>> compose(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        Optional<RouteCatalogue.RouteMatch> match = routes.match(request.getMethod(), path);
        if (match.isEmpty()) {
            log.info("[REST] {} {} -> status=404 no route", request.getMethod(), path);
            return CompletableFuture.completedFuture(ResponseEntity.notFound().build());
        }
        Route route = match.get().route();
        RenderContext context = renderContext(request, match.get().params());
        if (!route.onRequest(context)) {
            log.info("[REST] {} {} -> status=404 cancelled by route", request.getMethod(), path);
            return CompletableFuture.completedFuture(ResponseEntity.notFound().build());
        }
        if (route.isRedirect()) {
            log.info("[REST] {} {} -> status=302 location={}", request.getMethod(), path, route.redirect());
            return CompletableFuture.completedFuture(ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(route.redirect()))
                .build());
        }
        return composer.render(route, fetcher, context)
            .thenApply(body -> {
                log.info("[REST] {} {} -> status=200 contentType={}", request.getMethod(), path, body.contentType());
                return toResponse(route, context, body);
            });
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<String> renderFailed(Exception error) {
        log.error("[REST] composition failed: {}", error.getMessage(), error);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .contentType(MediaType.TEXT_PLAIN)
            .body("Page could not be composed: " + error.getMessage());
    }

    private static ResponseEntity<Object> toResponse(Route route, RenderContext context, FragmentBody body) {
        ResponseEntity.BodyBuilder response = ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(body.contentType()));
        route.responseHeaders(context).forEach((name, value) -> response.header(name, value));
        if (route.cacheMaxAge() != null) {
            response.cacheControl(CacheControl.maxAge(Duration.ofSeconds(route.cacheMaxAge())));
        }
        return response.body(body.body());
    }

    private static RenderContext renderContext(HttpServletRequest request, Map<String, String> params) {
        RenderContext.Builder context = RenderContext.builder().params(params);
        request.getParameterMap().forEach((name, values) -> context.query(name, List.of(values)));
        for (String name : Collections.list(request.getHeaderNames())) {
            context.header(name, request.getHeader(name));
        }
        return context
            .attribute("method", request.getMethod())
            .attribute("path", request.getRequestURI())
            .build();
    }
}
