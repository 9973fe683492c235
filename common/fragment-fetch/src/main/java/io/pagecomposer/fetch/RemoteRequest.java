package io.pagecomposer.fetch;

import io.pagecomposer.fragment.Fragment;
import io.pagecomposer.fragment.RenderContext;
import io.pagecomposer.fragment.source.RemoteUrl;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.net.URIBuilder;

/**
 * A single outbound call for a remote fragment.
 *
 * @param method  HTTP method
 * @param uri     target, query included
 * @param headers request headers in send order
 */
public record RemoteRequest(String method, URI uri, Map<String, String> headers) {

    public RemoteRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /**
     * Builds the request for {@code fragment}. The incoming query is forwarded first when the fragment
     * asks for it; the fragment's own query parameters then replace any forwarded value of the same name.
     */
    public static RemoteRequest of(Fragment fragment, RemoteUrl url, RenderContext context) {
        String target = url.resolve(context);
        URI uri;
        try {
            URIBuilder builder = new URIBuilder(target);
            if (fragment.passQueryParams()) {
                for (Map.Entry<String, List<String>> entry : context.query().entrySet()) {
                    for (String value : entry.getValue()) {
                        builder.addParameter(entry.getKey(), value);
                    }
                }
            }
            fragment.query().forEach(builder::setParameter);
            uri = builder.build();
        } catch (URISyntaxException ex) {
            throw new FragmentFetchException("Invalid fragment url " + target + ": " + ex.getMessage(), ex);
        }
        Map<String, String> headers = new LinkedHashMap<>(fragment.headers());
        if (url.authorization() != null) {
            headers.put(HttpHeaders.AUTHORIZATION, url.authorization());
        }
        return new RemoteRequest(fragment.method(), uri, headers);
    }
}
