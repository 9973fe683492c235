package io.pagecomposer.fetch;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RemoteFragmentClient} on the Apache HttpClient 5 classic API.
 */
public final class ApacheRemoteFragmentClient implements RemoteFragmentClient {

    private static final Logger log = LoggerFactory.getLogger(ApacheRemoteFragmentClient.class);

    private final HttpClient httpClient;

    public ApacheRemoteFragmentClient(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public RemoteResponse execute(RemoteRequest request) throws IOException {
        Objects.requireNonNull(request, "request");
        HttpUriRequestBase httpRequest = new HttpUriRequestBase(request.method(), request.uri());
        request.headers().forEach(httpRequest::addHeader);
        log.debug("{} {}", request.method(), request.uri());
        return httpClient.execute(httpRequest, response -> toRemoteResponse(request, response));
    }

    private static RemoteResponse toRemoteResponse(RemoteRequest request, ClassicHttpResponse response)
        throws IOException {
        int code = response.getCode();
        HttpEntity entity = response.getEntity();
        String body;
        try {
            body = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
        } catch (ParseException ex) {
            throw new IOException("Unreadable response from " + request.uri() + ": " + ex.getMessage(), ex);
        }
        if (code < 200 || code >= 300) {
            throw new FragmentFetchException(
                request.method() + " " + request.uri() + " answered with status " + code, code);
        }
        return new RemoteResponse(code, body, mimeType(entity));
    }

    private static String mimeType(HttpEntity entity) {
        if (entity == null || entity.getContentType() == null || entity.getContentType().isBlank()) {
            return null;
        }
        try {
            return ContentType.parse(entity.getContentType()).getMimeType();
        } catch (RuntimeException ex) {
            return null;
        }
    }
}
