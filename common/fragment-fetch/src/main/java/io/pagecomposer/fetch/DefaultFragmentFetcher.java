package io.pagecomposer.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pagecomposer.fragment.BodyType;
import io.pagecomposer.fragment.FetchOptions;
import io.pagecomposer.fragment.Fragment;
import io.pagecomposer.fragment.FragmentBody;
import io.pagecomposer.fragment.FragmentFetcher;
import io.pagecomposer.fragment.RenderContext;
import io.pagecomposer.fragment.source.LocalFilePath;
import io.pagecomposer.fragment.source.RemoteUrl;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads fragments from inline data, local files or remote urls on the supplied executor.
 * <p>
 * Text bodies of JSON fragments are parsed into maps and lists. When loading fails, required
 * fragments and calls made with {@link FetchOptions#failFast()} fail; every other fragment
 * is answered with its missing content message. A fragment's fetch error hook sees every failure
 * before that decision.
 */
public final class DefaultFragmentFetcher implements FragmentFetcher {

    private static final Logger log = LoggerFactory.getLogger(DefaultFragmentFetcher.class);

    private final RemoteFragmentClient client;
    private final ObjectMapper mapper;
    private final Executor executor;
    private final Path workingDirectory;

    public DefaultFragmentFetcher(RemoteFragmentClient client, ObjectMapper mapper, Executor executor,
                                  Path workingDirectory) {
        this.client = Objects.requireNonNull(client, "client");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.workingDirectory = workingDirectory;
    }

    @Override
    public CompletableFuture<FragmentBody> fetch(Fragment fragment, RenderContext context, FetchOptions options) {
        Objects.requireNonNull(fragment, "fragment");
        RenderContext safeContext = context == null ? RenderContext.empty() : context;
        FetchOptions safeOptions = options == null ? FetchOptions.defaults() : options;
        CompletableFuture<FragmentBody> loading;
        try {
            loading = CompletableFuture.supplyAsync(() -> load(fragment, safeContext), executor);
        } catch (RuntimeException ex) {
            loading = CompletableFuture.failedFuture(ex);
        }
        return loading.<CompletableFuture<FragmentBody>>handle((body, error) -> {
            if (error == null) {
                return CompletableFuture.completedFuture(body);
            }
            Throwable cause = unwrap(error);
            BiConsumer<Throwable, RenderContext> onFetchError = fragment.onFetchError();
            if (onFetchError != null) {
                onFetchError.accept(cause, safeContext);
            }
            if (fragment.isRequired() || safeOptions.neverHandleError()) {
                return CompletableFuture.failedFuture(cause);
            }
            log.warn("Fragment {} could not be fetched, using its missing content message: {}",
                fragment, cause.getMessage());
            return CompletableFuture.completedFuture(fragment.contentMissingMessage(cause));
        }).thenCompose(result -> result);
    }

    private FragmentBody load(Fragment fragment, RenderContext context) {
        Object body;
        String contentType = fragment.bodyType().defaultContentType();
        if (fragment.source() instanceof RemoteUrl url) {
            RemoteResponse response = fetchRemote(RemoteRequest.of(fragment, url, context));
            body = response.body();
            if (!fragment.isJson() && response.contentType() != null) {
                contentType = response.contentType();
            }
        } else if (fragment.source() instanceof LocalFilePath file) {
            body = readFile(file.resolve(context, workingDirectory));
        } else if (fragment.hasLocalData()) {
            body = fragment.localData();
        } else {
            throw new FragmentFetchException("Fragment has neither a source nor data: " + fragment);
        }

        if (fragment.isJson() && body instanceof String text) {
            body = parseJson(text);
        }
        BiFunction<Object, RenderContext, Object> parser = fragment.bodyParser();
        if (parser != null) {
            body = parser.apply(body, context);
        }
        return new FragmentBody(body, contentType);
    }

    private RemoteResponse fetchRemote(RemoteRequest request) {
        try {
            return client.execute(request);
        } catch (IOException ex) {
            throw new FragmentFetchException(request.method() + " " + request.uri() + " failed: " + ex.getMessage(), ex);
        }
    }

    private static String readFile(Path path) {
        log.debug("Reading fragment file {}", path);
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Could not read fragment file " + path, ex);
        }
    }

    private Object parseJson(String text) {
        if (text.isBlank()) {
            return null;
        }
        try {
            return mapper.readValue(text, Object.class);
        } catch (JsonProcessingException ex) {
            throw new FragmentFetchException("Invalid " + BodyType.JSON.defaultContentType() + " body: "
                + ex.getOriginalMessage(), ex);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
