package io.pagecomposer.compose;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "pagecomposer.compose")
public class ComposeServiceProperties {
    private Path workingDirectory;

    @Valid
    private final Fetch fetch = new Fetch();

    @Valid
    private List<RouteDefinition> routes = new ArrayList<>();

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    public void setWorkingDirectory(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public List<RouteDefinition> getRoutes() {
        return routes;
    }

    public void setRoutes(List<RouteDefinition> routes) {
        this.routes = routes;
    }

    public static class Fetch {
        @Min(1)
        private int threads = 16;

        @Min(1)
        private int maxConnections = 200;

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(2);

        @NotNull
        private Duration responseTimeout = Duration.ofSeconds(5);

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public int getMaxConnections() {
            return maxConnections;
        }

        public void setMaxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getResponseTimeout() {
            return responseTimeout;
        }

        public void setResponseTimeout(Duration responseTimeout) {
            this.responseTimeout = responseTimeout;
        }
    }

    /**
     * One endpoint. Paths use {@code :name} segments for parameters.
     */
    public static class RouteDefinition {
        @NotBlank
        private String path;

        private String method = "GET";

        private Long cacheMaxAge;

        private String redirect;

        private Map<String, String> responseHeaders = new LinkedHashMap<>();

        @Valid
        private FragmentDefinition base;

        @Valid
        private Map<String, FragmentDefinition> fragments = new LinkedHashMap<>();

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }

        public Long getCacheMaxAge() {
            return cacheMaxAge;
        }

        public void setCacheMaxAge(Long cacheMaxAge) {
            this.cacheMaxAge = cacheMaxAge;
        }

        public String getRedirect() {
            return redirect;
        }

        public void setRedirect(String redirect) {
            this.redirect = redirect;
        }

        public Map<String, String> getResponseHeaders() {
            return responseHeaders;
        }

        public void setResponseHeaders(Map<String, String> responseHeaders) {
            this.responseHeaders = responseHeaders;
        }

        public FragmentDefinition getBase() {
            return base;
        }

        public void setBase(FragmentDefinition base) {
            this.base = base;
        }

        public Map<String, FragmentDefinition> getFragments() {
            return fragments;
        }

        public void setFragments(Map<String, FragmentDefinition> fragments) {
            this.fragments = fragments;
        }
    }

    /**
     * A fragment is loaded from {@code url} (plus an optional relative {@code path}), from the
     * {@code file} parts, or from inline {@code data}, in that order of preference.
     */
    public static class FragmentDefinition {
        private String type = "html";
        private String url;
        private String path;
        private String authorization;
        private List<String> file = new ArrayList<>();
        private String data;
        private String method = "GET";
        private Map<String, String> query = new LinkedHashMap<>();
        private Map<String, String> headers = new LinkedHashMap<>();
        private boolean passQueryParams;
        private boolean required;
        private List<String> requiredData = new ArrayList<>();
        private String contentMissingMessage;
        private String renderErrorMessage;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getAuthorization() {
            return authorization;
        }

        public void setAuthorization(String authorization) {
            this.authorization = authorization;
        }

        public List<String> getFile() {
            return file;
        }

        public void setFile(List<String> file) {
            this.file = file;
        }

        public String getData() {
            return data;
        }

        public void setData(String data) {
            this.data = data;
        }

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }

        public Map<String, String> getQuery() {
            return query;
        }

        public void setQuery(Map<String, String> query) {
            this.query = query;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers;
        }

        public boolean isPassQueryParams() {
            return passQueryParams;
        }

        public void setPassQueryParams(boolean passQueryParams) {
            this.passQueryParams = passQueryParams;
        }

        public boolean isRequired() {
            return required;
        }

        public void setRequired(boolean required) {
            this.required = required;
        }

        public List<String> getRequiredData() {
            return requiredData;
        }

        public void setRequiredData(List<String> requiredData) {
            this.requiredData = requiredData;
        }

        public String getContentMissingMessage() {
            return contentMissingMessage;
        }

        public void setContentMissingMessage(String contentMissingMessage) {
            this.contentMissingMessage = contentMissingMessage;
        }

        public String getRenderErrorMessage() {
            return renderErrorMessage;
        }

        public void setRenderErrorMessage(String renderErrorMessage) {
            this.renderErrorMessage = renderErrorMessage;
        }
    }
}
