package com.todochat.pipeline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Inbound request as seen by the pipeline. Immutable for the duration of a pass; per-request
 * mutable state lives in {@link RequestContext}.
 *
 * @param method          HTTP method, upper case
 * @param path            request path without query string
 * @param headers         request headers (a private copy; looked up case-insensitively)
 * @param queryParameters query parameters by name, in request order
 * @param remoteAddress   direct network peer address, or null if the transport does not know it
 */
public record HttpRequest(
        String method,
        String path,
        HttpHeaders headers,
        Map<String, List<String>> queryParameters,
        String remoteAddress
) {

    public HttpRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method must not be null or blank");
        }
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        headers = headers == null ? new HttpHeaders() : headers.copy();
        queryParameters = queryParameters == null ? Map.of() : Map.copyOf(queryParameters);
    }

    /** Returns the value of a request header, if present. */
    public Optional<String> header(String name) {
        return headers.get(name);
    }

    /**
     * Returns a copy of the headers. The request's own header map is never handed out, so stages
     * cannot change the request under each other.
     */
    @Override
    public HttpHeaders headers() {
        return headers.copy();
    }

    /** Starts a builder for a request with the given method and path. */
    public static Builder builder(String method, String path) {
        return new Builder(method, path);
    }

    /** Fluent builder, mainly for transports and tests. */
    public static final class Builder {

        private final String method;
        private final String path;
        private final HttpHeaders headers = new HttpHeaders();
        private final Map<String, List<String>> queryParameters = new LinkedHashMap<>();
        private String remoteAddress;

        private Builder(String method, String path) {
            this.method = method;
            this.path = path;
        }

        public Builder header(String name, String value) {
            headers.set(name, value);
            return this;
        }

        public Builder queryParameter(String name, String... values) {
            queryParameters.put(name, List.of(values));
            return this;
        }

        public Builder remoteAddress(String remoteAddress) {
            this.remoteAddress = remoteAddress;
            return this;
        }

        public HttpRequest build() {
            return new HttpRequest(method, path, headers, queryParameters, remoteAddress);
        }
    }
}
