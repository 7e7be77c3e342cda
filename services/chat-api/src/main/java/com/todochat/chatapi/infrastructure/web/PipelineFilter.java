package com.todochat.chatapi.infrastructure.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.todochat.pipeline.HttpRequest;
import com.todochat.pipeline.HttpResponse;
import com.todochat.pipeline.Pipeline;
import com.todochat.pipeline.RequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Runs every servlet request through the shared {@link Pipeline}.
 *
 * <p>The servlet request is copied into a pipeline {@link HttpRequest}; the rest of the filter
 * chain becomes the pipeline's terminal stage (see {@link ServletTerminalHandler}). The pipeline's
 * final {@link HttpResponse} is then written to the real response: status, headers, and either the
 * buffered body or, for responses produced by the pipeline itself, the JSON form of the structured
 * body.
 *
 * <p>The {@link RequestContext} is exposed to controllers as the request attribute
 * {@value #REQUEST_CONTEXT_ATTRIBUTE}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class PipelineFilter extends OncePerRequestFilter {

    public static final String REQUEST_CONTEXT_ATTRIBUTE = "todochat.requestContext";

    private final Pipeline pipeline;
    private final ObjectMapper objectMapper;

    public PipelineFilter(Pipeline pipeline, ObjectMapper objectMapper) {
        this.pipeline = pipeline;
        this.objectMapper = objectMapper;
    }

    /** Returns the pipeline context of a request passing through this filter. */
    public static Optional<RequestContext> requestContext(HttpServletRequest request) {
        Object context = request.getAttribute(REQUEST_CONTEXT_ATTRIBUTE);
        return context instanceof RequestContext requestContext ? Optional.of(requestContext) : Optional.empty();
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        ContentCachingResponseWrapper buffered = new ContentCachingResponseWrapper(response);
        RequestContext context = pipeline.newContext();
        context.setAttribute(ServletExchange.ATTRIBUTE, new ServletExchange(request, buffered, filterChain));
        request.setAttribute(REQUEST_CONTEXT_ATTRIBUTE, context);

        HttpResponse result;
        try {
            result = pipeline.handle(toPipelineRequest(request), context);
        } catch (IOException | ServletException | RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new ServletException(ex);
        }
        write(result, response);
    }

    private void write(HttpResponse result, HttpServletResponse response) throws IOException {
        response.setStatus(result.status());
        // Headers the chain wrote already sit on the real response, possibly with several values;
        // only rewrite those a stage added or changed.
        result.headers().asMap().forEach((name, value) -> {
            if (!HttpHeaders.CONTENT_LENGTH.equalsIgnoreCase(name)
                    && !response.getHeaders(name).contains(value)) {
                response.setHeader(name, value);
            }
        });

        Object body = result.body();
        if (body == null) {
            return;
        }
        byte[] bytes;
        if (body instanceof byte[] raw) {
            bytes = raw;
        } else {
            bytes = objectMapper.writeValueAsBytes(body);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        }
        if (bytes.length > 0) {
            response.setContentLength(bytes.length);
            response.getOutputStream().write(bytes);
        }
        response.flushBuffer();
    }

    static HttpRequest toPipelineRequest(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        HttpRequest.Builder builder = HttpRequest.builder(request.getMethod(), path)
                .remoteAddress(request.getRemoteAddr());
        for (String name : Collections.list(request.getHeaderNames())) {
            String value = request.getHeader(name);
            if (value != null) {
                builder.header(name, value);
            }
        }
        queryParameters(request.getQueryString())
                .forEach((name, values) -> builder.queryParameter(name, values.toArray(String[]::new)));
        return builder.build();
    }

    private static Map<String, List<String>> queryParameters(String queryString) {
        Map<String, List<String>> parameters = new LinkedHashMap<>();
        if (queryString == null || queryString.isEmpty()) {
            return parameters;
        }
        MultiValueMap<String, String> raw = UriComponentsBuilder.newInstance().query(queryString).build().getQueryParams();
        raw.forEach((name, values) -> {
            List<String> decoded = new ArrayList<>(values.size());
            for (String value : values) {
                decoded.add(value == null ? "" : UriUtils.decode(value, StandardCharsets.UTF_8));
            }
            parameters.put(UriUtils.decode(name, StandardCharsets.UTF_8), decoded);
        });
        return parameters;
    }
}
