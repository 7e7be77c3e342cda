package com.todochat.chatapi.infrastructure.web;

import com.todochat.pipeline.HttpRequest;
import com.todochat.pipeline.HttpResponse;
import com.todochat.pipeline.RequestContext;
import com.todochat.pipeline.RequestHandler;
import jakarta.servlet.ServletException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.util.ContentCachingResponseWrapper;

/**
 * Innermost pipeline stage: runs the rest of the servlet filter chain, then turns what it wrote
 * into an {@link HttpResponse} so the outer stages can decorate it.
 *
 * <p>The body stays buffered in the {@link ContentCachingResponseWrapper}; {@link PipelineFilter}
 * writes the final response. Headers pass straight through the wrapper to the servlet response,
 * so the pipeline sees the first value of each; further values of a repeated header such as
 * {@code Vary} stay on the servlet response untouched unless a stage replaces the header. A {@link ServletException} wrapping an application exception is
 * unwrapped so the error stage sees the original.
 */
public final class ServletTerminalHandler implements RequestHandler {

    @Override
    public HttpResponse handle(HttpRequest request, RequestContext context) throws Exception {
        ServletExchange exchange = context.attribute(ServletExchange.ATTRIBUTE, ServletExchange.class)
                .orElseThrow(() -> new IllegalStateException("no servlet exchange bound to request context"));
        try {
            exchange.chain().doFilter(exchange.request(), exchange.response());
        } catch (ServletException ex) {
            if (ex.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw ex;
        }

        ContentCachingResponseWrapper captured = exchange.response();
        HttpResponse response = HttpResponse.withStatus(captured.getStatus()).body(captured.getContentAsByteArray());
        for (String name : captured.getHeaderNames()) {
            String value = captured.getHeader(name);
            if (value != null && !HttpHeaders.CONTENT_LENGTH.equalsIgnoreCase(name)) {
                response.header(name, value);
            }
        }
        if (captured.getContentType() != null) {
            response.header(HttpHeaders.CONTENT_TYPE, captured.getContentType());
        }
        return response;
    }
}
