package com.todochat.pipeline.headers;

import com.todochat.pipeline.HttpRequest;
import com.todochat.pipeline.HttpResponse;
import com.todochat.pipeline.Middleware;
import com.todochat.pipeline.RequestContext;
import com.todochat.pipeline.RequestHandler;

/**
 * Applies a {@link SecurityHeaderPolicy} to every response that passes back through it,
 * overwriting any value set further in and removing the {@code Server} header.
 * <p>
 * Place it outside the error-translation stage so error responses are covered too.
 */
public final class SecurityHeadersMiddleware implements Middleware {

    private final SecurityHeaderPolicy policy;

    public SecurityHeadersMiddleware(SecurityHeaderPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        this.policy = policy;
    }

    @Override
    public HttpResponse handle(HttpRequest request, RequestContext context, RequestHandler next) throws Exception {
        HttpResponse response = next.handle(request, context);
        policy.headers().forEach(response::header);
        policy.removedHeaders().forEach(response.headers()::remove);
        return response;
    }
}
