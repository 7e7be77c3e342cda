package com.todochat.pipeline;

/**
 * One stage of a {@link Pipeline}. A stage may pass the request on by calling {@code next},
 * add to the {@link RequestContext}, short-circuit by returning or throwing without calling
 * {@code next}, and change the response on its way back.
 */
@FunctionalInterface
public interface Middleware {

    HttpResponse handle(HttpRequest request, RequestContext context, RequestHandler next) throws Exception;

    /** Returns a handler that runs this stage in front of {@code next}. */
    default RequestHandler wrap(RequestHandler next) {
        if (next == null) {
            throw new IllegalArgumentException("next must not be null");
        }
        return (request, context) -> handle(request, context, next);
    }
}
