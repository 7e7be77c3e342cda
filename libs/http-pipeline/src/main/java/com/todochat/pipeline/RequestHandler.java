package com.todochat.pipeline;

/**
 * Produces a response for a request. The innermost handler of a {@link Pipeline} is the route
 * layer; every middleware-wrapped chain is itself a {@code RequestHandler}.
 */
@FunctionalInterface
public interface RequestHandler {

    /**
     * Handles one request.
     *
     * @param request the inbound request
     * @param context the request's own context
     * @return the response, never null
     * @throws Exception any failure; stages decide whether to translate or propagate it
     */
    HttpResponse handle(HttpRequest request, RequestContext context) throws Exception;
}
