package com.todochat.pipeline.ratelimit;

import com.todochat.pipeline.ClientIdentity;
import com.todochat.pipeline.HttpRequest;
import com.todochat.pipeline.HttpResponse;
import com.todochat.pipeline.Middleware;
import com.todochat.pipeline.RequestContext;
import com.todochat.pipeline.RequestHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admission-control stage. Exempt paths pass straight through; every other request spends one
 * token from its client's bucket or is rejected with {@link RateLimitExceededException}.
 * <p>
 * Admitted responses are annotated with {@value #LIMIT_HEADER} and {@value #REMAINING_HEADER},
 * the latter being the whole tokens left right after this request was admitted.
 */
public final class RateLimitMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(RateLimitMiddleware.class);

    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";

    /** Context attribute holding the client identity used for this request. */
    public static final String CLIENT_ID_ATTRIBUTE = "rateLimit.clientId";

    private final RateLimiter rateLimiter;
    private final RateLimitSettings settings;

    public RateLimitMiddleware(RateLimiter rateLimiter, RateLimitSettings settings) {
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter must not be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        this.rateLimiter = rateLimiter;
        this.settings = settings;
    }

    @Override
    public HttpResponse handle(HttpRequest request, RequestContext context, RequestHandler next) throws Exception {
        if (settings.isExempt(request.path())) {
            return next.handle(request, context);
        }

        String clientId = ClientIdentity.resolve(request);
        context.setAttribute(CLIENT_ID_ATTRIBUTE, clientId);

        RateLimitDecision decision = rateLimiter.admit(clientId);
        if (!decision.allowed()) {
            log.warn("Rate limit exceeded client={} method={} path={}", clientId, request.method(), request.path());
            throw new RateLimitExceededException(clientId, decision.limit());
        }

        HttpResponse response = next.handle(request, context);
        return response
                .header(LIMIT_HEADER, String.valueOf(decision.limit()))
                .header(REMAINING_HEADER, String.valueOf(decision.remaining()));
    }
}
