package com.todochat.chatapi.config;

import com.todochat.chatapi.infrastructure.web.ServletTerminalHandler;
import com.todochat.observability.MetricFactory;
import com.todochat.pipeline.Pipeline;
import com.todochat.pipeline.correlation.CorrelationLoggingMiddleware;
import com.todochat.pipeline.error.ErrorDetailLevel;
import com.todochat.pipeline.error.ErrorResponseMiddleware;
import com.todochat.pipeline.headers.SecurityHeaderPolicy;
import com.todochat.pipeline.headers.SecurityHeadersMiddleware;
import com.todochat.pipeline.metrics.RequestMetricsMiddleware;
import com.todochat.pipeline.ratelimit.RateLimitMiddleware;
import com.todochat.pipeline.ratelimit.RateLimiter;
import com.todochat.security.AccessGuard;
import com.todochat.security.PrincipalLookup;
import com.todochat.security.TokenAuthority;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.Set;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the request pipeline and the token/guard pair.
 *
 * <p>Stage order, outermost first: correlation logging, security headers, request metrics, error
 * translation, rate limiting. The terminal stage hands the request to the servlet filter chain
 * (and so to Spring MVC).
 */
@Configuration
public class PipelineConfig {

    static final Set<String> UNMETERED_PATHS = Set.of(RequestMetricsMiddleware.METRICS_PATH, "/actuator/prometheus");

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimiter rateLimiter(PipelineProperties properties, Clock clock) {
        return new RateLimiter(properties.rateLimitSettings(), clock);
    }

    @Bean
    public TokenAuthority tokenAuthority(SecurityProperties properties, Clock clock) {
        return new TokenAuthority(properties.tokenSettings(), clock);
    }

    @Bean
    public AccessGuard accessGuard(TokenAuthority tokenAuthority, PrincipalLookup principalLookup) {
        return new AccessGuard(tokenAuthority, principalLookup);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, ServiceProperties service) {
        return new MetricFactory(meterRegistry, service.name());
    }

    @Bean
    public Pipeline requestPipeline(
            PipelineProperties properties,
            ServiceProperties service,
            RateLimiter rateLimiter,
            MetricFactory metricFactory,
            Clock clock) {
        return Pipeline.builder()
                .clock(clock)
                .use(new CorrelationLoggingMiddleware(clock))
                .use(new SecurityHeadersMiddleware(SecurityHeaderPolicy.forOrigin(properties.corsAllowedOrigin())))
                .use(new RequestMetricsMiddleware(metricFactory, UNMETERED_PATHS))
                .use(new ErrorResponseMiddleware(ErrorDetailLevel.forEnvironment(service.environment())))
                .use(new RateLimitMiddleware(rateLimiter, rateLimiter.settings()))
                .build(new ServletTerminalHandler());
    }
}
