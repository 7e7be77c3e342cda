package com.todochat.chatapi.infrastructure.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.util.ContentCachingResponseWrapper;

/**
 * The servlet objects a pipeline pass needs to continue down the filter chain. Carried as a
 * {@link com.todochat.pipeline.RequestContext} attribute.
 */
record ServletExchange(HttpServletRequest request, ContentCachingResponseWrapper response, FilterChain chain) {

    static final String ATTRIBUTE = ServletExchange.class.getName();
}
