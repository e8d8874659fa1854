package com.playarr.livetv.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards /internal/** (sync trigger and cancel) with a shared X-Api-Key header.
 * With no key configured every internal request is refused.
 */
@Component
public class InternalApiKeyFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(InternalApiKeyFilter.class);
    static final String API_KEY_HEADER = "X-Api-Key";
    private static final String INTERNAL_PATH_PREFIX = "/internal/";

    private final String expectedApiKey;

    public InternalApiKeyFilter(@Value("${internal.api-key:}") String expectedApiKey) {
        this.expectedApiKey = expectedApiKey;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(INTERNAL_PATH_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (expectedApiKey == null || expectedApiKey.isBlank()) {
            logger.error("internal.api-key is not configured, refusing {}", request.getRequestURI());
            reject(response, HttpServletResponse.SC_SERVICE_UNAVAILABLE, "Internal API disabled");
            return;
        }

        String providedApiKey = request.getHeader(API_KEY_HEADER);
        if (providedApiKey == null || providedApiKey.isBlank()) {
            logger.warn("Missing API key for internal endpoint: {}", request.getRequestURI());
            reject(response, HttpServletResponse.SC_UNAUTHORIZED, "Missing API key");
            return;
        }

        if (!MessageDigest.isEqual(
                expectedApiKey.getBytes(StandardCharsets.UTF_8),
                providedApiKey.getBytes(StandardCharsets.UTF_8))) {
            logger.warn("Invalid API key for internal endpoint: {}", request.getRequestURI());
            reject(response, HttpServletResponse.SC_UNAUTHORIZED, "Invalid API key");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response, int status, String error) throws IOException {
        response.setStatus(status);
        response.setContentType("application/json");
        response.getWriter().write("{\"error\": \"" + error + "\"}");
    }
}
