package com.tripmate.backend.global.web;

import java.io.IOException;

import com.tripmate.backend.global.config.RateLimitProperties;
import com.tripmate.backend.global.error.ErrorCode;
import com.tripmate.backend.global.error.ProblemResponseWriter;
import com.tripmate.backend.global.error.RetryableProblemException;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Fixed-window limit per client IP and path on {@code rate_limit:{ip}:{path}}. When the counter
 * cannot be reached the request is let through.
 */
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String RESET_HEADER = "X-RateLimit-Reset";

    private final RateLimitCounter rateLimitCounter;
    private final RateLimitProperties properties;
    private final ProblemResponseWriter problemResponseWriter;

    public RateLimitFilter(RateLimitCounter rateLimitCounter,
                           RateLimitProperties properties,
                           ProblemResponseWriter problemResponseWriter) {
        this.rateLimitCounter = rateLimitCounter;
        this.properties = properties;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String path = request.getServletPath();
        String key = "rate_limit:" + ClientIpResolver.resolve(request) + ":" + path;

        RateLimitCounter.Window window;
        try {
            window = rateLimitCounter.increment(key, properties.window());
        } catch (DataAccessException ex) {
            log.warn("Rate limit counter unavailable for {}, allowing request: {}", path, ex.getMessage());
            filterChain.doFilter(request, response);
            return;
        }

        int max = properties.maxRequests();
        response.setHeader(LIMIT_HEADER, String.valueOf(max));
        response.setHeader(REMAINING_HEADER, String.valueOf(Math.max(0, max - window.count())));
        response.setHeader(RESET_HEADER, String.valueOf(window.resetSeconds()));

        if (window.count() > max) {
            log.warn("Rate limit exceeded on {} ({} hits)", path, window.count());
            problemResponseWriter.write(request, response,
                    new RetryableProblemException(ErrorCode.TOO_MANY_REQUESTS, window.resetSeconds()));
            return;
        }
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if (!properties.enabled() || "OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = request.getServletPath();
        return properties.pathPrefixes().stream().noneMatch(path::startsWith);
    }
}
