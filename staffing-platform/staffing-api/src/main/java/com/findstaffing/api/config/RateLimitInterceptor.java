package com.findstaffing.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.findstaffing.api.auth.JwtTokenService;
import com.findstaffing.api.error.ErrorKind;
import com.findstaffing.api.error.ErrorResponse;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Enforces the admin API rate limits and answers 429 in the standard error shape.
 * Clients are keyed by token subject when the bearer token is valid, else by address.
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RateLimitInterceptor.class);

    private final RateLimitConfig rateLimitConfig;
    private final JwtTokenService tokenService;
    private final ObjectMapper objectMapper;

    public RateLimitInterceptor(RateLimitConfig rateLimitConfig, JwtTokenService tokenService, ObjectMapper objectMapper) {
        this.rateLimitConfig = rateLimitConfig;
        this.tokenService = tokenService;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response,
                             Object handler) throws Exception {

        String clientId = resolveClientId(request);
        Bucket bucket = selectBucket(request, clientId);

        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);

        if (probe.isConsumed()) {
            response.addHeader("X-Rate-Limit-Remaining", String.valueOf(probe.getRemainingTokens()));
            return true;
        }

        long waitForRefill = Math.max(1, probe.getNanosToWaitForRefill() / 1_000_000_000);
        response.addHeader("X-Rate-Limit-Retry-After-Seconds", String.valueOf(waitForRefill));
        response.setStatus(ErrorKind.RATE_LIMITED.status().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), ErrorResponse.of(ErrorKind.RATE_LIMITED,
                "Rate limit exceeded. Retry after " + waitForRefill + " seconds."));
        return false;
    }

    String resolveClientId(HttpServletRequest request) {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith("Bearer ")) {
            try {
                return "user:" + tokenService.validateAccessToken(authHeader.substring(7).trim()).profileId();
            } catch (JwtTokenService.TokenExpiredException | JwtTokenService.InvalidTokenException e) {
                log.debug("Rate limiting by address, token rejected: {}", e.getMessage());
            }
        }

        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return "ip:" + forwarded.split(",")[0].trim();
        }
        return "ip:" + request.getRemoteAddr();
    }

    private Bucket selectBucket(HttpServletRequest request, String clientId) {
        String path = request.getRequestURI();
        String method = request.getMethod();

        if (path.endsWith("/compliance/document") && ("POST".equals(method) || "DELETE".equals(method))) {
            return rateLimitConfig.resolveStrictBucket(clientId);
        }
        return rateLimitConfig.resolveBucket(clientId);
    }
}
