package com.eventhub.registration.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Sliding window rate limiter using Redis ZADD + ZREMRANGEBYSCORE, keyed by
 * client IP. Guards the endpoints that can be used to guess codes or tokens
 * and the one that sends mail. Inactive when the ephemeral store is
 * in-memory.
 */
@Slf4j
@Component
public class RateLimitFilter extends OncePerRequestFilter {

    private final ObjectProvider<StringRedisTemplate> redisTemplateProvider;
    private final RegistrationProperties properties;
    private final ObjectMapper objectMapper;

    @Value("${rate-limit.enabled:true}")
    private boolean enabled;

    public RateLimitFilter(ObjectProvider<StringRedisTemplate> redisTemplateProvider,
            RegistrationProperties properties,
            ObjectMapper objectMapper) {
        this.redisTemplateProvider = redisTemplateProvider;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain chain) throws ServletException, IOException {
        if (!enabled || !properties.usesRedis() || !"POST".equals(request.getMethod())) {
            chain.doFilter(request, response);
            return;
        }

        String path = request.getRequestURI();
        RateLimitConfig config = resolveConfig(path);

        if (config == null) {
            chain.doFilter(request, response);
            return;
        }

        String key = "ratelimit:" + config.endpointKey + ":" + ClientIpResolver.resolve(request);

        if (isRateLimited(key, config.maxRequests, config.windowSeconds)) {
            log.warn("Rate limited: key={}, path={}", key, path);
            response.setStatus(429);
            response.setHeader("Retry-After", String.valueOf(config.windowSeconds));
            response.setContentType("application/json");
            response.getWriter().write(objectMapper.writeValueAsString(Map.of(
                    "error", "RATE_LIMITED",
                    "message", "Too many requests. Try again later.",
                    "retryable", true,
                    "retryAfterSeconds", config.windowSeconds)));
            return;
        }

        chain.doFilter(request, response);
    }

    boolean isRateLimited(String key, int maxRequests, int windowSeconds) {
        try {
            StringRedisTemplate redisTemplate = redisTemplateProvider.getObject();
            double now = Instant.now().toEpochMilli();
            double windowStart = now - (windowSeconds * 1000.0);

            // Remove expired entries
            redisTemplate.opsForZSet().removeRangeByScore(key, 0, windowStart);

            // Count current entries
            Long count = redisTemplate.opsForZSet().zCard(key);

            if (count != null && count >= maxRequests) {
                return true;
            }

            // Add current request
            redisTemplate.opsForZSet().add(key, String.valueOf(now), now);

            // Set key expiry (auto-cleanup)
            redisTemplate.expire(key, Duration.ofSeconds(windowSeconds + 10));

            return false;
        } catch (Exception e) {
            // On Redis failure, allow the request (fail-open)
            log.warn("Rate limit check failed (allowing request): {}", e.getMessage());
            return false;
        }
    }

    RateLimitConfig resolveConfig(String path) {
        if (!path.startsWith("/public/")) {
            return null;
        }
        if (path.endsWith("/codes/verify")) {
            return new RateLimitConfig("code_verify", 20, 300);
        } else if (path.endsWith("/codes")) {
            return new RateLimitConfig("code_issue", 5, 300);
        } else if (path.equals("/public/redirect-tokens/consume")) {
            return new RateLimitConfig("token_consume", 20, 300);
        } else if (path.endsWith("/signed-links/accept")) {
            return new RateLimitConfig("link_accept", 20, 300);
        } else if (path.endsWith("/qualification")) {
            return new RateLimitConfig("qualification", 30, 300);
        }
        return null;
    }

    record RateLimitConfig(String endpointKey, int maxRequests, int windowSeconds) {
    }
}
