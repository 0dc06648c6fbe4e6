package com.mlbbai.hero_analysis_engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mlbbai.hero_analysis_engine.config.HeroEngineProperties;
import com.mlbbai.hero_analysis_engine.controller.support.ErrorResponseUtils;
import com.mlbbai.hero_analysis_engine.service.ClientRequestRateLimiter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Applies the per-client request budget to {@code /api/**}. Clients are keyed by remote address.
 */
@Component
@Slf4j
public class ClientRateLimitFilter extends OncePerRequestFilter {

    private final ClientRequestRateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final boolean enabled;

    public ClientRateLimitFilter(ClientRequestRateLimiter rateLimiter,
                                 ObjectMapper objectMapper,
                                 HeroEngineProperties properties) {
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.enabled = properties.getRateLimit().isEnabled();
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return !enabled || !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        ClientRequestRateLimiter.Decision decision = rateLimiter.tryAcquire(request.getRemoteAddr());
        if (decision.allowed()) {
            response.setHeader("X-RateLimit-Remaining", String.valueOf(decision.remaining()));
            filterChain.doFilter(request, response);
            return;
        }
        log.info("Rate limit exceeded for {} on {}", request.getRemoteAddr(), request.getRequestURI());
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(),
            ErrorResponseUtils.errorBody("Too many requests", "Please try again later."));
    }
}
