package com.microblog.infrastructure.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.microblog.adapter.in.web.ErrorResponse;
import com.microblog.application.port.in.AuthenticateUseCase;
import com.microblog.domain.model.User;
import com.microblog.infrastructure.context.RequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns the bearer session token into the signed-in user for the rest of the request.
 * Account creation, sign-in, password reset and the operational endpoints stay open.
 */
@Component
@Order(1)
public class AuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthFilter.class);

    private static final String REQUEST_ID_HEADER = "X-Request-Id";
    private static final String SCHEME = "Bearer ";

    private static final List<String> OPEN_PREFIXES = List.of(
        "/actuator", "/api-docs", "/v3/api-docs", "/swagger-ui", "/docs.html",
        "/api/v1/accounts", "/api/v1/sessions", "/api/v1/password-resets"
    );

    private final AuthenticateUseCase authenticateUseCase;
    private final ObjectMapper objectMapper;

    public AuthFilter(AuthenticateUseCase authenticateUseCase, ObjectMapper objectMapper) {
        this.authenticateUseCase = authenticateUseCase;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = Optional.ofNullable(request.getHeader(REQUEST_ID_HEADER))
            .filter(id -> !id.isBlank())
            .orElseGet(() -> UUID.randomUUID().toString());
        response.setHeader(REQUEST_ID_HEADER, requestId);

        String path = request.getRequestURI();
        if (OPEN_PREFIXES.stream().anyMatch(path::startsWith)) {
            RequestContext.setAnonymous(requestId);
            proceed(request, response, chain);
            return;
        }

        Optional<String> token = bearerToken(request);
        if (token.isEmpty()) {
            log.warn("No bearer token on {} {}", request.getMethod(), path);
            reject(response, "Missing bearer token", requestId);
            return;
        }

        Optional<User> user = authenticateUseCase.resolveSession(token.get());
        if (user.isEmpty()) {
            log.warn("Session token rejected on {} {}", request.getMethod(), path);
            reject(response, "Session is invalid or has expired", requestId);
            return;
        }

        RequestContext.set(user.get(), requestId);
        log.debug("Session user {} on {} (request {})", user.get().id(), path, requestId);
        proceed(request, response, chain);
    }

    private static Optional<String> bearerToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(SCHEME)) {
            return Optional.empty();
        }
        String token = header.substring(SCHEME.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    private static void proceed(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        try {
            chain.doFilter(request, response);
        } finally {
            RequestContext.clear();
        }
    }

    private void reject(HttpServletResponse response, String message, String requestId) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), new ErrorResponse("UNAUTHORIZED", message, requestId));
    }
}
