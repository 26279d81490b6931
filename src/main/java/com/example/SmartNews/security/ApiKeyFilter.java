package com.example.SmartNews.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Checks the shared secret in the {@code X-API-Key} header. A blank configured key
 * lets every request through (development mode).
 */
public class ApiKeyFilter extends OncePerRequestFilter {
    public static final String API_KEY_HEADER = "X-API-Key";
    public static final String USER_ID_HEADER = "X-User-ID";
    public static final String DEFAULT_USER = "anonymous";

    private final String apiKey;

    public ApiKeyFilter(String apiKey) {
        this.apiKey = apiKey;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String path = request.getRequestURI();

        // CORS preflight and health checks
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())
                || path.equals("/")
                || path.equals("/health")
                || path.startsWith("/actuator/")) {
            filterChain.doFilter(request, response);
            return;
        }

        if (apiKey != null && !apiKey.isBlank()) {
            String provided = request.getHeader(API_KEY_HEADER);
            if (provided == null || provided.isBlank()) {
                response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
                response.setContentType("application/json");
                response.getWriter().write("{\"error\":\"API key required\"}");
                return;
            }
            if (!MessageDigest.isEqual(provided.getBytes(StandardCharsets.UTF_8), apiKey.getBytes(StandardCharsets.UTF_8))) {
                response.setStatus(HttpServletResponse.SC_FORBIDDEN);
                response.setContentType("application/json");
                response.getWriter().write("{\"error\":\"Invalid API key\"}");
                return;
            }
        }

        String userId = request.getHeader(USER_ID_HEADER);
        UsernamePasswordAuthenticationToken authToken = new UsernamePasswordAuthenticationToken(
                userId != null && !userId.isBlank() ? userId : DEFAULT_USER, null, List.of());
        SecurityContextHolder.getContext().setAuthentication(authToken);

        filterChain.doFilter(request, response);
    }
}
