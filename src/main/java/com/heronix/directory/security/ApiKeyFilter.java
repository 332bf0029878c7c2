package com.heronix.directory.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import org.springframework.web.filter.OncePerRequestFilter;

import com.heronix.directory.config.DirectoryProperties;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * OncePerRequestFilter on /api/**.
 * Compares the X-Api-Key header with the configured key and returns 401 when it
 * is missing or wrong. Rejects everything when no key is configured.
 *
 * @author Heronix Educational Systems LLC
 * @since October 2026
 */
@RequiredArgsConstructor
@Slf4j
public class ApiKeyFilter extends OncePerRequestFilter {

    public static final String API_KEY_HEADER = "X-Api-Key";

    private static final String API_PATH = "/api/";

    private final DirectoryProperties properties;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(API_PATH);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String expected = properties.getSecurity().getApiKey();
        String presented = request.getHeader(API_KEY_HEADER);

        if (expected == null || expected.isBlank()) {
            log.error("API_KEY_FILTER: No API key configured, rejecting {}", request.getRequestURI());
            reject(response, "API key authentication is not configured");
            return;
        }

        if (presented == null || !MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8))) {
            log.warn("API_KEY_FILTER: Rejected request to {}", request.getRequestURI());
            reject(response, "Missing or invalid API key");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response, String message) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json");
        response.getWriter().write("{\"status\":\"error\",\"type\":\"unauthorized\",\"message\":\"" + message + "\"}");
    }
}
