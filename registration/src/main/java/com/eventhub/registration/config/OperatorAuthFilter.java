package com.eventhub.registration.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Operator authentication for {@code /admin/**}.
 * <ul>
 * <li>Reads the operator token header (default {@code X-Operator-Token})</li>
 * <li>Compares it in constant time against the configured token</li>
 * <li>Sets SecurityContext with ROLE_OPERATOR</li>
 * <li>Returns 401 JSON when missing or wrong; an unset token locks the admin
 * routes entirely</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OperatorAuthFilter extends OncePerRequestFilter {

    public static final String OPERATOR_ATTRIBUTE = "operator";
    static final String OPERATOR_NAME_HEADER = "X-Operator-Name";

    private final RegistrationProperties properties;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/admin/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain)
            throws ServletException, IOException {

        String presented = request.getHeader(properties.getOperatorHeader());

        if (!isValidOperatorToken(presented)) {
            log.warn("Operator request rejected on path={}", request.getRequestURI());
            sendUnauthorized(response);
            return;
        }

        String operator = request.getHeader(OPERATOR_NAME_HEADER);
        if (operator == null || operator.isBlank()) {
            operator = "operator";
        }

        UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
                operator,
                null,
                List.of(new SimpleGrantedAuthority("ROLE_OPERATOR")));
        SecurityContextHolder.getContext().setAuthentication(auth);

        request.setAttribute(OPERATOR_ATTRIBUTE, operator);

        filterChain.doFilter(request, response);
    }

    private boolean isValidOperatorToken(String presented) {
        String expected = properties.getOperatorToken();
        if (presented == null || expected == null || expected.isBlank()) {
            return false;
        }
        return MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }

    private void sendUnauthorized(HttpServletResponse response) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(
                "{\"status\":401,\"error\":\"Unauthorized\",\"message\":\"Operator token required\"}");
    }
}
