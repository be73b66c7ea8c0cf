package com.quashbugs.prpulse.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.ObjectUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Authenticates the external scheduler that fires the trigger endpoints. The caller presents the
 * shared secret as a bearer token.
 */
@Component
public class CronSecretAuthenticationFilter extends OncePerRequestFilter {

    public static final String CRON_TRIGGER_PRINCIPAL = "cron-trigger";

    private static final Logger LOGGER = LoggerFactory.getLogger(CronSecretAuthenticationFilter.class);

    private final byte[] cronSecret;

    public CronSecretAuthenticationFilter(@Value("${spring.cron.secret:}") String cronSecret) {
        this.cronSecret = cronSecret.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/cron/");
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain)
            throws ServletException, IOException {

        if (cronSecret.length == 0) {
            LOGGER.error("Rejecting trigger request to {}: spring.cron.secret is not configured", request.getRequestURI());
            handleAuthenticationException(response, "Trigger secret is not configured", HttpServletResponse.SC_SERVICE_UNAVAILABLE);
            return;
        }

        final String authHeader = request.getHeader("Authorization");
        if (ObjectUtils.isEmpty(authHeader) || !StringUtils.startsWithIgnoreCase(authHeader, "Bearer ")) {
            filterChain.doFilter(request, response);
            return;
        }

        byte[] presented = authHeader.substring(7).trim().getBytes(StandardCharsets.UTF_8);
        if (MessageDigest.isEqual(cronSecret, presented)) {
            SecurityContext context = SecurityContextHolder.createEmptyContext();
            context.setAuthentication(new UsernamePasswordAuthenticationToken(CRON_TRIGGER_PRINCIPAL, null,
                    List.of(new SimpleGrantedAuthority("ROLE_CRON"))));
            SecurityContextHolder.setContext(context);
        } else {
            LOGGER.warn("Invalid trigger secret presented for {}", request.getRequestURI());
        }

        filterChain.doFilter(request, response);
    }

    private void handleAuthenticationException(HttpServletResponse response, String message, int statusCode) throws IOException {
        response.setStatus(statusCode);
        response.setContentType("application/json");
        response.getWriter().write("{\"error\": \"" + message + "\"}");
        response.getWriter().flush();
    }
}
