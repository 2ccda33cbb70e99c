package com.cred.freestyle.eventpricing.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Collections;

/**
 * Authenticates administrators by a shared API key.
 *
 * Header-based Authentication:
 * - Authorization: Bearer {admin api key}
 *
 * A matching key authenticates the request as "admin" with ROLE_ADMIN. Any other
 * request passes through unauthenticated and is rejected by the security chain
 * if it targets an admin route.
 *
 * @author Event Pricing Team
 */
public class AdminApiKeyAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(AdminApiKeyAuthenticationFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";
    static final String ADMIN_ROLE = "ROLE_ADMIN";

    private final byte[] adminApiKey;

    public AdminApiKeyAuthenticationFilter(String adminApiKey) {
        this.adminApiKey = adminApiKey.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (header != null && header.startsWith(BEARER_PREFIX)) {
            byte[] presented = header.substring(BEARER_PREFIX.length()).trim().getBytes(StandardCharsets.UTF_8);

            if (MessageDigest.isEqual(adminApiKey, presented)) {
                UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                        "admin", null, Collections.singletonList(new SimpleGrantedAuthority(ADMIN_ROLE)));
                SecurityContextHolder.getContext().setAuthentication(authentication);
                logger.debug("Authenticated admin request: {} {}", request.getMethod(), request.getRequestURI());
            } else {
                logger.warn("Invalid admin API key on {} {}", request.getMethod(), request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }
}
