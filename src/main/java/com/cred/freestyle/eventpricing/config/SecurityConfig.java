package com.cred.freestyle.eventpricing.config;

import com.cred.freestyle.eventpricing.security.AdminApiKeyAuthenticationFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Security configuration for the event pricing service.
 *
 * Authentication Strategy:
 * - Admin API key in the Authorization header (Bearer)
 * - Stateless session management (no server-side sessions)
 *
 * Public Endpoints (no authentication required):
 * - /actuator/** (health checks)
 * - /api/v1/bookings/** (booking, cancellation, booking views)
 * - GET /api/v1/events/{id}/price and /api/v1/events/{id}/availability
 *
 * Everything else under /api/v1/events requires ROLE_ADMIN. Unauthenticated
 * requests to those routes get 401.
 *
 * @author Event Pricing Team
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Value("${eventpricing.admin.api-key:dev-admin-key}")
    private String adminApiKey;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            // Disable CSRF for stateless REST API
            .csrf(csrf -> csrf.disable())

            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/**").permitAll()
                .requestMatchers("/api/v1/bookings/**", "/api/v1/bookings").permitAll()
                .requestMatchers(HttpMethod.GET, "/api/v1/events/*/price", "/api/v1/events/*/availability").permitAll()
                .requestMatchers("/api/v1/events/**", "/api/v1/events").hasRole("ADMIN")
                .anyRequest().permitAll()
            )

            .sessionManagement(session -> session
                .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED))
            )

            .addFilterBefore(
                adminApiKeyAuthenticationFilter(),
                UsernamePasswordAuthenticationFilter.class
            );

        return http.build();
    }

    /**
     * Admin API key filter. Not registered as a bean so it only runs inside the security chain.
     */
    private AdminApiKeyAuthenticationFilter adminApiKeyAuthenticationFilter() {
        return new AdminApiKeyAuthenticationFilter(adminApiKey);
    }
}
