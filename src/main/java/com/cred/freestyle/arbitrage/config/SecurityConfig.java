package com.cred.freestyle.arbitrage.config;

import com.cred.freestyle.arbitrage.security.HeaderAuthenticationFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Security configuration for the arbitrage engine.
 *
 * Authentication Strategy:
 * - Header-based authentication using X-User-Id header
 * - Stateless session management (no server-side sessions)
 * - The API gateway in front of the service validates tokens and forwards the identity headers
 *
 * Authorization:
 * - Alert rules are owned by the user who created them; admins may manage any rule
 * - /api/v1/admin/** (manual alert scans) requires ADMIN role
 * - Size alias management and conflict reconciliation under /api/v1/sizes/** require ADMIN via @PreAuthorize
 *
 * Public Endpoints (no authentication required):
 * - /actuator/** (health checks, metrics)
 * - GET /api/v1/sizes/** (size lookup and conversion)
 *
 * @author Arbitrage Team
 */
@Configuration
@EnableWebSecurity
@EnableMethodSecurity(prePostEnabled = true)
public class SecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            // Stateless REST API
            .csrf(csrf -> csrf.disable())

            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/**").permitAll()
                .requestMatchers(HttpMethod.GET, "/api/v1/sizes/**").permitAll()
                .requestMatchers("/api/v1/admin/**").hasRole("ADMIN")
                .anyRequest().authenticated()
            )

            .sessionManagement(session -> session
                .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            .addFilterBefore(
                headerAuthenticationFilter(),
                UsernamePasswordAuthenticationFilter.class
            );

        return http.build();
    }

    /**
     * Extracts user identity from X-User-Id and X-User-Role headers.
     */
    @Bean
    public HeaderAuthenticationFilter headerAuthenticationFilter() {
        return new HeaderAuthenticationFilter();
    }
}
