package com.eventhub.registration.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.Arrays;
import java.util.List;

/**
 * Stateless security configuration.
 * <ul>
 * <li>Security headers: HSTS, X-Content-Type-Options, X-Frame-Options, CSP,
 * Cache-Control</li>
 * <li>Rate limiting filter registered before operator auth</li>
 * <li>/public/**, /actuator/health: permitAll</li>
 * <li>/admin/**: operator token (ROLE_OPERATOR)</li>
 * <li>CSRF disabled (no cookies, no browser session)</li>
 * </ul>
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

        @Value("${app.frontend-url:http://localhost:3000}")
        private String frontendUrl;

        private final OperatorAuthFilter operatorAuthFilter;
        private final RateLimitFilter rateLimitFilter;

        public SecurityConfig(OperatorAuthFilter operatorAuthFilter, RateLimitFilter rateLimitFilter) {
                this.operatorAuthFilter = operatorAuthFilter;
                this.rateLimitFilter = rateLimitFilter;
        }

        @Bean
        public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
                http
                                .csrf(AbstractHttpConfigurer::disable)
                                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                                .sessionManagement(session -> session
                                                .sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                                // ── Security Headers ──
                                .headers(headers -> headers
                                                .contentTypeOptions(opt -> {
                                                }) // X-Content-Type-Options: nosniff
                                                .frameOptions(frame -> frame.deny()) // X-Frame-Options: DENY
                                                .httpStrictTransportSecurity(hsts -> hsts
                                                                .includeSubDomains(true)
                                                                .maxAgeInSeconds(31536000)) // HSTS: 1 year
                                                .contentSecurityPolicy(csp -> csp
                                                                .policyDirectives("default-src 'none'; frame-ancestors 'none'"))
                                                .cacheControl(cache -> {
                                                })) // Cache-Control: no-cache, no-store, must-revalidate

                                .authorizeHttpRequests(auth -> auth
                                                .requestMatchers("/public/**").permitAll()
                                                .requestMatchers("/actuator/health").permitAll()
                                                .requestMatchers("/error").permitAll()
                                                .requestMatchers("/admin/**").hasRole("OPERATOR")
                                                .anyRequest().denyAll())
                                .addFilterBefore(rateLimitFilter, UsernamePasswordAuthenticationFilter.class)
                                .addFilterBefore(operatorAuthFilter, UsernamePasswordAuthenticationFilter.class)
                                .formLogin(AbstractHttpConfigurer::disable)
                                .httpBasic(AbstractHttpConfigurer::disable);

                return http.build();
        }

        @Bean
        public CorsConfigurationSource corsConfigurationSource() {
                CorsConfiguration config = new CorsConfiguration();
                config.setAllowedOrigins(Arrays.asList(
                                "http://localhost:3000",
                                frontendUrl));
                config.setAllowedMethods(List.of("GET", "POST", "DELETE", "OPTIONS"));
                config.setAllowedHeaders(List.of("*"));
                config.setExposedHeaders(List.of(RequestCorrelationFilter.HEADER));
                config.setMaxAge(3600L);

                UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
                source.registerCorsConfiguration("/**", config);
                return source;
        }
}
