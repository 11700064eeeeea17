package com.nosota.tripfund.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Authentication happens upstream; the gateway forwards the caller in the X-User-Id header
 * and trip-level permissions are enforced by the services.
 *
 * <p>Only the REST API is reachable. OpenAPI docs are served in the {@code dev} profile only.
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    static final String API_PATHS = "/api/v1/**";
    static final String[] DOC_PATHS = {"/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html"};

    private final Environment environment;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        boolean exposeDocs = environment.acceptsProfiles(Profiles.of("dev"));

        return http
                .authorizeHttpRequests(auth -> {
                    auth.requestMatchers(API_PATHS, "/error").permitAll();
                    if (exposeDocs) {
                        auth.requestMatchers(DOC_PATHS).permitAll();
                    }
                    auth.anyRequest().denyAll();
                })
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .csrf(AbstractHttpConfigurer::disable)
                .build();
    }
}
