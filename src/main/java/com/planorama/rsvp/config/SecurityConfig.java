package com.planorama.rsvp.config;

import com.planorama.rsvp.repository.UserRepository;
import com.planorama.rsvp.security.JwtAuthenticationEntryPoint;
import com.planorama.rsvp.security.JwtAuthenticationFilter;
import com.planorama.rsvp.security.JwtService;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Security configuration for the RSVP API.
 *
 * Authentication Strategy:
 * - Bearer JWT issued by /api/v1/auth/login and /api/v1/auth/signup
 * - Stateless session management (no server-side sessions)
 * - Missing or invalid tokens on protected routes get a JSON 401
 *
 * Authorization:
 * - Method-level security using @PreAuthorize annotations
 * - Organizer endpoints require the ADMIN role
 *
 * Public Endpoints (no authentication required):
 * - /actuator/health
 * - /api/v1/auth/login, /api/v1/auth/signup
 * - GET /api/v1/events/public/**
 * - /api/v1/rsvps/token/** (guest responses by invitation token)
 * - GET /api/v1/tokens/token/** (invitation details by token)
 *
 * @author Planorama Team
 */
@Configuration
@EnableWebSecurity
@EnableMethodSecurity(prePostEnabled = true)
public class SecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(
            HttpSecurity http,
            JwtAuthenticationFilter jwtAuthenticationFilter,
            JwtAuthenticationEntryPoint jwtAuthenticationEntryPoint
    ) throws Exception {
        http
            .csrf(csrf -> csrf.disable())

            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/health", "/actuator/health/**").permitAll()
                .requestMatchers(HttpMethod.POST, "/api/v1/auth/login", "/api/v1/auth/signup").permitAll()
                .requestMatchers(HttpMethod.GET, "/api/v1/events/public/**").permitAll()
                .requestMatchers("/api/v1/rsvps/token/**").permitAll()
                .requestMatchers(HttpMethod.GET, "/api/v1/tokens/token/**").permitAll()
                .anyRequest().authenticated()
            )

            .sessionManagement(session -> session
                .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint(jwtAuthenticationEntryPoint)
            )

            .addFilterBefore(jwtAuthenticationFilter, UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }

    /**
     * JWT authentication filter bean. Runs inside the security chain only.
     */
    @Bean
    public JwtAuthenticationFilter jwtAuthenticationFilter(JwtService jwtService, UserRepository userRepository) {
        return new JwtAuthenticationFilter(jwtService, userRepository);
    }

    /**
     * Keep the servlet container from registering the filter a second time outside the chain.
     */
    @Bean
    public FilterRegistrationBean<JwtAuthenticationFilter> jwtAuthenticationFilterRegistration(
            JwtAuthenticationFilter jwtAuthenticationFilter
    ) {
        FilterRegistrationBean<JwtAuthenticationFilter> registration =
                new FilterRegistrationBean<>(jwtAuthenticationFilter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
