package com.planorama.rsvp.security;

import com.planorama.rsvp.domain.model.User;
import com.planorama.rsvp.repository.UserRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.Optional;

/**
 * Authenticates requests carrying {@code Authorization: Bearer <jwt>}.
 *
 * A valid token whose user still exists becomes an authentication with the user ID as principal
 * and {@code ROLE_<role>} as its single authority. Anything else leaves the request
 * unauthenticated; protected routes then answer through {@link JwtAuthenticationEntryPoint}.
 *
 * @author Planorama Team
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtService jwtService;
    private final UserRepository userRepository;

    public JwtAuthenticationFilter(JwtService jwtService, UserRepository userRepository) {
        this.jwtService = jwtService;
        this.userRepository = userRepository;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String authHeader = request.getHeader("Authorization");

        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            String token = authHeader.substring(BEARER_PREFIX.length());

            if (jwtService.isTokenValid(token)) {
                String userId = jwtService.extractUserId(token);
                Optional<User> user = userRepository.findById(userId);

                if (user.isPresent()) {
                    String role = "ROLE_" + user.get().getRole().name();
                    UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                            userId, null, Collections.singletonList(new SimpleGrantedAuthority(role)));
                    SecurityContextHolder.getContext().setAuthentication(authentication);

                    logger.debug("Authenticated user: {} with role: {}", userId, role);
                } else {
                    logger.warn("JWT references unknown user: {}", userId);
                }
            } else {
                logger.warn("Invalid or expired JWT token for request: {} {}",
                        request.getMethod(), request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }
}
