package com.planorama.rsvp.infrastructure.ratelimit;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Configuration for rate limiting interceptors.
 *
 * - Auth endpoints: AUTH policy
 * - RSVP submissions (POST only): RSVP policy
 * - Organizer endpoints: API policy
 *
 * @author Planorama Team
 */
@Configuration
public class RateLimitConfig implements WebMvcConfigurer {

    private final RateLimitService rateLimitService;

    @Value("${rsvp.rate-limiting.enabled:true}")
    private boolean rateLimitingEnabled;

    public RateLimitConfig(RateLimitService rateLimitService) {
        this.rateLimitService = rateLimitService;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        if (!rateLimitingEnabled) {
            return;
        }

        registry.addInterceptor(new RateLimitInterceptor(rateLimitService, RateLimitPolicy.AUTH, false))
               .addPathPatterns("/api/v1/auth/login", "/api/v1/auth/signup");

        registry.addInterceptor(new RateLimitInterceptor(rateLimitService, RateLimitPolicy.RSVP, true))
               .addPathPatterns("/api/v1/rsvps/**")
               .excludePathPatterns("/api/v1/rsvps/event/**");

        registry.addInterceptor(new RateLimitInterceptor(rateLimitService, RateLimitPolicy.API, false))
               .addPathPatterns("/api/v1/events/**", "/api/v1/tokens/**", "/api/v1/email-templates/**");
    }
}
