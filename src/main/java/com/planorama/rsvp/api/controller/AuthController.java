package com.planorama.rsvp.api.controller;

import com.planorama.rsvp.api.dto.AuthResponse;
import com.planorama.rsvp.api.dto.LoginRequest;
import com.planorama.rsvp.api.dto.SignupRequest;
import com.planorama.rsvp.api.dto.UserResponse;
import com.planorama.rsvp.security.SecurityUtils;
import com.planorama.rsvp.service.AuthService;
import com.planorama.rsvp.service.result.AuthResult;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for organizer accounts.
 *
 * @author Planorama Team
 */
@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private static final Logger logger = LoggerFactory.getLogger(AuthController.class);

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    /**
     * Register a new organizer.
     *
     * @param request Email and password
     * @return Bearer token and account
     */
    @PostMapping("/signup")
    public ResponseEntity<AuthResponse> signup(@Valid @RequestBody SignupRequest request) {
        logger.info("Signup requested");

        AuthResult result = authService.signup(request.getEmail(), request.getPassword());
        return ResponseEntity.status(HttpStatus.CREATED).body(AuthResponse.fromResult(result));
    }

    /**
     * Authenticate with email and password.
     *
     * @param request Email and password
     * @return Bearer token and account
     */
    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        AuthResult result = authService.login(request.getEmail(), request.getPassword());
        return ResponseEntity.ok(AuthResponse.fromResult(result));
    }

    @GetMapping("/me")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<UserResponse> me() {
        String userId = SecurityUtils.requireCurrentUserId();
        return ResponseEntity.ok(UserResponse.fromEntity(authService.getCurrentUser(userId)));
    }
}
