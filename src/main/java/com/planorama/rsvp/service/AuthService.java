package com.planorama.rsvp.service;

import com.planorama.rsvp.domain.model.User;
import com.planorama.rsvp.exception.DuplicateAccountException;
import com.planorama.rsvp.exception.InvalidCredentialsException;
import com.planorama.rsvp.exception.ResourceNotFoundException;
import com.planorama.rsvp.repository.InvitationTokenRepository;
import com.planorama.rsvp.repository.UserRepository;
import com.planorama.rsvp.security.JwtService;
import com.planorama.rsvp.service.result.AuthResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Service for organizer accounts: signup, login and the current user.
 *
 * @author Planorama Team
 */
@Service
public class AuthService {

    private static final Logger logger = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final InvitationTokenRepository tokenRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;

    public AuthService(
            UserRepository userRepository,
            InvitationTokenRepository tokenRepository,
            PasswordEncoder passwordEncoder,
            JwtService jwtService
    ) {
        this.userRepository = userRepository;
        this.tokenRepository = tokenRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtService = jwtService;
    }

    /**
     * Register an organizer account and link invitations already sent to its email.
     *
     * @param email Email (normalized before storing)
     * @param password Plain password
     * @return Bearer token and the new account
     * @throws DuplicateAccountException if the email is taken
     */
    @Transactional
    public AuthResult signup(String email, String password) {
        String normalizedEmail = User.normalizeEmail(email);

        if (userRepository.existsByEmail(normalizedEmail)) {
            logger.warn("Signup rejected, email already registered: {}", normalizedEmail);
            throw new DuplicateAccountException(normalizedEmail);
        }

        User user = User.builder()
                .email(normalizedEmail)
                .passwordHash(passwordEncoder.encode(password))
                .role(User.Role.ADMIN)
                .build();

        User saved;
        try {
            saved = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // Concurrent signup with the same email won the unique index
            throw new DuplicateAccountException(normalizedEmail);
        }

        int linked = tokenRepository.linkInviteeAccount(normalizedEmail, saved.getUserId());
        logger.info("User registered: {}, linked invitations: {}", saved.getUserId(), linked);

        return new AuthResult(jwtService.generateToken(saved.getUserId()), saved);
    }

    /**
     * Authenticate with email and password.
     *
     * @throws InvalidCredentialsException on an unknown email or a wrong password alike
     */
    @Transactional(readOnly = true)
    public AuthResult login(String email, String password) {
        String normalizedEmail = User.normalizeEmail(email);

        User user = userRepository.findByEmail(normalizedEmail)
                .orElseThrow(InvalidCredentialsException::new);

        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            logger.warn("Login failed for user: {}", user.getUserId());
            throw new InvalidCredentialsException();
        }

        logger.info("User logged in: {}", user.getUserId());
        return new AuthResult(jwtService.generateToken(user.getUserId()), user);
    }

    @Transactional(readOnly = true)
    public User getCurrentUser(String userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    }
}
