package com.planorama.rsvp.security;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.function.Predicate;

/**
 * Generates invitation secrets: 32 bytes of SecureRandom output, hex encoded (64 characters).
 *
 * @author Planorama Team
 */
public final class InvitationSecretGenerator {

    private static final int SECRET_BYTES = 32;
    private static final SecureRandom random = new SecureRandom();

    private InvitationSecretGenerator() {
    }

    public static String generate() {
        byte[] bytes = new byte[SECRET_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /**
     * Generate a secret the checker does not already know about.
     *
     * @param existsChecker Returns true if a secret is already taken
     * @return A unique secret
     */
    public static String generateUnique(Predicate<String> existsChecker) {
        String secret;
        do {
            secret = generate();
        } while (existsChecker.test(secret));
        return secret;
    }
}
