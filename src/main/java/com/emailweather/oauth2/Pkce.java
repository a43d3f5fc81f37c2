package com.emailweather.oauth2;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Proof Key for Code Exchange (RFC 7636) verifier/challenge pair, S256 method.
 *
 * <p>A fresh pair is generated for every consent attempt.
 */
public final class Pkce {

    public static final String METHOD = "S256";

    private static final int VERIFIER_BYTES = 32;

    private final String verifier;
    private final String challenge;

    private Pkce(String verifier, String challenge) {
        this.verifier = verifier;
        this.challenge = challenge;
    }

    /**
     * Generates a new pair from 32 random bytes.
     *
     * @param random the source of randomness
     * @return the new pair
     */
    public static Pkce generate(SecureRandom random) {
        byte[] bytes = new byte[VERIFIER_BYTES];
        random.nextBytes(bytes);
        String verifier = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        return new Pkce(verifier, challengeOf(verifier));
    }

    /**
     * Computes the S256 challenge {@code BASE64URL(SHA-256(ASCII(verifier)))}.
     */
    static String challengeOf(String verifier) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** The secret sent with the code exchange. */
    public String getVerifier() {
        return verifier;
    }

    /** The value sent in the authorization URL. */
    public String getChallenge() {
        return challenge;
    }

    @Override
    public String toString() {
        return "Pkce{method=" + METHOD + ", challenge='" + challenge + "'}";
    }
}
