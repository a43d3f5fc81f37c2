package com.emailweather.oauth2;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Bearer access token returned by {@link AuthenticationFlow#authenticate}.
 *
 * <p>The value is a secret: {@link #toString()} never reveals it, so an access token can
 * safely end up in log statements. Use {@link #getSecret()} only where the raw bearer
 * string is needed (an {@code Authorization} header, an XOAUTH2 initial response).
 */
public final class AccessToken {

    private static final int VISIBLE_PREFIX = 4;

    private final String secret;

    public AccessToken(String secret) {
        this.secret = Preconditions.requireNonBlank(secret, "Access token");
    }

    /**
     * Returns the raw bearer token.
     *
     * @return the token value
     */
    public String getSecret() {
        return secret;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AccessToken)) {
            return false;
        }
        // Constant-time comparison
        return MessageDigest.isEqual(
                secret.getBytes(StandardCharsets.UTF_8),
                ((AccessToken) o).secret.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public int hashCode() {
        return secret.hashCode();
    }

    @Override
    public String toString() {
        String prefix = secret.length() > VISIBLE_PREFIX * 4
                ? secret.substring(0, VISIBLE_PREFIX)
                : "";
        return "AccessToken{" + prefix + "***, length=" + secret.length() + "}";
    }
}
