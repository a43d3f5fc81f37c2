package com.emailweather.relay;

import com.emailweather.oauth2.AccessToken;
import com.emailweather.oauth2.AuthenticationFlow;
import com.emailweather.oauth2.OAuth2Exception;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

/**
 * SASL XOAUTH2 initial client response used to log in to IMAP/SMTP with a bearer token.
 *
 * <p>Format: {@code user=<user>^Aauth=Bearer <token>^A^A}, where {@code ^A} is
 * {@code \u0001}.
 */
public final class XOAuth2 {

    private static final char SEPARATOR = '\u0001';

    private XOAuth2() {
        // Utility class
    }

    public static String initialResponse(String user, AccessToken token) {
        if (user == null || user.isBlank()) {
            throw new IllegalArgumentException("User cannot be null or blank");
        }
        if (token == null) {
            throw new IllegalArgumentException("Access token cannot be null");
        }
        return "user=" + user + SEPARATOR + "auth=Bearer " + token.getSecret() + SEPARATOR + SEPARATOR;
    }

    /**
     * The initial response, Base64-encoded as sent on the wire.
     */
    public static String encodedInitialResponse(String user, AccessToken token) {
        return Base64.getEncoder().encodeToString(initialResponse(user, token).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Obtains a token from the flow and formats the (unencoded) initial response.
     *
     * @param flow   the authentication flow
     * @param scopes the scopes to request
     * @param user   the mailbox user
     * @return the initial response
     * @throws OAuth2Exception if no token could be obtained
     */
    public static String authenticate(AuthenticationFlow flow, List<String> scopes, String user)
            throws OAuth2Exception {
        AccessToken token = flow.authenticate(scopes);
        return initialResponse(user, token);
    }
}
