package com.emailweather.oauth2;

import com.google.api.client.auth.oauth2.TokenResponse;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authorization code flow with PKCE for installed applications.
 *
 * <p>A new token is obtained in four steps:
 * <ol>
 *   <li>Build the authorization URL with a fresh PKCE pair and a random state</li>
 *   <li>Wait for the user's consent through the {@link ConsentRedirect}</li>
 *   <li>Verify the delivered state (HTTP redirects only)</li>
 *   <li>Exchange the code and verifier for a token</li>
 * </ol>
 * Expired tokens are refreshed with the cached refresh token; consent is only requested
 * again when there is none.
 */
public class InstalledFlow implements AuthenticationFlow {

    private static final Logger logger = LoggerFactory.getLogger(InstalledFlow.class);

    private static final int STATE_BYTES = 16;

    private final ClientCredential credential;
    private final ConsentRedirect redirect;
    private final TokenCache tokenCache;
    private final OAuth2Client client;
    private final SecureRandom random;

    public InstalledFlow(ClientCredential credential, ConsentRedirect redirect, TokenCache tokenCache,
                         OAuth2Client client) {
        this(credential, redirect, tokenCache, client, new SecureRandom());
    }

    public InstalledFlow(ClientCredential credential, ConsentRedirect redirect, TokenCache tokenCache,
                         OAuth2Client client, SecureRandom random) {
        this.credential = Preconditions.requireNonNull(credential, "Client credential");
        this.redirect = Preconditions.requireNonNull(redirect, "Consent redirect");
        this.tokenCache = Preconditions.requireNonNull(tokenCache, "Token cache");
        this.client = Preconditions.requireNonNull(client, "OAuth2 client");
        this.random = Preconditions.requireNonNull(random, "Secure random");
    }

    @Override
    public FlowKind getFlowKind() {
        return FlowKind.INSTALLED;
    }

    @Override
    public AccessToken authenticate(List<String> scopes) throws OAuth2Exception {
        Preconditions.requireNonEmpty(scopes, "Scopes");
        try (TokenCache.Guard guard = tokenCache.lock()) {
            AccessToken token = TokenCacheAuthenticator.authenticate(scopes, guard,
                    this::obtainNewToken, this::refreshToken);
            logger.debug("Authenticated with installed flow: {}", token);
            return token;
        }
    }

    TokenResponse obtainNewToken(List<String> scopes) throws OAuth2Exception {
        redirect.discardStale();
        Pkce pkce = Pkce.generate(random);
        String state = newState();
        String authorizationUrl = client.buildAuthorizationUrl(credential, redirect.getRedirectUri(),
                scopes, state, pkce);

        RedirectParameters parameters = redirect.awaitConsent(authorizationUrl);

        if (redirect.deliversState() && !stateMatches(state, parameters.getState())) {
            throw new OAuth2Exception(ErrorKind.CSRF_MISMATCH,
                    "CSRF state returned by the redirect does not match the state that was sent");
        }

        TokenResponse response = client.exchangeCode(credential, parameters.getCode(),
                redirect.getRedirectUri(), pkce.getVerifier());

        if (response.getRefreshToken() == null) {
            Long expiresIn = response.getExpiresInSeconds();
            String lifetime = expiresIn == null
                    ? "never expires"
                    : "expires in " + TokenCacheAuthenticator.formatDuration(Duration.ofSeconds(expiresIn));
            logger.warn("No refresh token was issued; the token {} and consent will be requested again "
                    + "after that", lifetime);
        }
        logger.info("Obtained new token with installed flow");
        return response;
    }

    TokenResponse refreshToken(String refreshToken, List<String> scopes) throws OAuth2Exception {
        return client.refresh(credential, refreshToken, scopes);
    }

    private String newState() {
        byte[] bytes = new byte[STATE_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static boolean stateMatches(String expected, String actual) {
        if (actual == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8));
    }
}
