package com.emailweather.oauth2;

import com.google.api.client.auth.oauth2.TokenResponse;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service account flow: a signed JWT assertion is exchanged for a token, with no human
 * involved.
 *
 * <p>The provider never issues a refresh token for this grant, so an expired token is
 * replaced by signing a new assertion.
 */
public class ServiceAccountFlow implements AuthenticationFlow {

    private static final Logger logger = LoggerFactory.getLogger(ServiceAccountFlow.class);

    private final ServiceAccountKey key;
    private final TokenCache tokenCache;
    private final OAuth2Client client;
    private final Clock clock;

    public ServiceAccountFlow(ServiceAccountKey key, TokenCache tokenCache, OAuth2Client client) {
        this(key, tokenCache, client, tokenCache.getClock());
    }

    public ServiceAccountFlow(ServiceAccountKey key, TokenCache tokenCache, OAuth2Client client, Clock clock) {
        this.key = Preconditions.requireNonNull(key, "Service account key");
        this.tokenCache = Preconditions.requireNonNull(tokenCache, "Token cache");
        this.client = Preconditions.requireNonNull(client, "OAuth2 client");
        this.clock = Preconditions.requireNonNull(clock, "Clock");
    }

    @Override
    public FlowKind getFlowKind() {
        return FlowKind.SERVICE_ACCOUNT;
    }

    @Override
    public AccessToken authenticate(List<String> scopes) throws OAuth2Exception {
        if (scopes == null || scopes.size() != 1) {
            throw new OAuth2Exception(ErrorKind.CONFIGURATION,
                    "Service account flow requires exactly one scope, got "
                            + (scopes == null ? 0 : scopes.size()));
        }
        try (TokenCache.Guard guard = tokenCache.lock()) {
            AccessToken token = TokenCacheAuthenticator.authenticate(scopes, guard,
                    this::obtainNewToken, (refreshToken, refreshScopes) -> obtainNewToken(refreshScopes));
            logger.debug("Authenticated with service account flow: {}", token);
            return token;
        }
    }

    TokenResponse obtainNewToken(List<String> scopes) throws OAuth2Exception {
        String assertion = JwtAssertion.sign(key, scopes.get(0), clock.instant(), client.getJsonFactory());
        TokenResponse response = client.exchangeJwtAssertion(key.getTokenUri(), assertion);
        logger.info("Obtained new token for service account {}", key.getClientEmail());
        return response;
    }
}
