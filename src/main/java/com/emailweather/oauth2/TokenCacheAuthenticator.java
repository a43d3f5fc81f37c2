package com.emailweather.oauth2;

import com.google.api.client.auth.oauth2.TokenResponse;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a cached token can be reused, must be refreshed, or must be obtained
 * again, and keeps the {@link TokenCache} file up to date.
 *
 * <p>How a token is obtained or refreshed is supplied by the calling
 * {@link AuthenticationFlow} as two callbacks; this class only decides <em>whether</em> to
 * call the network. The caller holds the cache {@link TokenCache.Guard} for the whole
 * algorithm, so at most one exchange happens per call and concurrent callers on the same
 * cache see each other's writes.
 */
public final class TokenCacheAuthenticator {

    private static final Logger logger = LoggerFactory.getLogger(TokenCacheAuthenticator.class);

    /**
     * Obtains a brand new token (consent, device code or JWT assertion).
     */
    @FunctionalInterface
    public interface NewTokenObtainer {
        TokenResponse obtainNewToken(List<String> scopes) throws OAuth2Exception;
    }

    /**
     * Exchanges a refresh token for a new token response.
     */
    @FunctionalInterface
    public interface TokenRefresher {
        TokenResponse refreshToken(String refreshToken, List<String> scopes) throws OAuth2Exception;
    }

    private TokenCacheAuthenticator() {
        // Utility class
    }

    /**
     * Returns a valid access token, reusing, refreshing or re-obtaining it as needed.
     *
     * <ol>
     *   <li>No cache file: obtain a new token and persist it</li>
     *   <li>Cached token without expiry, or not yet expired: return it unchanged</li>
     *   <li>Expired with a refresh token: refresh; a response without a refresh token keeps
     *       the cached one</li>
     *   <li>Expired without a refresh token: obtain a new token</li>
     * </ol>
     *
     * @param scopes         the requested scopes
     * @param guard          the held cache guard
     * @param obtainNewToken callback performing a full token acquisition
     * @param refreshToken   callback performing a refresh-token exchange
     * @return the current access token
     * @throws OAuth2Exception if reading, acquiring or persisting the token fails; the
     *                         message names the failed step
     */
    public static AccessToken authenticate(List<String> scopes, TokenCache.Guard guard,
                                           NewTokenObtainer obtainNewToken,
                                           TokenRefresher refreshToken) throws OAuth2Exception {
        Clock clock = guard.getClock();
        TokenCacheData data;

        if (guard.exists()) {
            logger.debug("Token cache {} exists, attempting to read from file", guard.getPath());
            TokenCacheData cached;
            try {
                cached = guard.read();
            } catch (OAuth2Exception e) {
                throw e.withContext("Error reading token cache " + guard.getPath());
            }

            if (cached.isExpired(clock)) {
                logger.debug("Token in cache has expired");
                String cachedRefreshToken = cached.getRefreshToken();
                TokenResponse response;
                if (cachedRefreshToken != null) {
                    logger.debug("Using refresh token to automatically obtain a new token");
                    try {
                        response = refreshToken.refreshToken(cachedRefreshToken, scopes);
                    } catch (OAuth2Exception e) {
                        throw e.withContext("Error while refreshing token");
                    }
                    if (response.getRefreshToken() == null) {
                        logger.debug("No new refresh token in the response, re-using current refresh token");
                        response.setRefreshToken(cachedRefreshToken);
                    }
                } else {
                    logger.debug("No refresh token available, obtaining a new token");
                    response = obtain(obtainNewToken, scopes);
                }
                data = persist(guard, response, clock);
            } else {
                data = cached;
            }
        } else {
            logger.debug("Token cache {} does not exist, obtaining new token", guard.getPath());
            TokenResponse response = obtain(obtainNewToken, scopes);
            logger.debug("Successfully obtained new token");
            data = persist(guard, response, clock);
        }

        logExpiry(data, clock);
        return new AccessToken(data.getAccessToken());
    }

    private static TokenResponse obtain(NewTokenObtainer obtainNewToken, List<String> scopes)
            throws OAuth2Exception {
        try {
            return obtainNewToken.obtainNewToken(scopes);
        } catch (OAuth2Exception e) {
            throw e.withContext("Error while obtaining new token");
        }
    }

    private static TokenCacheData persist(TokenCache.Guard guard, TokenResponse response, Clock clock)
            throws OAuth2Exception {
        if (response == null || response.getAccessToken() == null || response.getAccessToken().isBlank()) {
            throw new OAuth2Exception(ErrorKind.DESERIALIZE,
                    "Token response does not contain an access_token");
        }
        TokenCacheData data;
        try {
            data = TokenCacheData.create(response, clock);
        } catch (ArithmeticException | DateTimeException e) {
            throw new OAuth2Exception(ErrorKind.DESERIALIZE,
                    "Invalid expires_in " + response.getExpiresInSeconds() + " in token response", e);
        }
        try {
            guard.write(data);
        } catch (OAuth2Exception e) {
            throw e.withContext("Error writing token cache " + guard.getPath());
        }
        return data;
    }

    private static void logExpiry(TokenCacheData data, Clock clock) {
        Duration expiresIn = data.expiresInNow(clock);
        if (expiresIn == null) {
            logger.warn("Token has no expiration time");
            return;
        }
        String refreshMessage = data.getRefreshToken() != null
                ? "It can be refreshed using the cached refresh token."
                : "It cannot be refreshed, the cache does not contain a refresh token; "
                        + "a new token will need to be obtained upon expiry.";
        logger.debug("Token expires in: {}. {}", formatDuration(expiresIn), refreshMessage);
    }

    /**
     * Formats a duration as e.g. {@code 59m 58s}.
     */
    static String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        if (seconds == 0) {
            return "0s";
        }
        StringBuilder sb = new StringBuilder();
        long days = seconds / 86_400;
        long hours = (seconds % 86_400) / 3_600;
        long minutes = (seconds % 3_600) / 60;
        long secs = seconds % 60;
        if (days > 0) {
            sb.append(days).append("d ");
        }
        if (hours > 0) {
            sb.append(hours).append("h ");
        }
        if (minutes > 0) {
            sb.append(minutes).append("m ");
        }
        if (secs > 0) {
            sb.append(secs).append("s ");
        }
        return sb.toString().trim();
    }
}
