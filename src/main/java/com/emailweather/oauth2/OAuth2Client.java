package com.emailweather.oauth2;

import com.google.api.client.auth.oauth2.AuthorizationCodeRequestUrl;
import com.google.api.client.auth.oauth2.AuthorizationCodeTokenRequest;
import com.google.api.client.auth.oauth2.ClientParametersAuthentication;
import com.google.api.client.auth.oauth2.RefreshTokenRequest;
import com.google.api.client.auth.oauth2.TokenErrorResponse;
import com.google.api.client.auth.oauth2.TokenRequest;
import com.google.api.client.auth.oauth2.TokenResponse;
import com.google.api.client.auth.oauth2.TokenResponseException;
import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpResponse;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.UrlEncodedContent;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.JsonObjectParser;
import com.google.api.client.json.jackson2.JacksonFactory;
import com.google.api.client.util.Sleeper;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around the OAuth2 client library for the token endpoint exchanges used by
 * the authentication flows.
 *
 * <p>It handles:
 * <ul>
 *   <li>Authorization URL construction with PKCE and offline access</li>
 *   <li>Authorization code, refresh token, device code and JWT bearer grants</li>
 *   <li>Translation of library failures into {@link OAuth2Exception}</li>
 * </ul>
 *
 * <p>The client is designed to be injectable/mockable for unit testing; tests pass a
 * {@code MockHttpTransport} and a no-op {@link Sleeper}.
 */
public class OAuth2Client {

    private static final Logger logger = LoggerFactory.getLogger(OAuth2Client.class);

    public static final String OUT_OF_BAND_REDIRECT_URI = "urn:ietf:wg:oauth:2.0:oob";
    public static final String DEVICE_CODE_GRANT_TYPE = "urn:ietf:params:oauth:grant-type:device_code";
    public static final String JWT_BEARER_GRANT_TYPE = "urn:ietf:params:oauth:grant-type:jwt-bearer";

    private static final long SLOW_DOWN_INCREMENT_SECONDS = 5;

    private final HttpTransport transport;
    private final JsonFactory jsonFactory;
    private final Sleeper sleeper;

    /**
     * Creates a new OAuth2Client using the JDK HTTP transport and Jackson.
     */
    public OAuth2Client() {
        this(new NetHttpTransport(), JacksonFactory.getDefaultInstance(), Sleeper.DEFAULT);
    }

    /**
     * Creates a new OAuth2Client with injected collaborators (for testing).
     *
     * @param transport   the HTTP transport
     * @param jsonFactory the JSON factory used to parse responses
     * @param sleeper     used between device code polls
     */
    public OAuth2Client(HttpTransport transport, JsonFactory jsonFactory, Sleeper sleeper) {
        this.transport = Preconditions.requireNonNull(transport, "HTTP transport");
        this.jsonFactory = Preconditions.requireNonNull(jsonFactory, "JSON factory");
        this.sleeper = Preconditions.requireNonNull(sleeper, "Sleeper");
    }

    public JsonFactory getJsonFactory() {
        return jsonFactory;
    }

    /**
     * Builds the consent URL the resource owner must visit.
     *
     * @param credential  the client credential
     * @param redirectUri the redirect URI, or {@link #OUT_OF_BAND_REDIRECT_URI}
     * @param scopes      the requested scopes
     * @param state       the anti-CSRF state value
     * @param pkce        the PKCE pair for this attempt
     * @return the authorization URL
     */
    public String buildAuthorizationUrl(ClientCredential credential, String redirectUri,
                                        List<String> scopes, String state, Pkce pkce) {
        return new AuthorizationCodeRequestUrl(credential.getAuthUri(), credential.getClientId())
                .setRedirectUri(redirectUri)
                .setScopes(scopes)
                .setState(state)
                .set("access_type", "offline")
                .set("code_challenge", pkce.getChallenge())
                .set("code_challenge_method", Pkce.METHOD)
                .build();
    }

    /**
     * Exchanges an authorization code for a token.
     *
     * @param credential   the client credential
     * @param code         the authorization code
     * @param redirectUri  the redirect URI used in the authorization URL
     * @param codeVerifier the PKCE verifier of this attempt
     * @return the token response
     * @throws OAuth2Exception if the exchange fails
     */
    public TokenResponse exchangeCode(ClientCredential credential, String code, String redirectUri,
                                      String codeVerifier) throws OAuth2Exception {
        logger.debug("Exchanging authorization code at {}", credential.getTokenUri());
        AuthorizationCodeTokenRequest request = new AuthorizationCodeTokenRequest(
                transport, jsonFactory, new GenericUrl(credential.getTokenUri()), code)
                .setRedirectUri(redirectUri)
                .setClientAuthentication(clientAuthentication(credential))
                .set("code_verifier", codeVerifier);
        return execute("Authorization code exchange failed", request);
    }

    /**
     * Exchanges a refresh token for a new token.
     *
     * @param credential   the client credential
     * @param refreshToken the refresh token
     * @param scopes       the requested scopes
     * @return the token response, which may omit the refresh token
     * @throws OAuth2Exception if the exchange fails
     */
    public TokenResponse refresh(ClientCredential credential, String refreshToken, List<String> scopes)
            throws OAuth2Exception {
        logger.debug("Refreshing token at {}", credential.getTokenUri());
        RefreshTokenRequest request = new RefreshTokenRequest(
                transport, jsonFactory, new GenericUrl(credential.getTokenUri()), refreshToken)
                .setScopes(scopes)
                .setClientAuthentication(clientAuthentication(credential));
        return execute("Refresh token exchange failed", request);
    }

    /**
     * Starts a device authorization grant.
     *
     * @param deviceAuthorizationUrl the device authorization endpoint
     * @param credential             the client credential
     * @param scopes                 the requested scopes
     * @return the device code, user code and verification URL
     * @throws OAuth2Exception if the request fails
     */
    public DeviceAuthorizationResponse requestDeviceCode(String deviceAuthorizationUrl,
                                                         ClientCredential credential,
                                                         List<String> scopes) throws OAuth2Exception {
        logger.debug("Requesting device code at {}", deviceAuthorizationUrl);
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("client_id", credential.getClientId());
        form.put("scope", String.join(" ", scopes));

        try {
            HttpRequest request = transport.createRequestFactory()
                    .buildPostRequest(new GenericUrl(deviceAuthorizationUrl), new UrlEncodedContent(form));
            request.setParser(new JsonObjectParser(jsonFactory));
            request.setThrowExceptionOnExecuteError(false);

            HttpResponse response = request.execute();
            try {
                if (!response.isSuccessStatusCode()) {
                    throw OAuth2Exception.fromTokenResponseException("Device code request failed",
                            TokenResponseException.from(jsonFactory, response));
                }
                DeviceAuthorizationResponse device = response.parseAs(DeviceAuthorizationResponse.class);
                if (device.getDeviceCode() == null || device.getUserCode() == null
                        || device.getVerificationUri() == null) {
                    throw new OAuth2Exception(ErrorKind.DESERIALIZE,
                            "Device code response is missing device_code, user_code or verification_uri");
                }
                return device;
            } finally {
                response.disconnect();
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new OAuth2Exception(ErrorKind.NETWORK,
                    "Device code request failed: " + e.getMessage(), e);
        }
    }

    /**
     * Polls the token endpoint until the user approves the device, the provider refuses,
     * or the device code expires.
     *
     * @param credential the client credential
     * @param device     the device authorization response
     * @return the token response
     * @throws OAuth2Exception {@link ErrorKind#SERVER_ERROR} if the provider refuses,
     *                         {@link ErrorKind#CONSENT_TIMEOUT} once the device code expires,
     *                         {@link ErrorKind#CANCELLED} if the thread is interrupted
     */
    public TokenResponse pollDeviceToken(ClientCredential credential, DeviceAuthorizationResponse device)
            throws OAuth2Exception {
        long interval = device.getIntervalSeconds() != null && device.getIntervalSeconds() > 0
                ? device.getIntervalSeconds()
                : DeviceAuthorizationResponse.DEFAULT_INTERVAL_SECONDS;
        Long expiresIn = device.getExpiresInSeconds();
        long waited = 0;

        while (true) {
            if (expiresIn != null && waited >= expiresIn) {
                throw new OAuth2Exception(ErrorKind.CONSENT_TIMEOUT,
                        "Device code expired after " + expiresIn + "s without authorization");
            }
            sleep(interval);
            waited += interval;

            TokenRequest request = new TokenRequest(transport, jsonFactory,
                    new GenericUrl(credential.getTokenUri()), DEVICE_CODE_GRANT_TYPE)
                    .setClientAuthentication(clientAuthentication(credential))
                    .set("device_code", device.getDeviceCode());
            try {
                return request.execute();
            } catch (TokenResponseException e) {
                TokenErrorResponse details = e.getDetails();
                String error = details == null ? null : details.getError();
                if ("authorization_pending".equals(error)) {
                    logger.debug("Authorization pending, polling again in {}s", interval);
                } else if ("slow_down".equals(error)) {
                    interval += SLOW_DOWN_INCREMENT_SECONDS;
                    logger.debug("Provider asked to slow down, polling interval now {}s", interval);
                } else {
                    throw OAuth2Exception.fromTokenResponseException("Device token request failed", e);
                }
            } catch (IOException | IllegalArgumentException e) {
                throw networkError("Device token request failed", e);
            }
        }
    }

    /**
     * Exchanges a signed JWT assertion for a token.
     *
     * @param tokenUri  the token endpoint
     * @param assertion the signed assertion
     * @return the token response
     * @throws OAuth2Exception if the exchange fails
     */
    public TokenResponse exchangeJwtAssertion(String tokenUri, String assertion) throws OAuth2Exception {
        logger.debug("Exchanging JWT assertion at {}", tokenUri);
        TokenRequest request = new TokenRequest(transport, jsonFactory, new GenericUrl(tokenUri),
                JWT_BEARER_GRANT_TYPE)
                .set("assertion", assertion);
        return execute("JWT assertion exchange failed", request);
    }

    private void sleep(long seconds) throws OAuth2Exception {
        try {
            sleeper.sleep(seconds * 1000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OAuth2Exception(ErrorKind.CANCELLED, "Interrupted while polling for device token", e);
        }
    }

    private static ClientParametersAuthentication clientAuthentication(ClientCredential credential) {
        return new ClientParametersAuthentication(credential.getClientId(), credential.getClientSecret());
    }

    private static TokenResponse execute(String step, TokenRequest request) throws OAuth2Exception {
        try {
            return request.execute();
        } catch (TokenResponseException e) {
            throw OAuth2Exception.fromTokenResponseException(step, e);
        } catch (IOException | IllegalArgumentException e) {
            throw networkError(step, e);
        }
    }

    private static OAuth2Exception networkError(String step, Exception e) {
        return new OAuth2Exception(ErrorKind.NETWORK, step + ": " + e.getMessage(), e);
    }
}
