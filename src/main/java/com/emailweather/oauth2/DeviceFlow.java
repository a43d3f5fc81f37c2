package com.emailweather.oauth2;

import com.google.api.client.auth.oauth2.TokenResponse;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OAuth2 device authorization grant (RFC 8628) for hosts without a browser.
 *
 * <p>The user is shown a short code and a URL to visit on another device while the flow
 * polls the token endpoint.
 */
public class DeviceFlow implements AuthenticationFlow {

    private static final Logger logger = LoggerFactory.getLogger(DeviceFlow.class);

    /** Google's device authorization endpoint. */
    public static final String DEFAULT_DEVICE_AUTHORIZATION_URL = "https://oauth2.googleapis.com/device/code";

    private final ClientCredential credential;
    private final String deviceAuthorizationUrl;
    private final TokenCache tokenCache;
    private final OAuth2Client client;

    public DeviceFlow(ClientCredential credential, String deviceAuthorizationUrl, TokenCache tokenCache,
                      OAuth2Client client) {
        this.credential = Preconditions.requireNonNull(credential, "Client credential");
        this.deviceAuthorizationUrl = Preconditions.requireNonBlank(deviceAuthorizationUrl,
                "Device authorization URL");
        this.tokenCache = Preconditions.requireNonNull(tokenCache, "Token cache");
        this.client = Preconditions.requireNonNull(client, "OAuth2 client");
    }

    @Override
    public FlowKind getFlowKind() {
        return FlowKind.DEVICE;
    }

    public String getDeviceAuthorizationUrl() {
        return deviceAuthorizationUrl;
    }

    @Override
    public AccessToken authenticate(List<String> scopes) throws OAuth2Exception {
        Preconditions.requireNonEmpty(scopes, "Scopes");
        try (TokenCache.Guard guard = tokenCache.lock()) {
            AccessToken token = TokenCacheAuthenticator.authenticate(scopes, guard,
                    this::obtainNewToken, this::refreshToken);
            logger.debug("Authenticated with device flow: {}", token);
            return token;
        }
    }

    TokenResponse obtainNewToken(List<String> scopes) throws OAuth2Exception {
        DeviceAuthorizationResponse device = client.requestDeviceCode(deviceAuthorizationUrl, credential,
                scopes);
        logger.info("To authorize access, visit {} and enter the code {}",
                device.getVerificationUri(), device.getUserCode());
        if (device.getVerificationUriComplete() != null) {
            logger.info("Or open {}", device.getVerificationUriComplete());
        }

        TokenResponse response = client.pollDeviceToken(credential, device);
        logger.info("Obtained new token with device flow");
        return response;
    }

    TokenResponse refreshToken(String refreshToken, List<String> scopes) throws OAuth2Exception {
        return client.refresh(credential, refreshToken, scopes);
    }
}
