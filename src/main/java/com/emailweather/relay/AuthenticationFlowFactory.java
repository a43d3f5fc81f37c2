package com.emailweather.relay;

import com.emailweather.oauth2.AuthenticationFlow;
import com.emailweather.oauth2.DeviceFlow;
import com.emailweather.oauth2.ErrorKind;
import com.emailweather.oauth2.FlowKind;
import com.emailweather.oauth2.HttpRedirect;
import com.emailweather.oauth2.InstalledFlow;
import com.emailweather.oauth2.OAuth2Client;
import com.emailweather.oauth2.OAuth2Exception;
import com.emailweather.oauth2.OutOfBandRedirect;
import com.emailweather.oauth2.RedirectChannel;
import com.emailweather.oauth2.ServiceAccountFlow;
import com.emailweather.oauth2.TokenCache;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the configured {@link AuthenticationFlow}.
 *
 * <p>Configuration is resolved in order: parameter, environment variable, then default
 * value.
 *
 * <table>
 *   <caption>Configuration</caption>
 *   <tr><th>Parameter</th><th>Environment</th><th>Default</th></tr>
 *   <tr><td>flow</td><td>OAUTH2_FLOW</td><td>installed</td></tr>
 *   <tr><td>redirect-url</td><td>OAUTH2_REDIRECT_URL</td><td>(out-of-band consent)</td></tr>
 *   <tr><td>consent-timeout-seconds</td><td></td><td>0 (wait indefinitely)</td></tr>
 *   <tr><td>device-authorization-url</td><td>OAUTH2_DEVICE_AUTHORIZATION_URL</td>
 *       <td>Google's device endpoint</td></tr>
 * </table>
 */
public class AuthenticationFlowFactory {

    private static final Logger logger = LoggerFactory.getLogger(AuthenticationFlowFactory.class);

    /** Scope for IMAP/SMTP access to Gmail. */
    public static final List<String> DEFAULT_SCOPES = List.of("https://mail.google.com/");

    static final String PARAM_FLOW = "flow";
    static final String PARAM_REDIRECT_URL = "redirect-url";
    static final String PARAM_CONSENT_TIMEOUT_SECONDS = "consent-timeout-seconds";
    static final String PARAM_DEVICE_AUTHORIZATION_URL = "device-authorization-url";

    static final String ENV_FLOW = "OAUTH2_FLOW";
    static final String ENV_REDIRECT_URL = "OAUTH2_REDIRECT_URL";
    static final String ENV_DEVICE_AUTHORIZATION_URL = "OAUTH2_DEVICE_AUTHORIZATION_URL";

    private final Map<String, String> env;
    private final OAuth2Client client;
    private final Clock clock;

    public AuthenticationFlowFactory() {
        this(System.getenv(), new OAuth2Client(), Clock.systemUTC());
    }

    public AuthenticationFlowFactory(Map<String, String> env, OAuth2Client client, Clock clock) {
        this.env = env;
        this.client = client;
        this.clock = clock;
    }

    /**
     * Creates the flow selected by the configuration.
     *
     * @param params          configuration parameters
     * @param secrets         the loaded secrets
     * @param redirectChannel channel fed by the {@link RedirectServer}; required when a
     *                        redirect URL is configured
     * @return the flow
     * @throws OAuth2Exception {@link ErrorKind#CONFIGURATION} if the configuration is invalid
     *                         or the secrets needed by the selected flow are missing
     */
    public AuthenticationFlow create(Map<String, String> params, OAuth2Secrets secrets,
                                     RedirectChannel redirectChannel) throws OAuth2Exception {
        FlowKind kind;
        try {
            kind = FlowKind.fromValue(getConfig(params, PARAM_FLOW, ENV_FLOW, FlowKind.INSTALLED.getValue()));
        } catch (IllegalArgumentException e) {
            throw new OAuth2Exception(ErrorKind.CONFIGURATION, e.getMessage(), e);
        }

        TokenCache tokenCache = new TokenCache(secrets.getTokenCachePath(), client.getJsonFactory(), clock);

        switch (kind) {
            case INSTALLED:
                return createInstalledFlow(params, secrets, redirectChannel, tokenCache);
            case DEVICE:
                requireClientCredential(secrets, kind);
                String deviceUrl = getConfig(params, PARAM_DEVICE_AUTHORIZATION_URL,
                        ENV_DEVICE_AUTHORIZATION_URL, DeviceFlow.DEFAULT_DEVICE_AUTHORIZATION_URL);
                logger.info("Using device OAuth2 flow with {}", deviceUrl);
                return new DeviceFlow(secrets.getClientCredential(), deviceUrl, tokenCache, client);
            case SERVICE_ACCOUNT:
                if (secrets.getServiceAccountKey() == null) {
                    throw new OAuth2Exception(ErrorKind.CONFIGURATION,
                            "Service account key has not been provided, and is required for the "
                                    + kind + " OAuth2 flow");
                }
                logger.info("Using service account OAuth2 flow for {}",
                        secrets.getServiceAccountKey().getClientEmail());
                return new ServiceAccountFlow(secrets.getServiceAccountKey(), tokenCache, client, clock);
            default:
                throw new OAuth2Exception(ErrorKind.CONFIGURATION, "Unsupported flow: " + kind);
        }
    }

    private AuthenticationFlow createInstalledFlow(Map<String, String> params, OAuth2Secrets secrets,
                                                   RedirectChannel redirectChannel, TokenCache tokenCache)
            throws OAuth2Exception {
        requireClientCredential(secrets, FlowKind.INSTALLED);

        String redirectUrl = getConfig(params, PARAM_REDIRECT_URL, ENV_REDIRECT_URL, null);
        if (redirectUrl == null) {
            logger.info("Using installed OAuth2 flow with out-of-band consent");
            return new InstalledFlow(secrets.getClientCredential(), new OutOfBandRedirect(), tokenCache, client);
        }

        if (redirectChannel == null) {
            throw new OAuth2Exception(ErrorKind.CONFIGURATION,
                    "A redirect channel is required when " + PARAM_REDIRECT_URL + " is configured");
        }
        Duration timeout = parseTimeout(getConfig(params, PARAM_CONSENT_TIMEOUT_SECONDS, null, "0"));
        logger.info("Using installed OAuth2 flow with redirect to {}", redirectUrl);
        return new InstalledFlow(secrets.getClientCredential(),
                new HttpRedirect(redirectUrl, redirectChannel, timeout), tokenCache, client);
    }

    private static void requireClientCredential(OAuth2Secrets secrets, FlowKind kind) throws OAuth2Exception {
        if (secrets.getClientCredential() == null) {
            throw new OAuth2Exception(ErrorKind.CONFIGURATION,
                    "Client secret has not been provided, and is required for the " + kind + " OAuth2 flow");
        }
    }

    private static Duration parseTimeout(String value) throws OAuth2Exception {
        long seconds;
        try {
            seconds = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new OAuth2Exception(ErrorKind.CONFIGURATION,
                    "Invalid " + PARAM_CONSENT_TIMEOUT_SECONDS + ": '" + value + "'", e);
        }
        if (seconds < 0) {
            throw new OAuth2Exception(ErrorKind.CONFIGURATION,
                    PARAM_CONSENT_TIMEOUT_SECONDS + " cannot be negative");
        }
        return seconds == 0 ? null : Duration.ofSeconds(seconds);
    }

    /**
     * Get configuration value with resolution order: param → env → default.
     */
    private String getConfig(Map<String, String> params, String paramName, String envName, String defaultValue) {
        String value = params.get(paramName);
        if (value != null && !value.isBlank()) {
            return value;
        }

        if (envName != null) {
            value = env.get(envName);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }

        return defaultValue;
    }
}
