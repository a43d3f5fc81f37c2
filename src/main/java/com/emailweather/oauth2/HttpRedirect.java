package com.emailweather.oauth2;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consent through an HTTP redirect endpoint, which forwards the delivered parameters
 * through a {@link RedirectChannel}.
 */
public class HttpRedirect implements ConsentRedirect {

    private static final Logger logger = LoggerFactory.getLogger(HttpRedirect.class);

    private final String redirectUri;
    private final RedirectChannel channel;
    private final Duration timeout;

    /**
     * Creates a redirect that waits indefinitely.
     */
    public HttpRedirect(String redirectUri, RedirectChannel channel) {
        this(redirectUri, channel, null);
    }

    /**
     * @param redirectUri the public URL of the redirect endpoint
     * @param channel     the channel the endpoint sends to
     * @param timeout     maximum wait per consent attempt, or null for none
     */
    public HttpRedirect(String redirectUri, RedirectChannel channel, Duration timeout) {
        this.redirectUri = Preconditions.requireNonBlank(redirectUri, "Redirect URI");
        this.channel = Preconditions.requireNonNull(channel, "Redirect channel");
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("Consent timeout must be positive");
        }
        this.timeout = timeout;
    }

    @Override
    public String getRedirectUri() {
        return redirectUri;
    }

    @Override
    public boolean deliversState() {
        return true;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public void discardStale() {
        int discarded = channel.clear();
        if (discarded > 0) {
            logger.warn("Discarded {} stale consent redirect(s) received outside a consent attempt", discarded);
        }
    }

    @Override
    public RedirectParameters awaitConsent(String authorizationUrl) throws OAuth2Exception {
        logger.info("Open this URL in your browser to authorize access:\n{}", authorizationUrl);
        if (timeout != null) {
            logger.debug("Waiting up to {}s for redirect to {}", timeout.getSeconds(), redirectUri);
        }
        return channel.receive(timeout);
    }
}
