package com.emailweather.oauth2;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consent without a redirect endpoint: the provider displays the code and the user pastes
 * it back.
 */
public class OutOfBandRedirect implements ConsentRedirect {

    private static final Logger logger = LoggerFactory.getLogger(OutOfBandRedirect.class);

    private final CodePrompt prompt;

    public OutOfBandRedirect() {
        this(CodePrompt.console());
    }

    public OutOfBandRedirect(CodePrompt prompt) {
        this.prompt = Preconditions.requireNonNull(prompt, "Code prompt");
    }

    @Override
    public String getRedirectUri() {
        return OAuth2Client.OUT_OF_BAND_REDIRECT_URI;
    }

    @Override
    public boolean deliversState() {
        return false;
    }

    @Override
    public RedirectParameters awaitConsent(String authorizationUrl) throws OAuth2Exception {
        logger.info("Open this URL in your browser to authorize access:\n{}", authorizationUrl);
        String code = prompt.readCode("Enter the authorization code: ");
        if (code == null || code.isBlank()) {
            throw new OAuth2Exception(ErrorKind.IO, "No authorization code entered");
        }
        return new RedirectParameters(code, null);
    }
}
