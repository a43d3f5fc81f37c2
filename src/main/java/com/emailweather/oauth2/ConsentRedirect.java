package com.emailweather.oauth2;

/**
 * How the authorization code gets back to the {@link InstalledFlow} after the resource
 * owner has consented.
 *
 * @see OutOfBandRedirect
 * @see HttpRedirect
 */
public interface ConsentRedirect {

    /**
     * @return the {@code redirect_uri} to put in the authorization URL and code exchange
     */
    String getRedirectUri();

    /**
     * Whether the delivered parameters carry the {@code state} value. When true the flow
     * rejects a delivery whose state does not match the one it generated.
     */
    boolean deliversState();

    /**
     * Drops deliveries that arrived outside a consent attempt. Called before every new
     * attempt so it only ever sees the redirect for its own authorization URL.
     */
    default void discardStale() {
    }

    /**
     * Presents the authorization URL and waits for the resulting code.
     *
     * @param authorizationUrl the consent URL
     * @return the delivered code (and state, where applicable)
     * @throws OAuth2Exception if no code could be obtained
     */
    RedirectParameters awaitConsent(String authorizationUrl) throws OAuth2Exception;
}
