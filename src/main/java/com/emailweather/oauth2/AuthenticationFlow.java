package com.emailweather.oauth2;

import java.util.List;

/**
 * A strategy for obtaining OAuth2 access tokens.
 *
 * <p>Implementations own their credential configuration and exactly one {@link TokenCache}.
 * The outer application holds one long-lived flow and calls {@link #authenticate(List)}
 * whenever a mail session needs a bearer token; the flow decides, through
 * {@link TokenCacheAuthenticator}, whether the cached token can be reused, refreshed, or
 * must be obtained again.
 *
 * <h2>Token Lifecycle</h2>
 * <ol>
 *   <li>No cache file: obtain a new token (consent, device code or JWT assertion) and persist it</li>
 *   <li>Cached token not expired: return it, no network call</li>
 *   <li>Cached token expired: refresh it with the cached refresh token, or obtain a new one</li>
 * </ol>
 *
 * <p>Concurrent calls on the same flow serialize on the cache lock, so the second caller
 * observes the token written by the first rather than triggering a second exchange.
 *
 * <h2>Implementing New Flows</h2>
 * <ol>
 *   <li>Create a class implementing this interface that owns a {@link TokenCache}</li>
 *   <li>Acquire {@link TokenCache#lock()} in {@link #authenticate(List)}</li>
 *   <li>Pass "obtain new token" and "refresh token" callbacks to
 *       {@link TokenCacheAuthenticator#authenticate}</li>
 *   <li>Register the new {@link FlowKind} value</li>
 * </ol>
 *
 * @see InstalledFlow
 * @see DeviceFlow
 * @see ServiceAccountFlow
 */
public interface AuthenticationFlow {

    /**
     * Returns the kind of this flow.
     *
     * <p>Used for logging and configuration matching.
     *
     * @return the flow kind
     */
    FlowKind getFlowKind();

    /**
     * Returns a valid access token for the given scopes.
     *
     * <p>Performs at most one network exchange. May block while waiting for the cache lock
     * or for human consent; interrupting the calling thread aborts the wait with
     * {@link ErrorKind#CANCELLED}. The cache file is only written after a fully successful
     * exchange.
     *
     * @param scopes the OAuth2 scopes to request
     * @return the access token
     * @throws OAuth2Exception if the token cannot be read, refreshed or obtained
     */
    AccessToken authenticate(List<String> scopes) throws OAuth2Exception;
}
