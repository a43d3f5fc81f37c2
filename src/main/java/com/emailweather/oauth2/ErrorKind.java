package com.emailweather.oauth2;

/**
 * Classification of {@link OAuth2Exception} failures.
 *
 * @see OAuth2Exception#getKind()
 */
public enum ErrorKind {

    /** Token cache or secret file could not be read or written. */
    IO,

    /** Malformed token cache, client credential or service account JSON. */
    DESERIALIZE,

    /** Token cache data could not be serialized. */
    SERIALIZE,

    /** Transport failure, or a non-2xx response without a structured error body. */
    NETWORK,

    /**
     * The provider returned a structured OAuth2 error response.
     *
     * <p>The pretty-printed body is available from {@link OAuth2Exception#getServerResponse()}.
     */
    SERVER_ERROR,

    /**
     * The {@code state} delivered by a consent redirect did not match the one generated
     * for the request. Possible interception attempt; never retried.
     */
    CSRF_MISMATCH,

    /** The redirect channel was closed before delivering a result. */
    CHANNEL_CLOSED,

    /** No consent redirect arrived within the configured timeout. */
    CONSENT_TIMEOUT,

    /** The calling thread was interrupted while waiting. */
    CANCELLED,

    /** Invalid or missing configuration, e.g. more than one scope for a service account. */
    CONFIGURATION
}
