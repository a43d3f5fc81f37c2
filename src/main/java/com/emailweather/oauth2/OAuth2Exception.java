package com.emailweather.oauth2;

import com.google.api.client.auth.oauth2.TokenErrorResponse;
import com.google.api.client.auth.oauth2.TokenResponseException;
import java.io.IOException;

/**
 * Exception thrown when obtaining, refreshing or caching an OAuth2 token fails.
 *
 * <p>This exception captures the {@link ErrorKind}, the HTTP status code and, when the
 * provider answered with a structured error, the pretty-printed error body. Status code 0
 * indicates that no HTTP response was received (connection failure, local error).
 */
public class OAuth2Exception extends Exception {

    private final ErrorKind kind;
    private final int httpStatusCode;
    private final String serverResponse;

    /**
     * Creates a new OAuth2Exception without an HTTP response.
     *
     * @param kind    the failure classification
     * @param message the error message
     */
    public OAuth2Exception(ErrorKind kind, String message) {
        this(kind, message, 0, null, null);
    }

    /**
     * Creates a new OAuth2Exception with a cause and without an HTTP response.
     *
     * @param kind    the failure classification
     * @param message the error message
     * @param cause   the underlying cause
     */
    public OAuth2Exception(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, 0, null, cause);
    }

    /**
     * Creates a new OAuth2Exception.
     *
     * @param kind           the failure classification
     * @param message        the error message
     * @param httpStatusCode the HTTP status code (0 when no response was received)
     * @param serverResponse the pretty-printed provider error body, or null
     * @param cause          the underlying cause, or null
     */
    public OAuth2Exception(ErrorKind kind, String message, int httpStatusCode,
                           String serverResponse, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.httpStatusCode = httpStatusCode;
        this.serverResponse = serverResponse;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Gets the HTTP status code of the provider response.
     *
     * @return the status code, or 0 if the request failed before receiving a response
     */
    public int getHttpStatusCode() {
        return httpStatusCode;
    }

    /**
     * Gets the provider's structured error body, pretty-printed.
     *
     * @return the error body, or null if the provider did not return one
     */
    public String getServerResponse() {
        return serverResponse;
    }

    /**
     * Indicates whether retrying the whole {@code authenticate()} call may succeed.
     *
     * <p>Nothing in this library retries by itself; this is a hint for the outer caller.
     *
     * @return true for transport failures, 5xx responses and consent timeouts
     */
    public boolean isRetryable() {
        switch (kind) {
            case NETWORK:
            case CONSENT_TIMEOUT:
                return true;
            case SERVER_ERROR:
                return httpStatusCode >= 500;
            default:
                return false;
        }
    }

    /**
     * Wraps this exception with the name of the step that failed.
     *
     * <p>The kind, status code and server response are carried over unchanged.
     *
     * @param step description of the failed step, e.g. "Error while refreshing token"
     * @return a new exception whose cause is this exception
     */
    public OAuth2Exception withContext(String step) {
        return new OAuth2Exception(kind, step + ": " + getMessage(), httpStatusCode,
                serverResponse, this);
    }

    /**
     * Creates an OAuth2Exception from a failed token endpoint call.
     *
     * <p>When the provider returned a parseable OAuth2 error body the result is a
     * {@link ErrorKind#SERVER_ERROR} containing the whole body. Otherwise only the raw
     * status code is reported as {@link ErrorKind#NETWORK}.
     *
     * @param step description of the exchange that failed
     * @param e    the exception thrown by the OAuth client library
     * @return a new OAuth2Exception
     */
    public static OAuth2Exception fromTokenResponseException(String step, TokenResponseException e) {
        int statusCode = e.getStatusCode();
        TokenErrorResponse details = e.getDetails();
        if (details == null) {
            return new OAuth2Exception(ErrorKind.NETWORK,
                    step + ": provider returned status " + statusCode, statusCode, null, e);
        }

        String body = prettyPrint(details);
        return new OAuth2Exception(ErrorKind.SERVER_ERROR,
                step + ": server returned error response:\n" + body, statusCode, body, e);
    }

    private static String prettyPrint(TokenErrorResponse details) {
        if (details.getFactory() == null) {
            return details.toString();
        }
        try {
            return details.toPrettyString();
        } catch (IOException e) {
            return "Unable to display response, error while serializing response to json ("
                    + e.getMessage() + ")";
        }
    }

    @Override
    public String toString() {
        return "OAuth2Exception{" +
                "kind=" + kind +
                ", message='" + getMessage() + '\'' +
                ", httpStatusCode=" + httpStatusCode +
                '}';
    }
}
