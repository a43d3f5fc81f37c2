package com.emailweather.oauth2;

/**
 * Supported OAuth2 authentication flows.
 *
 * @see AuthenticationFlow
 */
public enum FlowKind {

    /**
     * Three-legged authorization code flow with PKCE.
     *
     * <p>Requires human consent in a browser, either by pasting the code back
     * (out-of-band) or via an HTTP redirect. Obtains a refresh token.
     */
    INSTALLED("installed"),

    /**
     * Device authorization flow for headless environments.
     *
     * <p>The operator completes consent on a separate device using a short user code.
     */
    DEVICE("device"),

    /**
     * Service account flow using a self-signed RS256 JWT assertion.
     *
     * <p>No human consent and no refresh token; a new assertion is signed on expiry.
     */
    SERVICE_ACCOUNT("service-account");

    private final String value;

    FlowKind(String value) {
        this.value = value;
    }

    /**
     * Returns the string value used in configuration.
     *
     * @return the configuration value (e.g., "installed", "device")
     */
    public String getValue() {
        return value;
    }

    /**
     * Parses a configuration string to a FlowKind.
     *
     * @param value the configuration value (case-insensitive)
     * @return the corresponding FlowKind
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static FlowKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Flow cannot be null or blank");
        }
        for (FlowKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException(
                "Invalid flow: '" + value + "'. Supported values: installed, device, service-account");
    }

    @Override
    public String toString() {
        return value;
    }
}
