package com.emailweather.oauth2;

/**
 * Query parameters delivered to the OAuth2 redirect endpoint after consent.
 *
 * <p>{@code state} is null when the code was pasted by the user (out-of-band consent).
 */
public final class RedirectParameters {

    private final String code;
    private final String state;

    public RedirectParameters(String code, String state) {
        this.code = Preconditions.requireNonBlank(code, "Authorization code");
        this.state = state;
    }

    public String getCode() {
        return code;
    }

    public String getState() {
        return state;
    }

    @Override
    public String toString() {
        // Both values are secrets
        return "RedirectParameters{codeLength=" + code.length()
                + ", state=" + (state == null ? "none" : "***") + '}';
    }
}
