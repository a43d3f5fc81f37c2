package com.emailweather.oauth2;

import com.google.api.client.json.GenericJson;
import com.google.api.client.util.Key;

/**
 * Device authorization response (RFC 8628 section 3.2).
 *
 * <p>Google historically returns {@code verification_url} instead of
 * {@code verification_uri}; {@link #getVerificationUri()} accepts either. Fields not
 * declared here are kept as unknown keys.
 */
public class DeviceAuthorizationResponse extends GenericJson {

    /** Polling interval used when the provider does not send one. */
    public static final long DEFAULT_INTERVAL_SECONDS = 5;

    @Key("device_code")
    private String deviceCode;

    @Key("user_code")
    private String userCode;

    @Key("verification_uri")
    private String verificationUri;

    @Key("verification_url")
    private String verificationUrl;

    @Key("verification_uri_complete")
    private String verificationUriComplete;

    @Key("expires_in")
    private Long expiresInSeconds;

    @Key("interval")
    private Long intervalSeconds;

    public DeviceAuthorizationResponse() {
    }

    public String getDeviceCode() {
        return deviceCode;
    }

    public DeviceAuthorizationResponse setDeviceCode(String deviceCode) {
        this.deviceCode = deviceCode;
        return this;
    }

    public String getUserCode() {
        return userCode;
    }

    public DeviceAuthorizationResponse setUserCode(String userCode) {
        this.userCode = userCode;
        return this;
    }

    /**
     * The URL the user must visit, from {@code verification_uri} or, failing that,
     * {@code verification_url}.
     */
    public String getVerificationUri() {
        return verificationUri != null ? verificationUri : verificationUrl;
    }

    public DeviceAuthorizationResponse setVerificationUri(String verificationUri) {
        this.verificationUri = verificationUri;
        return this;
    }

    public String getVerificationUriComplete() {
        return verificationUriComplete;
    }

    public Long getExpiresInSeconds() {
        return expiresInSeconds;
    }

    public DeviceAuthorizationResponse setExpiresInSeconds(Long expiresInSeconds) {
        this.expiresInSeconds = expiresInSeconds;
        return this;
    }

    public Long getIntervalSeconds() {
        return intervalSeconds;
    }

    public DeviceAuthorizationResponse setIntervalSeconds(Long intervalSeconds) {
        this.intervalSeconds = intervalSeconds;
        return this;
    }

    @Override
    public DeviceAuthorizationResponse set(String fieldName, Object value) {
        return (DeviceAuthorizationResponse) super.set(fieldName, value);
    }

    @Override
    public DeviceAuthorizationResponse clone() {
        return (DeviceAuthorizationResponse) super.clone();
    }
}
