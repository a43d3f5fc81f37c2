package com.emailweather.oauth2;

import com.google.api.client.auth.oauth2.TokenResponse;
import com.google.api.client.json.GenericJson;
import com.google.api.client.util.Data;
import com.google.api.client.util.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Contents of the token cache file: the provider's token response plus the absolute
 * instant at which the access token expires.
 *
 * <pre>{@code
 * {
 *   "response": { "access_token": "...", "refresh_token": "...", "token_type": "Bearer", ... },
 *   "expires_time": "2024-05-01T10:15:30.123Z"
 * }
 * }</pre>
 *
 * <p>{@code expires_time} is computed once, as {@code now + expires_in}, when the data is
 * created from a fresh response. After a reload only the absolute instant is trusted; the
 * relative {@code expires_in} is cleared by {@link TokenCache.Guard#read()}. A missing
 * expiry means the token never expires.
 *
 * <p>The data is replaced wholesale on every refresh or re-obtain, never merged.
 */
public class TokenCacheData extends GenericJson {

    @Key("response")
    private TokenResponse response;

    @Key("expires_time")
    private String expiresTime;

    /** Used by the JSON parser; use {@link #create(TokenResponse, Clock)} instead. */
    public TokenCacheData() {
    }

    /**
     * Wraps a fresh token response, computing the absolute expiry from {@code expires_in}.
     *
     * @param response the provider's token response
     * @param clock    the clock giving "now"
     * @return the cache data
     */
    public static TokenCacheData create(TokenResponse response, Clock clock) {
        Preconditions.requireNonNull(response, "Token response");
        TokenCacheData data = new TokenCacheData();
        data.response = response;

        Long expiresInSeconds = response.getExpiresInSeconds();
        data.expiresTime = expiresInSeconds == null
                ? Data.NULL_STRING
                : DateTimeFormatter.ISO_INSTANT.format(
                        clock.instant().plusSeconds(expiresInSeconds));
        return data;
    }

    public TokenResponse getResponse() {
        return response;
    }

    /**
     * Returns the absolute expiry of the access token.
     *
     * @return the expiry instant, or null if the token never expires
     * @throws java.time.format.DateTimeParseException if the stored value is not RFC 3339
     */
    public Instant getExpiresTime() {
        if (expiresTime == null || Data.isNull(expiresTime)) {
            return null;
        }
        return OffsetDateTime.parse(expiresTime, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    }

    /**
     * Remaining lifetime of the access token.
     *
     * @param clock the clock giving "now"
     * @return the remaining time, zero once expired (never negative), or null if the
     *         token never expires
     */
    public Duration expiresInNow(Clock clock) {
        Instant expires = getExpiresTime();
        if (expires == null) {
            return null;
        }
        Instant now = clock.instant();
        return now.isBefore(expires) ? Duration.between(now, expires) : Duration.ZERO;
    }

    /**
     * Whether the access token has expired. A token without expiry never expires.
     */
    public boolean isExpired(Clock clock) {
        Instant expires = getExpiresTime();
        return expires != null && expires.isBefore(clock.instant());
    }

    public String getAccessToken() {
        return response == null ? null : response.getAccessToken();
    }

    /** The cached refresh token, or null if the provider never issued one. */
    public String getRefreshToken() {
        return response == null ? null : response.getRefreshToken();
    }

    @Override
    public TokenCacheData set(String fieldName, Object value) {
        return (TokenCacheData) super.set(fieldName, value);
    }

    @Override
    public TokenCacheData clone() {
        return (TokenCacheData) super.clone();
    }
}
