package com.emailweather.oauth2;

import static org.assertj.core.api.Assertions.assertThat;

import com.google.api.client.auth.oauth2.TokenResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TokenCacheData expiry computations.
 */
class TokenCacheDataTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void create_withExpiresIn_computesAbsoluteExpiry() {
        TokenCacheData data = TokenCacheData.create(
                new TokenResponse().setAccessToken("abc").setExpiresInSeconds(3600L), clock);

        assertThat(data.getExpiresTime()).isEqualTo(NOW.plusSeconds(3600));
        assertThat(data.expiresInNow(clock)).isEqualTo(Duration.ofHours(1));
        assertThat(data.isExpired(clock)).isFalse();
    }

    @Test
    void create_withoutExpiresIn_neverExpires() {
        TokenCacheData data = TokenCacheData.create(new TokenResponse().setAccessToken("abc"), clock);

        assertThat(data.getExpiresTime()).isNull();
        assertThat(data.expiresInNow(clock)).isNull();
        assertThat(data.isExpired(Clock.offset(clock, Duration.ofDays(3650)))).isFalse();
    }

    @Test
    void expiresInNow_afterExpiry_isZero() {
        TokenCacheData data = TokenCacheData.create(
                new TokenResponse().setAccessToken("abc").setExpiresInSeconds(60L), clock);
        Clock later = Clock.offset(clock, Duration.ofMinutes(5));

        assertThat(data.expiresInNow(later)).isEqualTo(Duration.ZERO);
        assertThat(data.isExpired(later)).isTrue();
    }

    @Test
    void getRefreshToken_returnsCachedValue() {
        TokenCacheData data = TokenCacheData.create(
                new TokenResponse().setAccessToken("abc").setRefreshToken("refresh"), clock);

        assertThat(data.getAccessToken()).isEqualTo("abc");
        assertThat(data.getRefreshToken()).isEqualTo("refresh");
    }
}
