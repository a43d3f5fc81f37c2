package com.emailweather.oauth2;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for AccessToken.
 */
class AccessTokenTest {

    @Test
    void constructor_withBlankValue_throwsException() {
        assertThatThrownBy(() -> new AccessToken("  "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Access token");
    }

    @Test
    void toString_withLongToken_showsOnlyPrefix() {
        AccessToken token = new AccessToken("ya29.a0AfH6SMBxyz1234567890");

        assertThat(token.toString())
                .isEqualTo("AccessToken{ya29***, length=27}")
                .doesNotContain("SMBxyz");
    }

    @Test
    void toString_withShortToken_hidesEverything() {
        AccessToken token = new AccessToken("abc");

        assertThat(token.toString()).isEqualTo("AccessToken{***, length=3}");
    }

    @Test
    void equals_comparesSecret() {
        assertThat(new AccessToken("abc")).isEqualTo(new AccessToken("abc"));
        assertThat(new AccessToken("abc")).isNotEqualTo(new AccessToken("abd"));
        assertThat(new AccessToken("abc").getSecret()).isEqualTo("abc");
    }
}
