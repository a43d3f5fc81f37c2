package com.emailweather.relay;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.emailweather.oauth2.ErrorKind;
import com.emailweather.oauth2.OAuth2Exception;
import com.emailweather.oauth2.RedirectChannel;
import com.emailweather.oauth2.RedirectParameters;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RedirectServer.
 */
class RedirectServerTest {

    private final HttpClient httpClient = HttpClient.newHttpClient();
    private RedirectChannel channel;
    private RedirectServer server;

    @BeforeEach
    void setUp() throws Exception {
        channel = new RedirectChannel();
        server = RedirectServer.start(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0),
                RedirectServer.DEFAULT_PATH, channel);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private HttpResponse<String> get(String query) throws Exception {
        URI uri = URI.create("http://127.0.0.1:" + server.getPort() + "/oauth2" + query);
        return httpClient.send(HttpRequest.newBuilder(uri).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void redirect_withCodeAndState_forwardsToChannel() throws Exception {
        HttpResponse<String> response = get("?code=4%2F0Adeu5B&state=abc&scope=https%3A%2F%2Fmail.google.com%2F");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("Authentication Successful");
        RedirectParameters parameters = channel.receive(Duration.ofSeconds(1));
        assertThat(parameters.getCode()).isEqualTo("4/0Adeu5B");
        assertThat(parameters.getState()).isEqualTo("abc");
    }

    @Test
    void redirect_withProviderError_answers400AndSendsNothing() throws Exception {
        HttpResponse<String> response = get("?error=access_denied&state=abc");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(response.body()).contains("access_denied");
        assertThatThrownBy(() -> channel.receive(Duration.ofMillis(20)))
                .isInstanceOfSatisfying(OAuth2Exception.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.CONSENT_TIMEOUT));
    }

    @Test
    void redirect_withoutState_answers400() throws Exception {
        assertThat(get("?code=abc").statusCode()).isEqualTo(400);
    }

    @Test
    void redirect_whilePreviousRedirectPending_answers503() throws Exception {
        assertThat(get("?code=one&state=s").statusCode()).isEqualTo(200);
        HttpResponse<String> rejected = get("?code=two&state=s");

        assertThat(rejected.statusCode()).isEqualTo(503);
        assertThat(rejected.body()).contains("already pending");

        assertThat(channel.receive(Duration.ofSeconds(1)).getCode()).isEqualTo("one");
    }

    @Test
    void stop_closesChannel() {
        server.stop();

        assertThatThrownBy(() -> channel.receive(Duration.ofSeconds(1)))
                .isInstanceOfSatisfying(OAuth2Exception.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.CHANNEL_CLOSED));
    }

    @Test
    void parseQuery_decodesValues() {
        assertThat(RedirectServer.parseQuery("a=1%2B1&b=x+y&flag"))
                .containsEntry("a", "1+1")
                .containsEntry("b", "x y")
                .containsEntry("flag", "");
        assertThat(RedirectServer.parseQuery(null)).isEmpty();
    }
}
