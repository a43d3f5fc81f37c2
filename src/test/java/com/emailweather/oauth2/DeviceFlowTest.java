package com.emailweather.oauth2;

import static com.emailweather.oauth2.RecordingTransport.formParams;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for DeviceFlow.
 */
class DeviceFlowTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final List<String> SCOPES = List.of("https://mail.google.com/");
    private static final String DEVICE_URI = "https://oauth2.example.com/device/code";

    @TempDir
    Path tempDir;

    private final JsonFactory jsonFactory = JacksonFactory.getDefaultInstance();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final ClientCredential credential = new ClientCredential("client-id", "client-secret",
            "https://accounts.example.com/o/oauth2/auth", "https://oauth2.example.com/token",
            List.of("http://localhost"));

    private RecordingTransport transport;
    private DeviceFlow flow;

    @BeforeEach
    void setUp() {
        transport = new RecordingTransport();
        OAuth2Client client = new OAuth2Client(transport, jsonFactory, millis -> { });
        flow = new DeviceFlow(credential, DEVICE_URI, new TokenCache(tempDir.resolve("token_cache.json"),
                jsonFactory, clock), client);
    }

    @Test
    void authenticate_afterPendingPolls_cachesToken() throws Exception {
        transport.respondJson(200, "{\"device_code\":\"dev-1\",\"user_code\":\"ABCD-EFGH\","
                        + "\"verification_uri\":\"https://www.google.com/device\",\"expires_in\":1800,\"interval\":5}")
                .respondJson(428, "{\"error\":\"authorization_pending\"}")
                .respondJson(200, "{\"access_token\":\"device-token\",\"expires_in\":3600,\"refresh_token\":\"r\"}");

        AccessToken token = flow.authenticate(SCOPES);

        assertThat(token.getSecret()).isEqualTo("device-token");
        assertThat(transport.getRequests()).hasSize(3);
        assertThat(transport.getRequests().get(0).getUrl()).isEqualTo(DEVICE_URI);
        assertThat(formParams(transport.lastRequest())).containsEntry("device_code", "dev-1");

        AccessToken cached = flow.authenticate(SCOPES);
        assertThat(cached.getSecret()).isEqualTo("device-token");
        assertThat(transport.getRequests()).hasSize(3);
    }

    @Test
    void authenticate_whenExpiredTokenReported_throwsServerError() {
        transport.respondJson(200, "{\"device_code\":\"dev-1\",\"user_code\":\"ABCD-EFGH\","
                        + "\"verification_uri\":\"https://www.google.com/device\",\"expires_in\":1800}")
                .respondJson(400, "{\"error\":\"expired_token\"}");

        assertThatThrownBy(() -> flow.authenticate(SCOPES))
                .isInstanceOfSatisfying(OAuth2Exception.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.SERVER_ERROR);
                    assertThat(e.getMessage()).startsWith("Error while obtaining new token");
                    assertThat(e.getServerResponse()).contains("expired_token");
                });
    }

    @Test
    void authenticate_withIncompleteDeviceResponse_throwsDeserialize() {
        transport.respondJson(200, "{\"device_code\":\"dev-1\"}");

        assertThatThrownBy(() -> flow.authenticate(SCOPES))
                .isInstanceOfSatisfying(OAuth2Exception.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.DESERIALIZE));
    }

    @Test
    void getFlowKind_returnsDevice() {
        assertThat(flow.getFlowKind()).isEqualTo(FlowKind.DEVICE);
        assertThat(flow.getDeviceAuthorizationUrl()).isEqualTo(DEVICE_URI);
    }
}
