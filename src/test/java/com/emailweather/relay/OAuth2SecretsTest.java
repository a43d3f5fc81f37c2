package com.emailweather.relay;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.emailweather.oauth2.ErrorKind;
import com.emailweather.oauth2.OAuth2Exception;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for OAuth2Secrets initialization.
 */
class OAuth2SecretsTest {

    static final String CLIENT_SECRET = "{\"installed\":{\"client_id\":\"file-client\","
            + "\"client_secret\":\"s\",\"auth_uri\":\"https://accounts.google.com/o/oauth2/auth\","
            + "\"token_uri\":\"https://oauth2.googleapis.com/token\",\"redirect_uris\":[\"http://localhost\"]}}";

    @TempDir
    Path tempDir;

    private final JsonFactory jsonFactory = JacksonFactory.getDefaultInstance();

    @Test
    void initialize_withMissingDirectory_throwsConfiguration() {
        assertThatThrownBy(() -> OAuth2Secrets.initialize(tempDir.resolve("missing"), Map.of(), jsonFactory))
                .isInstanceOfSatisfying(OAuth2Exception.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.CONFIGURATION));
    }

    @Test
    void initialize_withEmptyDirectory_hasNoSecrets() throws Exception {
        OAuth2Secrets secrets = OAuth2Secrets.initialize(tempDir, Map.of(), jsonFactory);

        assertThat(secrets.getClientCredential()).isNull();
        assertThat(secrets.getServiceAccountKey()).isNull();
        assertThat(secrets.getTokenCachePath()).isEqualTo(tempDir.resolve("token_cache.json"));
        assertThat(secrets.getTokenCachePath()).doesNotExist();
    }

    @Test
    void initialize_readsClientSecretFile() throws Exception {
        Files.writeString(tempDir.resolve("client_secret.json"), CLIENT_SECRET);

        OAuth2Secrets secrets = OAuth2Secrets.initialize(tempDir, Map.of(), jsonFactory);

        assertThat(secrets.getClientCredential().getClientId()).isEqualTo("file-client");
    }

    @Test
    void initialize_prefersClientSecretFromEnvironment() throws Exception {
        Files.writeString(tempDir.resolve("client_secret.json"), CLIENT_SECRET);
        String envSecret = CLIENT_SECRET.replace("file-client", "env-client");

        OAuth2Secrets secrets = OAuth2Secrets.initialize(tempDir, Map.of("CLIENT_SECRET", envSecret), jsonFactory);

        assertThat(secrets.getClientCredential().getClientId()).isEqualTo("env-client");
    }

    @Test
    void initialize_withInvalidClientSecret_throwsDeserializeWithContext() {
        assertThatThrownBy(() -> OAuth2Secrets.initialize(tempDir, Map.of("CLIENT_SECRET", "{}"), jsonFactory))
                .isInstanceOfSatisfying(OAuth2Exception.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.DESERIALIZE);
                    assertThat(e.getMessage()).startsWith("Unable to load client secret");
                });
    }

    @Test
    void initialize_withInvalidServiceAccountKey_throwsDeserialize() {
        assertThatThrownBy(() -> OAuth2Secrets.initialize(tempDir,
                Map.of("SERVICE_ACCOUNT_KEY", "{\"type\":\"authorized_user\"}"), jsonFactory))
                .isInstanceOfSatisfying(OAuth2Exception.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.DESERIALIZE);
                    assertThat(e.getMessage()).startsWith("Unable to load service account key");
                });
    }

    @Test
    void initialize_withTokenCacheEnv_seedsMissingFile() throws Exception {
        OAuth2Secrets secrets = OAuth2Secrets.initialize(tempDir, Map.of("TOKEN_CACHE", "seeded"), jsonFactory);

        assertThat(Files.readString(secrets.getTokenCachePath())).isEqualTo("seeded");
    }

    @Test
    void initialize_withTokenCacheEnv_keepsExistingFile() throws Exception {
        Path cache = tempDir.resolve("token_cache.json");
        Files.writeString(cache, "existing");

        OAuth2Secrets.initialize(tempDir, Map.of("TOKEN_CACHE", "seeded"), jsonFactory);

        assertThat(Files.readString(cache)).isEqualTo("existing");
    }

    @Test
    void initialize_withOverwriteTokenCache_replacesExistingFile() throws Exception {
        Path cache = tempDir.resolve("token_cache.json");
        Files.writeString(cache, "existing");

        OAuth2Secrets.initialize(tempDir,
                Map.of("TOKEN_CACHE", "seeded", "OVERWRITE_TOKEN_CACHE", "true"), jsonFactory);

        assertThat(Files.readString(cache)).isEqualTo("seeded");
    }

    @Test
    void initialize_withDeleteTokenCache_removesExistingFile() throws Exception {
        Path cache = tempDir.resolve("token_cache.json");
        Files.writeString(cache, "existing");

        OAuth2Secrets.initialize(tempDir, Map.of("DELETE_TOKEN_CACHE", ""), jsonFactory);

        assertThat(cache).doesNotExist();
    }
}
