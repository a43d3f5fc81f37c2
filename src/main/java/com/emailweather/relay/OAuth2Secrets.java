package com.emailweather.relay;

import com.emailweather.oauth2.ClientCredential;
import com.emailweather.oauth2.ErrorKind;
import com.emailweather.oauth2.OAuth2Exception;
import com.emailweather.oauth2.ServiceAccountKey;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OAuth2 secrets loaded from a secrets directory, overridable through the environment.
 *
 * <table>
 *   <caption>Environment variables</caption>
 *   <tr><th>Variable</th><th>Effect</th></tr>
 *   <tr><td>CLIENT_SECRET</td><td>Client credential JSON, instead of {@code client_secret.json}</td></tr>
 *   <tr><td>SERVICE_ACCOUNT_KEY</td><td>Service account key JSON, instead of
 *       {@code service_account_key.json}</td></tr>
 *   <tr><td>DELETE_TOKEN_CACHE</td><td>If set, delete an existing {@code token_cache.json}</td></tr>
 *   <tr><td>TOKEN_CACHE</td><td>Seeds {@code token_cache.json} when it does not exist</td></tr>
 *   <tr><td>OVERWRITE_TOKEN_CACHE</td><td>{@code true} lets TOKEN_CACHE replace an existing file</td></tr>
 * </table>
 */
public final class OAuth2Secrets {

    private static final Logger logger = LoggerFactory.getLogger(OAuth2Secrets.class);

    static final String ENV_CLIENT_SECRET = "CLIENT_SECRET";
    static final String ENV_SERVICE_ACCOUNT_KEY = "SERVICE_ACCOUNT_KEY";
    static final String ENV_TOKEN_CACHE = "TOKEN_CACHE";
    static final String ENV_OVERWRITE_TOKEN_CACHE = "OVERWRITE_TOKEN_CACHE";
    static final String ENV_DELETE_TOKEN_CACHE = "DELETE_TOKEN_CACHE";

    static final String CLIENT_SECRET_FILE = "client_secret.json";
    static final String SERVICE_ACCOUNT_KEY_FILE = "service_account_key.json";
    static final String TOKEN_CACHE_FILE = "token_cache.json";

    private final Path tokenCachePath;
    private final ClientCredential clientCredential;
    private final ServiceAccountKey serviceAccountKey;

    OAuth2Secrets(Path tokenCachePath, ClientCredential clientCredential, ServiceAccountKey serviceAccountKey) {
        this.tokenCachePath = tokenCachePath;
        this.clientCredential = clientCredential;
        this.serviceAccountKey = serviceAccountKey;
    }

    /**
     * Loads secrets from the directory using the process environment.
     */
    public static OAuth2Secrets initialize(Path secretsDir) throws OAuth2Exception {
        return initialize(secretsDir, System.getenv(), JacksonFactory.getDefaultInstance());
    }

    /**
     * Loads secrets from the directory.
     *
     * @param secretsDir  directory holding the secret files and the token cache
     * @param env         environment variables
     * @param jsonFactory the JSON factory
     * @return the loaded secrets
     * @throws OAuth2Exception {@link ErrorKind#CONFIGURATION} if the directory is invalid,
     *                         {@link ErrorKind#DESERIALIZE} if a secret cannot be parsed,
     *                         {@link ErrorKind#IO} if a file cannot be read or written
     */
    public static OAuth2Secrets initialize(Path secretsDir, Map<String, String> env, JsonFactory jsonFactory)
            throws OAuth2Exception {
        if (secretsDir == null || !Files.isDirectory(secretsDir)) {
            throw new OAuth2Exception(ErrorKind.CONFIGURATION,
                    "Secrets directory " + secretsDir + " is not a directory");
        }

        String clientSecretJson = readSecret(env, ENV_CLIENT_SECRET, secretsDir.resolve(CLIENT_SECRET_FILE));
        ClientCredential clientCredential = null;
        if (clientSecretJson != null) {
            try {
                clientCredential = ClientCredential.parse(clientSecretJson, jsonFactory);
            } catch (OAuth2Exception e) {
                throw e.withContext("Unable to load client secret");
            }
        }

        String keyJson = readSecret(env, ENV_SERVICE_ACCOUNT_KEY, secretsDir.resolve(SERVICE_ACCOUNT_KEY_FILE));
        ServiceAccountKey serviceAccountKey = null;
        if (keyJson != null) {
            try {
                serviceAccountKey = ServiceAccountKey.parse(keyJson, jsonFactory);
            } catch (OAuth2Exception e) {
                throw e.withContext("Unable to load service account key");
            }
        }

        Path tokenCachePath = initializeTokenCache(secretsDir.resolve(TOKEN_CACHE_FILE), env);
        return new OAuth2Secrets(tokenCachePath, clientCredential, serviceAccountKey);
    }

    private static String readSecret(Map<String, String> env, String envName, Path file) throws OAuth2Exception {
        String value = env.get(envName);
        if (value != null) {
            logger.debug("Reading {} from environment variable", envName);
            return value;
        }
        if (!Files.exists(file)) {
            logger.debug("Secret file {} not present", file);
            return null;
        }
        logger.debug("Reading secret from file {}", file);
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new OAuth2Exception(ErrorKind.IO, "Error reading secret file " + file + ": " + e.getMessage(), e);
        }
    }

    private static Path initializeTokenCache(Path path, Map<String, String> env) throws OAuth2Exception {
        try {
            if (env.containsKey(ENV_DELETE_TOKEN_CACHE) && Files.isRegularFile(path)) {
                logger.warn("Deleting existing token cache file {}", path);
                Files.delete(path);
            }

            String seed = env.get(ENV_TOKEN_CACHE);
            if (seed == null) {
                if (Files.exists(path)) {
                    logger.debug("Pre-existing token cache file {} will be used", path);
                } else {
                    logger.debug("Token cache {} will be created on first authentication", path);
                }
                return path;
            }

            if (!Files.exists(path)) {
                logger.info("Writing new token cache file {} from {}", path, ENV_TOKEN_CACHE);
                Files.writeString(path, seed, StandardCharsets.UTF_8);
            } else if ("true".equals(env.get(ENV_OVERWRITE_TOKEN_CACHE))) {
                logger.warn("Overwriting token cache file {} from {}", path, ENV_TOKEN_CACHE);
                Files.writeString(path, seed, StandardCharsets.UTF_8);
            } else {
                logger.debug("Token cache file {} already exists, will not overwrite", path);
            }
            return path;
        } catch (IOException e) {
            throw new OAuth2Exception(ErrorKind.IO,
                    "Error initializing token cache " + path + ": " + e.getMessage(), e);
        }
    }

    public Path getTokenCachePath() {
        return tokenCachePath;
    }

    /** The installed/device client credential, or null if none was provided. */
    public ClientCredential getClientCredential() {
        return clientCredential;
    }

    /** The service account key, or null if none was provided. */
    public ServiceAccountKey getServiceAccountKey() {
        return serviceAccountKey;
    }
}
