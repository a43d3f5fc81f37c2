package com.emailweather.oauth2;

import com.google.api.client.json.GenericJson;
import com.google.api.client.json.JsonFactory;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * OAuth2 client credential ("client secret") as downloaded from the provider console.
 *
 * <p>The file is an envelope keyed by application type:
 * <pre>{@code
 * {
 *   "installed": {
 *     "client_id": "...",
 *     "client_secret": "...",
 *     "auth_uri": "https://accounts.google.com/o/oauth2/auth",
 *     "token_uri": "https://oauth2.googleapis.com/token",
 *     "redirect_uris": ["http://localhost"]
 *   }
 * }
 * }</pre>
 * A {@code "web"} envelope has the same fields. Instances are immutable.
 */
public final class ClientCredential {

    private static final String[] ENVELOPES = {"installed", "web"};

    private final String clientId;
    private final String clientSecret;
    private final String authUri;
    private final String tokenUri;
    private final List<String> redirectUris;
    private final String projectId;

    public ClientCredential(String clientId, String clientSecret, String authUri,
                            String tokenUri, List<String> redirectUris) {
        this(clientId, clientSecret, authUri, tokenUri, redirectUris, null);
    }

    public ClientCredential(String clientId, String clientSecret, String authUri,
                            String tokenUri, List<String> redirectUris, String projectId) {
        this.clientId = Preconditions.requireNonBlank(clientId, "Client ID");
        this.clientSecret = Preconditions.requireNonBlank(clientSecret, "Client secret");
        this.authUri = Preconditions.requireNonBlank(authUri, "Auth URI");
        this.tokenUri = Preconditions.requireNonBlank(tokenUri, "Token URI");
        this.redirectUris = redirectUris == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(redirectUris));
        this.projectId = projectId;
    }

    /**
     * Parses a client credential file.
     *
     * @param json        the file contents
     * @param jsonFactory the JSON factory
     * @return the parsed credential
     * @throws OAuth2Exception with {@link ErrorKind#DESERIALIZE} if the JSON is malformed,
     *                         has no known envelope, or misses a required field
     */
    public static ClientCredential parse(String json, JsonFactory jsonFactory) throws OAuth2Exception {
        GenericJson root;
        try {
            root = jsonFactory.fromString(json, GenericJson.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new OAuth2Exception(ErrorKind.DESERIALIZE,
                    "Unable to parse client secret: " + e.getMessage(), e);
        }

        for (String envelope : ENVELOPES) {
            Object definition = root.get(envelope);
            if (definition instanceof Map) {
                return fromDefinition(envelope, (Map<?, ?>) definition);
            }
        }

        throw new OAuth2Exception(ErrorKind.DESERIALIZE,
                "Unable to parse client secret: expected an \"installed\" or \"web\" object");
    }

    private static ClientCredential fromDefinition(String envelope, Map<?, ?> definition)
            throws OAuth2Exception {
        List<String> redirectUris = new ArrayList<>();
        Object uris = definition.get("redirect_uris");
        if (uris instanceof List) {
            for (Object uri : (List<?>) uris) {
                redirectUris.add(String.valueOf(uri));
            }
        }

        try {
            return new ClientCredential(
                    stringField(definition, "client_id"),
                    stringField(definition, "client_secret"),
                    stringField(definition, "auth_uri"),
                    stringField(definition, "token_uri"),
                    redirectUris,
                    stringField(definition, "project_id"));
        } catch (IllegalArgumentException e) {
            throw new OAuth2Exception(ErrorKind.DESERIALIZE,
                    "Unable to parse \"" + envelope + "\" client secret: " + e.getMessage(), e);
        }
    }

    private static String stringField(Map<?, ?> definition, String name) {
        Object value = definition.get(name);
        return value instanceof String ? (String) value : null;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public String getAuthUri() {
        return authUri;
    }

    public String getTokenUri() {
        return tokenUri;
    }

    public List<String> getRedirectUris() {
        return redirectUris;
    }

    /** Name of the provider project, or null when the file does not declare one. */
    public String getProjectId() {
        return projectId;
    }

    @Override
    public String toString() {
        return "ClientCredential{" +
                "clientId='" + clientId + '\'' +
                ", authUri='" + authUri + '\'' +
                ", tokenUri='" + tokenUri + '\'' +
                ", redirectUris=" + redirectUris +
                '}';
    }
}
