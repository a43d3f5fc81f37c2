package com.emailweather.oauth2;

import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.webtoken.JsonWebSignature;
import com.google.api.client.json.webtoken.JsonWebToken;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.time.Instant;

/**
 * Builds the RS256-signed JWT used for the service account JWT bearer grant.
 *
 * <p>Claims: {@code iss} = service account email, {@code scope}, {@code aud} = token URI,
 * {@code iat} = now, {@code exp} = now + 30 minutes.
 */
public final class JwtAssertion {

    static final Duration LIFETIME = Duration.ofMinutes(30);

    private JwtAssertion() {
        // Utility class
    }

    /**
     * Signs an assertion for the given key and scope.
     *
     * @param key         the service account key
     * @param scope       the single requested scope
     * @param now         the issue time
     * @param jsonFactory the JSON factory
     * @return the compact serialized JWT
     * @throws OAuth2Exception with {@link ErrorKind#CONFIGURATION} if the key cannot be used
     */
    public static String sign(ServiceAccountKey key, String scope, Instant now, JsonFactory jsonFactory)
            throws OAuth2Exception {
        JsonWebSignature.Header header = new JsonWebSignature.Header()
                .setAlgorithm("RS256")
                .setType("JWT");
        if (key.getPrivateKeyId() != null) {
            header.setKeyId(key.getPrivateKeyId());
        }

        long issuedAt = now.getEpochSecond();
        JsonWebToken.Payload payload = new JsonWebToken.Payload()
                .setIssuer(key.getClientEmail())
                .setAudience(key.getTokenUri())
                .setIssuedAtTimeSeconds(issuedAt)
                .setExpirationTimeSeconds(issuedAt + LIFETIME.getSeconds());
        payload.set("scope", scope);

        try {
            return JsonWebSignature.signUsingRsaSha256(key.getPrivateKey(), jsonFactory, header, payload);
        } catch (GeneralSecurityException | IOException e) {
            throw new OAuth2Exception(ErrorKind.CONFIGURATION,
                    "Error signing JWT assertion: " + e.getMessage(), e);
        }
    }
}
