package com.emailweather.oauth2;

import com.google.api.client.json.JsonFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.format.DateTimeParseException;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File-backed store of the most recent OAuth2 token.
 *
 * <p>One cache file exists per credential/scope-set combination and is exclusively owned
 * by one {@code TokenCache} instance, which in turn is owned by one
 * {@link AuthenticationFlow}. All file access goes through a {@link Guard} obtained from
 * {@link #lock()}, held for the duration of one {@code authenticate()} call, so concurrent
 * callers serialize and never observe or produce a half-written cache.
 *
 * <p>Writes go to a temporary sibling file that is then moved over the cache file, so a
 * crash mid-write leaves the previous cache intact.
 */
public class TokenCache {

    private static final Logger logger = LoggerFactory.getLogger(TokenCache.class);

    private static final Set<PosixFilePermission> OWNER_ONLY =
            PosixFilePermissions.fromString("rw-------");

    private final Path path;
    private final JsonFactory jsonFactory;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock(true);

    /**
     * Creates a new TokenCache.
     *
     * @param path        the cache file path (need not exist yet)
     * @param jsonFactory JSON factory used to (de)serialize the cache
     * @param clock       clock used for expiry computations
     */
    public TokenCache(Path path, JsonFactory jsonFactory, Clock clock) {
        this.path = Preconditions.requireNonNull(path, "Token cache path");
        this.jsonFactory = Preconditions.requireNonNull(jsonFactory, "JSON factory");
        this.clock = Preconditions.requireNonNull(clock, "Clock");
    }

    /**
     * Acquires exclusive access to the cache file.
     *
     * <p>Blocks until the lock is available. The wait can be abandoned by interrupting the
     * calling thread.
     *
     * @return the guard; close it to release the lock
     * @throws OAuth2Exception with {@link ErrorKind#CANCELLED} if interrupted while waiting
     */
    public Guard lock() throws OAuth2Exception {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OAuth2Exception(ErrorKind.CANCELLED,
                    "Interrupted while waiting for token cache " + path, e);
        }
        return new Guard();
    }

    public Path getPath() {
        return path;
    }

    public Clock getClock() {
        return clock;
    }

    @Override
    public String toString() {
        return "TokenCache{path=" + path + '}';
    }

    /**
     * Exclusive access to the cache file. Obtain it with {@link TokenCache#lock()}.
     *
     * <p>Not thread-safe: a guard belongs to the thread that acquired it.
     */
    public final class Guard implements AutoCloseable {

        private boolean released;

        private Guard() {
        }

        /**
         * Whether the cache file exists. Never fails.
         */
        public boolean exists() {
            checkHeld();
            return Files.exists(path);
        }

        /**
         * Reads the cache file.
         *
         * <p>The relative {@code expires_in} of the stored response is cleared, so only the
         * absolute {@code expires_time} governs expiry decisions.
         *
         * @return the cached data
         * @throws OAuth2Exception with {@link ErrorKind#IO} if the file cannot be read, or
         *                         {@link ErrorKind#DESERIALIZE} if its contents are invalid
         */
        public TokenCacheData read() throws OAuth2Exception {
            checkHeld();
            String content;
            try {
                content = Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new OAuth2Exception(ErrorKind.IO,
                        "Cannot read token cache " + path + ": " + e.getMessage(), e);
            }

            TokenCacheData data;
            try {
                data = jsonFactory.fromString(content, TokenCacheData.class);
                // Validates the stored instant eagerly
                data.getExpiresTime();
            } catch (IOException | IllegalArgumentException | DateTimeParseException e) {
                throw new OAuth2Exception(ErrorKind.DESERIALIZE,
                        "Invalid token cache " + path + ": " + e.getMessage(), e);
            }

            if (data.getResponse() == null || data.getAccessToken() == null) {
                throw new OAuth2Exception(ErrorKind.DESERIALIZE,
                        "Invalid token cache " + path + ": missing response access_token");
            }

            data.getResponse().setExpiresInSeconds(null);
            return data;
        }

        /**
         * Replaces the cache file with the given data, as pretty-printed JSON.
         *
         * @param data the data to persist
         * @throws OAuth2Exception with {@link ErrorKind#SERIALIZE} if the data cannot be
         *                         serialized, or {@link ErrorKind#IO} if the file cannot be written
         */
        public void write(TokenCacheData data) throws OAuth2Exception {
            checkHeld();
            boolean overwritten = Files.exists(path);

            String json;
            try {
                json = jsonFactory.toPrettyString(data);
            } catch (IOException | IllegalArgumentException e) {
                throw new OAuth2Exception(ErrorKind.SERIALIZE,
                        "Error serializing token cache: " + e.getMessage(), e);
            }

            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            try {
                createOwnerOnly(temp);
                Files.writeString(temp, json, StandardCharsets.UTF_8);
                moveIntoPlace(temp);
            } catch (IOException e) {
                deleteQuietly(temp);
                throw new OAuth2Exception(ErrorKind.IO,
                        "Error writing token cache to " + path + ": " + e.getMessage(), e);
            }

            if (overwritten) {
                logger.debug("Overwritten token cache {}", path);
            } else {
                logger.debug("Wrote new token cache {}", path);
            }
        }

        // The cache holds a refresh token; keep it unreadable to other users where possible.
        private void createOwnerOnly(Path temp) throws IOException {
            if (!temp.getFileSystem().supportedFileAttributeViews().contains("posix")) {
                return;
            }
            Files.deleteIfExists(temp);
            Files.createFile(temp, PosixFilePermissions.asFileAttribute(OWNER_ONLY));
        }

        private void moveIntoPlace(Path temp) throws IOException {
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        }

        private void deleteQuietly(Path temp) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                logger.debug("Could not delete temporary token cache {}: {}", temp, e.getMessage());
            }
        }

        public Path getPath() {
            return path;
        }

        /** Clock used for expiry decisions on this cache. */
        public Clock getClock() {
            return clock;
        }

        /**
         * Releases the cache lock. Idempotent.
         */
        @Override
        public void close() {
            if (!released) {
                released = true;
                lock.unlock();
            }
        }

        private void checkHeld() {
            if (released) {
                throw new IllegalStateException("Token cache guard already released: " + path);
            }
        }

        @Override
        public String toString() {
            return "TokenCache.Guard{path=" + path + '}';
        }
    }
}
