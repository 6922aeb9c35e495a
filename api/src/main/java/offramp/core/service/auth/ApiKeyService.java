package offramp.core.service.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import offramp.core.config.ApiKeyConfig;
import offramp.core.model.auth.ApiKey;

/**
 * Validates admin API keys against the configured SHA-256 digests.
 *
 * <p>Digests are compared in constant time.
 */
@ApplicationScoped
public class ApiKeyService {

    private static final Logger LOG = Logger.getLogger(ApiKeyService.class);

    private final ApiKeyConfig config;

    @Inject
    public ApiKeyService(ApiKeyConfig config) {
        this.config = config;
        if (config.apiKeys().isEmpty()) {
            LOG.warn("No admin API keys configured; admin endpoints will refuse every request");
        }
    }

    /**
     * Validate a plaintext API key.
     *
     * @param plaintextKey the key presented by the caller
     * @return the matching key, or empty if no configured key matches
     */
    public Optional<ApiKey> validate(String plaintextKey) {
        if (plaintextKey == null || plaintextKey.isBlank()) {
            return Optional.empty();
        }
        final var presented = hashKey(plaintextKey).getBytes(StandardCharsets.US_ASCII);

        for (final var entry : config.apiKeys().entrySet()) {
            final var expected =
                    entry.getValue().keyHash().trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
            if (MessageDigest.isEqual(presented, expected)) {
                return Optional.of(new ApiKey(entry.getKey(), entry.getValue().permissions()));
            }
        }
        return Optional.empty();
    }

    /**
     * Hash a key the way it is configured.
     *
     * @param key the plaintext key
     * @return lowercase SHA-256 hex digest
     */
    public static String hashKey(String key) {
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 must be available per Java spec", e);
        }
    }
}
