package offramp.core.config;

import java.util.Map;
import java.util.Set;

import io.smallrye.config.ConfigMapping;

/**
 * Configuration mapping for admin API keys.
 *
 * <p>Configuration prefix: {@code offramp.admin}
 *
 * <p>Only the SHA-256 hex digest of each key is configured, never the key itself:
 * <pre>
 * offramp.admin.api-keys.operator.key-hash=3f0a...
 * offramp.admin.api-keys.operator.permissions=lockouts.read,lockouts.write
 * </pre>
 */
@ConfigMapping(prefix = "offramp.admin")
public interface ApiKeyConfig {

    /**
     * Admin keys by name. No entries means every admin endpoint refuses access.
     *
     * @return configured keys
     */
    Map<String, KeyEntry> apiKeys();

    /**
     * A single configured key.
     */
    interface KeyEntry {

        /** @return lowercase SHA-256 hex digest of the key */
        String keyHash();

        /** @return permission values, see {@code Permission} */
        Set<String> permissions();
    }
}
