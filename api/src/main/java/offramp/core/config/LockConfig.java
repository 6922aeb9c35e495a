package offramp.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for distributed locks.
 *
 * <p>Configuration prefix: {@code offramp.lock}
 */
@ConfigMapping(prefix = "offramp.lock")
public interface LockConfig {

    /**
     * Expiry of a held lock. A holder that crashes releases the lock when it elapses.
     *
     * <p>Must exceed the longest critical section, otherwise a second holder
     * may enter while the first is still running.
     *
     * @return lock TTL (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration ttl();
}
