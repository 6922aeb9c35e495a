package offramp.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the shared key-value store.
 *
 * <p>Configuration prefix: {@code offramp.store}
 */
@ConfigMapping(prefix = "offramp.store")
public interface StoreConfig {

    /**
     * Redis backend settings.
     */
    RedisConfig redis();

    interface RedisConfig {

        /**
         * Use Redis. When disabled, or when no Redis client is available, an
         * in-memory store is used, which is only correct for a single instance.
         *
         * @return true to use Redis (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Maximum time to wait for a Redis operation. Exceeding it fails the
         * operation as an unavailable store.
         *
         * @return operation timeout (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration operationTimeout();
    }
}
