package offramp.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for account lockout after failed OTP verifications.
 *
 * <p>Configuration prefix: {@code offramp.auth.lockout}
 */
@ConfigMapping(prefix = "offramp.auth.lockout")
public interface AccountLockoutConfig {

    /**
     * Failed attempts that trigger a lockout.
     *
     * @return threshold (default: 3)
     */
    @WithDefault("3")
    int maxFailedAttempts();

    /**
     * How long an account stays locked, also the window in which failures are counted.
     *
     * @return lockout duration (default: 15 minutes)
     */
    @WithDefault("PT15M")
    Duration duration();
}
