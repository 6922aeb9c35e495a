package offramp.core.config;

import java.util.List;
import java.util.Map;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import offramp.core.model.ratelimit.StoreFailureMode;

/**
 * Configuration mapping for rate limiting.
 *
 * <p>Configuration prefix: {@code offramp.rate-limit}
 *
 * <p>Each entry under {@code subjects} defines the policy of one protected
 * operation. Example:
 * <pre>
 * offramp.rate-limit.subjects.otp.email.count=5
 * offramp.rate-limit.subjects.otp.ip.capacity=20
 * offramp.rate-limit.subjects.otp.progressive-delay.delays-seconds=0,0,30,120,900
 * offramp.rate-limit.subjects.otp.global.count=1000
 * </pre>
 */
@ConfigMapping(prefix = "offramp.rate-limit")
public interface RateLimitConfig {

    /**
     * Master switch. When disabled every check allows without touching the store.
     *
     * @return true if rate limiting is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Policies keyed by subject name.
     */
    Map<String, SubjectConfig> subjects();

    /**
     * Policy of one subject.
     */
    interface SubjectConfig {

        EmailConfig email();

        IpConfig ip();

        ProgressiveDelayConfig progressiveDelay();

        GlobalConfig global();

        /**
         * Treatment of requests when the store is unavailable.
         *
         * @return OPEN to forward unchecked, CLOSED to reject (default: OPEN)
         */
        @WithDefault("OPEN")
        StoreFailureMode storeFailureMode();
    }

    /**
     * Sliding window per email.
     */
    interface EmailConfig {

        /**
         * @return requests per window (default: 5)
         */
        @WithDefault("5")
        long count();

        /**
         * @return window length in seconds (default: 3600)
         */
        @WithDefault("3600")
        long windowSeconds();

        /**
         * @return expiry of the window key in seconds (default: 7200)
         */
        @WithDefault("7200")
        long keyTtlSeconds();
    }

    /**
     * Token bucket per client IP.
     */
    interface IpConfig {

        /**
         * @return bucket capacity (default: 20)
         */
        @WithDefault("20")
        long capacity();

        /**
         * @return tokens added per hour (default: 10)
         */
        @WithDefault("10")
        double refillPerHour();

        /**
         * @return expiry of the bucket key in seconds (default: 7200)
         */
        @WithDefault("7200")
        long keyTtlSeconds();
    }

    /**
     * Escalating delay between attempts per email.
     */
    interface ProgressiveDelayConfig {

        /**
         * Required delays in seconds; the element at index {@code i} applies to attempt {@code i + 1}.
         *
         * @return delays (default: 0,0,30,120,900)
         */
        @WithDefault("0,0,30,120,900")
        List<Long> delaysSeconds();

        /**
         * @return delay for attempts beyond the list (default: 900)
         */
        @WithDefault("900")
        long defaultDelaySeconds();

        /**
         * @return expiry of the attempt counter in seconds (default: 3600)
         */
        @WithDefault("3600")
        long attemptsKeyTtlSeconds();

        /**
         * @return expiry of the last-attempt timestamp in seconds (default: 3600)
         */
        @WithDefault("3600")
        long lastAttemptKeyTtlSeconds();
    }

    /**
     * Fixed window across all callers of the subject.
     */
    interface GlobalConfig {

        /**
         * @return requests per window (default: 1000)
         */
        @WithDefault("1000")
        long count();

        /**
         * @return window length in seconds (default: 60)
         */
        @WithDefault("60")
        long windowSeconds();
    }
}
