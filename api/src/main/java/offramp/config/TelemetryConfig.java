package offramp.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for telemetry.
 *
 * <p>Configuration prefix: {@code offramp.telemetry}
 */
@ConfigMapping(prefix = "offramp.telemetry")
public interface TelemetryConfig {

    /**
     * Master switch for all telemetry.
     *
     * @return true if telemetry is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    MetricsConfig metrics();

    interface MetricsConfig {

        /**
         * @return true if Micrometer counters are recorded (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }
}
