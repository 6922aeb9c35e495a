package offramp.core.config;

import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;

/**
 * Configuration mapping for trusted reverse proxies.
 *
 * <p>Configuration prefix: {@code offramp.trusted-proxy}
 *
 * <p>Forwarding headers ({@code Forwarded}, {@code X-Forwarded-For},
 * {@code X-Real-IP}) are only read when the direct connection comes from a
 * listed proxy. With no proxies listed the socket address is always the client IP.
 */
@ConfigMapping(prefix = "offramp.trusted-proxy")
public interface TrustedProxyConfig {

    /** @return trusted proxy IPs or CIDRs, e.g. {@code 10.0.0.0/8} */
    Optional<List<String>> proxies();
}
