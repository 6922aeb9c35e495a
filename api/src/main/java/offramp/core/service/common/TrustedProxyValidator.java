package offramp.core.service.common;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import offramp.core.config.TrustedProxyConfig;

/**
 * Decides whether an address belongs to a trusted reverse proxy.
 *
 * <p>Proxy entries are exact IPs or CIDR ranges, parsed once at startup.
 * Invalid entries are logged and ignored. Hostnames are never resolved.
 */
@ApplicationScoped
public class TrustedProxyValidator {

    private static final Logger LOG = Logger.getLogger(TrustedProxyValidator.class);

    private final List<Network> networks;

    private record Network(byte[] address, int prefixLength) {

        boolean contains(byte[] candidate) {
            if (candidate.length != address.length) {
                return false;
            }
            final var fullBytes = prefixLength / 8;
            final var remainingBits = prefixLength % 8;

            for (var i = 0; i < fullBytes; i++) {
                if (address[i] != candidate[i]) {
                    return false;
                }
            }
            if (remainingBits > 0) {
                final var mask = (byte) (0xFF << (8 - remainingBits));
                return (address[fullBytes] & mask) == (candidate[fullBytes] & mask);
            }
            return true;
        }
    }

    @Inject
    public TrustedProxyValidator(TrustedProxyConfig config) {
        final var parsed = new ArrayList<Network>();
        for (final var entry : config.proxies().orElse(List.of())) {
            final var network = parseEntry(entry.trim());
            if (network != null) {
                parsed.add(network);
            }
        }
        this.networks = List.copyOf(parsed);
        LOG.infof("Trusted proxies: %d configured", networks.size());
    }

    /**
     * @return true if at least one valid proxy entry is configured
     */
    public boolean hasTrustedProxies() {
        return !networks.isEmpty();
    }

    /**
     * Check whether an address is one of the trusted proxies.
     *
     * @param ip an IP literal, IPv6 optionally in brackets
     * @return true if the address falls within a configured proxy entry
     */
    public boolean isTrustedProxy(String ip) {
        if (networks.isEmpty()) {
            return false;
        }
        final var bytes = parseIpLiteral(ip);
        if (bytes == null) {
            return false;
        }
        for (final var network : networks) {
            if (network.contains(bytes)) {
                return true;
            }
        }
        return false;
    }

    private static Network parseEntry(String entry) {
        final var slash = entry.indexOf('/');
        final var address = parseIpLiteral(slash < 0 ? entry : entry.substring(0, slash));
        if (address == null) {
            LOG.warnf("Ignoring trusted proxy entry with an invalid address: %s", entry);
            return null;
        }
        if (slash < 0) {
            return new Network(address, address.length * 8);
        }
        try {
            final var prefixLength = Integer.parseInt(entry.substring(slash + 1));
            if (prefixLength < 0 || prefixLength > address.length * 8) {
                LOG.warnf("Ignoring trusted proxy entry with prefix out of range: %s", entry);
                return null;
            }
            return new Network(address, prefixLength);
        } catch (NumberFormatException e) {
            LOG.warnf("Ignoring trusted proxy entry with an invalid prefix: %s", entry);
            return null;
        }
    }

    /**
     * Parse an IP literal without DNS resolution.
     *
     * @return the address bytes, or null if the input is not an IP literal
     */
    static byte[] parseIpLiteral(String input) {
        if (input == null || input.isEmpty()) {
            return null;
        }
        var candidate = input;
        if (candidate.startsWith("[") && candidate.endsWith("]")) {
            candidate = candidate.substring(1, candidate.length() - 1);
        }
        if (!isIpLiteral(candidate)) {
            return null;
        }
        try {
            // only reached for literals, so no lookup happens
            return InetAddress.getByName(candidate).getAddress();
        } catch (UnknownHostException e) {
            return null;
        }
    }

    private static boolean isIpLiteral(String input) {
        if (input.isEmpty()) {
            return false;
        }
        if (input.contains(":")) {
            return input.chars().allMatch(c -> c == ':' || c == '.' || Character.digit(c, 16) >= 0);
        }
        if (input.chars().filter(c -> c == '.').count() != 3) {
            return false;
        }
        return Arrays.stream(input.split("\\.", -1))
                .allMatch(part -> !part.isEmpty()
                        && part.length() <= 3
                        && part.chars().allMatch(Character::isDigit)
                        && Integer.parseInt(part) <= 255);
    }
}
