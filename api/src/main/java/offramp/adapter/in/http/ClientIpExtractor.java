package offramp.adapter.in.http;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import offramp.core.service.common.TrustedProxyValidator;

/**
 * Extracts the client IP address of a request.
 *
 * <p>Forwarding headers are only read when the socket peer is a trusted
 * proxy; otherwise the socket address is the client IP, whatever the headers
 * claim. When they are read, the first header present wins:
 * <ol>
 *   <li>RFC 7239 {@code Forwarded} header's {@code for} parameters</li>
 *   <li>Legacy {@code X-Forwarded-For} header</li>
 *   <li>{@code X-Real-IP} header</li>
 * </ol>
 *
 * <p>The chain is walked from the nearest hop outwards and the first address
 * that is not itself a trusted proxy is the client. Entries further out were
 * written by the client and are ignored.
 */
@ApplicationScoped
public class ClientIpExtractor {

    static final String UNKNOWN = "unknown";

    private final TrustedProxyValidator trustedProxyValidator;

    @Inject
    public ClientIpExtractor(TrustedProxyValidator trustedProxyValidator) {
        this.trustedProxyValidator = trustedProxyValidator;
    }

    /**
     * Extract the original client IP address.
     *
     * @param headers header lookup by name, returning null when absent
     * @param remoteAddress the socket peer address, may be null
     * @return the client IP, or {@code unknown} if none is available
     */
    public String extract(UnaryOperator<String> headers, String remoteAddress) {
        if (remoteAddress == null || remoteAddress.isBlank()) {
            return UNKNOWN;
        }
        if (!trustedProxyValidator.isTrustedProxy(remoteAddress)) {
            return remoteAddress;
        }

        final var chain = forwardedChain(headers);
        for (var i = chain.size() - 1; i >= 0; i--) {
            final var hop = chain.get(i);
            if (!trustedProxyValidator.isTrustedProxy(hop)) {
                return hop;
            }
        }
        return chain.isEmpty() ? remoteAddress : chain.get(0);
    }

    private static List<String> forwardedChain(UnaryOperator<String> headers) {
        final var chain = new ArrayList<String>();

        final var forwarded = headers.apply("Forwarded");
        if (forwarded != null) {
            for (final var entry : forwarded.split(",")) {
                addHop(chain, extractForwardedParam(entry, "for"));
            }
            if (!chain.isEmpty()) {
                return chain;
            }
        }

        final var xForwardedFor = headers.apply("X-Forwarded-For");
        if (xForwardedFor != null) {
            for (final var entry : xForwardedFor.split(",")) {
                addHop(chain, entry);
            }
            if (!chain.isEmpty()) {
                return chain;
            }
        }

        addHop(chain, headers.apply("X-Real-IP"));
        return chain;
    }

    private static void addHop(List<String> chain, String value) {
        final var hop = normalize(value);
        if (hop != null) {
            chain.add(hop);
        }
    }

    /**
     * Strip brackets from IPv6 and the port from {@code ip:port} values.
     */
    static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        var hop = value.trim();
        if (hop.startsWith("[")) {
            final var close = hop.indexOf(']');
            return close > 1 ? hop.substring(1, close) : null;
        }
        final var colon = hop.indexOf(':');
        if (colon > 0 && colon == hop.lastIndexOf(':')) {
            hop = hop.substring(0, colon);
        }
        return hop;
    }

    /**
     * Extract a parameter value from a single entry of an RFC 7239 Forwarded header.
     *
     * @param entry one comma-separated element of the Forwarded header
     * @param param the parameter name to extract (e.g., "for", "proto")
     * @return the parameter value, or null if not found
     */
    static String extractForwardedParam(String entry, String param) {
        for (var part : entry.trim().split(";")) {
            var keyValue = part.trim().split("=", 2);
            if (keyValue.length == 2 && keyValue[0].trim().equalsIgnoreCase(param)) {
                var value = keyValue[1].trim();
                if (value.startsWith("\"") && value.endsWith("\"") && value.length() >= 2) {
                    value = value.substring(1, value.length() - 1);
                }
                return value;
            }
        }

        return null;
    }
}
