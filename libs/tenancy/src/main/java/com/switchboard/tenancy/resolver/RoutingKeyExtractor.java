package com.switchboard.tenancy.resolver;

import com.switchboard.tenancy.TenantValidator;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Derives a routing key from a request host.
 * <p>
 * The host is lower-cased and stripped of any port and trailing dot. A host below one of the
 * platform's base domains yields its leftmost label ({@code acme.example.com → acme}); the bare
 * base domain yields nothing. Any other well-formed host is a tenant's custom host and is used
 * whole.
 */
public final class RoutingKeyExtractor {

    private final List<String> baseDomains;

    /**
     * @param baseDomains platform domains tenants are addressed under, e.g. {@code example.com}
     */
    public RoutingKeyExtractor(List<String> baseDomains) {
        if (baseDomains == null) {
            throw new IllegalArgumentException("baseDomains must not be null");
        }
        this.baseDomains = baseDomains.stream()
                .map(RoutingKeyExtractor::normalize)
                .filter(d -> !d.isEmpty())
                .toList();
    }

    /**
     * Extracts the routing key.
     *
     * @param host raw {@code Host} value, possibly with a port
     * @return the routing key, or empty for the apex, a missing or a malformed host
     */
    public Optional<String> extract(String host) {
        if (host == null) {
            return Optional.empty();
        }
        String normalized = normalize(host);
        if (!TenantValidator.isValidRoutingKey(normalized)) {
            return Optional.empty();
        }
        for (String baseDomain : baseDomains) {
            if (normalized.equals(baseDomain)) {
                return Optional.empty();
            }
            if (normalized.endsWith("." + baseDomain)) {
                return Optional.of(normalized.substring(0, normalized.indexOf('.')));
            }
        }
        return Optional.of(normalized);
    }

    public List<String> baseDomains() {
        return baseDomains;
    }

    static String normalize(String host) {
        String h = host.trim().toLowerCase(Locale.ROOT);
        int colon = h.lastIndexOf(':');
        if (colon >= 0 && isPort(h.substring(colon + 1))) {
            h = h.substring(0, colon);
        }
        while (h.endsWith(".")) {
            h = h.substring(0, h.length() - 1);
        }
        return h;
    }

    private static boolean isPort(String s) {
        if (s.isEmpty() || s.length() > 5) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
