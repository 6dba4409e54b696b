package com.switchboard.tenancy;

import java.util.ArrayList;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates tenant registration input and derives store names.
 * <p>
 * Returns all errors at once, the way EventValidator does.
 */
public final class TenantValidator {

    /** Routing keys that would shadow the platform's own hosts. */
    public static final Set<String> RESERVED_ROUTING_KEYS = Set.of("www", "admin", "api");

    static final Pattern DNS_LABEL = Pattern.compile("[a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?");
    static final Pattern STORE_NAME = Pattern.compile("[a-z][a-z0-9_]{0,62}");

    private static final int MAX_HOST_LENGTH = 253;
    private static final int MAX_DISPLAY_NAME_LENGTH = 200;
    private static final String STORE_PREFIX = "tenant_";

    private TenantValidator() {
        // utility class
    }

    /**
     * Validates registration input.
     *
     * @param routingKey  subdomain label or custom host
     * @param displayName organisation name
     * @param storeName   physical store name
     * @return a result listing every problem found
     */
    public static TenantValidationResult validate(String routingKey, String displayName, String storeName) {
        var errors = new ArrayList<String>();

        if (isBlank(routingKey)) {
            errors.add("routingKey must not be null or blank");
        } else {
            if (!isValidRoutingKey(routingKey)) {
                errors.add("routingKey must be a lower-case DNS label or host name: " + routingKey);
            }
            if (RESERVED_ROUTING_KEYS.contains(routingKey)) {
                errors.add("routingKey is reserved: " + routingKey);
            }
        }

        if (isBlank(displayName)) {
            errors.add("displayName must not be null or blank");
        } else if (displayName.length() > MAX_DISPLAY_NAME_LENGTH) {
            errors.add("displayName must be at most " + MAX_DISPLAY_NAME_LENGTH + " characters");
        }

        if (isBlank(storeName)) {
            errors.add("storeName must not be null or blank");
        } else if (!STORE_NAME.matcher(storeName).matches()) {
            errors.add("storeName must match " + STORE_NAME.pattern() + ": " + storeName);
        }

        return errors.isEmpty() ? TenantValidationResult.ok() : TenantValidationResult.fail(errors);
    }

    /**
     * Whether the key is a single DNS label or a dotted host made only of DNS labels.
     */
    public static boolean isValidRoutingKey(String routingKey) {
        if (routingKey == null || routingKey.isEmpty() || routingKey.length() > MAX_HOST_LENGTH) {
            return false;
        }
        for (String label : routingKey.split("\\.", -1)) {
            if (!DNS_LABEL.matcher(label).matches()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Whether the name is usable as an unquoted SQL identifier for a store.
     */
    public static boolean isValidStoreName(String storeName) {
        return storeName != null && STORE_NAME.matcher(storeName).matches();
    }

    /**
     * Derives a store name from a routing key: {@code acme} becomes {@code tenant_acme},
     * {@code shop.example.org} becomes {@code tenant_shop_example_org}. Characters outside the
     * store-name alphabet are replaced and the result is truncated to the maximum length.
     */
    public static String deriveStoreName(String routingKey) {
        String normalized = routingKey.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "_");
        String name = STORE_PREFIX + normalized;
        return name.length() > 63 ? name.substring(0, 63) : name;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
