package com.switchboard.tenancy.store;

/**
 * A store session failed for infrastructure reasons. A handle that sees this is marked broken
 * and its session is closed instead of going back to the pool.
 */
public class StoreSessionException extends RuntimeException {

    private final String storeName;

    public StoreSessionException(String storeName, String message) {
        super(message);
        this.storeName = storeName;
    }

    public StoreSessionException(String storeName, String message, Throwable cause) {
        super(message, cause);
        this.storeName = storeName;
    }

    public String storeName() {
        return storeName;
    }
}
