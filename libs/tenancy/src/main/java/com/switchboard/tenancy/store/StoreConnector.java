package com.switchboard.tenancy.store;

/**
 * Opens sessions against physical tenant stores. Implementations decide what a store is (a
 * PostgreSQL database, an in-memory map); the switchboard only needs the capability.
 */
@FunctionalInterface
public interface StoreConnector {

    /**
     * Opens a new session against the named store.
     *
     * @param storeName physical store name as recorded in the registry
     * @return an open session, owned by the caller
     * @throws StoreSessionException if the store cannot be reached
     */
    StoreSession open(String storeName);
}
