package com.switchboard.database.provisioning;

/**
 * Creates and drops physical tenant stores. Every operation is idempotent: the provisioning state
 * machine repeats them after failures.
 *
 * <p>Store names reach the database as unquoted identifiers, so implementations reject any name
 * outside the store-name alphabet before building a statement.
 */
public interface StoreAdmin {

    boolean exists(String storeName);

    /** Creates the store unless it already exists. */
    void create(String storeName);

    /** Drops the store and everything in it. Dropping a missing store succeeds. */
    void drop(String storeName);

    /** The layout this admin manages. */
    StoreLayout layout();
}
