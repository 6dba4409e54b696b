package com.switchboard.database.migration;

import java.util.List;

/**
 * Migration state of one tenant store.
 *
 * @param storeName the store
 * @param url JDBC URL with credentials redacted
 * @param appliedMigrations number of successfully applied migrations
 * @param pendingMigrations number of migrations waiting to be applied
 * @param currentVersion current schema version (0 if no migration has been applied)
 * @param migrations every known migration, applied and pending, in version order
 */
public record StoreMigrationStatus(
        String storeName,
        String url,
        int appliedMigrations,
        int pendingMigrations,
        int currentVersion,
        List<MigrationEntry> migrations) {

    public StoreMigrationStatus {
        migrations = migrations == null ? List.of() : List.copyOf(migrations);
    }

    /** Whether the store is at {@code targetVersion} with nothing pending. */
    public boolean isAt(int targetVersion) {
        return pendingMigrations == 0 && currentVersion == targetVersion;
    }

    /**
     * One migration as Flyway reports it.
     *
     * @param version migration version (e.g., "1", "2")
     * @param description migration description (e.g., "create employees")
     * @param state migration state (e.g., "SUCCESS", "PENDING", "FAILED")
     * @param installedOn ISO-8601 timestamp of when the migration was applied (null if pending)
     */
    public record MigrationEntry(
            String version, String description, String state, String installedOn) {}
}
