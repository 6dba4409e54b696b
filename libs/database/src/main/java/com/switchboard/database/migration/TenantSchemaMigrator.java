package com.switchboard.database.migration;

import com.switchboard.database.config.TenantDatabaseProperties;
import com.switchboard.observability.SensitiveDataRedactor;
import com.switchboard.tenancy.TenantValidator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;
import org.flywaydb.core.api.MigrationVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.jdbc.datasource.SimpleDriverDataSource;

/**
 * Runs the per-tenant schema migrations against one store at a time.
 *
 * <p>The target version is the highest versioned migration found under the configured locations
 * when the migrator is created. A store is ready for traffic only once it reports exactly that
 * version. Versions are whole numbers ({@code V1__}, {@code V2__}, ...).
 *
 * <p>Each call opens its own unpooled data source: migrations run once per provisioning attempt,
 * never on the request path.
 */
public class TenantSchemaMigrator {

    private static final Logger log = LoggerFactory.getLogger(TenantSchemaMigrator.class);

    private static final Pattern VERSIONED = Pattern.compile("^V(\\d+)__.+\\.sql$");

    private final TenantDatabaseProperties.StoreConfig config;
    private final SensitiveDataRedactor redactor;
    private final int targetVersion;

    public TenantSchemaMigrator(
            TenantDatabaseProperties.StoreConfig config, SensitiveDataRedactor redactor) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        this.config = config;
        this.redactor = redactor == null ? new SensitiveDataRedactor() : redactor;
        this.targetVersion = latestAvailableVersion(config.locations());
        if (targetVersion == 0) {
            throw new IllegalStateException(
                    "No versioned tenant migrations found under " + config.locations());
        }
    }

    /** Schema version every tenant store must reach. */
    public int targetVersion() {
        return targetVersion;
    }

    /**
     * Migrates the store to the target version.
     *
     * @return the version the store reports afterwards
     */
    public int migrate(String storeName) {
        Flyway flyway = flywayFor(storeName);
        var result = flyway.migrate();
        int version = currentVersion(flyway.info());
        log.info(
                "Migrated store {} ({} migrations executed), now at version {}",
                storeName,
                result.migrationsExecuted,
                version);
        return version;
    }

    /** Version the store currently reports, 0 when nothing has been applied. */
    public int currentVersion(String storeName) {
        return currentVersion(flywayFor(storeName).info());
    }

    /** Applied and pending migrations of the store. */
    public StoreMigrationStatus status(String storeName) {
        MigrationInfoService info = flywayFor(storeName).info();
        List<StoreMigrationStatus.MigrationEntry> entries = new ArrayList<>();
        for (MigrationInfo migration : info.all()) {
            entries.add(
                    new StoreMigrationStatus.MigrationEntry(
                            migration.getVersion() == null
                                    ? null
                                    : migration.getVersion().getVersion(),
                            migration.getDescription(),
                            migration.getState().name(),
                            migration.getInstalledOn() == null
                                    ? null
                                    : migration.getInstalledOn().toInstant().toString()));
        }
        return new StoreMigrationStatus(
                storeName,
                redactor.redactUrl(config.urlFor(storeName)),
                info.applied().length,
                info.pending().length,
                currentVersion(info),
                entries);
    }

    /**
     * Highest {@code V<n>__} migration under the given comma-separated locations.
     *
     * @return the version, or 0 when there are none
     */
    static int latestAvailableVersion(String locations) {
        var resolver = new PathMatchingResourcePatternResolver();
        int latest = 0;
        for (String location : locations(locations)) {
            String path = location.replaceFirst("^classpath:", "");
            try {
                for (Resource resource : resolver.getResources("classpath*:" + path + "/*.sql")) {
                    String name = resource.getFilename();
                    Matcher m = name == null ? null : VERSIONED.matcher(name);
                    if (m != null && m.matches()) {
                        latest = Math.max(latest, Integer.parseInt(m.group(1)));
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot scan migrations under " + location, e);
            }
        }
        return latest;
    }

    private Flyway flywayFor(String storeName) {
        if (!TenantValidator.isValidStoreName(storeName)) {
            throw new IllegalArgumentException("Invalid store name: " + storeName);
        }
        DataSource dataSource =
                DataSourceBuilder.create()
                        .type(SimpleDriverDataSource.class)
                        .url(config.urlFor(storeName))
                        .username(config.username())
                        .password(config.password())
                        .build();

        return Flyway.configure()
                .dataSource(dataSource)
                .locations(locations(config.locations()))
                .cleanDisabled(true)
                .load();
    }

    private static String[] locations(String locations) {
        return Arrays.stream(locations.split(","))
                .map(String::trim)
                .filter(l -> !l.isEmpty())
                .toArray(String[]::new);
    }

    private static int currentVersion(MigrationInfoService info) {
        MigrationInfo current = info.current();
        if (current == null || current.getVersion() == null) {
            return 0;
        }
        MigrationVersion version = current.getVersion();
        return Integer.parseInt(version.getVersion());
    }
}
