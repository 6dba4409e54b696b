package com.switchboard.database.provisioning;

import com.switchboard.tenancy.TenantValidator;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Shared plumbing for the DDL-based store admins: name checking and the existence check.
 */
abstract class AbstractStoreAdmin implements StoreAdmin {

    private static final Logger log = LoggerFactory.getLogger(AbstractStoreAdmin.class);

    protected final JdbcTemplate admin;

    protected AbstractStoreAdmin(JdbcTemplate admin) {
        if (admin == null) {
            throw new IllegalArgumentException("admin must not be null");
        }
        this.admin = admin;
    }

    /** Query counting stores with the given (lower-case) name. */
    protected abstract String existsQuery();

    protected abstract String createStatement(String storeName);

    protected abstract String dropStatement(String storeName);

    @Override
    public boolean exists(String storeName) {
        Integer count = admin.queryForObject(existsQuery(), Integer.class, checked(storeName));
        return count != null && count > 0;
    }

    @Override
    public void create(String storeName) {
        if (exists(storeName)) {
            log.debug("Store {} already exists", storeName);
            return;
        }
        admin.execute(createStatement(checked(storeName)));
        log.info("Created {} store {}", layout().name().toLowerCase(Locale.ROOT), storeName);
    }

    @Override
    public void drop(String storeName) {
        admin.execute(dropStatement(checked(storeName)));
        log.info("Dropped {} store {}", layout().name().toLowerCase(Locale.ROOT), storeName);
    }

    static String checked(String storeName) {
        if (!TenantValidator.isValidStoreName(storeName)) {
            throw new IllegalArgumentException("Invalid store name: " + storeName);
        }
        return storeName;
    }
}
