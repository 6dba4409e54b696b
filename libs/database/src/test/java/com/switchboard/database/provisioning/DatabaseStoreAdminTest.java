package com.switchboard.database.provisioning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * {@link DatabaseStoreAdmin} needs a PostgreSQL server, so these tests only check the statements
 * it sends.
 */
@DisplayName("DatabaseStoreAdmin")
class DatabaseStoreAdminTest {

    private JdbcTemplate jdbc;
    private DatabaseStoreAdmin admin;

    @BeforeEach
    void setUp() {
        jdbc = mock(JdbcTemplate.class);
        admin = new DatabaseStoreAdmin(jdbc);
    }

    @Test
    @DisplayName("creates a database when pg_database has none")
    void createsMissingDatabase() {
        when(jdbc.queryForObject(anyString(), eq(Integer.class), eq("tenant_acme"))).thenReturn(0);

        admin.create("tenant_acme");

        verify(jdbc).execute("CREATE DATABASE tenant_acme");
    }

    @Test
    @DisplayName("skips creation when the database exists")
    void skipsExistingDatabase() {
        when(jdbc.queryForObject(anyString(), eq(Integer.class), eq("tenant_acme"))).thenReturn(1);

        admin.create("tenant_acme");

        verify(jdbc, never()).execute(anyString());
        assertThat(admin.exists("tenant_acme")).isTrue();
    }

    @Test
    @DisplayName("drops with IF EXISTS")
    void dropsIfExists() {
        admin.drop("tenant_acme");

        verify(jdbc).execute("DROP DATABASE IF EXISTS tenant_acme WITH (FORCE)");
    }

    @Test
    void reportsLayout() {
        assertThat(admin.layout()).isEqualTo(StoreLayout.DATABASE);
    }
}
