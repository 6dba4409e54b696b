package com.switchboard.tenancy;

import com.switchboard.tenancy.routing.TenantBinding;
import com.switchboard.tenancy.testing.InMemoryTenancy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Cross-tenant access through a binding is blocked with TenantMismatchException; same-tenant
 * access passes silently.
 */
@DisplayName("TenantIsolationEnforcer")
class TenantIsolationEnforcerTest {

    private InMemoryTenancy tenancy;

    @BeforeEach
    void setUp() {
        tenancy = InMemoryTenancy.create();
        tenancy.addActive("T1", "acme");
    }

    @AfterEach
    void tearDown() {
        tenancy.close();
    }

    @Test
    @DisplayName("passes when tenants match")
    void tenantsMatch() {
        try (TenantBinding binding = tenancy.router().bind("acme.example.com", RequestKind.READ)) {
            assertThatCode(() -> TenantIsolationEnforcer.enforce(binding, "T1")).doesNotThrowAnyException();
        }
    }

    @Test
    @DisplayName("throws TenantMismatchException when tenants differ")
    void tenantsMismatch() {
        try (TenantBinding binding = tenancy.router().bind("acme.example.com", RequestKind.READ)) {
            assertThatThrownBy(() -> TenantIsolationEnforcer.enforce(binding, "T2"))
                    .isInstanceOf(TenantMismatchException.class)
                    .hasMessageContaining("T1")
                    .hasMessageContaining("T2");
        }
    }

    @Test
    @DisplayName("exception carries both tenant IDs")
    void exceptionCarriesIds() {
        try {
            TenantIsolationEnforcer.enforce("t-a", "t-b");
        } catch (TenantMismatchException e) {
            assertThat(e.boundTenantId()).isEqualTo("t-a");
            assertThat(e.resourceTenantId()).isEqualTo("t-b");
            return;
        }
        throw new AssertionError("Expected TenantMismatchException");
    }

    @Test
    @DisplayName("a null resource tenant is a mismatch")
    void nullResourceTenant() {
        assertThatThrownBy(() -> TenantIsolationEnforcer.enforce("t-a", null))
                .isInstanceOf(TenantMismatchException.class);
    }
}
