package com.switchboard.gateway.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.switchboard.gateway.config.SwitchboardProperties;
import com.switchboard.observability.ComponentHealth;
import com.switchboard.observability.HealthCheckRegistry;
import com.switchboard.tenancy.RequestKind;
import com.switchboard.tenancy.testing.InMemoryTenancy;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@DisplayName("SwitchboardInfoController")
class SwitchboardInfoControllerTest {

    private InMemoryTenancy tenancy;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        tenancy = InMemoryTenancy.create();
        tenancy.addActive("t-acme", "acme");
        var props = new SwitchboardProperties("gateway-test", List.of("example.com"), null, null, null, null, null);
        var checks = new HealthCheckRegistry();
        checks.register("registry", () -> CompletableFuture.completedFuture(ComponentHealth.healthy("registry", 1)));
        mockMvc =
                MockMvcBuilders.standaloneSetup(
                                new SwitchboardInfoController(props, tenancy.switchboard(), checks, tenancy.clock()))
                        .build();
    }

    @AfterEach
    void tearDown() {
        tenancy.close();
    }

    private void touchAcme() {
        tenancy.router().execute(InMemoryTenancy.host("acme"), RequestKind.READ, binding -> binding.tenantId());
    }

    @Test
    @DisplayName("info reports configuration and open pools")
    void info() throws Exception {
        touchAcme();

        mockMvc.perform(get("/admin/v1/switchboard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("gateway-test"))
                .andExpect(jsonPath("$.pools").value(1))
                .andExpect(jsonPath("$.checkedOut").value(0))
                .andExpect(jsonPath("$.baseDomains[0]").value("example.com"));
    }

    @Test
    @DisplayName("lists pool stats per tenant")
    void pools() throws Exception {
        touchAcme();

        mockMvc.perform(get("/admin/v1/switchboard/pools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].tenantId").value("t-acme"))
                .andExpect(jsonPath("$[0].storeName").value("tenant_acme"));
        mockMvc.perform(get("/admin/v1/switchboard/pools/{id}", "t-none")).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("evicting a pool removes it, unknown pool is 404")
    void evict() throws Exception {
        touchAcme();

        mockMvc.perform(post("/admin/v1/switchboard/pools/{id}/evict", "t-acme"))
                .andExpect(status().isAccepted());
        mockMvc.perform(post("/admin/v1/switchboard/pools/{id}/evict", "t-acme"))
                .andExpect(status().isNotFound());

        assertThat(tenancy.switchboard().poolCount()).isZero();
    }

    @Test
    @DisplayName("health runs the registered checks")
    void health() throws Exception {
        mockMvc.perform(get("/admin/v1/switchboard/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("HEALTHY"));
    }
}
