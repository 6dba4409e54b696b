package com.switchboard.gateway.api;

import com.switchboard.tenancy.routing.TenantBinding;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Tenant-scoped employee records, the sample business data kept in every tenant store.
 *
 * <p>Every method receives the request's {@link TenantBinding}: the store it talks to is the one
 * the request's host resolved to, and there is no way to name another. Statements are plain SQL
 * with positional parameters against the tenant schema ({@code db/tenant}).
 */
@RestController
@RequestMapping("/api/v1/employees")
public class EmployeeController {

    static final String SELECT_ALL =
            "SELECT id, name, email, department, created_at FROM employees ORDER BY created_at, id";
    static final String SELECT_BY_DEPARTMENT =
            "SELECT id, name, email, department, created_at FROM employees WHERE department = ?"
                    + " ORDER BY created_at, id";
    static final String SELECT_BY_ID =
            "SELECT id, name, email, department, created_at FROM employees WHERE id = ?";
    static final String INSERT =
            "INSERT INTO employees (id, name, email, department, created_at) VALUES (?, ?, ?, ?, ?)";
    static final String DELETE = "DELETE FROM employees WHERE id = ?";

    private final Clock clock;

    public EmployeeController(Clock clock) {
        this.clock = clock;
    }

    @GetMapping
    public List<Employee> list(
            TenantBinding tenant, @RequestParam(name = "department", required = false) String department) {
        List<Map<String, Object>> rows =
                department == null || department.isBlank()
                        ? tenant.query(SELECT_ALL)
                        : tenant.query(SELECT_BY_DEPARTMENT, department);
        return rows.stream().map(Employee::fromRow).toList();
    }

    @GetMapping("/{id}")
    public Employee get(TenantBinding tenant, @PathVariable("id") String id) {
        return tenant.query(SELECT_BY_ID, id).stream()
                .findFirst()
                .map(Employee::fromRow)
                .orElseThrow(() -> new EmployeeNotFoundException(id));
    }

    @PostMapping
    public ResponseEntity<Employee> create(TenantBinding tenant, @Valid @RequestBody NewEmployee request) {
        var employee =
                new Employee(
                        UUID.randomUUID().toString(),
                        request.name(),
                        request.email(),
                        request.department(),
                        clock.instant());
        tenant.update(
                INSERT,
                employee.id(),
                employee.name(),
                employee.email(),
                employee.department(),
                Timestamp.from(employee.createdAt()));
        return ResponseEntity.created(URI.create("/api/v1/employees/" + employee.id())).body(employee);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(TenantBinding tenant, @PathVariable("id") String id) {
        if (tenant.update(DELETE, id) == 0) {
            throw new EmployeeNotFoundException(id);
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * An employee of the bound tenant.
     *
     * @param id generated identifier
     * @param name full name
     * @param email contact address
     * @param department department name (nullable)
     * @param createdAt creation time
     */
    public record Employee(String id, String name, String email, String department, Instant createdAt) {

        static Employee fromRow(Map<String, Object> row) {
            return new Employee(
                    (String) row.get("id"),
                    (String) row.get("name"),
                    (String) row.get("email"),
                    (String) row.get("department"),
                    toInstant(row.get("created_at")));
        }

        private static Instant toInstant(Object value) {
            if (value instanceof Timestamp ts) {
                return ts.toInstant();
            }
            if (value instanceof OffsetDateTime odt) {
                return odt.toInstant();
            }
            if (value instanceof Instant instant) {
                return instant;
            }
            return null;
        }
    }

    /** Request body for {@code POST /api/v1/employees}. */
    public record NewEmployee(
            @NotBlank @Size(max = 200) String name,
            @NotBlank @Email @Size(max = 320) String email,
            @Size(max = 100) String department) {}
}
