package com.switchboard.gateway.api;

/**
 * No employee with the given id exists in the bound tenant's store.
 */
public class EmployeeNotFoundException extends RuntimeException {

    public EmployeeNotFoundException(String employeeId) {
        super("Employee not found: " + employeeId);
    }
}
