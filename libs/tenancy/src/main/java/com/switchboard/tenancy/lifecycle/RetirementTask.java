package com.switchboard.tenancy.lifecycle;

import com.switchboard.tenancy.Tenant;

import java.util.concurrent.CompletableFuture;

/**
 * A retirement in progress.
 *
 * @param tenant    the retired registry record
 * @param destroyed completes once the store is destroyed after the retention window, or
 *                  exceptionally once destruction was escalated
 */
public record RetirementTask(Tenant tenant, CompletableFuture<Void> destroyed) {
}
