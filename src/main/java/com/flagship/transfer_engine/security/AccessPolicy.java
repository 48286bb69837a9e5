package com.flagship.transfer_engine.security;

/**
 * Capabilities a principal may hold at the API boundary.
 *
 * The engine never consults this; it trusts the actor id it is given.
 */
public interface AccessPolicy {

    boolean canInitiateTransfers();

    boolean canApproveTransfers();

    boolean canViewTransfers();

    boolean canViewAuditTrail();
}
