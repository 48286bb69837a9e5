package com.flagship.transfer_engine.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Predicate;

/**
 * Capability checks performed at the HTTP boundary before any engine call.
 */
@Component
@Slf4j
public class AccessGuard {

    public void requireInitiate(Principal principal) {
        require(principal, AccessPolicy::canInitiateTransfers, "initiate transfers");
    }

    public void requireApprove(Principal principal) {
        require(principal, AccessPolicy::canApproveTransfers, "approve transfers");
    }

    public void requireViewTransfers(Principal principal) {
        require(principal, AccessPolicy::canViewTransfers, "view transfers");
    }

    public void requireViewAuditTrail(Principal principal) {
        require(principal, AccessPolicy::canViewAuditTrail, "view audit records");
    }

    private void require(Principal principal, Predicate<AccessPolicy> capability, String operation) {
        if (!capability.test(principal.getRole())) {
            log.warn("Access denied: principal={}, role={}, operation={}",
                    principal.getId(), principal.getRole(), operation);
            throw new AccessDeniedException(
                    "Forbidden: insufficient permissions to " + operation);
        }
    }
}
