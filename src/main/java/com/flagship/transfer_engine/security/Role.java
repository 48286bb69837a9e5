package com.flagship.transfer_engine.security;

/**
 * Operator roles supplied by the identity provider, each with its own access policy.
 */
public enum Role implements AccessPolicy {

    /**
     * Moves funds; cannot approve.
     */
    CONTROLLER {
        @Override
        public boolean canInitiateTransfers() {
            return true;
        }

        @Override
        public boolean canViewTransfers() {
            return true;
        }
    },

    /**
     * Full access, including second-party approval of transfers above the threshold.
     */
    ADMIN {
        @Override
        public boolean canInitiateTransfers() {
            return true;
        }

        @Override
        public boolean canApproveTransfers() {
            return true;
        }

        @Override
        public boolean canViewTransfers() {
            return true;
        }

        @Override
        public boolean canViewAuditTrail() {
            return true;
        }
    },

    /**
     * Read-only access to transfers and the audit trail.
     */
    AUDIT {
        @Override
        public boolean canViewTransfers() {
            return true;
        }

        @Override
        public boolean canViewAuditTrail() {
            return true;
        }
    },

    NONE;

    @Override
    public boolean canInitiateTransfers() {
        return false;
    }

    @Override
    public boolean canApproveTransfers() {
        return false;
    }

    @Override
    public boolean canViewTransfers() {
        return false;
    }

    @Override
    public boolean canViewAuditTrail() {
        return false;
    }

    /**
     * Resolves a role name; unknown or missing names carry no capabilities.
     */
    public static Role fromName(String name) {
        if (name == null || name.isBlank()) {
            return NONE;
        }
        try {
            return Role.valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return NONE;
        }
    }
}
