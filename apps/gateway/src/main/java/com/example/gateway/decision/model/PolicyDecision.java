package com.example.gateway.decision.model;

/**
 * Outcome of pushing a partial policy evaluation down to a datastore.
 */
public record PolicyDecision(
        Decision decision,
        String reason,
        String datastore
) {
    public enum Decision {
        ALLOW,
        DENY
    }

    public static PolicyDecision allow(String datastore, String reason) {
        return new PolicyDecision(Decision.ALLOW, reason, datastore);
    }

    public static PolicyDecision deny(String datastore, String reason) {
        return new PolicyDecision(Decision.DENY, reason, datastore);
    }

    public boolean isAllowed() {
        return decision == Decision.ALLOW;
    }

    public boolean isDenied() {
        return decision == Decision.DENY;
    }
}
