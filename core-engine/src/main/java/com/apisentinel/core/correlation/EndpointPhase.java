package com.apisentinel.core.correlation;

/**
 * Debounce state of one endpoint.
 *
 * <pre>
 *   HEALTHY ──signal──► CANDIDATE ──corroborated──► OPEN ──ack──► ACKNOWLEDGED
 *      ▲                   │                          │                │
 *      └──signals expired──┘                          └──N healthy─────┴──► (resolved) HEALTHY
 * </pre>
 *
 * @since 1.0.0
 */
public enum EndpointPhase {

    HEALTHY,
    CANDIDATE,
    OPEN,
    ACKNOWLEDGED;

    public boolean isAlerting() {
        return this == OPEN || this == ACKNOWLEDGED;
    }
}
