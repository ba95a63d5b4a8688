package com.cadence.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * What the advancer does after a node has run.
 *
 *   ADVANCE → follow nextNodeId; a null target completes the enrollment
 *   SUSPEND → a wait node was armed; persist and halt
 *   IDLE    → an armed wait node is still waiting; halt without writing
 *   STOP    → terminate with reason
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NodeOutcome {

    public enum Kind { ADVANCE, SUSPEND, IDLE, STOP }

    private static final NodeOutcome SUSPENDED = new NodeOutcome(Kind.SUSPEND, null, null);
    private static final NodeOutcome IDLE = new NodeOutcome(Kind.IDLE, null, null);

    private final Kind kind;
    private final String nextNodeId;
    private final String reason;

    public static NodeOutcome advance(String nextNodeId) {
        return new NodeOutcome(Kind.ADVANCE, nextNodeId, null);
    }

    public static NodeOutcome suspend() {
        return SUSPENDED;
    }

    public static NodeOutcome idle() {
        return IDLE;
    }

    public static NodeOutcome stop(String reason) {
        return new NodeOutcome(Kind.STOP, null, reason);
    }
}
