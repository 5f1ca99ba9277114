package org.carma.merchant.network;

import java.util.Objects;

/**
 * Unordered pair of agent ids, stored in canonical (sorted) order so that
 * {@code AgentPair.of(a, b).equals(AgentPair.of(b, a))}.
 */
public record AgentPair(String first, String second) {

    public AgentPair {
        Objects.requireNonNull(first, "Agent ID cannot be null");
        Objects.requireNonNull(second, "Agent ID cannot be null");
        if (first.compareTo(second) > 0) {
            throw new IllegalArgumentException("Use AgentPair.of for unsorted ids");
        }
    }

    public static AgentPair of(String a, String b) {
        return a.compareTo(b) <= 0 ? new AgentPair(a, b) : new AgentPair(b, a);
    }

    public boolean contains(String agentId) {
        return first.equals(agentId) || second.equals(agentId);
    }

    /**
     * The member that is not {@code agentId}.
     */
    public String other(String agentId) {
        if (first.equals(agentId)) {
            return second;
        }
        if (second.equals(agentId)) {
            return first;
        }
        throw new IllegalArgumentException(agentId + " is not part of " + this);
    }

    @Override
    public String toString() {
        return first + "<->" + second;
    }
}
