package org.carma.merchant.network;

import org.carma.merchant.model.TradeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Trust-weighted relationship graph between merchants.
 *
 * The graph is undirected: each pair of agents has at most one
 * {@link Relationship}, keyed by its canonical {@link AgentPair}.
 *
 * Provides:
 * - Agent and relationship registration
 * - Information propagation with per-relationship delay and reliability
 * - Interaction feedback on strength and trust
 * - Cluster detection over strong bonds
 *
 * Every mutation, including the event computation and inbox update of
 * {@link #propagate}, runs under a single write lock. A null agent id is
 * treated like an unknown one, except by {@link #addAgent}.
 */
public class RelationshipNetwork {

    private static final Logger log = LoggerFactory.getLogger(RelationshipNetwork.class);

    private static final int BASE_DELAY = 3;
    private static final double BASE_RELIABILITY = 0.7;

    private final Set<String> agents = new TreeSet<>();
    private final Map<AgentPair, Relationship> relationships = new HashMap<>();
    private final Map<String, SortedSet<String>> neighbors = new HashMap<>();
    private final Map<String, List<InformationPacket>> inboxes = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // ========================================================================
    // Agents
    // ========================================================================

    public void addAgent(String agentId) {
        Objects.requireNonNull(agentId, "Agent ID cannot be null");
        lock.writeLock().lock();
        try {
            agents.add(agentId);
            neighbors.computeIfAbsent(agentId, k -> new TreeSet<>());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove an agent together with all its relationships and its inbox.
     */
    public void removeAgent(String agentId) {
        if (agentId == null) {
            return;
        }
        lock.writeLock().lock();
        try {
            if (!agents.remove(agentId)) {
                return;
            }
            SortedSet<String> linked = neighbors.remove(agentId);
            if (linked != null) {
                for (String other : linked) {
                    relationships.remove(AgentPair.of(agentId, other));
                    SortedSet<String> back = neighbors.get(other);
                    if (back != null) {
                        back.remove(agentId);
                    }
                }
            }
            inboxes.remove(agentId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean containsAgent(String agentId) {
        if (agentId == null) {
            return false;
        }
        lock.readLock().lock();
        try {
            return agents.contains(agentId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getAgentCount() {
        lock.readLock().lock();
        try {
            return agents.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================================================================
    // Relationships
    // ========================================================================

    /**
     * Create, or replace, the relationship between two registered agents
     * with strength and trust reset to 0.5.
     *
     * @return false, changing nothing, if either agent is null or unknown, or a == b
     */
    public boolean addRelationship(String a, String b, RelationshipType type) {
        Objects.requireNonNull(type, "Relationship type cannot be null");
        if (a == null || b == null) {
            log.debug("Ignoring relationship {} with a missing agent id", type);
            return false;
        }
        lock.writeLock().lock();
        try {
            if (!agents.contains(a) || !agents.contains(b) || a.equals(b)) {
                log.debug("Ignoring relationship {} between {} and {}: unknown or identical agents", type, a, b);
                return false;
            }
            AgentPair pair = AgentPair.of(a, b);
            relationships.put(pair, new Relationship(pair, type));
            neighbors.get(a).add(b);
            neighbors.get(b).add(a);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Copy of the relationship between two agents, in either order.
     */
    public Optional<Relationship> getRelationship(String a, String b) {
        if (a == null || b == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            Relationship rel = relationships.get(AgentPair.of(a, b));
            return rel != null ? Optional.of(rel.copy()) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Copies of all relationships of an agent, ordered by the other agent's id.
     */
    public List<Relationship> getRelationshipsOf(String agentId) {
        if (agentId == null) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            SortedSet<String> linked = neighbors.get(agentId);
            if (linked == null) {
                return List.of();
            }
            List<Relationship> result = new ArrayList<>(linked.size());
            for (String other : linked) {
                result.add(relationships.get(AgentPair.of(agentId, other)).copy());
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Apply interaction feedback to a relationship.
     *
     * @return false if the two agents are not related
     */
    public boolean updateStrength(String a, String b, double delta) {
        lock.writeLock().lock();
        try {
            Relationship rel = a != null && b != null ? relationships.get(AgentPair.of(a, b)) : null;
            if (rel == null) {
                log.debug("No relationship between {} and {}; strength update ignored", a, b);
                return false;
            }
            rel.applyInteraction(delta);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Append a trade to the shared history of two related agents.
     *
     * @return false if the two agents are not related
     */
    public boolean recordTrade(String a, String b, TradeRecord record) {
        Objects.requireNonNull(record, "Trade record cannot be null");
        if (a == null || b == null) {
            return false;
        }
        lock.writeLock().lock();
        try {
            Relationship rel = relationships.get(AgentPair.of(a, b));
            if (rel == null) {
                return false;
            }
            rel.addTrade(record);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ========================================================================
    // Information Propagation
    // ========================================================================

    /**
     * Spread a packet from its source to every related agent.
     *
     * Each target receives the raw packet in its inbox; the returned events
     * carry the delivery delay and compounded reliability, ordered by target
     * id. An unknown source yields no events.
     */
    public List<PropagationEvent> propagate(InformationPacket packet) {
        Objects.requireNonNull(packet, "Packet cannot be null");
        lock.writeLock().lock();
        try {
            if (!agents.contains(packet.sourceId())) {
                return List.of();
            }

            SortedSet<String> targets = neighbors.getOrDefault(packet.sourceId(), Collections.emptySortedSet());
            List<PropagationEvent> events = new ArrayList<>(targets.size());
            for (String targetId : targets) {
                Relationship rel = relationships.get(AgentPair.of(packet.sourceId(), targetId));
                int delay = delayFor(rel);
                double reliability = reliabilityFor(rel) * packet.reliability();
                events.add(new PropagationEvent(targetId, packet, delay, reliability));
                inboxes.computeIfAbsent(targetId, k -> new ArrayList<>()).add(packet);
            }

            log.debug("Propagated {} from {} to {} agent(s)", packet.itemId(), packet.sourceId(), events.size());
            return events;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Ticks before information crosses a relationship. Allies pass it on at
     * once, friends faster the stronger the bond, rivals slowest.
     */
    static int delayFor(Relationship rel) {
        switch (rel.getType()) {
            case ALLIED:
                return 1;
            case FRIENDLY:
                return Math.max(1, BASE_DELAY - (int) (rel.getStrength() * 2));
            case RIVAL:
                return BASE_DELAY * 2;
            default:
                return BASE_DELAY;
        }
    }

    static double reliabilityFor(Relationship rel) {
        switch (rel.getType()) {
            case ALLIED:
                return 0.95 * rel.getTrust();
            case FRIENDLY:
                return BASE_RELIABILITY + 0.2 * rel.getTrust();
            case RIVAL:
                return 0.3 * rel.getTrust();
            default:
                return BASE_RELIABILITY * rel.getTrust();
        }
    }

    /**
     * Packets delivered to an agent so far, in arrival order.
     */
    public List<InformationPacket> getInformation(String agentId) {
        lock.readLock().lock();
        try {
            List<InformationPacket> inbox = inboxes.get(agentId);
            return inbox != null ? List.copyOf(inbox) : List.of();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clearInformation(String agentId) {
        lock.writeLock().lock();
        try {
            inboxes.remove(agentId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ========================================================================
    // Clusters
    // ========================================================================

    /**
     * Groups of agents joined by alliances or strong friendships
     * (strength above 0.7). Singletons are omitted. Members are sorted and
     * clusters are ordered by their first member.
     */
    public List<List<String>> clusters() {
        lock.readLock().lock();
        try {
            Set<String> visited = new HashSet<>();
            List<List<String>> clusters = new ArrayList<>();

            for (String agentId : agents) {
                if (visited.contains(agentId)) {
                    continue;
                }
                List<String> cluster = collectCluster(agentId, visited);
                if (cluster.size() > 1) {
                    Collections.sort(cluster);
                    clusters.add(cluster);
                }
            }

            clusters.sort(Comparator.comparing(c -> c.get(0)));
            return clusters;
        } finally {
            lock.readLock().unlock();
        }
    }

    // Depth-first walk with an explicit stack
    private List<String> collectCluster(String startId, Set<String> visited) {
        List<String> cluster = new ArrayList<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(startId);

        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            cluster.add(current);

            for (String neighborId : neighbors.getOrDefault(current, Collections.emptySortedSet())) {
                if (visited.contains(neighborId)) {
                    continue;
                }
                Relationship rel = relationships.get(AgentPair.of(current, neighborId));
                if (rel.isClusterBond()) {
                    stack.push(neighborId);
                }
            }
        }
        return cluster;
    }

    @Override
    public String toString() {
        lock.readLock().lock();
        try {
            return String.format("RelationshipNetwork[agents=%d, relationships=%d]",
                agents.size(), relationships.size());
        } finally {
            lock.readLock().unlock();
        }
    }
}
