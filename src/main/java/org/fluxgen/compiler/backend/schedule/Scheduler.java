package org.fluxgen.compiler.backend.schedule;

import org.fluxgen.compiler.api.CyclicBlockException;
import org.fluxgen.compiler.graph.Block;
import org.fluxgen.compiler.graph.BlockId;
import org.fluxgen.compiler.graph.Connection;
import org.fluxgen.compiler.graph.ConnectionId;
import org.fluxgen.compiler.graph.Graph;
import org.fluxgen.compiler.graph.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Orders the nodes of a block into a statement sequence.
 * <p>
 * Every data or sequence connection owned by the block contributes an edge between its
 * two endpoints lifted to the block, so a control node is ordered by the connections of
 * everything nested in it. A connection from inside a control node back to one of its
 * own inputs lifts to a self-edge and makes the block cyclic. Among ready nodes the one created first
 * goes first, which makes the order stable across runs.
 */
public class Scheduler {

    private static final Logger LOG = LoggerFactory.getLogger(Scheduler.class);

    private final Graph graph;

    public Scheduler(Graph graph) {
        this.graph = graph;
    }

    /**
     * @param blockId The block to order.
     * @return The nodes directly in the block, dependencies first.
     * @throws CyclicBlockException if the lifted edges form a cycle.
     */
    public List<NodeId> order(BlockId blockId) throws CyclicBlockException {
        Block block = graph.block(blockId);
        List<NodeId> members = block.nodes();
        Map<NodeId, Integer> rank = new HashMap<>();
        for (int i = 0; i < members.size(); i++) {
            rank.put(members.get(i), i);
        }
        Map<NodeId, Set<NodeId>> successors = new HashMap<>();
        Map<NodeId, Integer> inDegree = new HashMap<>();
        for (NodeId n : members) {
            successors.put(n, new LinkedHashSet<>());
            inDegree.put(n, 0);
        }
        for (Connection c : relevantConnections(blockId)) {
            NodeId from = graph.liftTo(graph.port(c.source()).owner(), blockId);
            NodeId to = graph.liftTo(graph.port(c.destination()).owner(), blockId);
            if (from == null || to == null) {
                continue;
            }
            if (successors.get(from).add(to)) {
                inDegree.merge(to, 1, Integer::sum);
            }
        }

        PriorityQueue<NodeId> ready = new PriorityQueue<>(Comparator.comparingInt(rank::get));
        inDegree.forEach((n, d) -> {
            if (d == 0) {
                ready.add(n);
            }
        });
        List<NodeId> order = new ArrayList<>(members.size());
        while (!ready.isEmpty()) {
            NodeId n = ready.poll();
            order.add(n);
            for (NodeId s : successors.get(n)) {
                if (inDegree.merge(s, -1, Integer::sum) == 0) {
                    ready.add(s);
                }
            }
        }
        if (order.size() != members.size()) {
            List<NodeId> participants = cycleParticipants(members, successors, order);
            LOG.debug("Block {} is cyclic, participants {}", blockId, participants);
            throw new CyclicBlockException(blockId, participants);
        }
        LOG.debug("Scheduled {}: {}", blockId, order);
        return order;
    }

    /**
     * Connections owned by the block. Connections owned by a nested block lift to a single
     * node and add nothing; connections owned further out have an endpoint outside.
     */
    private List<Connection> relevantConnections(BlockId blockId) {
        List<Connection> out = new ArrayList<>();
        for (ConnectionId c : graph.block(blockId).connections()) {
            out.add(graph.connection(c));
        }
        return out;
    }

    /**
     * Drops nodes that were scheduled and, repeatedly, nodes with no remaining successor,
     * leaving the nodes on cycles and those feeding them from within.
     */
    private static List<NodeId> cycleParticipants(List<NodeId> members, Map<NodeId, Set<NodeId>> successors,
                                                  List<NodeId> scheduled) {
        Set<NodeId> remaining = new LinkedHashSet<>(members);
        scheduled.forEach(remaining::remove);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (NodeId n : List.copyOf(remaining)) {
                boolean hasSuccessor = successors.get(n).stream().anyMatch(remaining::contains);
                if (!hasSuccessor) {
                    remaining.remove(n);
                    changed = true;
                }
            }
        }
        return new ArrayList<>(remaining);
    }
}
