package org.fluxgen.compiler.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Worklist re-derivation of port types after structural edits.
 * <p>
 * Every edit marks the affected nodes dirty; {@link #run()} then re-derives them until no
 * output type changes. A node that keeps changing is cut off after a fixed number of
 * passes per run so that propagation always terminates.
 */
public final class TypePropagator {

    private static final Logger LOG = LoggerFactory.getLogger(TypePropagator.class);

    /** Default number of derivation passes a single node may take per run. */
    public static final int DEFAULT_MAX_PASSES = 64;

    private final Graph graph;
    private final int maxPassesPerNode;
    private final Deque<NodeId> worklist = new ArrayDeque<>();
    private final Set<NodeId> queued = new HashSet<>();
    private boolean running;

    TypePropagator(Graph graph, int maxPassesPerNode) {
        if (maxPassesPerNode < 1) {
            throw new IllegalArgumentException("maxPassesPerNode must be positive: " + maxPassesPerNode);
        }
        this.graph = graph;
        this.maxPassesPerNode = maxPassesPerNode;
    }

    void invalidate(NodeId node) {
        if (node != null && queued.add(node)) {
            worklist.add(node);
        }
    }

    void invalidateDownstream(Port output) {
        for (ConnectionId c : output.connections()) {
            invalidate(graph.port(graph.connection(c).destination()).owner());
        }
    }

    /**
     * Drains the worklist. Re-entrant calls made by edits during a pass return immediately;
     * their work is picked up by the outer loop.
     */
    void run() {
        if (running) {
            return;
        }
        running = true;
        Map<NodeId, Integer> passes = new HashMap<>();
        try {
            while (!worklist.isEmpty()) {
                NodeId id = worklist.poll();
                queued.remove(id);
                Node node = graph.findNode(id);
                if (node == null) {
                    continue;
                }
                int count = passes.merge(id, 1, Integer::sum);
                if (count > maxPassesPerNode) {
                    if (count == maxPassesPerNode + 1) {
                        LOG.warn("Type propagation for {} did not settle after {} passes, keeping last types", node, maxPassesPerNode);
                    }
                    continue;
                }
                LOG.debug("Deriving types of {} (pass {})", node, count);
                node.deriveTypes(new TypeDerivation(graph, this));
            }
        } finally {
            worklist.clear();
            queued.clear();
            running = false;
        }
    }
}
