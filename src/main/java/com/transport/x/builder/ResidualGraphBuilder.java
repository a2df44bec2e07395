package com.transport.x.builder;

import com.transport.x.config.SolverConfig;
import com.transport.x.dto.ForwardArcRef;
import com.transport.x.dto.TransportRecords;
import com.transport.x.models.Edge;
import com.transport.x.models.Node;
import com.transport.x.models.ResidualGraph;
import com.transport.x.validation.TransportInputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Turns a transportation instance into a residual network with a super-source feeding every
 * producer and a super-sink draining every consumer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResidualGraphBuilder {
    private static final long SUPER_ARC_COST = 0L;

    private final SolverConfig solverConfig;

    /**
     * Builds the residual network. One forward/reverse pair is added per original edge in list
     * order, so {@code forwardArcs.get(i)} locates the arc of {@code edges.get(i)}.
     *
     * @param costs      per {@code (source, target)} cost override, may be null
     * @param capacities per {@code (source, target)} capacity override, may be null
     * @throws com.transport.x.exceptions.InvalidInputException if the instance is malformed
     */
    public TransportRecords.ResidualNetwork build(List<Node> nodes, List<Edge> edges,
                                                  Map<Pair<Integer, Integer>, Long> costs,
                                                  Map<Pair<Integer, Integer>, Long> capacities) {
        int nodeCount = TransportInputValidator.validateInstance(
                nodes, edges, costs, capacities, solverConfig.getUnlimitedCapacity());
        Map<Pair<Integer, Integer>, Long> costOverrides = costs != null ? costs : Collections.emptyMap();
        Map<Pair<Integer, Integer>, Long> capacityOverrides = capacities != null ? capacities : Collections.emptyMap();

        ResidualGraph graph = new ResidualGraph(nodeCount);
        List<ForwardArcRef> forwardArcs = new ArrayList<>(edges.size());

        for (Edge edge : edges) {
            int u = edge.getSource();
            int v = edge.getTarget();
            Pair<Integer, Integer> key = Pair.of(u, v);
            long capacity = capacityOverrides.getOrDefault(key, solverConfig.getUnlimitedCapacity());
            long cost = costOverrides.getOrDefault(key, solverConfig.getDefaultEdgeCost());

            int slot = graph.addArcPair(u, v, capacity, cost);
            forwardArcs.add(new ForwardArcRef(u, slot, capacity));
        }

        long requestedFlow = 0L;
        int producers = 0;
        int consumers = 0;
        for (Node node : nodes) {
            if (node.isProducer()) {
                graph.addArcPair(graph.getSuperSource(), node.getId(), node.getSupply(), SUPER_ARC_COST);
                requestedFlow += node.getSupply();
                producers++;
            } else if (node.isConsumer()) {
                graph.addArcPair(node.getId(), graph.getSuperSink(), -node.getSupply(), SUPER_ARC_COST);
                consumers++;
            }
        }

        log.debug("Built residual network: nodes={}, edges={}, producers={}, consumers={}, requestedFlow={}",
                nodeCount, edges.size(), producers, consumers, requestedFlow);
        return new TransportRecords.ResidualNetwork(graph, forwardArcs, requestedFlow);
    }
}
