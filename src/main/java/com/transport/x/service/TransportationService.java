package com.transport.x.service;

import com.transport.x.dto.FlowSummary;
import com.transport.x.models.Edge;
import com.transport.x.models.Node;
import org.apache.commons.lang3.tuple.Pair;

import java.util.List;
import java.util.Map;

public interface TransportationService {

    /**
     * Routes all positive supply at minimum cost and writes the amount carried by every edge into
     * {@link Edge#setTransported(long)}. Supply that cannot reach any consumer is left unrouted and
     * shows up as {@code flow < requestedFlow} in the summary.
     *
     * @param costs      cost per {@code (source, target)}, null or missing keys fall back to the default cost
     * @param capacities capacity per {@code (source, target)}, null or missing keys are unbounded
     * @throws com.transport.x.exceptions.InvalidInputException if the instance is malformed; no edge is modified
     */
    FlowSummary solve(List<Node> nodes, List<Edge> edges,
                      Map<Pair<Integer, Integer>, Long> costs,
                      Map<Pair<Integer, Integer>, Long> capacities);

    FlowSummary solve(List<Node> nodes, List<Edge> edges);
}
