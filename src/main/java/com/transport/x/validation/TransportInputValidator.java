package com.transport.x.validation;

import com.transport.x.exceptions.InvalidInputException;
import com.transport.x.models.Edge;
import com.transport.x.models.Node;
import org.apache.commons.lang3.tuple.Pair;

import java.util.BitSet;
import java.util.List;
import java.util.Map;

public final class TransportInputValidator {

    private TransportInputValidator() {
        throw new UnsupportedOperationException("unsupported");
    }

    /**
     * Checks a transportation instance before anything is built from it.
     *
     * @return number of node slots to allocate, i.e. the largest node id plus one
     * @throws InvalidInputException if the instance is malformed
     */
    public static int validateInstance(List<Node> nodes, List<Edge> edges,
                                       Map<Pair<Integer, Integer>, Long> costs,
                                       Map<Pair<Integer, Integer>, Long> capacities,
                                       long unlimitedCapacity) {
        if (nodes == null || nodes.isEmpty()) {
            throw new InvalidInputException("At least one node is required");
        }
        if (edges == null) {
            throw new InvalidInputException("Edge list must not be null");
        }

        int maxId = -1;
        long totalSupply = 0L;
        BitSet seen = new BitSet();
        for (Node node : nodes) {
            if (node == null) {
                throw new InvalidInputException("Node list contains null");
            }
            int id = node.getId();
            if (id < 0 || id > Integer.MAX_VALUE - 3) {
                throw new InvalidInputException("Node id out of range: " + id);
            }
            if (seen.get(id)) {
                throw new InvalidInputException("Duplicate node id: " + id);
            }
            seen.set(id);
            maxId = Math.max(maxId, id);

            long supply = node.getSupply();
            if (supply > unlimitedCapacity || supply < -unlimitedCapacity) {
                throw new InvalidInputException(
                        "Supply of node " + id + " exceeds the unlimited-capacity sentinel " + unlimitedCapacity + ": " + supply);
            }
            if (supply > 0) {
                if (supply > unlimitedCapacity - totalSupply) {
                    throw new InvalidInputException(
                            "Total positive supply exceeds the unlimited-capacity sentinel " + unlimitedCapacity);
                }
                totalSupply += supply;
            }
        }

        int nodeCount = maxId + 1;
        long maxEdges = (long) nodeCount * (nodeCount - 1);
        if (edges.size() > maxEdges) {
            throw new InvalidInputException(
                    "Edge count " + edges.size() + " exceeds the maximum of " + maxEdges + " for " + nodeCount + " nodes");
        }

        for (Edge edge : edges) {
            if (edge == null) {
                throw new InvalidInputException("Edge list contains null");
            }
            if (!isKnownNode(edge.getSource(), nodeCount) || !isKnownNode(edge.getTarget(), nodeCount)) {
                throw new InvalidInputException(
                        "Edge " + edge.getSource() + "->" + edge.getTarget() + " references an unknown node");
            }
        }

        if (capacities != null) {
            for (Map.Entry<Pair<Integer, Integer>, Long> entry : capacities.entrySet()) {
                Long capacity = entry.getValue();
                if (capacity == null || capacity < 0) {
                    throw new InvalidInputException("Capacity of " + entry.getKey() + " must be non-negative: " + capacity);
                }
                if (capacity > unlimitedCapacity) {
                    throw new InvalidInputException(
                            "Capacity of " + entry.getKey() + " exceeds the unlimited-capacity sentinel " + unlimitedCapacity);
                }
            }
        }

        if (costs != null) {
            for (Map.Entry<Pair<Integer, Integer>, Long> entry : costs.entrySet()) {
                Long cost = entry.getValue();
                if (cost == null || cost < 0) {
                    throw new InvalidInputException("Cost of " + entry.getKey() + " must be non-negative: " + cost);
                }
            }
        }

        return nodeCount;
    }

    /**
     * @throws InvalidInputException if the generator cannot produce a simple digraph with these arguments
     */
    public static void validateGeneratorArguments(int numNodes, int numEdges, int supplyRange) {
        if (numNodes < 1) {
            throw new InvalidInputException("numNodes must be at least 1");
        }
        long maxEdges = (long) numNodes * (numNodes - 1);
        if (numEdges < 0 || numEdges > maxEdges) {
            throw new InvalidInputException("numEdges must be between 0 and " + maxEdges + " (no self-loops)");
        }
        if (supplyRange < 0) {
            throw new InvalidInputException("supplyRange must be non-negative");
        }
    }

    private static boolean isKnownNode(int id, int nodeCount) {
        return id >= 0 && id < nodeCount;
    }
}
