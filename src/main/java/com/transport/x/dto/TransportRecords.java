package com.transport.x.dto;

import com.transport.x.models.Edge;
import com.transport.x.models.Node;
import com.transport.x.models.ResidualGraph;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

public interface TransportRecords {

    @AllArgsConstructor
    @Data
    class ResidualNetwork {
        private final ResidualGraph graph;
        private final List<ForwardArcRef> forwardArcs;
        private final long requestedFlow;
    }

    @AllArgsConstructor
    @Data
    class AugmentationResult {
        private final long flow;
        private final long cost;
        private final int iterations;
    }

    @AllArgsConstructor
    @Data
    class GeneratedGraph {
        private final List<Node> nodes;
        private final List<Edge> edges;
        private final long supplyImbalance;

        public boolean isBalanced() {
            return supplyImbalance == 0;
        }
    }
}
