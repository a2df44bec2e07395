package com.transport.x.service;

import com.transport.x.builder.ResidualGraphBuilder;
import com.transport.x.dto.FlowSummary;
import com.transport.x.dto.TransportRecords;
import com.transport.x.exceptions.InvalidInputException;
import com.transport.x.metrics.SolverMetrics;
import com.transport.x.models.Edge;
import com.transport.x.models.Node;
import com.transport.x.processors.FlowResultMapper;
import com.transport.x.processors.ShortestPathAugmentor;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class TransportationServiceImpl implements TransportationService {

    private final ResidualGraphBuilder residualGraphBuilder;
    private final ShortestPathAugmentor shortestPathAugmentor;
    private final FlowResultMapper flowResultMapper;
    private final SolverMetrics solverMetrics;

    @Override
    public FlowSummary solve(List<Node> nodes, List<Edge> edges) {
        return solve(nodes, edges, null, null);
    }

    @Override
    public FlowSummary solve(List<Node> nodes, List<Edge> edges,
                             Map<Pair<Integer, Integer>, Long> costs,
                             Map<Pair<Integer, Integer>, Long> capacities) {
        Timer.Sample sample = solverMetrics.startSolve();
        try {
            TransportRecords.ResidualNetwork network;
            try {
                network = residualGraphBuilder.build(nodes, edges, costs, capacities);
            } catch (InvalidInputException e) {
                log.warn("Rejected transportation instance: {}", e.getMessage());
                solverMetrics.recordInvalidInput();
                throw e;
            }

            TransportRecords.AugmentationResult augmentation =
                    shortestPathAugmentor.augment(network.getGraph(), network.getRequestedFlow());
            FlowSummary summary = flowResultMapper.map(edges, network, augmentation);

            solverMetrics.recordAugmentations(summary.getAugmentations());
            if (summary.isComplete()) {
                solverMetrics.recordComplete();
                log.info("Solved transportation instance: nodes={}, edges={}, flow={}, cost={}, augmentations={}",
                        nodes.size(), edges.size(), summary.getFlow(), summary.getCost(), summary.getAugmentations());
            } else {
                long shortfall = summary.getRequestedFlow() - summary.getFlow();
                solverMetrics.recordPartial(shortfall);
                log.warn("Partial transportation result: flow={} of requested={}, unrouted={}, cost={}",
                        summary.getFlow(), summary.getRequestedFlow(), shortfall, summary.getCost());
            }
            return summary;
        } finally {
            solverMetrics.stopSolve(sample);
        }
    }
}
