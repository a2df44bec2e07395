package com.transport.x.processors;

import com.transport.x.config.GeneratorConfig;
import com.transport.x.dto.FlowSummary;
import com.transport.x.dto.TransportRecords;
import com.transport.x.models.Edge;
import com.transport.x.models.Node;
import com.transport.x.service.GraphGeneratorService;
import com.transport.x.service.TransportationService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Generates an instance from {@code transport.generator.*}, solves it with one uniform edge cost
 * and logs the outcome.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "transport.demo.enabled", havingValue = "true")
public class TransportDemoRunner implements CommandLineRunner {

    private final GraphGeneratorService graphGeneratorService;
    private final TransportationService transportationService;
    private final GeneratorConfig generatorConfig;
    private final long uniformCost;

    public TransportDemoRunner(GraphGeneratorService graphGeneratorService,
                               TransportationService transportationService,
                               GeneratorConfig generatorConfig,
                               @Value("${transport.demo.uniform-cost:1}") long uniformCost) {
        this.graphGeneratorService = graphGeneratorService;
        this.transportationService = transportationService;
        this.generatorConfig = generatorConfig;
        this.uniformCost = uniformCost;
    }

    @Override
    public void run(String... args) {
        TransportRecords.GeneratedGraph graph = graphGeneratorService.generate(
                generatorConfig.getNumNodes(), generatorConfig.getNumEdges(), generatorConfig.getSeed(),
                generatorConfig.getSupplyRange(), generatorConfig.isBalanceDemand());

        Map<Pair<Integer, Integer>, Long> costs = new HashMap<>();
        for (Edge edge : graph.getEdges()) {
            costs.put(Pair.of(edge.getSource(), edge.getTarget()), uniformCost);
        }

        FlowSummary summary = transportationService.solve(graph.getNodes(), graph.getEdges(), costs, null);

        for (Node node : graph.getNodes()) {
            log.info("Node id={} supply={} ({})", node.getId(), node.getSupply(), classify(node));
        }
        for (Edge edge : graph.getEdges()) {
            log.info("Edge {} -> {} transported={}", edge.getSource(), edge.getTarget(),
                    edge.isAssigned() ? String.valueOf(edge.getTransported()) : "unassigned");
        }
        log.info("Result: flow={}, cost={}, requested={}", summary.getFlow(), summary.getCost(), summary.getRequestedFlow());
    }

    private String classify(Node node) {
        if (node.isProducer()) {
            return "Producer";
        }
        return node.isConsumer() ? "Consumer" : "Neutral";
    }
}
