package com.transport.x.service;

import com.transport.x.dto.TransportRecords;
import com.transport.x.models.Edge;
import com.transport.x.models.Node;
import com.transport.x.validation.TransportInputValidator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

@Slf4j
@Service
public class RandomGraphGenerator implements GraphGeneratorService {

    @Override
    public TransportRecords.GeneratedGraph generate(int numNodes, int numEdges, long seed,
                                                    int supplyRange, boolean balanceDemand) {
        TransportInputValidator.validateGeneratorArguments(numNodes, numEdges, supplyRange);
        Random rng = new Random(seed);

        List<Node> nodes = new ArrayList<>(numNodes);
        long sum = 0L;
        for (int i = 0; i < numNodes - 1; i++) {
            long supply = randomSupply(rng, supplyRange);
            nodes.add(new Node(i, supply));
            sum += supply;
        }
        long lastSupply = balanceDemand ? -sum : randomSupply(rng, supplyRange);
        nodes.add(new Node(numNodes - 1, lastSupply));
        long imbalance = sum + lastSupply;

        if (imbalance != 0) {
            log.info("Supply sum of generated graph is {} (seed={}), the instance is unbalanced", imbalance, seed);
        }

        List<Pair<Integer, Integer>> candidates = new ArrayList<>();
        for (int i = 0; i < numNodes; i++) {
            for (int j = 0; j < numNodes; j++) {
                if (i != j) {
                    candidates.add(Pair.of(i, j));
                }
            }
        }
        Collections.shuffle(candidates, rng);

        List<Edge> edges = new ArrayList<>(numEdges);
        for (Pair<Integer, Integer> pair : candidates.subList(0, numEdges)) {
            edges.add(new Edge(pair.getLeft(), pair.getRight()));
        }

        log.debug("Generated graph: nodes={}, edges={}, seed={}, balanced={}", numNodes, numEdges, seed, imbalance == 0);
        return new TransportRecords.GeneratedGraph(nodes, edges, imbalance);
    }

    private long randomSupply(Random rng, int supplyRange) {
        return rng.nextInt(2 * supplyRange + 1) - (long) supplyRange;
    }
}
