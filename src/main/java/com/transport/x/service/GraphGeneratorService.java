package com.transport.x.service;

import com.transport.x.dto.TransportRecords;

public interface GraphGeneratorService {

    /**
     * Generates a random simple digraph with {@code numNodes} nodes and {@code numEdges} distinct
     * edges, none of them a self-loop. The same seed always yields the same graph.
     *
     * @param supplyRange   supplies are drawn uniformly from {@code [-supplyRange, supplyRange]}
     * @param balanceDemand when set, the last node absorbs the surplus so that supplies sum to zero
     * @throws com.transport.x.exceptions.InvalidInputException if the arguments cannot be satisfied
     */
    TransportRecords.GeneratedGraph generate(int numNodes, int numEdges, long seed, int supplyRange, boolean balanceDemand);
}
