package com.transport.x.config;

import lombok.Builder;
import lombok.Getter;

@Builder
@Getter
public class GeneratorConfig {
    private final int numNodes;
    private final int numEdges;
    private final long seed;
    private final int supplyRange;
    private final boolean balanceDemand;
}
