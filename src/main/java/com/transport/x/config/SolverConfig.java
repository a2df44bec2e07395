package com.transport.x.config;

import com.transport.x.utils.basic.Constant;
import lombok.Builder;
import lombok.Getter;

@Builder
@Getter
public class SolverConfig {
    @Builder.Default
    private final long defaultEdgeCost = Constant.DEFAULT_EDGE_COST;
    @Builder.Default
    private final long unlimitedCapacity = Constant.UNLIMITED_CAPACITY;
}
