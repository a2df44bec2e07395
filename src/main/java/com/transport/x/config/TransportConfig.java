package com.transport.x.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class TransportConfig {

    @Bean
    public SolverConfig solverConfig(
            @Value("${transport.solver.default-edge-cost:1}") long defaultEdgeCost,
            @Value("${transport.solver.unlimited-capacity:1000000000000}") long unlimitedCapacity) {
        if (defaultEdgeCost < 0) {
            throw new IllegalStateException("transport.solver.default-edge-cost must be non-negative: " + defaultEdgeCost);
        }
        if (unlimitedCapacity <= 0) {
            throw new IllegalStateException("transport.solver.unlimited-capacity must be positive: " + unlimitedCapacity);
        }
        log.info("Solver configured with defaultEdgeCost={}, unlimitedCapacity={}", defaultEdgeCost, unlimitedCapacity);
        return SolverConfig.builder()
                .defaultEdgeCost(defaultEdgeCost)
                .unlimitedCapacity(unlimitedCapacity)
                .build();
    }

    @Bean
    public GeneratorConfig generatorConfig(
            @Value("${transport.generator.num-nodes:6}") int numNodes,
            @Value("${transport.generator.num-edges:12}") int numEdges,
            @Value("${transport.generator.seed:42}") long seed,
            @Value("${transport.generator.supply-range:10}") int supplyRange,
            @Value("${transport.generator.balance-demand:false}") boolean balanceDemand) {
        return GeneratorConfig.builder()
                .numNodes(numNodes).numEdges(numEdges).seed(seed)
                .supplyRange(supplyRange).balanceDemand(balanceDemand)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
