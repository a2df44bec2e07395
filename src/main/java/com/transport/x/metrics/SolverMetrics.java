package com.transport.x.metrics;

import com.transport.x.utils.basic.Constant;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

@Component
public class SolverMetrics {
    private final MeterRegistry meterRegistry;
    private final DistributionSummary augmentationSummary;
    private final Timer solveTimer;

    public SolverMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.augmentationSummary = DistributionSummary.builder("transport_solve_augmentations")
                .description("Augmenting paths used per solve")
                .register(meterRegistry);
        this.solveTimer = Timer.builder("transport_solve_duration")
                .description("Wall time of a min-cost flow solve")
                .register(meterRegistry);
    }

    public Timer.Sample startSolve() {
        return Timer.start(meterRegistry);
    }

    public void stopSolve(Timer.Sample sample) {
        sample.stop(solveTimer);
    }

    public void recordAugmentations(int augmentations) {
        augmentationSummary.record(augmentations);
    }

    public void recordComplete() {
        meterRegistry.counter("transport_solve_total", Constant.OUTCOME, Constant.OUTCOME_COMPLETE).increment();
    }

    public void recordPartial(long shortfall) {
        meterRegistry.counter("transport_solve_total", Constant.OUTCOME, Constant.OUTCOME_PARTIAL).increment();
        meterRegistry.counter("transport_unrouted_supply_total").increment(shortfall);
    }

    public void recordInvalidInput() {
        meterRegistry.counter("transport_solve_total", Constant.OUTCOME, Constant.OUTCOME_INVALID).increment();
    }
}
