package com.transport.x.processors;

import com.transport.x.dto.FlowSummary;
import com.transport.x.dto.ForwardArcRef;
import com.transport.x.dto.TransportRecords;
import com.transport.x.models.Edge;
import com.transport.x.models.ResidualGraph;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class FlowResultMapper {

    /**
     * Writes {@code initialCapacity - residualCapacity} of each forward arc back onto its edge,
     * zero-flow edges included, and summarizes the run.
     */
    public FlowSummary map(List<Edge> edges, TransportRecords.ResidualNetwork network,
                           TransportRecords.AugmentationResult augmentation) {
        ResidualGraph graph = network.getGraph();
        List<ForwardArcRef> forwardArcs = network.getForwardArcs();

        for (int i = 0; i < edges.size(); i++) {
            ForwardArcRef ref = forwardArcs.get(i);
            long remaining = graph.arc(ref.owner(), ref.slot()).getCapacity();
            edges.get(i).setTransported(ref.initialCapacity() - remaining);
        }

        return FlowSummary.builder()
                .flow(augmentation.getFlow())
                .cost(augmentation.getCost())
                .requestedFlow(network.getRequestedFlow())
                .augmentations(augmentation.getIterations())
                .build();
    }
}
