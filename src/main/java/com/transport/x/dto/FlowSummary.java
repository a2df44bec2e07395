package com.transport.x.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Builder
@AllArgsConstructor
@Data
public class FlowSummary {
    private long flow;
    private long cost;
    private long requestedFlow;
    private int augmentations;

    public boolean isComplete() {
        return flow == requestedFlow;
    }
}
