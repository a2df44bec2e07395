package com.transport.x.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;


@Data
@AllArgsConstructor
@Builder
public class ResidualEdge {
    private int to;
    private int reverseEdgeIndex;
    private long capacity;
    private long cost;

    public boolean hasCapacity() {
        return capacity > 0;
    }
}
