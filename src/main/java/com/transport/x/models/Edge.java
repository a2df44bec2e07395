package com.transport.x.models;

import com.transport.x.utils.basic.Constant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A directed edge {@code source -> target}. {@code transported} stays at {@link Constant#UNASSIGNED}
 * until a solve writes the routed amount.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Edge {
    private int source;
    private int target;
    private long transported = Constant.UNASSIGNED;

    public Edge(int source, int target) {
        this(source, target, Constant.UNASSIGNED);
    }

    public boolean isAssigned() {
        return transported >= 0;
    }
}
