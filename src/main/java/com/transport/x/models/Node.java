package com.transport.x.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A vertex of the transportation network.
 * Positive supply must be emitted, negative supply must be absorbed, zero passes flow through.
 */
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Node {
    private int id;
    private long supply;

    public boolean isProducer() {
        return supply > 0;
    }

    public boolean isConsumer() {
        return supply < 0;
    }

    public boolean isIntermediate() {
        return supply == 0;
    }
}
