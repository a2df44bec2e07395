package com.transport.x.dto;

/**
 * Location of the forward residual arc built for one original edge.
 */
public record ForwardArcRef(int owner, int slot, long initialCapacity) {
}
