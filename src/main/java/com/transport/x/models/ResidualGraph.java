package com.transport.x.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Residual network over {@code nodeCount} real vertices plus a super-source ({@code nodeCount})
 * and a super-sink ({@code nodeCount + 1}).
 *
 * <p>Arcs live in one adjacency list per vertex. Every arc added through
 * {@link #addArcPair(int, int, long, long)} gets a sibling in the head's list that starts empty
 * and carries the negated cost; each side stores the slot index of the other in
 * {@link ResidualEdge#getReverseEdgeIndex()}. Slots are append-only, so an index handed out once
 * keeps pointing at the same arc.</p>
 */
public class ResidualGraph {

    private final int nodeCount;
    private final List<List<ResidualEdge>> adjacency;

    public ResidualGraph(int nodeCount) {
        this.nodeCount = nodeCount;
        this.adjacency = new ArrayList<>(nodeCount + 2);
        for (int i = 0; i < nodeCount + 2; i++) {
            adjacency.add(new ArrayList<>());
        }
    }

    /** @return number of vertices including the super-source and super-sink */
    public int size() {
        return adjacency.size();
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public int getSuperSource() {
        return nodeCount;
    }

    public int getSuperSink() {
        return nodeCount + 1;
    }

    public List<ResidualEdge> arcsFrom(int u) {
        return adjacency.get(u);
    }

    public ResidualEdge arc(int u, int slot) {
        return adjacency.get(u).get(slot);
    }

    public ResidualEdge reverseOf(ResidualEdge arc) {
        return adjacency.get(arc.getTo()).get(arc.getReverseEdgeIndex());
    }

    /**
     * Adds arc {@code u -> v} with the given capacity and cost together with its empty reverse arc.
     *
     * @return slot of the forward arc in {@code arcsFrom(u)}
     */
    public int addArcPair(int u, int v, long capacity, long cost) {
        List<ResidualEdge> from = adjacency.get(u);
        List<ResidualEdge> to = adjacency.get(v);
        int forwardSlot = from.size();
        // on a self-loop both arcs land in the same list, the reverse one right after the forward one
        int reverseSlot = u == v ? forwardSlot + 1 : to.size();

        from.add(ResidualEdge.builder().to(v).reverseEdgeIndex(reverseSlot).capacity(capacity).cost(cost).build());
        to.add(ResidualEdge.builder().to(u).reverseEdgeIndex(forwardSlot).capacity(0L).cost(-cost).build());
        return forwardSlot;
    }

    /**
     * Moves {@code amount} units of residual capacity from {@code arc} to its sibling.
     */
    public void push(ResidualEdge arc, long amount) {
        arc.setCapacity(arc.getCapacity() - amount);
        ResidualEdge reverse = reverseOf(arc);
        reverse.setCapacity(reverse.getCapacity() + amount);
    }
}
