package com.transport.x.processors;

import com.transport.x.dto.TransportRecords;
import com.transport.x.models.ResidualEdge;
import com.transport.x.models.ResidualGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Successive shortest paths from the super-source to the super-sink.
 *
 * <p>Each round runs Dijkstra on reduced costs {@code cost(u,v) + potential[u] - potential[v]},
 * folds the distances into the potentials and pushes the bottleneck of the found path in one go.
 * After the fold {@code potential[sink]} is the true cost of the path just used.</p>
 *
 * <p>Stateless: potentials and search arrays are allocated per call.</p>
 */
@Slf4j
@Component
public class ShortestPathAugmentor {
    private static final long UNREACHED = Long.MAX_VALUE;
    private static final int NONE = -1;

    /**
     * Pushes up to {@code targetFlow} units from super-source to super-sink, mutating the residual
     * capacities of {@code graph}. Stops early, without error, once the sink is cut off.
     */
    public TransportRecords.AugmentationResult augment(ResidualGraph graph, long targetFlow) {
        int n = graph.size();
        int source = graph.getSuperSource();
        int sink = graph.getSuperSink();

        long[] potential = new long[n];
        long[] dist = new long[n];
        int[] prevNode = new int[n];
        int[] prevSlot = new int[n];

        long flow = 0L;
        long cost = 0L;
        int iterations = 0;

        while (flow < targetFlow) {
            shortestPaths(graph, source, potential, dist, prevNode, prevSlot);
            if (dist[sink] == UNREACHED) {
                log.debug("Sink unreachable after {} augmentations, flow={} of {}", iterations, flow, targetFlow);
                break;
            }

            for (int v = 0; v < n; v++) {
                if (dist[v] != UNREACHED) {
                    potential[v] += dist[v];
                }
            }

            long bottleneck = targetFlow - flow;
            for (int v = sink; v != source; v = prevNode[v]) {
                bottleneck = Math.min(bottleneck, graph.arc(prevNode[v], prevSlot[v]).getCapacity());
            }
            for (int v = sink; v != source; v = prevNode[v]) {
                graph.push(graph.arc(prevNode[v], prevSlot[v]), bottleneck);
            }

            flow += bottleneck;
            cost += bottleneck * potential[sink];
            iterations++;
            log.debug("Augmentation {}: pushed={}, pathCost={}, flow={}", iterations, bottleneck, potential[sink], flow);
        }

        return new TransportRecords.AugmentationResult(flow, cost, iterations);
    }

    private void shortestPaths(ResidualGraph graph, int source, long[] potential,
                               long[] dist, int[] prevNode, int[] prevSlot) {
        Arrays.fill(dist, UNREACHED);
        Arrays.fill(prevNode, NONE);
        Arrays.fill(prevSlot, NONE);
        dist[source] = 0L;

        PriorityQueue<QueueEntry> queue = new PriorityQueue<>(
                Comparator.comparingLong(QueueEntry::distance).thenComparingLong(QueueEntry::sequence));
        long sequence = 0L;
        queue.add(new QueueEntry(source, 0L, sequence++));

        while (!queue.isEmpty()) {
            QueueEntry entry = queue.poll();
            int u = entry.vertex();
            if (entry.distance() > dist[u]) {
                continue;
            }
            List<ResidualEdge> arcs = graph.arcsFrom(u);
            for (int slot = 0; slot < arcs.size(); slot++) {
                ResidualEdge arc = arcs.get(slot);
                if (!arc.hasCapacity()) {
                    continue;
                }
                int v = arc.getTo();
                long candidate = dist[u] + arc.getCost() + potential[u] - potential[v];
                if (candidate < dist[v]) {
                    dist[v] = candidate;
                    prevNode[v] = u;
                    prevSlot[v] = slot;
                    queue.add(new QueueEntry(v, candidate, sequence++));
                }
            }
        }
    }

    private record QueueEntry(int vertex, long distance, long sequence) {
    }
}
