package com.transport.x.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.transport.x.exceptions.InvalidInputException;
import com.transport.x.models.Edge;
import com.transport.x.models.Node;
import com.transport.x.utils.basic.Constant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.Test;

class TransportInputValidatorTest {

    private static final List<Node> TWO_NODES = List.of(new Node(0, 5), new Node(1, -5));

    @Test
    void returnsLargestIdPlusOne() {
        List<Node> nodes = List.of(new Node(0, 1), new Node(3, -1));
        assertEquals(4, TransportInputValidator.validateInstance(
                nodes, List.of(new Edge(0, 3)), null, null, Constant.UNLIMITED_CAPACITY));
    }

    @Test
    void rejectsEmptyNodeList() {
        assertThrows(InvalidInputException.class, () -> TransportInputValidator.validateInstance(
                Collections.emptyList(), Collections.emptyList(), null, null, Constant.UNLIMITED_CAPACITY));
    }

    @Test
    void rejectsDuplicateNodeIds() {
        List<Node> nodes = List.of(new Node(0, 1), new Node(0, -1));
        assertThrows(InvalidInputException.class, () -> TransportInputValidator.validateInstance(
                nodes, Collections.emptyList(), null, null, Constant.UNLIMITED_CAPACITY));
    }

    @Test
    void rejectsMoreEdgesThanASimpleDigraphHolds() {
        List<Edge> edges = List.of(new Edge(0, 1), new Edge(1, 0), new Edge(0, 1));
        assertThrows(InvalidInputException.class, () -> TransportInputValidator.validateInstance(
                TWO_NODES, edges, null, null, Constant.UNLIMITED_CAPACITY));
    }

    @Test
    void rejectsEdgeToUnknownNode() {
        assertThrows(InvalidInputException.class, () -> TransportInputValidator.validateInstance(
                TWO_NODES, List.of(new Edge(0, 2)), null, null, Constant.UNLIMITED_CAPACITY));
    }

    @Test
    void rejectsNegativeCapacity() {
        Map<Pair<Integer, Integer>, Long> capacities = Map.of(Pair.of(0, 1), -1L);
        assertThrows(InvalidInputException.class, () -> TransportInputValidator.validateInstance(
                TWO_NODES, List.of(new Edge(0, 1)), null, capacities, Constant.UNLIMITED_CAPACITY));
    }

    @Test
    void rejectsCapacityAboveSentinel() {
        Map<Pair<Integer, Integer>, Long> capacities = Map.of(Pair.of(0, 1), 101L);
        assertThrows(InvalidInputException.class, () -> TransportInputValidator.validateInstance(
                TWO_NODES, List.of(new Edge(0, 1)), null, capacities, 100L));
    }

    @Test
    void rejectsNegativeCost() {
        Map<Pair<Integer, Integer>, Long> costs = Map.of(Pair.of(0, 1), -3L);
        assertThrows(InvalidInputException.class, () -> TransportInputValidator.validateInstance(
                TWO_NODES, List.of(new Edge(0, 1)), costs, null, Constant.UNLIMITED_CAPACITY));
    }

    @Test
    void rejectsSupplyBeyondSentinel() {
        List<Node> overProducer = List.of(new Node(0, 101), new Node(1, -5));
        List<Node> overConsumer = List.of(new Node(0, 5), new Node(1, Long.MIN_VALUE));
        assertThrows(InvalidInputException.class, () -> TransportInputValidator.validateInstance(
                overProducer, List.of(new Edge(0, 1)), null, null, 100L));
        assertThrows(InvalidInputException.class, () -> TransportInputValidator.validateInstance(
                overConsumer, List.of(new Edge(0, 1)), null, null, 100L));
    }

    @Test
    void rejectsTotalPositiveSupplyBeyondSentinel() {
        List<Node> nodes = List.of(new Node(0, 60), new Node(1, 60), new Node(2, -100));
        assertThrows(InvalidInputException.class, () -> TransportInputValidator.validateInstance(
                nodes, List.of(new Edge(0, 2), new Edge(1, 2)), null, null, 100L));

        List<Node> wrapping = List.of(new Node(0, Long.MAX_VALUE), new Node(1, 1), new Node(2, -5));
        assertThrows(InvalidInputException.class, () -> TransportInputValidator.validateInstance(
                wrapping, List.of(), null, null, Constant.UNLIMITED_CAPACITY));
    }

    @Test
    void acceptsSupplyTotalEqualToSentinel() {
        List<Node> nodes = List.of(new Node(0, 40), new Node(1, 60), new Node(2, -100));
        assertEquals(3, TransportInputValidator.validateInstance(
                nodes, List.of(new Edge(0, 2), new Edge(1, 2)), null, null, 100L));
    }

    @Test
    void generatorArgumentsMustDescribeASimpleDigraph() {
        TransportInputValidator.validateGeneratorArguments(3, 6, 10);
        assertThrows(InvalidInputException.class, () -> TransportInputValidator.validateGeneratorArguments(0, 0, 10));
        assertThrows(InvalidInputException.class, () -> TransportInputValidator.validateGeneratorArguments(3, 7, 10));
        assertThrows(InvalidInputException.class, () -> TransportInputValidator.validateGeneratorArguments(3, -1, 10));
        assertThrows(InvalidInputException.class, () -> TransportInputValidator.validateGeneratorArguments(3, 2, -1));
    }
}
