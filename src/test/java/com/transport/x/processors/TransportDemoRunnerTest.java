package com.transport.x.processors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.transport.x.builder.ResidualGraphBuilder;
import com.transport.x.config.GeneratorConfig;
import com.transport.x.config.SolverConfig;
import com.transport.x.metrics.SolverMetrics;
import com.transport.x.service.RandomGraphGenerator;
import com.transport.x.service.TransportationServiceImpl;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class TransportDemoRunnerTest {

    @Test
    void logsEveryNodeEdgeAndTheSummary() {
        TransportationServiceImpl service = new TransportationServiceImpl(
                new ResidualGraphBuilder(SolverConfig.builder().build()),
                new ShortestPathAugmentor(),
                new FlowResultMapper(),
                new SolverMetrics(new SimpleMeterRegistry()));
        GeneratorConfig config = GeneratorConfig.builder()
                .numNodes(6).numEdges(12).seed(42L).supplyRange(5).balanceDemand(true)
                .build();
        TransportDemoRunner runner = new TransportDemoRunner(new RandomGraphGenerator(), service, config, 1L);

        Logger logger = (Logger) LoggerFactory.getLogger(TransportDemoRunner.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            runner.run();
        } finally {
            logger.detachAppender(appender);
            appender.stop();
        }

        List<String> messages = appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
        assertEquals(6, messages.stream().filter(m -> m.startsWith("Node id=")).count());
        assertEquals(12, messages.stream().filter(m -> m.startsWith("Edge ")).count());
        assertTrue(messages.stream().filter(m -> m.startsWith("Edge ")).noneMatch(m -> m.endsWith("unassigned")));
        assertTrue(messages.get(messages.size() - 1).startsWith("Result: flow="));
    }
}
