package me.golemcore.coder.domain.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GraphRegistryTest {

    private static AgentGraph graph(String type) {
        AgentGraph graph = mock(AgentGraph.class);
        when(graph.getType()).thenReturn(type);
        return graph;
    }

    @Test
    void returnsRegisteredGraphByType() {
        AgentGraph coding = graph("coding");
        AgentGraph review = graph("review");
        GraphRegistry registry = new GraphRegistry(List.of(coding, review));

        assertSame(review, registry.get("review"));
        assertEquals(Set.of("coding", "review"), registry.getTypes());
    }

    @Test
    void unknownTypeFallsBackToCodingGraph() {
        AgentGraph coding = graph("coding");
        GraphRegistry registry = new GraphRegistry(List.of(coding));

        assertSame(coding, registry.get("something-else"));
    }

    @Test
    void missingDefaultGraphFails() {
        GraphRegistry registry = new GraphRegistry(List.of(graph("review")));

        assertThrows(IllegalStateException.class, () -> registry.get("coding"));
    }

    @Test
    void laterRegistrationReplacesType() {
        GraphRegistry registry = new GraphRegistry(List.of(graph("coding")));
        AgentGraph replacement = graph("coding");

        registry.register(replacement);

        assertSame(replacement, registry.get("coding"));
    }
}
