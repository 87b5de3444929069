package me.golemcore.coder.domain.graph.node;

import me.golemcore.coder.domain.graph.AgentSession;
import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.AgentStateUpdate;
import me.golemcore.coder.domain.model.ToolExecutionResult;
import me.golemcore.coder.domain.service.ErrorRecoveryAdvisor;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ReporterNodeTest {

    private final ReporterNode node = new ReporterNode(new ErrorRecoveryAdvisor(), Clock.systemUTC());

    private static AgentSession session(AgentState state) {
        AgentSession session = AgentSession.builder().conversationId("conv-1").build();
        session.setState(state);
        return session;
    }

    private static String report(AgentStateUpdate update) {
        assertEquals(1, update.getMessages().size());
        assertTrue(update.getMessages().get(0).isAssistantMessage());
        return update.getMessages().get(0).getContent();
    }

    @Test
    void agentErrorWinsOverEverythingElse() {
        AgentState state = AgentState.builder()
                .agentError("Connection refused")
                .iterationCount(3)
                .planSteps(new ArrayList<>(List.of("1. a", "2. b")))
                .toolResults(new ArrayList<>(List.of(ToolExecutionResult.builder().error("boom").build())))
                .build();

        String report = report(node.execute(session(state)));

        assertTrue(report.startsWith("Agent execution stopped"));
        assertTrue(report.contains("Error: Connection refused"));
        assertTrue(report.contains("Iterations: 3"));
        assertTrue(report.contains("Plan steps: 0/2 completed"));
        assertTrue(report.endsWith("Make sure the configured model supports tool calling."));
    }

    @Test
    void toolErrorsInLastBatchProduceErrorReport() {
        AgentState state = AgentState.builder()
                .toolResults(new ArrayList<>(List.of(
                        ToolExecutionResult.builder().toolName("file_read").result("ok").build(),
                        ToolExecutionResult.builder().toolName("command_execute").error("exit 1").build())))
                .build();

        assertEquals(ReporterNode.TOOL_ERROR_REPORT, report(node.execute(session(state))));
    }

    @Test
    void iterationLimitProducesWarning() {
        AgentState state = AgentState.builder().iterationCount(4).maxIterations(4).build();

        String report = report(node.execute(session(state)));

        assertTrue(report.startsWith("Reached the maximum number of iterations (4)"));
    }

    @Test
    void successListsChangedFilesAndPlanProgress() {
        List<String> modified = IntStream.range(0, 12).mapToObj(i -> "src/file" + i + ".ts").toList();
        AgentState state = AgentState.builder()
                .modifiedFiles(new ArrayList<>(modified))
                .deletedFiles(new ArrayList<>(List.of("old.ts")))
                .iterationCount(2)
                .planSteps(new ArrayList<>(List.of("1. a", "2. b", "3. c")))
                .currentPlanStep(2)
                .build();

        String report = report(node.execute(session(state)));

        assertTrue(report.startsWith("Task completed"));
        assertTrue(report.contains("Changed files: 12 modified, 1 deleted"));
        assertTrue(report.contains("  - src/file9.ts"));
        assertFalse(report.contains("src/file10.ts"));
        assertTrue(report.contains("  ... and 2 more"));
        assertTrue(report.contains("Iterations: 2"));
        assertTrue(report.contains("Plan steps: 2/3 completed"));
    }

    @Test
    void successWithoutChangesOmitsFileSection() {
        String report = report(node.execute(session(AgentState.builder().iterationCount(1).build())));

        assertFalse(report.contains("Changed files"));
        assertFalse(report.contains("Plan steps"));
    }
}
