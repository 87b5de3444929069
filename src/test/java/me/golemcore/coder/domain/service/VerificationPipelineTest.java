package me.golemcore.coder.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.coder.domain.model.VerificationCheck;
import me.golemcore.coder.domain.model.VerificationResult;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.CommandExecutionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class VerificationPipelineTest {

    private static final String PACKAGE_JSON = """
            {
              "name": "app",
              "scripts": {
                "type-check": "tsc --noEmit",
                "lint": "eslint",
                "test:backend": "jest",
                "build": ""
              }
            }
            """;

    @TempDir
    Path workDir;

    private CommandExecutionPort commands;
    private CoderProperties properties;
    private VerificationPipeline pipeline;

    @BeforeEach
    void setUp() throws IOException {
        commands = mock(CommandExecutionPort.class);
        properties = new CoderProperties();
        pipeline = new VerificationPipeline(commands, new ObjectMapper(), properties);
        Files.writeString(workDir.resolve("package.json"), PACKAGE_JSON);
    }

    @Test
    void typeErrorsFailVerification() throws IOException {
        Files.writeString(workDir.resolve("pnpm-lock.yaml"), "lockfileVersion: 9");
        when(commands.execute(eq("pnpm -s type-check"), any()))
                .thenReturn("src/a.ts(1,1): error TS2304: Cannot find name 'x'.");
        when(commands.execute(eq("pnpm -s lint -- \"src/a.ts\""), any())).thenReturn("0 errors, 0 warnings");

        VerificationResult result = pipeline.verify(List.of("src/a.ts"), workDir);

        assertFalse(result.isAllPassed());
        assertEquals(2, result.getChecks().size());
        VerificationCheck failed = result.failedChecks().get(0);
        assertEquals("type-check", failed.getName());
        assertEquals("Type errors found", failed.getMessage());
        assertEquals(List.of("pnpm -s type-check", "pnpm -s lint -- \"src/a.ts\""), result.getExecutedCommands());
        assertTrue(result.getSuggestions().get(0).contains("pnpm -s type-check"));
    }

    @Test
    void lintExitingNonZeroWithErrorsFails() {
        when(commands.execute(eq("npm run lint -- \"src/a.js\""), any()))
                .thenThrow(new CommandExecutionPort.CommandExecutionException("exit 1", "1 error found"));

        VerificationResult result = pipeline.verify(List.of("src/a.js"), workDir);

        VerificationCheck lint = result.getChecks().get(0);
        assertFalse(lint.isPassed());
        assertEquals("Lint errors found", lint.getMessage());
        assertEquals("npm run lint", lint.getCommand());
        assertTrue(lint.getDetails().contains("1 error found"));
    }

    @Test
    void testGateRunsRelatedTestsForGatedPaths() throws IOException {
        Files.writeString(workDir.resolve("yarn.lock"), "");
        String file = "lib/domains/agent/runner.js";
        String testCommand = "yarn test:backend -- --runInBand --passWithNoTests --findRelatedTests \"" + file + "\"";
        when(commands.execute(eq("yarn lint -- \"" + file + "\""), any())).thenReturn("ok");
        when(commands.execute(eq(testCommand), any())).thenReturn("Test Suites: 1 failed, 3 passed");

        VerificationResult result = pipeline.verify(List.of(file), workDir);

        assertFalse(result.isAllPassed());
        assertEquals("test-gate", result.failedChecks().get(0).getName());
        assertTrue(result.getExecutedCommands().contains(testCommand));
    }

    @Test
    void nothingRunsWithoutModifiedFiles() {
        VerificationResult result = pipeline.verify(List.of(), workDir);

        assertTrue(result.isAllPassed());
        assertTrue(result.getChecks().isEmpty());
        verifyNoInteractions(commands);
    }

    @Test
    void disabledVerificationSkipsChecks() {
        properties.getVerification().setEnabled(false);
        pipeline = new VerificationPipeline(commands, new ObjectMapper(), properties);

        assertTrue(pipeline.verify(List.of("src/a.ts"), workDir).getChecks().isEmpty());
        verifyNoInteractions(commands);
    }

    @Test
    void profileIgnoresEmptyScriptsAndDefaultsToNpm() {
        VerificationPipeline.ProjectProfile profile = pipeline.detectProfile(workDir);

        assertEquals(VerificationPipeline.PackageRunner.NPM, profile.runner());
        assertNull(profile.scriptCommand("build"));
        assertEquals("npm run lint", profile.scriptCommand("lint"));
    }

    @Test
    void projectWithoutPackageJsonHasNoChecks(@TempDir Path emptyDir) {
        VerificationResult result = pipeline.verify(List.of("main.py"), emptyDir);

        assertTrue(result.isAllPassed());
        assertTrue(result.getChecks().isEmpty());
    }
}
