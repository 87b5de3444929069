package me.golemcore.coder.tools;

import me.golemcore.coder.domain.model.ToolExecutionContext;
import me.golemcore.coder.domain.model.ToolResult;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GrepSearchToolTest {

    @TempDir
    Path tempDir;

    private GrepSearchTool tool;
    private ToolExecutionContext context;

    @BeforeEach
    void setUp() throws Exception {
        tool = new GrepSearchTool(new CoderProperties());
        context = new ToolExecutionContext(tempDir, "conv-1");
        Files.createDirectories(tempDir.resolve("src"));
        Files.createDirectories(tempDir.resolve("node_modules/dep"));
        Files.writeString(tempDir.resolve("src/auth.ts"), "import x;\nfunction login() {}\n");
        Files.writeString(tempDir.resolve("node_modules/dep/index.js"), "function login() {}");
    }

    @Test
    void returnsPathLineMatchesSkippingIgnoredDirectories() throws Exception {
        ToolResult result = tool.execute(Map.of("pattern", "function\\s+login"), context).get();

        assertEquals("src/auth.ts:2: function login() {}", result.getOutput());
    }

    @Test
    void ignoreCaseFlag() throws Exception {
        ToolResult result = tool.execute(Map.of("pattern", "LOGIN", "ignoreCase", true, "path", "src"), context)
                .get();

        assertTrue(result.getOutput().contains("src/auth.ts:2"));
    }

    @Test
    void noMatchesAndInvalidPattern() throws Exception {
        assertEquals("No matches found", tool.execute(Map.of("pattern", "logout"), context).get().getOutput());
        assertTrue(tool.execute(Map.of("pattern", "("), context).get().getError().startsWith("Invalid pattern"));
    }
}
