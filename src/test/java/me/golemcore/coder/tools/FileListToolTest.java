package me.golemcore.coder.tools;

import me.golemcore.coder.domain.model.ToolExecutionContext;
import me.golemcore.coder.domain.model.ToolResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileListToolTest {

    @TempDir
    Path tempDir;

    private final FileListTool tool = new FileListTool();

    @Test
    void listsDirectoriesBeforeFiles() throws Exception {
        Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(tempDir.resolve("a.txt"), "hello");

        ToolResult result = tool.execute(Map.of(), new ToolExecutionContext(tempDir, "conv-1")).get();

        assertTrue(result.isSuccess());
        String output = result.getOutput();
        assertTrue(output.startsWith("Directory: .\nEntries: 2"));
        assertTrue(output.indexOf("[DIR]  src/") < output.indexOf("[FILE] a.txt (5 B)"));
    }

    @Test
    void missingDirectoryFails() throws Exception {
        ToolResult result = tool.execute(Map.of("path", "missing"), new ToolExecutionContext(tempDir, "c")).get();

        assertEquals("Directory not found: missing", result.getError());
    }
}
