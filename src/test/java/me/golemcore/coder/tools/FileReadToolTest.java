package me.golemcore.coder.tools;

import me.golemcore.coder.domain.model.ToolExecutionContext;
import me.golemcore.coder.domain.model.ToolFailureKind;
import me.golemcore.coder.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileReadToolTest {

    @TempDir
    Path tempDir;

    private FileReadTool tool;
    private ToolExecutionContext context;

    @BeforeEach
    void setUp() throws Exception {
        tool = new FileReadTool();
        context = new ToolExecutionContext(tempDir, "conv-1");
        Files.writeString(tempDir.resolve("notes.md"), "one\ntwo\nthree\nfour");
    }

    @Test
    void readsWholeFile() throws Exception {
        ToolResult result = tool.execute(Map.of("path", "notes.md"), context).get();

        assertTrue(result.isSuccess());
        assertEquals("one\ntwo\nthree\nfour", result.getOutput());
    }

    @Test
    void readsLineRange() throws Exception {
        ToolResult result = tool.execute(Map.of("path", "notes.md", "startLine", 2, "endLine", 3), context).get();

        assertEquals("two\nthree", result.getOutput());
    }

    @Test
    void rangeBeyondEndIsClamped() throws Exception {
        ToolResult result = tool.execute(Map.of("path", "notes.md", "startLine", 4, "endLine", 99), context).get();

        assertEquals("four", result.getOutput());
    }

    @Test
    void missingFileAndDirectoryFail() throws Exception {
        Files.createDirectories(tempDir.resolve("src"));

        assertEquals("File not found: nope.md",
                tool.execute(Map.of("path", "nope.md"), context).get().getError());
        assertEquals("Not a file: src", tool.execute(Map.of("path", "src"), context).get().getError());
    }

    @Test
    void absolutePathOutsideWorkspaceIsDenied() throws Exception {
        ToolResult result = tool.execute(Map.of("path", "/etc/passwd"), context).get();

        assertEquals(ToolFailureKind.POLICY_DENIED, result.getFailureKind());
    }
}
