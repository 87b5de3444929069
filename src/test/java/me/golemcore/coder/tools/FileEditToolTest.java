package me.golemcore.coder.tools;

import me.golemcore.coder.domain.model.ToolExecutionContext;
import me.golemcore.coder.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileEditToolTest {

    @TempDir
    Path tempDir;

    private FileEditTool tool;
    private ToolExecutionContext context;
    private Path file;

    @BeforeEach
    void setUp() throws Exception {
        tool = new FileEditTool();
        context = new ToolExecutionContext(tempDir, "conv-1");
        file = tempDir.resolve("app.ts");
        Files.writeString(file, "const a = 1;\nconst b = 1;\n");
    }

    @Test
    void replacesUniqueFragment() throws Exception {
        ToolResult result = tool.execute(Map.of("path", "app.ts", "old_str", "const a = 1;",
                "new_str", "const a = 2;"), context).get();

        assertTrue(result.isSuccess());
        assertEquals("const a = 2;\nconst b = 1;\n", Files.readString(file));
    }

    @Test
    void ambiguousFragmentIsRejected() throws Exception {
        ToolResult result = tool.execute(Map.of("path", "app.ts", "old_str", "= 1;", "new_str", "= 3;"),
                context).get();

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("occurs 2 times"));
        assertEquals("const a = 1;\nconst b = 1;\n", Files.readString(file));
    }

    @Test
    void replaceAllUpdatesEveryOccurrence() throws Exception {
        ToolResult result = tool.execute(Map.of("path", "app.ts", "old_str", "= 1;", "new_str", "= 3;",
                "replace_all", true), context).get();

        assertEquals("Edited app.ts (2 replacement(s))", result.getOutput());
        assertEquals("const a = 3;\nconst b = 3;\n", Files.readString(file));
    }

    @Test
    void missingFragmentAndMissingFileFail() throws Exception {
        ToolResult notFound = tool.execute(Map.of("path", "app.ts", "old_str", "let x", "new_str", "y"),
                context).get();
        ToolResult noFile = tool.execute(Map.of("path", "none.ts", "old_str", "a", "new_str", "b"), context).get();

        assertEquals("Could not find text to replace: \"let x\"", notFound.getError());
        assertEquals("File not found: none.ts", noFile.getError());
    }
}
