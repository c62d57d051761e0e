package me.bantu.agent.tools;

import me.bantu.agent.domain.model.ToolResult;
import me.bantu.agent.tools.support.WorkspacePathResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ListDirToolTest {

    private static final String PATH = "path";

    @TempDir
    Path tempDir;

    private ListDirTool tool;

    @BeforeEach
    void setUp() {
        tool = new ListDirTool(new WorkspacePathResolver(tempDir));
    }

    @Test
    void shouldListSortedEntryNames() throws Exception {
        Files.writeString(tempDir.resolve("b.txt"), "b");
        Files.writeString(tempDir.resolve("a.txt"), "a");
        Files.createDirectory(tempDir.resolve("sub"));

        ToolResult result = FileToolsTestSupport.run(tool, Map.of(PATH, "."));

        assertTrue(result.isSuccess());
        assertEquals("a.txt\nb.txt\nsub", result.getOutput());
        assertEquals(List.of("a.txt", "b.txt", "sub"), result.getData());
    }

    @Test
    void shouldReturnEmptyOutputForEmptyDirectory() throws Exception {
        Files.createDirectory(tempDir.resolve("empty"));

        ToolResult result = FileToolsTestSupport.run(tool, Map.of(PATH, "empty"));

        assertTrue(result.isSuccess());
        assertEquals("", result.getOutput());
    }

    @Test
    void shouldFailForFile() throws Exception {
        Files.writeString(tempDir.resolve("file.txt"), "x");

        ToolResult result = FileToolsTestSupport.run(tool, Map.of(PATH, "file.txt"));

        assertFalse(result.isSuccess());
        assertEquals("Not a directory: file.txt", result.getError());
    }

    @Test
    void shouldFailForMissingPath() throws Exception {
        ToolResult result = FileToolsTestSupport.run(tool, Map.of(PATH, "nope"));

        assertEquals("Not a directory: nope", result.getError());
    }

    @Test
    void shouldDeclarePathAsRequired() {
        assertEquals("list_dir", tool.getToolName());
        assertEquals(List.of(PATH), tool.getDefinition().getRequired());
    }
}
