package me.bantu.agent.tools;

import me.bantu.agent.domain.model.ToolResult;
import me.bantu.agent.tools.support.WorkspacePathResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ListFilesToolTest {

    private static final String PATH = "path";
    private static final String RECURSIVE = "recursive";

    @TempDir
    Path tempDir;

    private ListFilesTool tool;

    @BeforeEach
    void setUp() throws Exception {
        tool = new ListFilesTool(new WorkspacePathResolver(tempDir));
        Files.createDirectories(tempDir.resolve("docs/nested"));
        Files.writeString(tempDir.resolve("docs/readme.md"), "r");
        Files.writeString(tempDir.resolve("docs/a.txt"), "a");
        Files.writeString(tempDir.resolve("docs/nested/deep.txt"), "d");
    }

    @Test
    void shouldListOnlyTopLevelFilesByDefault() throws Exception {
        ToolResult result = FileToolsTestSupport.run(tool, Map.of(PATH, "docs"));

        assertTrue(result.isSuccess());
        assertEquals("docs/a.txt\ndocs/readme.md", result.getOutput());
    }

    @Test
    void shouldListFilesRecursively() throws Exception {
        ToolResult result = FileToolsTestSupport.run(tool, Map.of(PATH, "docs", RECURSIVE, true));

        assertEquals("docs/a.txt\ndocs/nested/deep.txt\ndocs/readme.md", result.getOutput());
    }

    @Test
    void shouldFailForNonDirectory() throws Exception {
        ToolResult result = FileToolsTestSupport.run(tool, Map.of(PATH, "docs/a.txt"));

        assertEquals("Not a directory: docs/a.txt", result.getError());
    }
}
