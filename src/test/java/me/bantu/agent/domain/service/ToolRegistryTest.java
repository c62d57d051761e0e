package me.bantu.agent.domain.service;

import me.bantu.agent.domain.component.ToolComponent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ToolRegistryTest {

    private static ToolComponent tool(String name, boolean enabled) {
        ToolComponent tool = mock(ToolComponent.class);
        when(tool.getToolName()).thenReturn(name);
        when(tool.isEnabled()).thenReturn(enabled);
        return tool;
    }

    @Test
    void shouldRegisterOnlyEnabledComponents() {
        ToolRegistry registry = new ToolRegistry(List.of(tool("b", true), tool("a", true), tool("off", false)));

        assertEquals(List.of("a", "b"), registry.names());
        assertFalse(registry.contains("off"));
    }

    @Test
    void shouldReplaceToolWithSameName() {
        ToolRegistry registry = new ToolRegistry(List.of());
        ToolComponent first = tool("calc", true);
        ToolComponent second = tool("calc", true);

        registry.register(first);
        registry.register(second);

        assertSame(second, registry.get("calc"));
        assertEquals(1, registry.all().size());
    }

    @Test
    void shouldUnregister() {
        ToolRegistry registry = new ToolRegistry(List.of(tool("calc", true)));

        assertTrue(registry.unregister("calc"));
        assertFalse(registry.unregister("calc"));
        assertNull(registry.get("calc"));
    }

    @Test
    void shouldRejectBlankName() {
        ToolRegistry registry = new ToolRegistry(List.of());
        ToolComponent blank = tool(" ", true);

        assertThrows(IllegalArgumentException.class, () -> registry.register(blank));
    }

    @Test
    void shouldHandleNullLookups() {
        ToolRegistry registry = new ToolRegistry(null);

        assertNull(registry.get(null));
        assertFalse(registry.contains(null));
        assertFalse(registry.unregister(null));
    }
}
