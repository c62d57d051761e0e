package me.bantu.agent.adapter.inbound.cli;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.bantu.agent.domain.service.AgentManager;
import me.bantu.agent.domain.service.RetrievalMemory;
import me.bantu.agent.domain.service.SchedulingService;
import me.bantu.agent.domain.service.ToolRegistry;
import me.bantu.agent.infrastructure.config.BantuProperties;
import me.bantu.agent.port.outbound.LlmPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.info.BuildProperties;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Interactive read-eval-print loop on standard input.
 *
 * <p>
 * Each non-empty line is run through {@link AgentManager#execute(String)} and
 * the answer printed. {@code exit}/{@code quit} or end of input leaves the
 * loop. Lines starting with {@code /} are shell commands:
 * <ul>
 * <li>{@code /help} - list commands</li>
 * <li>{@code /version} - show the application version</li>
 * <li>{@code /status} - show provider, memory and scheduler state</li>
 * <li>{@code /tools} - list registered tools</li>
 * </ul>
 *
 * <p>
 * Disabled with {@code bantu.shell.enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "bantu.shell", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class CliShell implements CommandLineRunner {

    static final String GOODBYE = "Goodbye!";

    private final AgentManager agentManager;
    private final LlmPort llmPort;
    private final RetrievalMemory memory;
    private final ToolRegistry toolRegistry;
    private final SchedulingService schedulingService;
    private final BantuProperties properties;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Override
    public void run(String... args) {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        runLoop(in, out);
    }

    /**
     * Runs the loop until exit or end of input.
     */
    public void runLoop(BufferedReader in, PrintWriter out) {
        out.println("Welcome to Bantu Agent. Type 'exit' or 'quit' to leave, /help for commands.");
        String prompt = properties.getShell().getPrompt();
        while (true) {
            out.print(prompt);
            out.flush();

            String line = readLine(in);
            if (line == null) {
                out.println();
                out.println(GOODBYE);
                return;
            }
            line = line.strip();
            if (line.isEmpty()) {
                continue;
            }
            String lower = line.toLowerCase(Locale.ROOT);
            if ("exit".equals(lower) || "quit".equals(lower)) {
                out.println(GOODBYE);
                return;
            }
            try {
                if (line.startsWith("/")) {
                    handleCommand(lower, out);
                } else {
                    out.println(agentManager.execute(line));
                }
            } catch (RuntimeException e) { // NOSONAR - any failure is reported and the loop continues
                log.debug("[Shell] Turn failed", e);
                out.println("Error: " + e.getMessage());
            }
        }
    }

    private void handleCommand(String command, PrintWriter out) {
        switch (command) {
        case "/help" -> {
            out.println("Commands:");
            out.println("  /help     Show this help");
            out.println("  /version  Show version");
            out.println("  /status   Show system status");
            out.println("  /tools    List available tools");
            out.println("  exit      Leave the shell");
        }
        case "/version" -> out.println("Bantu Agent v" + version());
        case "/status" -> printStatus(out);
        case "/tools" -> toolRegistry.all().stream()
                .sorted((a, b) -> a.getToolName().compareTo(b.getToolName()))
                .forEach(tool -> out.println("  " + tool.getToolName() + " - "
                        + tool.getDefinition().getDescription()));
        default -> out.println("Unknown command: " + command + " (try /help)");
        }
    }

    private void printStatus(PrintWriter out) {
        out.println("Bantu Agent Status:");
        out.println("- LLM: " + llmPort.getProviderId() + " / " + llmPort.getCurrentModel()
                + (llmPort.isAvailable() ? " (available)" : " (not configured)"));
        out.println("- Memory: " + (memory.isConfigured()
                ? memory.size() + " items, dimension " + memory.getDimension()
                : "no embeddings provider"));
        out.println("- Tools: " + toolRegistry.names().size() + " registered");
        out.println("- Events: " + schedulingService.listEvents().size() + " scheduled");
    }

    private String version() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        return buildProps != null ? buildProps.getVersion() : "dev";
    }

    private String readLine(BufferedReader in) {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from console", e);
        }
    }
}
