package me.bantu.agent;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Bantu Agent.
 *
 * <p>
 * Bantu Agent turns free-text input into a structured action: a direct answer
 * or a call to one of the registered tools. Answers can be grounded in a small
 * retrieval memory, and scheduling requests are resolved through a
 * natural-language time parser.
 *
 * <h2>Pipeline</h2>
 *
 * <pre>
 * user text → Kernel (system prompt + memory + user message) → LLM
 *           → ActionInterpreter (JSON action plan)
 *           → AgentManager (respond | dispatch tool) → result text
 * </pre>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → interactive shell
 * Domain Layer       → Kernel, AgentManager, RetrievalMemory, scheduling
 * Infrastructure     → LLM/Embedding/Storage adapters, tools
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code bantu.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BantuApplication {

    public static void main(String[] args) {
        SpringApplication.run(BantuApplication.class, args);
    }

}
