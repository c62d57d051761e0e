package me.bantu.agent.domain.component;

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

/**
 * Base interface for pluggable components of the agent. Each component type
 * extends this interface to provide specialized capabilities while keeping a
 * consistent lifecycle contract.
 */
public interface Component {

    /**
     * Returns the type identifier for this component.
     *
     * @return the component type (e.g., "tool")
     */
    String getComponentType();

    /**
     * Checks whether this component is currently enabled. Disabled components are
     * not registered at startup.
     *
     * @return true if the component is enabled, false otherwise
     */
    default boolean isEnabled() {
        return true;
    }
}
