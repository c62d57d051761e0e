package me.bantu.agent.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for persistent storage operations within the local workspace. Files are
 * organized by directory (e.g. "events").
 */
public interface StoragePort {

    /**
     * Read text content from file. Completes with {@code null} when the file does
     * not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Atomically write text content to file with optional backup. The content is
     * written to a temporary file first and then moved over the target.
     *
     * @param backup
     *            if true, preserve previous version as .bak
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
