package me.bantu.agent.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * A scheduled event. Persisted in {@code events/events.json}; {@code when} is
 * stored as ISO local date-time truncated to minutes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimedEvent {

    public static final DateTimeFormatter MINUTE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm");

    private long id;
    private String title;
    private String when;

    @JsonIgnore
    public LocalDateTime getWhenTime() {
        return LocalDateTime.parse(when, MINUTE_FORMAT);
    }

    /**
     * Renders the event as a tab-separated listing line.
     */
    public String toListingLine() {
        return id + "\t" + when + "\t" + title;
    }
}
