package me.bantu.agent.domain.service;

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

import me.bantu.agent.domain.model.TimedEvent;
import me.bantu.agent.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Domain service for timed events. Events are persisted in
 * {@code events/events.json} via {@link StoragePort}.
 *
 * <p>
 * Ids are assigned from a persisted counter and are never reused, even after
 * removal. Listings are ordered by time ascending, then by id. Storage
 * failures propagate to the caller.
 */
@Service
@Slf4j
public class SchedulingService {

    private static final String EVENTS_DIR = "events";
    private static final String EVENTS_FILE = "events.json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final TimeExpressionParser timeParser;
    private final Clock clock;

    private EventBook cache;

    public SchedulingService(StoragePort storagePort, ObjectMapper objectMapper,
            TimeExpressionParser timeParser, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.timeParser = timeParser;
        this.clock = clock;
    }

    public TimedEvent addEvent(String title, String whenText) {
        return addEvent(title, whenText, LocalDateTime.now(clock));
    }

    /**
     * Parses {@code whenText} relative to {@code now} and stores a new event.
     *
     * @throws IllegalArgumentException
     *             if no time can be parsed from the text
     */
    public synchronized TimedEvent addEvent(String title, String whenText, LocalDateTime now) {
        LocalDateTime when = timeParser.parse(whenText, now)
                .orElseThrow(() -> new IllegalArgumentException("Could not parse time from: " + whenText));

        EventBook book = load();
        TimedEvent event = TimedEvent.builder()
                .id(book.getLastId() + 1)
                .title(title)
                .when(when.format(TimedEvent.MINUTE_FORMAT))
                .build();

        List<TimedEvent> events = new ArrayList<>(book.getEvents());
        events.add(event);
        save(new EventBook(event.getId(), events));
        log.info("[Scheduler] Added event {} at {}: {}", event.getId(), event.getWhen(), title);
        return event;
    }

    public synchronized List<TimedEvent> listEvents() {
        return load().getEvents().stream()
                .sorted(Comparator.comparing(TimedEvent::getWhenTime).thenComparingLong(TimedEvent::getId))
                .toList();
    }

    /**
     * Removes an event by id, returning whether it existed.
     */
    public synchronized boolean removeEvent(long id) {
        EventBook book = load();
        List<TimedEvent> events = new ArrayList<>(book.getEvents());
        boolean removed = events.removeIf(event -> event.getId() == id);
        if (removed) {
            save(new EventBook(book.getLastId(), events));
            log.info("[Scheduler] Removed event {}", id);
        }
        return removed;
    }

    private EventBook load() {
        if (cache != null) {
            return cache;
        }
        String json = join(storagePort.getText(EVENTS_DIR, EVENTS_FILE));
        if (json == null || json.isBlank()) {
            cache = new EventBook(0, new ArrayList<>());
            return cache;
        }
        try {
            EventBook book = objectMapper.readValue(json, EventBook.class);
            if (book.getEvents() == null) {
                book.setEvents(new ArrayList<>());
            }
            cache = book;
            log.debug("[Scheduler] Loaded {} events", book.getEvents().size());
            return cache;
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Corrupt events file: " + EVENTS_DIR + "/" + EVENTS_FILE, e);
        }
    }

    private void save(EventBook book) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(book);
            join(storagePort.putTextAtomic(EVENTS_DIR, EVENTS_FILE, json, false));
            cache = book;
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize events", e);
        }
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * Persisted form: the last assigned id plus the live events.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EventBook {
        private long lastId;
        private List<TimedEvent> events = new ArrayList<>();
    }
}
