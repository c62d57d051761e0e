package me.bantu.agent.domain.service;

import me.bantu.agent.adapter.outbound.storage.LocalStorageAdapter;
import me.bantu.agent.domain.model.TimedEvent;
import me.bantu.agent.infrastructure.config.AutoConfiguration;
import me.bantu.agent.infrastructure.config.BantuProperties;
import me.bantu.agent.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SchedulingServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 1, 1, 0, 0);

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private Clock clock;
    private SchedulingService service;

    @BeforeEach
    void setUp() {
        BantuProperties properties = new BantuProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        service = newService(storage);
    }

    private SchedulingService newService(StoragePort storagePort) {
        return new SchedulingService(storagePort, objectMapper, new TimeExpressionParser(clock), clock);
    }

    // ===== addEvent =====

    @Test
    void shouldAddEventWithParsedTime() {
        TimedEvent event = service.addEvent("Standup", "tomorrow at 8AM", NOW);

        assertEquals(1, event.getId());
        assertEquals("Standup", event.getTitle());
        assertEquals("2025-01-02T08:00", event.getWhen());
        assertEquals(LocalDateTime.of(2025, 1, 2, 8, 0), event.getWhenTime());
    }

    @Test
    void shouldUseClockWhenNowNotGiven() {
        TimedEvent event = service.addEvent("Coffee", "in 30 minutes");

        assertEquals("2025-01-01T00:30", event.getWhen());
    }

    @Test
    void shouldRejectUnparseableTime() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> service.addEvent("Party", "someday", NOW));

        assertEquals("Could not parse time from: someday", error.getMessage());
        assertTrue(service.listEvents().isEmpty());
    }

    @Test
    void shouldAssignIncreasingIds() {
        long first = service.addEvent("A", "at 10:00", NOW).getId();
        long second = service.addEvent("B", "at 11:00", NOW).getId();

        assertEquals(1, first);
        assertEquals(2, second);
    }

    @Test
    void shouldRejectTimeBeyondYear9999() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> service.addEvent("far", "in 80000000 hours", NOW));

        assertEquals("Could not parse time from: in 80000000 hours", error.getMessage());
        assertTrue(service.listEvents().isEmpty());
    }

    @Test
    void shouldRejectOverflowingAmount() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> service.addEvent("far", "in 99999999999999999999 minutes", NOW));

        assertEquals("Could not parse time from: in 99999999999999999999 minutes", error.getMessage());
    }

    // ===== listEvents =====

    @Test
    void shouldListEventsInTimeOrder() {
        service.addEvent("Late", "2025-01-05 18:00", NOW);
        service.addEvent("Early", "2025-01-03 07:00", NOW);
        service.addEvent("Same time", "2025-01-05 18:00", NOW);

        List<TimedEvent> events = service.listEvents();

        assertEquals(List.of("Early", "Late", "Same time"), events.stream().map(TimedEvent::getTitle).toList());
        assertEquals("2\t2025-01-03T07:00\tEarly", events.get(0).toListingLine());
    }

    @Test
    void shouldListOnlyStorableEventsAfterFarFutureAttempt() {
        assertThrows(IllegalArgumentException.class, () -> service.addEvent("far", "in 80000000 hours", NOW));
        service.addEvent("soon", "tomorrow at 8am", NOW);
        service.addEvent("later", "in 48 hours", NOW);

        List<String> lines = service.listEvents().stream().map(TimedEvent::toListingLine).toList();

        assertEquals(List.of("1\t2025-01-02T08:00\tsoon", "2\t2025-01-03T00:00\tlater"), lines);
    }

    @Test
    void shouldSortPersistedEventsByTime() throws Exception {
        Files.createDirectories(tempDir.resolve("events"));
        Files.writeString(tempDir.resolve("events/events.json"), "{\"lastId\":2,\"events\":["
                + "{\"id\":1,\"title\":\"b\",\"when\":\"2025-06-01T10:00\"},"
                + "{\"id\":2,\"title\":\"a\",\"when\":\"2025-01-15T09:30\"}]}");

        assertEquals(List.of("a", "b"), service.listEvents().stream().map(TimedEvent::getTitle).toList());
    }

    // ===== removeEvent =====

    @Test
    void shouldRemoveEvent() {
        long id = service.addEvent("Dentist", "2025-02-01 09:30", NOW).getId();

        assertTrue(service.removeEvent(id));
        assertFalse(service.removeEvent(id));
        assertTrue(service.listEvents().isEmpty());
    }

    @Test
    void shouldNotReuseIdsAfterRemoval() {
        long id = service.addEvent("A", "at 10:00", NOW).getId();
        service.removeEvent(id);

        assertEquals(2, service.addEvent("B", "at 11:00", NOW).getId());
    }

    @Test
    void shouldReturnFalseForUnknownId() {
        assertFalse(service.removeEvent(99));
    }

    // ===== Persistence =====

    @Test
    void shouldPersistAcrossInstances() throws Exception {
        service.addEvent("Persisted", "2025-03-01 12:00", NOW);
        service.addEvent("Removed", "2025-03-02 12:00", NOW);
        service.removeEvent(2);

        assertTrue(Files.exists(tempDir.resolve("events/events.json")));

        SchedulingService reloaded = newService(storage);
        List<TimedEvent> events = reloaded.listEvents();
        assertEquals(1, events.size());
        assertEquals("Persisted", events.get(0).getTitle());
        assertEquals(3, reloaded.addEvent("Next", "2025-03-03 12:00", NOW).getId());
    }

    @Test
    void shouldFailOnCorruptEventsFile() throws Exception {
        Files.createDirectories(tempDir.resolve("events"));
        Files.writeString(tempDir.resolve("events/events.json"), "{not json");

        assertThrows(UncheckedIOException.class, () -> service.listEvents());
    }

    @Test
    void shouldPropagateStorageFailure() {
        StoragePort broken = mock(StoragePort.class);
        when(broken.getText(anyString(), anyString())).thenReturn(
                CompletableFuture.failedFuture(new UncheckedIOException("disk gone", new java.io.IOException())));

        SchedulingService failing = newService(broken);

        assertThrows(UncheckedIOException.class, failing::listEvents);
    }
}
