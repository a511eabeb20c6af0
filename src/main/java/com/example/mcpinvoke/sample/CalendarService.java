package com.example.mcpinvoke.sample;

import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class CalendarService {
    private final Map<String, CalendarEvent> events = new ConcurrentHashMap<>();
    private final AtomicInteger sequence = new AtomicInteger();

    public CalendarService() {
        sampleEvents().forEach(event -> events.put(event.id(), event));
        sequence.set(events.size());
    }

    public List<CalendarEvent> queryEvents(String keyword, LocalDateTime start, LocalDateTime end) {
        String normalizedKeyword = keyword == null || keyword.isBlank() ? null : keyword.trim().toLowerCase(Locale.ROOT);
        return events.values().stream()
                .filter(event -> start == null || !event.endTime().isBefore(start))
                .filter(event -> end == null || !event.startTime().isAfter(end))
                .filter(event -> normalizedKeyword == null || containsKeyword(event, normalizedKeyword))
                .sorted(Comparator.comparing(CalendarEvent::startTime))
                .toList();
    }

    public Optional<CalendarEvent> findEvent(String id) {
        return Optional.ofNullable(events.get(id));
    }

    public CalendarEvent createEvent(CreateEventRequest request) {
        if (request.getEnd().isBefore(request.getStart())) {
            throw new IllegalArgumentException("Event end must not be before its start");
        }
        String id = String.format("evt-%03d", sequence.incrementAndGet());
        CalendarEvent event = new CalendarEvent(
                id,
                request.getTitle(),
                request.getStart(),
                request.getEnd(),
                request.getLocation(),
                request.getDescription(),
                request.getPriority(),
                request.getReminder(),
                List.copyOf(request.getAttendees())
        );
        events.put(id, event);
        return event;
    }

    private boolean containsKeyword(CalendarEvent event, String keyword) {
        return contains(event.title(), keyword)
                || contains(event.description(), keyword)
                || contains(event.location(), keyword);
    }

    private static boolean contains(String value, String keyword) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(keyword);
    }

    private List<CalendarEvent> sampleEvents() {
        return List.of(
                new CalendarEvent(
                        "evt-001",
                        "Daily Standup",
                        LocalDateTime.parse("2026-02-11T09:30:00"),
                        LocalDateTime.parse("2026-02-11T09:45:00"),
                        "Meeting Room A",
                        "Daily sync for engineering team",
                        EventPriority.NORMAL,
                        ReminderChannel.PUSH,
                        List.of()
                ),
                new CalendarEvent(
                        "evt-002",
                        "Product Review",
                        LocalDateTime.parse("2026-02-11T14:00:00"),
                        LocalDateTime.parse("2026-02-11T15:00:00"),
                        "Conference Room 3",
                        "Review sprint deliverables",
                        EventPriority.HIGH,
                        ReminderChannel.EMAIL,
                        List.of()
                ),
                new CalendarEvent(
                        "evt-003",
                        "Architecture Workshop",
                        LocalDateTime.parse("2026-02-12T10:00:00"),
                        LocalDateTime.parse("2026-02-12T11:30:00"),
                        "Online",
                        "Discuss MCP server extensibility",
                        EventPriority.LOW,
                        ReminderChannel.NONE,
                        List.of()
                )
        );
    }
}
