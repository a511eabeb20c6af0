package com.example.mcpinvoke.sample;

import java.time.LocalDateTime;
import java.util.List;

public record CalendarEvent(
        String id,
        String title,
        LocalDateTime startTime,
        LocalDateTime endTime,
        String location,
        String description,
        EventPriority priority,
        ReminderChannel reminder,
        List<Attendee> attendees
) {
}
