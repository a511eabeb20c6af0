package com.example.mcpinvoke.sample;

import com.example.mcpinvoke.annotation.ToolDescription;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

public class CreateEventRequest extends EventDetails {
    @NotBlank
    private String title;

    @NotNull
    @ToolDescription("Start of the event, ISO-8601 local date-time")
    private LocalDateTime start;

    @NotNull
    private LocalDateTime end;

    private EventPriority priority = EventPriority.NORMAL;

    private ReminderChannel reminder = ReminderChannel.NONE;

    @Valid
    private List<Attendee> attendees = new ArrayList<>();

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public LocalDateTime getStart() {
        return start;
    }

    public void setStart(LocalDateTime start) {
        this.start = start;
    }

    public LocalDateTime getEnd() {
        return end;
    }

    public void setEnd(LocalDateTime end) {
        this.end = end;
    }

    public EventPriority getPriority() {
        return priority;
    }

    public void setPriority(EventPriority priority) {
        this.priority = priority;
    }

    public ReminderChannel getReminder() {
        return reminder;
    }

    public void setReminder(ReminderChannel reminder) {
        this.reminder = reminder;
    }

    public List<Attendee> getAttendees() {
        return attendees;
    }

    public void setAttendees(List<Attendee> attendees) {
        this.attendees = attendees;
    }
}
