package com.presentos.core.model;

import java.time.OffsetDateTime;
import java.util.List;

public record CalendarIntent(
    String title,
    OffsetDateTime start,
    OffsetDateTime end,
    String description,
    List<String> attendees,
    String context,
    String source
) implements IntentRecord {

    @Override
    public Intent intent() {
        return Intent.CALENDAR;
    }
}
