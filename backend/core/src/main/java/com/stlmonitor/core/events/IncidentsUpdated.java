package com.stlmonitor.core.events;

import com.stlmonitor.core.model.IncidentCategory;

import java.time.Instant;

public record IncidentsUpdated(Instant timestamp, IncidentCategory category, int incidentCount) implements Event {
    @Override
    public String type() {
        return "IncidentsUpdated";
    }
}
