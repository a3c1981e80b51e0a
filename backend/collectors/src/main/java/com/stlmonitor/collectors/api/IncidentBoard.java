package com.stlmonitor.collectors.api;

import com.stlmonitor.core.model.Incident;
import com.stlmonitor.core.model.IncidentCategory;
import com.stlmonitor.core.model.NewsItem;

import java.util.List;

/**
 * Latest published picture of the metro. Collectors replace a whole category at once so readers never see a
 * half-updated run.
 */
public interface IncidentBoard {
    void replaceIncidents(IncidentCategory category, List<Incident> incidents);

    void replaceNews(List<NewsItem> items);

    List<Incident> incidents();

    List<NewsItem> news();
}
