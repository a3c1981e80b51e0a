package com.stlmonitor.service.store;

import com.stlmonitor.collectors.api.IncidentBoard;
import com.stlmonitor.core.model.Incident;
import com.stlmonitor.core.model.IncidentCategory;
import com.stlmonitor.core.model.NewsItem;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local incident board. Each category is swapped as a whole, so readers see either the previous run or
 * the new one.
 */
public class InMemoryIncidentBoard implements IncidentBoard {
    private static final Comparator<Incident> MOST_SEVERE_FIRST = Comparator
            .comparingInt(Incident::severity).reversed()
            .thenComparing(Incident::updatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(Incident::id);

    private final Map<IncidentCategory, List<Incident>> incidents = new ConcurrentHashMap<>();
    private volatile List<NewsItem> news = List.of();

    @Override
    public void replaceIncidents(IncidentCategory category, List<Incident> next) {
        incidents.put(category, List.copyOf(next));
    }

    @Override
    public void replaceNews(List<NewsItem> items) {
        news = List.copyOf(items);
    }

    /**
     * All categories, most severe first.
     */
    @Override
    public List<Incident> incidents() {
        return incidents.values().stream()
                .flatMap(List::stream)
                .sorted(MOST_SEVERE_FIRST)
                .toList();
    }

    public List<Incident> incidents(IncidentCategory category) {
        return incidents.getOrDefault(category, List.of()).stream()
                .sorted(MOST_SEVERE_FIRST)
                .toList();
    }

    @Override
    public List<NewsItem> news() {
        return news;
    }

    public Map<IncidentCategory, Integer> counts() {
        Map<IncidentCategory, Integer> counts = new ConcurrentHashMap<>();
        incidents.forEach((category, list) -> counts.put(category, list.size()));
        return Map.copyOf(counts);
    }
}
