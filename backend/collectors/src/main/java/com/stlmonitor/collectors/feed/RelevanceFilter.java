package com.stlmonitor.collectors.feed;

import com.stlmonitor.core.geo.Gazetteer;
import com.stlmonitor.core.model.RawFeedItem;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Drops repeats and articles that never mention the metro area.
 */
public class RelevanceFilter {
    public static final List<String> DEFAULT_KEYWORDS = List.of(
            "st. louis", "st louis", "stl", "missouri", "mo.", "downtown", "metro", "county", "city of st",
            "cardinals", "blues", "gateway arch", "busch stadium",
            "i-70", "i-64", "i-44", "i-55", "i-270", "highway 40",
            "ferguson", "clayton", "kirkwood", "florissant", "chesterfield", "university city", "maplewood",
            "webster groves", "ballwin", "metrolink", "metro transit", "lambert", "arch", "forest park",
            "tower grove", "soulard", "the hill", "central west end", "dogtown", "the grove",
            "north county", "south county", "west county", "creve coeur", "maryland heights", "overland",
            "east st. louis", "east stl", "belleville", "collinsville",
            "jefferson county", "jeff co", "jeffco", "jefferson co", "festus", "crystal city", "herculaneum",
            "de soto", "hillsboro", "pevely", "barnhart", "imperial", "high ridge", "house springs", "cedar hill",
            "byrnes mill", "meramec river", "meramec"
    );

    private final List<String> keywords;
    private final Gazetteer gazetteer;

    public RelevanceFilter(List<String> keywords, Gazetteer gazetteer) {
        this.keywords = keywords.stream().map(keyword -> keyword.toLowerCase(Locale.ROOT)).toList();
        this.gazetteer = Objects.requireNonNull(gazetteer, "gazetteer is required");
    }

    /**
     * The link is recorded in {@code seen} whether or not the item turns out to be relevant.
     */
    public boolean accept(RawFeedItem item, SeenUrls seen) {
        if (!seen.firstSighting(item.link())) {
            return false;
        }
        return isRelevant(item.title(), item.description());
    }

    public boolean isRelevant(String title, String description) {
        String text = (nullToEmpty(title) + " " + nullToEmpty(description)).toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return gazetteer.mentionsAnyPlace(text);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
