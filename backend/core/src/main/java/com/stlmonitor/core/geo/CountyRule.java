package com.stlmonitor.core.geo;

import com.stlmonitor.core.model.GazetteerEntry;
import com.stlmonitor.core.model.GeoPoint;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A county whose explicit mention in text should pull the match toward places inside it, and whose northern edge
 * is a river that jittered coordinates must not cross.
 *
 * @param nameToken     entries whose name contains this token count as naming the county itself
 * @param riverLatitude the county lies strictly south of this latitude
 * @param clampLatitude where a coordinate jittered across the river is pulled back to
 */
public record CountyRule(
        String name,
        String nameToken,
        List<Pattern> mentionPatterns,
        double southLatitude,
        double riverLatitude,
        double westLongitude,
        double eastLongitude,
        double clampLatitude
) {
    public static final int NAMED_BOOST = 20;
    public static final int CONTAINED_BOOST = 15;
    public static final int MIN_PREFERRED_SCORE = 10;

    // South of the Meramec River.
    public static final CountyRule JEFFERSON_COUNTY = new CountyRule(
            "Jefferson County",
            "jefferson",
            List.of(
                    Pattern.compile("\\bjefferson\\s+county\\b", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("\\bjeff\\s+co\\b", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("\\bjeffco\\b", Pattern.CASE_INSENSITIVE)
            ),
            38.20,
            38.45,
            -90.70,
            -90.20,
            38.40
    );

    public CountyRule {
        mentionPatterns = List.copyOf(mentionPatterns);
    }

    public boolean isMentionedIn(String text) {
        return mentionPatterns.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }

    public boolean contains(GeoPoint point) {
        return point.lat() < riverLatitude
                && point.lat() >= southLatitude
                && point.lng() >= westLongitude
                && point.lng() <= eastLongitude;
    }

    public int boostFor(GazetteerEntry entry) {
        if (entry.name().toLowerCase(Locale.ROOT).contains(nameToken)) {
            return NAMED_BOOST;
        }
        return contains(entry.location()) ? CONTAINED_BOOST : 0;
    }

    /**
     * Keeps a jittered coordinate for an in-county entry on the county side of the river.
     */
    public GeoPoint keepSouthOfRiver(GazetteerEntry entry, GeoPoint jittered) {
        if (contains(entry.location()) && jittered.lat() >= riverLatitude) {
            return jittered.withLat(Math.min(jittered.lat(), clampLatitude));
        }
        return jittered;
    }
}
